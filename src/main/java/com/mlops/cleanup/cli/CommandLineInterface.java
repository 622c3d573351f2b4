package com.mlops.cleanup.cli;

import com.mlops.cleanup.classifier.OwnershipClassifier;
import com.mlops.cleanup.config.BaselineConfigException;
import com.mlops.cleanup.config.CleanupConfig;
import com.mlops.cleanup.config.ConfigLoader;
import com.mlops.cleanup.config.NameMatcher;
import com.mlops.cleanup.engine.ExecutionEngine;
import com.mlops.cleanup.gate.ConfirmationGate;
import com.mlops.cleanup.gate.ConsoleConfirmationGate;
import com.mlops.cleanup.health.WorkloadHealthInspector;
import com.mlops.cleanup.helm.HelmCliReleaseClient;
import com.mlops.cleanup.helm.ShellCommandRunner;
import com.mlops.cleanup.kubernetes.ClusterAccessException;
import com.mlops.cleanup.kubernetes.Fabric8ClusterGateway;
import com.mlops.cleanup.kubernetes.KubernetesClusterManager;
import com.mlops.cleanup.kubernetes.ResourceDescriptorMapper;
import com.mlops.cleanup.model.ExecutionMode;
import com.mlops.cleanup.model.RunOutcome;
import com.mlops.cleanup.planner.CleanupPlanner;
import com.mlops.cleanup.registry.BaselineRegistry;
import com.mlops.cleanup.report.JsonReportExporter;
import com.mlops.cleanup.report.ReportRenderer;
import com.mlops.cleanup.scanner.InventoryScanner;
import com.mlops.cleanup.service.CleanupService;
import com.mlops.cleanup.service.Command;
import com.mlops.cleanup.service.RunReport;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command Line Interface handler for KCleanup
 *
 * Usage:
 *   java -jar kcleanup.jar check|plan|cleanup [options]
 *
 * Examples:
 *   java -jar kcleanup.jar check
 *   java -jar kcleanup.jar cleanup --dry-run --namespace-filter 'test-*'
 */
@Slf4j
public class CommandLineInterface {

    private static final String HELM_BINARY = "helm";

    private final Options options;
    private final PrintStream out;
    private final BufferedReader in;
    private final ConfigLoader configLoader;
    private final Clock clock;
    private volatile boolean shuttingDown;

    public CommandLineInterface() {
        this(System.out, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    public CommandLineInterface(PrintStream out, BufferedReader in) {
        this.out = out;
        this.in = in;
        this.configLoader = new ConfigLoader();
        this.clock = Clock.systemUTC();
        this.options = initializeOptions();
    }

    private static Options initializeOptions() {
        Options options = new Options();

        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("Display help information")
                .build());

        options.addOption(Option.builder()
                .longOpt("dry-run")
                .desc("Report what cleanup would delete without deleting anything")
                .build());

        options.addOption(Option.builder()
                .longOpt("non-interactive")
                .desc("Skip the confirmation prompt")
                .build());

        options.addOption(Option.builder()
                .longOpt("namespace-filter")
                .hasArg()
                .argName("pattern")
                .desc("Only consider namespaces matching the pattern (e.g. 'test-*')")
                .build());

        options.addOption(Option.builder("f")
                .longOpt("config")
                .hasArg()
                .argName("config-file")
                .desc("Path to cleanup config file (default: ./cleanup-config.yaml)")
                .build());

        options.addOption(Option.builder("c")
                .longOpt("context")
                .hasArg()
                .argName("context-name")
                .desc("Kubeconfig context (default: current context)")
                .build());

        options.addOption(Option.builder("o")
                .longOpt("output")
                .hasArg()
                .argName("json-file")
                .desc("Write the run report to a JSON file")
                .build());

        options.addOption(Option.builder("w")
                .longOpt("workers")
                .hasArg()
                .argName("n")
                .desc("Number of parallel deletions within a group")
                .build());

        options.addOption(Option.builder("v")
                .longOpt("verbose")
                .desc("Also list managed resources and per-item outcomes")
                .build());

        return options;
    }

    /**
     * Run the command line and return the process exit code.
     */
    public int execute(String[] args) {
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            return usageError(e.getMessage());
        }

        if (cmd.hasOption("h")) {
            printHelp();
            return ExitCode.SUCCESS.getCode();
        }

        List<String> commandArgs = cmd.getArgList();
        if (commandArgs.size() != 1) {
            return usageError(commandArgs.isEmpty() ? "Missing command" : "Unexpected arguments: " + commandArgs);
        }
        Command command;
        try {
            command = Command.fromName(commandArgs.get(0));
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        }

        NameMatcher namespaceFilter = null;
        Integer workers = null;
        try {
            if (cmd.hasOption("namespace-filter")) {
                namespaceFilter = NameMatcher.compile(cmd.getOptionValue("namespace-filter"));
            }
            if (cmd.hasOption("w")) {
                workers = Integer.parseInt(cmd.getOptionValue("w"));
                if (workers < 1) {
                    return usageError("--workers must be at least 1");
                }
            }
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        }

        boolean verbose = cmd.hasOption("v");
        boolean dryRun = cmd.hasOption("dry-run") || command == Command.PLAN;
        boolean nonInteractive = cmd.hasOption("non-interactive");
        String outputFile = cmd.getOptionValue("o");
        ReportRenderer renderer = new ReportRenderer(out, verbose);

        renderer.printBanner("KCleanup - Cluster Resource Lifecycle Reconciler");

        CleanupConfig config;
        BaselineRegistry registry;
        try {
            config = configLoader.load(cmd.getOptionValue("f"));
            registry = BaselineRegistry.fromConfig(config.getBaseline());
        } catch (BaselineConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            renderer.printAborted(e.getMessage());
            return finish(abortedReport(command, dryRun, e.getMessage()), outputFile);
        }
        if (workers != null) {
            config.getExecution().setWorkers(workers);
        }
        out.printf("📋 Baseline: %d managed namespaces, %d managed releases, %d system namespaces%n",
                registry.getManagedNamespaces().size(), registry.getManagedReleases().size(),
                registry.getSystemNamespaces().size());
        out.println();

        String context = cmd.getOptionValue("c", "current");
        try (KubernetesClusterManager clusterManager = new KubernetesClusterManager()) {
            KubernetesClient client;
            try {
                client = clusterManager.getClient(context);
            } catch (ClusterAccessException | KubernetesClientException e) {
                log.error("Cannot create Kubernetes client: {}", e.getMessage());
                renderer.printAborted(e.getMessage());
                return finish(abortedReport(command, dryRun, e.getMessage()), outputFile);
            }

            String helmContext = "current".equals(context) ? null : context;
            Fabric8ClusterGateway gateway = new Fabric8ClusterGateway(client,
                    new HelmCliReleaseClient(new ShellCommandRunner(), HELM_BINARY, helmContext),
                    new ResourceDescriptorMapper(clock),
                    config.getExecution().getPageSize());

            ExecutionEngine engine = new ExecutionEngine(gateway, gateway, gateway, config.getExecution(), clock);
            ConfirmationGate gate = nonInteractive ? ConfirmationGate.ALWAYS_APPROVE
                    : new ConsoleConfirmationGate(in, out);
            CleanupService service = new CleanupService(
                    new InventoryScanner(gateway, config.getExecution().getScanWorkers()),
                    new OwnershipClassifier(registry, config.getPolicy().getTerminalRetentionSeconds()),
                    new CleanupPlanner(),
                    new WorkloadHealthInspector(),
                    engine, gate, renderer, clock);

            return runWithInterruptHandler(service, engine, renderer, command, dryRun, namespaceFilter,
                    outputFile, config.getExecution().getNamespaceTimeoutSeconds());
        }
    }

    /**
     * Ctrl-C asks the engine to stop. Once deletions have started the JVM stays alive until
     * the final report has been written; before that the run is reported as cancelled at once.
     */
    private int runWithInterruptHandler(CleanupService service, ExecutionEngine engine, ReportRenderer renderer,
                                        Command command, boolean dryRun, NameMatcher namespaceFilter,
                                        String outputFile, long graceSeconds) {
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean reported = new AtomicBoolean(false);
        Thread hook = new Thread(() -> {
            shuttingDown = true;
            handleShutdown(engine, finished, graceSeconds, () -> {
                if (reported.compareAndSet(false, true)) {
                    renderer.printCancelled();
                    finish(cancelledReport(command, dryRun), outputFile);
                }
            });
        }, "kcleanup-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            RunReport report = service.run(command, dryRun, namespaceFilter);
            if (!reported.compareAndSet(false, true)) {
                log.debug("Run was already reported as cancelled by the shutdown hook");
                return ExitCode.CANCELLED.getCode();
            }
            return finish(report, outputFile);
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutdown already in progress");
                shuttingDown = true;
            }
        }
    }

    /**
     * Body of the shutdown hook. Waits for the running cleanup only if deletions have started.
     */
    void handleShutdown(ExecutionEngine engine, CountDownLatch finished, long graceSeconds,
                        Runnable reportCancelled) {
        if (!engine.requestStop()) {
            log.warn("Interrupted before any deletion started, cancelling the run");
            reportCancelled.run();
            return;
        }
        try {
            if (!finished.await(graceSeconds * 2, TimeUnit.SECONDS)) {
                log.warn("Cleanup did not finish within {}s after interrupt", graceSeconds * 2);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * True once the JVM has started shutting down; {@code System.exit} must not be called then.
     */
    public boolean isShuttingDown() {
        return shuttingDown;
    }

    private RunReport abortedReport(Command command, boolean dryRun, String reason) {
        return endedReport(command, dryRun, RunOutcome.ABORTED, reason);
    }

    RunReport cancelledReport(Command command, boolean dryRun) {
        return endedReport(command, dryRun, RunOutcome.CANCELLED, "interrupted before execution");
    }

    private RunReport endedReport(Command command, boolean dryRun, RunOutcome outcome, String reason) {
        return RunReport.builder()
                .command(command)
                .mode(command == Command.CLEANUP && !dryRun ? ExecutionMode.LIVE : ExecutionMode.DRY_RUN)
                .outcome(outcome)
                .abortReason(reason)
                .startedAt(clock.instant())
                .finishedAt(clock.instant())
                .build();
    }

    private int finish(RunReport report, String outputFile) {
        if (outputFile != null && !outputFile.isEmpty()) {
            try {
                new JsonReportExporter().export(report, Paths.get(outputFile));
                out.println("✅ JSON report written: " + outputFile);
            } catch (IOException e) {
                log.error("Failed to write JSON report", e);
                System.err.println("❌ Failed to write JSON report: " + e.getMessage());
            }
        }
        ExitCode exitCode = ExitCode.forReport(report);
        log.info("Exiting with {} ({})", exitCode.getCode(), exitCode);
        return exitCode.getCode();
    }

    private int usageError(String message) {
        System.err.println("Error: " + message);
        System.err.println("Usage: java -jar kcleanup.jar check|plan|cleanup [options]  (see --help)");
        return ExitCode.ABORTED.getCode();
    }

    private void printHelp() {
        out.println("KCleanup - Cluster Resource Lifecycle Reconciler");
        out.println();
        out.println("USAGE:");
        out.println("  java -jar kcleanup.jar <command> [OPTIONS]");
        out.println();
        out.println("COMMANDS:");
        out.println("  check                     Classify every resource against the baseline and report");
        out.println("  plan                      Show the ordered cleanup plan (same as cleanup --dry-run)");
        out.println("  cleanup                   Delete orphaned resources after confirmation");
        out.println();
        out.println("OPTIONS:");
        out.println("  -h, --help                Display this help message");
        out.println("      --dry-run             Report deletions without performing them");
        out.println("      --non-interactive     Skip the confirmation prompt");
        out.println("      --namespace-filter P  Only consider namespaces matching P ('*' at either end)");
        out.println("  -f, --config FILE         Path to cleanup config file");
        out.println("                            (default: ./cleanup-config.yaml, then built-in baseline)");
        out.println("  -c, --context NAME        Kubeconfig context (default: current context)");
        out.println("  -o, --output FILE         Write the run report as JSON");
        out.println("  -w, --workers N           Parallel deletions within a group (default: 4)");
        out.println("  -v, --verbose             Also list managed resources and per-item outcomes");
        out.println();
        out.println("EXIT CODES:");
        out.println("  0 nothing to do / success, 1 issues found, 2 deletions failed,");
        out.println("  3 aborted, 130 cancelled or interrupted");
        out.println();
        out.println("EXAMPLES:");
        out.println("  # Report orphaned resources");
        out.println("  java -jar kcleanup.jar check");
        out.println();
        out.println("  # Preview the cleanup of test namespaces");
        out.println("  java -jar kcleanup.jar plan --namespace-filter 'test-*'");
        out.println();
        out.println("  # Unattended cleanup in CI with a JSON audit report");
        out.println("  java -jar kcleanup.jar cleanup --non-interactive -o cleanup-report.json");
        out.println();
    }
}
