package com.mlops.cleanup.service;

import com.mlops.cleanup.classifier.OwnershipClassifier;
import com.mlops.cleanup.config.NameMatcher;
import com.mlops.cleanup.engine.ExecutionEngine;
import com.mlops.cleanup.gate.ConfirmationGate;
import com.mlops.cleanup.health.WorkloadHealthInspector;
import com.mlops.cleanup.kubernetes.ClusterAccessException;
import com.mlops.cleanup.model.Classification;
import com.mlops.cleanup.model.CleanupPlan;
import com.mlops.cleanup.model.ExecutionMode;
import com.mlops.cleanup.model.ExecutionResult;
import com.mlops.cleanup.model.HealthFinding;
import com.mlops.cleanup.model.RunOutcome;
import com.mlops.cleanup.model.ScanResult;
import com.mlops.cleanup.planner.CleanupPlanner;
import com.mlops.cleanup.report.ReportRenderer;
import com.mlops.cleanup.scanner.InventoryScanner;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Runs one pass of the pipeline: scan, classify, plan, confirm, execute, report.
 * {@code check} also reports failing workloads.
 * Every path, aborted ones included, ends with a {@link RunReport}.
 */
@Slf4j
public class CleanupService {

    private final InventoryScanner scanner;
    private final OwnershipClassifier classifier;
    private final CleanupPlanner planner;
    private final WorkloadHealthInspector healthInspector;
    private final ExecutionEngine engine;
    private final ConfirmationGate gate;
    private final ReportRenderer renderer;
    private final Clock clock;

    public CleanupService(InventoryScanner scanner, OwnershipClassifier classifier, CleanupPlanner planner,
                          WorkloadHealthInspector healthInspector, ExecutionEngine engine, ConfirmationGate gate,
                          ReportRenderer renderer, Clock clock) {
        this.scanner = scanner;
        this.classifier = classifier;
        this.planner = planner;
        this.healthInspector = healthInspector;
        this.engine = engine;
        this.gate = gate;
        this.renderer = renderer;
        this.clock = clock;
    }

    /**
     * @param dryRun          forces dry-run for {@link Command#CLEANUP}; check and plan never mutate
     * @param namespaceFilter optional scan restriction
     */
    public RunReport run(Command command, boolean dryRun, NameMatcher namespaceFilter) {
        ExecutionMode mode = command == Command.CLEANUP && !dryRun ? ExecutionMode.LIVE : ExecutionMode.DRY_RUN;
        RunReport.RunReportBuilder report = RunReport.builder()
                .command(command)
                .mode(mode)
                .startedAt(clock.instant());

        log.info("Starting {} in {} mode{}", command, mode,
                namespaceFilter != null ? " for namespaces matching '" + namespaceFilter + "'" : "");

        ScanResult scan;
        try {
            scan = scanner.scan(InventoryScanner.ALL_KINDS, namespaceFilter);
        } catch (ClusterAccessException e) {
            log.error("Inventory scan failed: {}", e.getMessage());
            renderer.printAborted(e.getMessage());
            return finish(report.outcome(RunOutcome.ABORTED).abortReason(e.getMessage()));
        }
        report.scan(scan);
        renderer.printInventory(scan);

        List<Classification> classifications = classifier.classifyAll(scan.getDescriptors());
        CleanupPlan plan = planner.plan(classifications);
        report.classifications(classifications).plan(plan);

        if (command == Command.CHECK) {
            List<HealthFinding> failing = healthInspector.inspect(scan.getDescriptors());
            report.failingWorkloads(failing);
            renderer.printCheck(classifications, failing);
            return finish(report.outcome(RunOutcome.COMPLETED));
        }

        renderer.printPlan(plan, mode);

        if (mode == ExecutionMode.DRY_RUN) {
            ExecutionResult result = engine.execute(plan, mode);
            renderer.printExecution(result);
            return finish(report.execution(result).outcome(RunOutcome.COMPLETED));
        }

        if (plan.isEmpty()) {
            log.info("Nothing to delete");
            return finish(report.execution(engine.execute(plan, mode)).outcome(RunOutcome.COMPLETED));
        }

        if (engine.isStopRequested()) {
            renderer.printCancelled();
            return finish(report.outcome(RunOutcome.CANCELLED).abortReason("interrupted before execution"));
        }

        if (!gate.confirm(plan)) {
            log.info("Cleanup declined at the confirmation prompt");
            renderer.printCancelled();
            return finish(report.outcome(RunOutcome.CANCELLED).abortReason("declined at confirmation prompt"));
        }

        if (engine.isStopRequested()) {
            renderer.printCancelled();
            return finish(report.outcome(RunOutcome.CANCELLED).abortReason("interrupted at confirmation prompt"));
        }

        ExecutionResult result = engine.execute(plan, mode);
        renderer.printExecution(result);
        if (result.getOutcome() == RunOutcome.ABORTED_PARTIAL) {
            renderer.printInterrupted();
            report.abortReason("interrupted during execution");
        }
        return finish(report.execution(result).outcome(result.getOutcome()));
    }

    private RunReport finish(RunReport.RunReportBuilder report) {
        RunReport finished = report.finishedAt(clock.instant()).build();
        log.info("Run finished: {}", finished.getOutcome());
        return finished;
    }
}
