package com.mlops.cleanup.helm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlops.cleanup.kubernetes.ClusterAccessException;
import com.mlops.cleanup.kubernetes.DeleteOutcome;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link ReleaseClient} backed by the Helm 3 command line.
 */
@Slf4j
public class HelmCliReleaseClient implements ReleaseClient {

    private static final Duration LIST_TIMEOUT = Duration.ofSeconds(60);
    /**
     * Extra time given to the helm process beyond its own --timeout.
     */
    private static final Duration PROCESS_GRACE = Duration.ofSeconds(30);

    private final ShellCommandRunner runner;
    private final String helmBinary;
    private final String kubeContext;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HelmCliReleaseClient(ShellCommandRunner runner, String helmBinary, String kubeContext) {
        this.runner = runner;
        this.helmBinary = helmBinary;
        this.kubeContext = kubeContext;
    }

    @Override
    public List<HelmRelease> listReleases() {
        List<String> command = baseCommand();
        command.addAll(List.of("list", "--all-namespaces", "--all", "--max", "0", "-o", "json"));

        ShellResponse response = run(command, LIST_TIMEOUT);
        if (!response.isSuccess()) {
            throw new ClusterAccessException("helm list failed (exit " + response.getCode() + "): "
                    + response.getError().trim());
        }
        String json = response.getOutput().trim();
        if (json.isEmpty()) {
            return List.of();
        }
        try {
            List<HelmRelease> releases = objectMapper.readValue(json, new TypeReference<List<HelmRelease>>() {});
            log.debug("helm reported {} releases", releases.size());
            return releases;
        } catch (IOException e) {
            throw new ClusterAccessException("Unreadable helm list output: " + e.getMessage(), e);
        }
    }

    @Override
    public DeleteOutcome uninstall(String name, String namespace, Duration timeout) {
        List<String> command = baseCommand();
        command.addAll(List.of("uninstall", name, "--namespace", namespace,
                "--wait", "--timeout", timeout.getSeconds() + "s"));

        ShellResponse response = run(command, timeout.plus(PROCESS_GRACE));
        if (response.isSuccess()) {
            log.info("Uninstalled release {}/{}", namespace, name);
            return DeleteOutcome.REMOVED;
        }
        String error = response.getError().toLowerCase(Locale.ROOT);
        if (error.contains("not found")) {
            log.info("Release {}/{} already absent", namespace, name);
            return DeleteOutcome.NOT_FOUND;
        }
        if (response.isTimedOut() || error.contains("timed out")) {
            return DeleteOutcome.TIMED_OUT;
        }
        throw new ClusterAccessException("helm uninstall " + namespace + "/" + name + " failed (exit "
                + response.getCode() + "): " + response.getError().trim());
    }

    private List<String> baseCommand() {
        List<String> command = new ArrayList<>();
        command.add(helmBinary);
        if (kubeContext != null && !kubeContext.isEmpty()) {
            command.add("--kube-context");
            command.add(kubeContext);
        }
        return command;
    }

    private ShellResponse run(List<String> command, Duration timeout) {
        try {
            return runner.run(command, timeout);
        } catch (IOException e) {
            throw new ClusterAccessException("Cannot run " + helmBinary + ": " + e.getMessage(), e);
        }
    }
}
