package com.mlops.cleanup.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of cleanup-config.yaml.
 */
@Data
public class CleanupConfig {

    private Baseline baseline = new Baseline();

    private Execution execution = new Execution();

    private Policy policy = new Policy();

    /**
     * Declared platform baseline. Membership here is the only way a resource becomes managed.
     * Patterns accept a leading and/or trailing '*' wildcard.
     */
    @Data
    public static class Baseline {

        /**
         * Namespaces reserved by Kubernetes itself; everything inside them is managed.
         */
        private List<String> systemNamespaces = new ArrayList<>();

        private List<String> managedNamespaces = new ArrayList<>();

        /**
         * Helm release names expected to exist.
         */
        private List<String> managedReleases = new ArrayList<>();

        /**
         * CRD name patterns belonging to recognized operators, e.g. "*strimzi*".
         */
        private List<String> managedCrdPatterns = new ArrayList<>();

        /**
         * ConfigMap/Secret name patterns reserved for ephemeral artifacts.
         */
        private List<String> disposableNamePatterns = new ArrayList<>();

        /**
         * Names that are never orphaned even if a disposable pattern matches.
         */
        private List<String> protectedNames = new ArrayList<>();
    }

    /**
     * Scan and deletion tuning.
     */
    @Data
    public static class Execution {

        private int workers = 4;

        private int scanWorkers = 2;

        private int pageSize = 500;

        private long podTimeoutSeconds = 60;

        private long jobTimeoutSeconds = 60;

        private long namespaceTimeoutSeconds = 300;

        private long defaultTimeoutSeconds = 60;
    }

    @Data
    public static class Policy {

        /**
         * Minimum age before a terminal job or pod is considered stale. 0 disables the check.
         */
        private long terminalRetentionSeconds = 0;
    }
}
