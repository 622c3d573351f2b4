package com.mlops.cleanup.model;

/**
 * Terminal state of one invocation.
 */
public enum RunOutcome {
    /**
     * All groups processed, regardless of individual item failures.
     */
    COMPLETED,
    /**
     * The operator declined at the confirmation gate.
     */
    CANCELLED,
    /**
     * Configuration failed to load or the inventory scan failed entirely.
     */
    ABORTED,
    /**
     * Interrupted during execution; some groups were never started.
     */
    ABORTED_PARTIAL
}
