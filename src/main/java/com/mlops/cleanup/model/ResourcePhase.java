package com.mlops.cleanup.model;

import java.util.Locale;

/**
 * Lifecycle phase observed on a resource. Meaning is kind-specific:
 * pods and jobs report run state, claims report binding, namespaces report
 * {@link #ACTIVE} or {@link #TERMINATING}.
 */
public enum ResourcePhase {
    ACTIVE,
    SUCCEEDED,
    FAILED,
    TERMINATING,
    BOUND,
    PENDING,
    UNKNOWN;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Map a phase string reported by the API server or Helm. Unrecognised values map to UNKNOWN.
     */
    public static ResourcePhase fromApiValue(String value) {
        if (value == null || value.isEmpty()) {
            return UNKNOWN;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "active":
            case "running":
            case "available":
            case "deployed":
                return ACTIVE;
            case "succeeded":
            case "complete":
            case "completed":
                return SUCCEEDED;
            case "failed":
            case "lost":
                return FAILED;
            case "terminating":
            case "uninstalling":
                return TERMINATING;
            case "bound":
                return BOUND;
            case "pending":
            case "pending-install":
            case "pending-upgrade":
            case "pending-rollback":
                return PENDING;
            default:
                return UNKNOWN;
        }
    }
}
