package com.mlops.cleanup.model;

/**
 * Outcome of classifying one resource against the platform baseline.
 */
public enum Verdict {
    /**
     * Owned by the baseline, or not confidently disposable. Never deleted.
     */
    MANAGED,

    /**
     * Confidently identified leftover state. Eligible for automatic deletion.
     */
    ORPHANED,

    /**
     * Cannot be safely auto-classified. Reported, never acted upon.
     */
    NEEDS_REVIEW
}
