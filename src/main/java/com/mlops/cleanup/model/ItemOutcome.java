package com.mlops.cleanup.model;

/**
 * Summary category of an item result, used for counts in reports.
 */
public enum ItemOutcome {
    DELETED,
    ALREADY_ABSENT,
    RECOVERED,
    FAILED,
    SKIPPED,
    DRY_RUN
}
