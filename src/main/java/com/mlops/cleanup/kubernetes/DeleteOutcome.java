package com.mlops.cleanup.kubernetes;

public enum DeleteOutcome {
    /**
     * Deletion accepted and the object is gone.
     */
    REMOVED,
    /**
     * The object did not exist when the delete was issued.
     */
    NOT_FOUND,
    /**
     * Deletion accepted but the object is still present after the timeout.
     */
    TIMED_OUT
}
