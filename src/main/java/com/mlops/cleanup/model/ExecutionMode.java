package com.mlops.cleanup.model;

public enum ExecutionMode {
    /**
     * No mutating calls; every item is reported as would-succeed.
     */
    DRY_RUN,
    LIVE
}
