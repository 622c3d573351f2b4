package com.mlops.cleanup.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A workload observed in an error state. Reported by {@code check}; never acted upon.
 */
@Value
public class HealthFinding {

    @NonNull
    ResourceDescriptor descriptor;

    /**
     * What is wrong, e.g. "Failed", "Pending" or "CrashLoopBackOff".
     */
    @NonNull
    String problem;
}
