package com.mlops.cleanup.service;

import com.mlops.cleanup.model.Classification;
import com.mlops.cleanup.model.CleanupPlan;
import com.mlops.cleanup.model.ExecutionMode;
import com.mlops.cleanup.model.ExecutionResult;
import com.mlops.cleanup.model.HealthFinding;
import com.mlops.cleanup.model.RunOutcome;
import com.mlops.cleanup.model.ScanResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Everything one invocation produced. Fields after the point where the run stopped are null.
 */
@Value
@Builder
public class RunReport {

    Command command;

    ExecutionMode mode;

    RunOutcome outcome;

    Instant startedAt;

    Instant finishedAt;

    ScanResult scan;

    @Singular
    List<Classification> classifications;

    CleanupPlan plan;

    /**
     * Workloads in an error state. Only {@link Command#CHECK} looks for them.
     */
    @Singular
    List<HealthFinding> failingWorkloads;

    ExecutionResult execution;

    /**
     * Set when the run was aborted or cancelled.
     */
    String abortReason;

    public boolean hasIssues() {
        return plan != null && (!plan.isEmpty() || !plan.getAdvisories().isEmpty())
                || !failingWorkloads.isEmpty();
    }
}
