package com.mlops.cleanup.cli;

import com.mlops.cleanup.model.ExecutionMode;
import com.mlops.cleanup.service.RunReport;

/**
 * Process exit codes.
 */
public enum ExitCode {

    SUCCESS(0),
    /** check, plan or dry-run cleanup found something to act on. */
    ISSUES_FOUND(1),
    /** Live cleanup finished but some deletions failed. */
    EXECUTION_FAILURES(2),
    /** Bad configuration, unreachable cluster or bad command line. */
    ABORTED(3),
    /** Declined at the prompt or interrupted. */
    CANCELLED(130);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ExitCode forReport(RunReport report) {
        switch (report.getOutcome()) {
            case ABORTED:
                return ABORTED;
            case CANCELLED:
            case ABORTED_PARTIAL:
                return CANCELLED;
            case COMPLETED:
            default:
                break;
        }
        if (report.getMode() == ExecutionMode.LIVE) {
            return report.getExecution() != null && report.getExecution().hasFailures()
                    ? EXECUTION_FAILURES : SUCCESS;
        }
        return report.hasIssues() ? ISSUES_FOUND : SUCCESS;
    }
}
