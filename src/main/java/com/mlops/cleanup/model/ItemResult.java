package com.mlops.cleanup.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Result of applying one planned deletion.
 */
@Value
@Builder
public class ItemResult {

    public static final String STUCK_TERMINATING = "stuck-terminating-requires-manual-intervention";
    public static final String SKIPPED_INTERRUPTED = "skipped: run interrupted before this group started";

    @NonNull
    PlannedDeletion deletion;

    /**
     * Whether a mutating call was issued. False in dry-run and for skipped items.
     */
    boolean attempted;

    boolean succeeded;

    String errorMessage;

    /**
     * Finalizers were cleared to unblock a stuck deletion.
     */
    boolean recoveryApplied;

    /**
     * The object was already gone when the delete was issued.
     */
    boolean alreadyAbsent;

    Instant startedAt;
    Instant finishedAt;

    public ItemOutcome getOutcome() {
        if (!attempted) {
            return succeeded ? ItemOutcome.DRY_RUN : ItemOutcome.SKIPPED;
        }
        if (!succeeded) {
            return ItemOutcome.FAILED;
        }
        if (recoveryApplied) {
            return ItemOutcome.RECOVERED;
        }
        return alreadyAbsent ? ItemOutcome.ALREADY_ABSENT : ItemOutcome.DELETED;
    }

    public static ItemResult dryRun(PlannedDeletion deletion) {
        return ItemResult.builder().deletion(deletion).attempted(false).succeeded(true).build();
    }

    public static ItemResult skipped(PlannedDeletion deletion) {
        return ItemResult.builder().deletion(deletion).attempted(false).succeeded(false)
                .errorMessage(SKIPPED_INTERRUPTED).build();
    }
}
