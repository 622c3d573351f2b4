package com.mlops.cleanup.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Verdict for one resource descriptor together with the rule that produced it.
 */
@Value
public class Classification {

    @NonNull
    ResourceDescriptor descriptor;

    @NonNull
    Verdict verdict;

    @NonNull
    String reason;

    public static Classification managed(ResourceDescriptor descriptor, String reason) {
        return new Classification(descriptor, Verdict.MANAGED, reason);
    }

    public static Classification orphaned(ResourceDescriptor descriptor, String reason) {
        return new Classification(descriptor, Verdict.ORPHANED, reason);
    }

    public static Classification needsReview(ResourceDescriptor descriptor, String reason) {
        return new Classification(descriptor, Verdict.NEEDS_REVIEW, reason);
    }
}
