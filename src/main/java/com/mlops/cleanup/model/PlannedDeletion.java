package com.mlops.cleanup.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One deletion scheduled by the planner.
 */
@Value
public class PlannedDeletion {

    @NonNull
    ResourceDescriptor descriptor;

    @NonNull
    String verdictReason;

    @NonNull
    SequenceGroup sequenceGroup;
}
