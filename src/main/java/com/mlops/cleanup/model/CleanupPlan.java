package com.mlops.cleanup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Ordered deletions plus the advisory set of resources that need a human decision.
 * Deletions are sorted by sequence group, then namespace, then name.
 */
@Value
public class CleanupPlan {

    public static final CleanupPlan EMPTY = new CleanupPlan(List.of(), List.of());

    @NonNull
    List<PlannedDeletion> deletions;

    /**
     * NeedsReview verdicts. Surfaced to the operator, never executed.
     */
    @NonNull
    List<Classification> advisories;

    public CleanupPlan(List<PlannedDeletion> deletions, List<Classification> advisories) {
        this.deletions = List.copyOf(deletions);
        this.advisories = List.copyOf(advisories);
    }

    public boolean isEmpty() {
        return deletions.isEmpty();
    }

    public int size() {
        return deletions.size();
    }

    /**
     * Deletions bucketed by group, in group order. Groups without items are omitted.
     */
    @JsonIgnore
    public Map<SequenceGroup, List<PlannedDeletion>> getDeletionsByGroup() {
        Map<SequenceGroup, List<PlannedDeletion>> byGroup = new EnumMap<>(SequenceGroup.class);
        for (PlannedDeletion deletion : deletions) {
            byGroup.computeIfAbsent(deletion.getSequenceGroup(), g -> new ArrayList<>()).add(deletion);
        }
        return byGroup;
    }

    public Map<ResourceKind, Long> getCountsByKind() {
        return deletions.stream()
                .collect(Collectors.groupingBy(d -> d.getDescriptor().getKind(),
                        TreeMap::new, Collectors.counting()));
    }
}
