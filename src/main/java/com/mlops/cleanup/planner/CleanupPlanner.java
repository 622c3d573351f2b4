package com.mlops.cleanup.planner;

import com.mlops.cleanup.model.Classification;
import com.mlops.cleanup.model.CleanupPlan;
import com.mlops.cleanup.model.PlannedDeletion;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.SequenceGroup;
import com.mlops.cleanup.model.Verdict;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns verdicts into an ordered, reproducible cleanup plan.
 * Only orphaned resources are planned; needs-review ones travel along as advisories.
 */
@Slf4j
public class CleanupPlanner {

    /**
     * Cluster-scoped objects (no namespace) sort before namespaced ones.
     */
    static final Comparator<ResourceDescriptor> BY_NAMESPACE_AND_NAME =
            Comparator.comparing((ResourceDescriptor d) -> d.getNamespace() == null ? "" : d.getNamespace())
                    .thenComparing(ResourceDescriptor::getName)
                    .thenComparing(ResourceDescriptor::getKind);

    public CleanupPlan plan(List<Classification> classifications) {
        List<PlannedDeletion> deletions = new ArrayList<>();
        List<Classification> advisories = new ArrayList<>();

        for (Classification classification : classifications) {
            if (classification.getVerdict() == Verdict.ORPHANED) {
                ResourceDescriptor descriptor = classification.getDescriptor();
                deletions.add(new PlannedDeletion(descriptor, classification.getReason(),
                        SequenceGroup.forKind(descriptor.getKind())));
            } else if (classification.getVerdict() == Verdict.NEEDS_REVIEW) {
                advisories.add(classification);
            }
        }

        deletions.sort(Comparator.comparing(PlannedDeletion::getSequenceGroup)
                .thenComparing(PlannedDeletion::getDescriptor, BY_NAMESPACE_AND_NAME));
        advisories.sort(Comparator.comparing(Classification::getDescriptor, BY_NAMESPACE_AND_NAME));

        log.info("Planned {} deletions, {} resources need review", deletions.size(), advisories.size());
        return new CleanupPlan(deletions, advisories);
    }
}
