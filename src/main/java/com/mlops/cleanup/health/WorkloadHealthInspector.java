package com.mlops.cleanup.health;

import com.mlops.cleanup.model.HealthFinding;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Finds pods and jobs that are failed, stuck in Pending, or whose containers cannot start.
 * Ownership plays no part here: a broken managed workload is reported as well.
 */
@Slf4j
public class WorkloadHealthInspector {

    /**
     * Container waiting reasons that mean the workload will not recover on its own.
     */
    public static final Set<String> ERROR_REASONS = Set.of(
            "CrashLoopBackOff",
            "ImagePullBackOff",
            "ErrImagePull",
            "InvalidImageName",
            "CreateContainerConfigError",
            "CreateContainerError",
            "RunContainerError");

    static final String FAILED = "Failed";
    static final String PENDING = "Pending";

    private static final Comparator<HealthFinding> ORDER =
            Comparator.comparing((HealthFinding f) -> f.getDescriptor().getNamespace() == null
                            ? "" : f.getDescriptor().getNamespace())
                    .thenComparing(f -> f.getDescriptor().getName())
                    .thenComparing(f -> f.getDescriptor().getKind());

    public List<HealthFinding> inspect(List<ResourceDescriptor> descriptors) {
        List<HealthFinding> findings = new ArrayList<>();
        for (ResourceDescriptor descriptor : descriptors) {
            String problem = problemOf(descriptor);
            if (problem != null) {
                findings.add(new HealthFinding(descriptor, problem));
            }
        }
        findings.sort(ORDER);
        log.info("Health check: {} failing workloads", findings.size());
        return findings;
    }

    /**
     * @return the problem to report, or null for a healthy or irrelevant resource
     */
    String problemOf(ResourceDescriptor descriptor) {
        ResourceKind kind = descriptor.getKind();
        if (kind != ResourceKind.POD && kind != ResourceKind.JOB) {
            return null;
        }
        ResourcePhase phase = descriptor.getPhase();
        if (phase == ResourcePhase.TERMINATING || phase == ResourcePhase.SUCCEEDED) {
            return null;
        }
        String reason = descriptor.getStatusReason();
        if (reason != null && ERROR_REASONS.contains(reason)) {
            return reason;
        }
        if (phase == ResourcePhase.FAILED) {
            return reason != null ? FAILED + " (" + reason + ")" : FAILED;
        }
        if (phase == ResourcePhase.PENDING && kind == ResourceKind.POD) {
            return PENDING;
        }
        return null;
    }
}
