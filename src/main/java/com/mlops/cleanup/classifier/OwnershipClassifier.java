package com.mlops.cleanup.classifier;

import com.mlops.cleanup.model.Classification;
import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;
import com.mlops.cleanup.registry.BaselineRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides managed / orphaned / needs-review for each scanned resource.
 * Rules are evaluated in order and the first match wins. Anything no rule
 * claims stays managed.
 */
@Slf4j
public class OwnershipClassifier {

    public static final String SYSTEM_RESERVED = "system-reserved";
    public static final String MANAGED_NAMESPACE = "managed-namespace";
    public static final String UNMANAGED_AND_EMPTY = "unmanaged-and-empty";
    public static final String UNMANAGED_BUT_OCCUPIED = "unmanaged-but-occupied";
    public static final String CHILD_COUNT_UNKNOWN = "child-count-unknown";
    public static final String COMPLETED_JOB = "completed-job";
    public static final String FAILED_JOB = "failed-job";
    public static final String TERMINAL_POD = "terminal-pod";
    public static final String WITHIN_RETENTION = "within-retention-window";
    public static final String UNBOUND_PVC = "unbound-pvc";
    public static final String UNRECOGNIZED_CRD = "unrecognized-crd";
    public static final String UNRECOGNIZED_RELEASE = "unrecognized-release";
    public static final String DISPOSABLE_NAME = "disposable-name-pattern";
    public static final String PROTECTED_NAME = "protected-name";
    public static final String NO_RULE_MATCHED = "no-orphan-rule-matched";

    private final BaselineRegistry registry;
    private final long terminalRetentionSeconds;

    public OwnershipClassifier(BaselineRegistry registry) {
        this(registry, 0);
    }

    /**
     * @param terminalRetentionSeconds terminal jobs and pods younger than this stay managed; 0 disables
     */
    public OwnershipClassifier(BaselineRegistry registry, long terminalRetentionSeconds) {
        this.registry = registry;
        this.terminalRetentionSeconds = terminalRetentionSeconds;
    }

    public List<Classification> classifyAll(List<ResourceDescriptor> descriptors) {
        List<Classification> result = new ArrayList<>(descriptors.size());
        for (ResourceDescriptor descriptor : descriptors) {
            result.add(classify(descriptor));
        }
        return result;
    }

    public Classification classify(ResourceDescriptor descriptor) {
        Classification verdict = evaluate(descriptor);
        log.debug("{} -> {} ({})", descriptor.getDisplayId(), verdict.getVerdict(), verdict.getReason());
        return verdict;
    }

    private Classification evaluate(ResourceDescriptor d) {
        ResourceKind kind = d.getKind();

        if (isSystemReserved(d)) {
            return Classification.managed(d, SYSTEM_RESERVED);
        }

        if (kind == ResourceKind.NAMESPACE) {
            if (registry.isManagedNamespace(d.getName())) {
                return Classification.managed(d, MANAGED_NAMESPACE);
            }
            Integer children = d.getOwnerHints().getChildResourceCount();
            if (children == null) {
                return Classification.needsReview(d, CHILD_COUNT_UNKNOWN);
            }
            if (children == 0) {
                return Classification.orphaned(d, UNMANAGED_AND_EMPTY);
            }
            return Classification.needsReview(d, UNMANAGED_BUT_OCCUPIED);
        }

        if (kind == ResourceKind.JOB && d.getPhase() == ResourcePhase.SUCCEEDED) {
            return terminal(d, COMPLETED_JOB);
        }
        if (kind == ResourceKind.JOB && d.getPhase() == ResourcePhase.FAILED) {
            return terminal(d, FAILED_JOB);
        }
        if (kind == ResourceKind.POD && d.getPhase().isTerminal()) {
            return terminal(d, TERMINAL_POD);
        }

        if (kind == ResourceKind.PERSISTENT_VOLUME_CLAIM && d.getPhase() != ResourcePhase.BOUND) {
            return Classification.needsReview(d, UNBOUND_PVC);
        }

        if (kind == ResourceKind.CUSTOM_RESOURCE_DEFINITION && !registry.matchesManagedCRDPattern(d.getName())) {
            return Classification.orphaned(d, UNRECOGNIZED_CRD);
        }

        if (kind == ResourceKind.PACKAGE_RELEASE && !registry.isManagedRelease(d.getName())) {
            return Classification.orphaned(d, UNRECOGNIZED_RELEASE);
        }

        if (kind == ResourceKind.CONFIG_MAP || kind == ResourceKind.SECRET) {
            if (registry.isProtectedName(d.getName())) {
                return Classification.managed(d, PROTECTED_NAME);
            }
            if (registry.isDisposableName(d.getName())) {
                return Classification.orphaned(d, DISPOSABLE_NAME);
            }
        }

        return Classification.managed(d, NO_RULE_MATCHED);
    }

    private boolean isSystemReserved(ResourceDescriptor d) {
        if (d.getKind() == ResourceKind.NAMESPACE) {
            return registry.isSystemNamespace(d.getName());
        }
        return registry.isSystemNamespace(d.getNamespace());
    }

    private Classification terminal(ResourceDescriptor d, String reason) {
        if (terminalRetentionSeconds > 0 && d.getAgeSeconds() < terminalRetentionSeconds) {
            return Classification.managed(d, WITHIN_RETENTION);
        }
        return Classification.orphaned(d, reason);
    }
}
