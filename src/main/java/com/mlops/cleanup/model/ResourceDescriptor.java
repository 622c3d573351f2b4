package com.mlops.cleanup.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time snapshot of one live cluster object. Never mutated after the scan;
 * classification and planning build new structures around it.
 */
@Value
@Builder(toBuilder = true)
public class ResourceDescriptor {

    @NonNull
    ResourceKind kind;

    /**
     * Null for cluster-scoped kinds.
     */
    String namespace;

    @NonNull
    String name;

    @Singular
    Map<String, String> labels;

    @NonNull
    @Builder.Default
    ResourcePhase phase = ResourcePhase.UNKNOWN;

    @NonNull
    @Builder.Default
    OwnerHints ownerHints = OwnerHints.NONE;

    long ageSeconds;

    /**
     * Short machine-readable reason a workload is not healthy, such as a container
     * waiting reason. Null when nothing is reported.
     */
    String statusReason;

    /**
     * Identifier used in reports and logs: "Kind namespace/name" or "Kind name".
     */
    public String getDisplayId() {
        return kind.getDisplayName() + " " + getQualifiedName();
    }

    public String getQualifiedName() {
        return namespace == null ? name : namespace + "/" + name;
    }
}
