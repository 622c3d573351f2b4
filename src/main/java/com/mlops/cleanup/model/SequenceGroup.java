package com.mlops.cleanup.model;

/**
 * Ordered deletion buckets. Every item of a group reaches a terminal state before
 * the next group starts: namespace deletion can block on jobs, pods and config
 * objects that are scheduled for removal in the earlier groups.
 */
public enum SequenceGroup {

    TERMINAL_WORKLOADS(1, "Completed/failed jobs and terminal pods"),
    DISPOSABLE_CONFIG(2, "Temporary ConfigMaps and Secrets"),
    EMPTY_NAMESPACES(3, "Empty orphaned namespaces"),
    UNBOUND_CLAIMS(4, "Unbound orphaned PersistentVolumeClaims"),
    ORPHANED_CRDS(5, "Orphaned CustomResourceDefinitions"),
    ORPHANED_RELEASES(6, "Orphaned package releases");

    private final int order;
    private final String description;

    SequenceGroup(int order, String description) {
        this.order = order;
        this.description = description;
    }

    public int getOrder() {
        return order;
    }

    public String getDescription() {
        return description;
    }

    public static SequenceGroup forKind(ResourceKind kind) {
        switch (kind) {
            case JOB:
            case POD:
                return TERMINAL_WORKLOADS;
            case CONFIG_MAP:
            case SECRET:
                return DISPOSABLE_CONFIG;
            case NAMESPACE:
                return EMPTY_NAMESPACES;
            case PERSISTENT_VOLUME_CLAIM:
                return UNBOUND_CLAIMS;
            case CUSTOM_RESOURCE_DEFINITION:
                return ORPHANED_CRDS;
            case PACKAGE_RELEASE:
                return ORPHANED_RELEASES;
            default:
                throw new IllegalArgumentException("No sequence group for kind " + kind);
        }
    }
}
