package com.mlops.cleanup.model;

/**
 * Kinds of cluster objects the inventory scanner looks at.
 */
public enum ResourceKind {

    NAMESPACE("Namespace", false),
    PERSISTENT_VOLUME_CLAIM("PersistentVolumeClaim", true),
    CUSTOM_RESOURCE_DEFINITION("CustomResourceDefinition", false),
    /**
     * A release installed by the package manager (Helm). Lives in a namespace
     * but is not a Kubernetes API object.
     */
    PACKAGE_RELEASE("PackageRelease", true),
    JOB("Job", true),
    POD("Pod", true),
    CONFIG_MAP("ConfigMap", true),
    SECRET("Secret", true);

    private final String displayName;
    private final boolean namespaced;

    ResourceKind(String displayName, boolean namespaced) {
        this.displayName = displayName;
        this.namespaced = namespaced;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isNamespaced() {
        return namespaced;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
