package com.mlops.cleanup.kubernetes;

import com.mlops.cleanup.model.ResourceDescriptor;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ResourcePhase;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to cluster inventory.
 */
public interface ResourceLister {

    /**
     * @throws ClusterAccessException if the cluster cannot be reached at all
     */
    void verifyConnectivity();

    /**
     * Every object of the kind visible to the caller's credentials, across all namespaces
     * for namespaced kinds.
     *
     * @throws ClusterAccessException if the kind cannot be listed
     */
    List<ResourceDescriptor> list(ResourceKind kind);

    /**
     * Number of workload objects (pods, services, controllers, jobs, claims) in a namespace.
     *
     * @throws ClusterAccessException if the namespace cannot be inspected
     */
    int countNamespaceChildren(String namespace);

    /**
     * Current phase of the object, or empty when it no longer exists.
     */
    Optional<ResourcePhase> currentPhase(ResourceDescriptor descriptor);
}
