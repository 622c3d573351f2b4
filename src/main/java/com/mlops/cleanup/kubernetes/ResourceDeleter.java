package com.mlops.cleanup.kubernetes;

import com.mlops.cleanup.model.ResourceDescriptor;

import java.time.Duration;

/**
 * Mutating access used by the execution engine.
 */
public interface ResourceDeleter {

    /**
     * Request deletion and wait up to {@code timeout} for the object to disappear.
     *
     * @throws ClusterAccessException when the API rejects the request
     */
    DeleteOutcome delete(ResourceDescriptor descriptor, Duration timeout);

    /**
     * Wait for an object whose deletion was already requested.
     *
     * @return true if the object is gone within the timeout
     */
    boolean awaitRemoval(ResourceDescriptor descriptor, Duration timeout);
}
