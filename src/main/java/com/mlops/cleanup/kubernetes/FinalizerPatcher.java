package com.mlops.cleanup.kubernetes;

import com.mlops.cleanup.model.ResourceDescriptor;

/**
 * Stuck-resource recovery: drops every finalizer from an object's metadata.
 */
public interface FinalizerPatcher {

    /**
     * @throws ClusterAccessException when the patch is rejected
     */
    void clearFinalizers(ResourceDescriptor descriptor);
}
