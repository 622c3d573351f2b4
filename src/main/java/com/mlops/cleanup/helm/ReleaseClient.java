package com.mlops.cleanup.helm;

import com.mlops.cleanup.kubernetes.DeleteOutcome;

import java.time.Duration;
import java.util.List;

/**
 * Package manager capability: list releases and uninstall one.
 */
public interface ReleaseClient {

    /**
     * @throws com.mlops.cleanup.kubernetes.ClusterAccessException if releases cannot be listed
     */
    List<HelmRelease> listReleases();

    /**
     * @throws com.mlops.cleanup.kubernetes.ClusterAccessException if the uninstall fails
     */
    DeleteOutcome uninstall(String name, String namespace, Duration timeout);
}
