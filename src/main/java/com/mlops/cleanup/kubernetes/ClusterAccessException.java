package com.mlops.cleanup.kubernetes;

/**
 * A call to the cluster API or the release manager failed.
 */
public class ClusterAccessException extends RuntimeException {

    public ClusterAccessException(String message) {
        super(message);
    }

    public ClusterAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
