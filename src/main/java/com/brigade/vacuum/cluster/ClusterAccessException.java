package com.brigade.vacuum.cluster;

/**
 * Thrown when the cluster cannot list or delete a resource.
 */
public class ClusterAccessException extends RuntimeException {
    public ClusterAccessException(String message) {
        super(message);
    }

    public ClusterAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
