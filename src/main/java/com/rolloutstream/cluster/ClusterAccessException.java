package com.rolloutstream.cluster;

/**
 * Thrown when a query against the cluster API fails. Callers in the log engine
 * treat it as transient and retry on their next tick.
 */
public class ClusterAccessException extends RuntimeException {
    public ClusterAccessException(String message) {
        super(message);
    }

    public ClusterAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
