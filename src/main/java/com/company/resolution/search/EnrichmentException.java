package com.company.resolution.search;

/**
 * Failure while looking up website candidates for a cluster.
 * Not retried; the cluster is recorded as an error.
 */
public class EnrichmentException extends RuntimeException {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
