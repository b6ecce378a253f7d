package com.company.resolution.search;

/**
 * Failure that may succeed when retried: network errors, timeouts, rate limiting and server errors.
 */
public class TransientEnrichmentException extends EnrichmentException {

    public TransientEnrichmentException(String message) {
        super(message);
    }

    public TransientEnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
