package com.company.resolution.config;

/**
 * Retry policy for calls to the external search capability.
 *
 * @param maxAttempts       total attempts including the first call
 * @param initialBackoffMs  delay before the second attempt in milliseconds
 * @param backoffMultiplier factor applied to the delay after each failed attempt
 */
public record RetryConfig(int maxAttempts, long initialBackoffMs, double backoffMultiplier) {

    public RetryConfig {
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (initialBackoffMs < 0) {
            throw new ConfigurationException("initialBackoffMs must be >= 0, got " + initialBackoffMs);
        }
        if (backoffMultiplier < 1.0) {
            throw new ConfigurationException("backoffMultiplier must be >= 1.0, got " + backoffMultiplier);
        }
    }

    /**
     * Default policy: 3 attempts, 1s initial backoff, doubling.
     */
    public static RetryConfig defaults() {
        return new RetryConfig(3, 1_000, 2.0);
    }

    /**
     * A single attempt with no retries.
     */
    public static RetryConfig noRetry() {
        return new RetryConfig(1, 0, 1.0);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public long backoffMsAfter(int attempt) {
        return (long) (initialBackoffMs * Math.pow(backoffMultiplier, Math.max(0, attempt - 1)));
    }
}
