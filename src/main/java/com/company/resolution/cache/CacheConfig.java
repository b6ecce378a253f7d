package com.company.resolution.cache;

import com.company.resolution.config.ConfigurationException;

/**
 * Configuration for the page content cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new ConfigurationException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new ConfigurationException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 pages, 1h TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 3_600, true);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
