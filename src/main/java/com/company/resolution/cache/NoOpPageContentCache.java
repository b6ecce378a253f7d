package com.company.resolution.cache;

import java.util.Optional;

/**
 * Cache that never stores anything. Used when page caching is disabled.
 */
public class NoOpPageContentCache implements PageContentCache {

    @Override
    public Optional<String> get(String url) {
        return Optional.empty();
    }

    @Override
    public void put(String url, String pageText) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
