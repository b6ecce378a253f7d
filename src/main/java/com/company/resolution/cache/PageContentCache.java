package com.company.resolution.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Cache of fetched homepage text, keyed by URL.
 * Shared by all enrichment workers, so implementations must be thread-safe.
 */
public interface PageContentCache {

    /**
     * @return the cached page text, or empty if the URL has not been fetched
     */
    Optional<String> get(String url);

    void put(String url, String pageText);

    /**
     * Returns the cached text for the URL, computing and caching it on a miss.
     */
    default String get(String url, Function<String, String> loader) {
        Optional<String> cached = get(url);
        if (cached.isPresent()) {
            return cached.get();
        }
        String text = loader.apply(url);
        put(url, text);
        return text;
    }

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates the cache described by the given configuration.
     */
    static PageContentCache create(CacheConfig config) {
        return config.enabled() ? new CaffeinePageContentCache(config) : new NoOpPageContentCache();
    }
}
