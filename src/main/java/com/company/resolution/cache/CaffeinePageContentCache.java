package com.company.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Caffeine-backed page cache with bounded size and write TTL.
 */
public class CaffeinePageContentCache implements PageContentCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeinePageContentCache.class);

    private final Cache<String, String> cache;

    public CaffeinePageContentCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeinePageContentCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(String url) {
        return Optional.ofNullable(cache.getIfPresent(url));
    }

    @Override
    public void put(String url, String pageText) {
        cache.put(url, pageText != null ? pageText : "");
    }

    @Override
    public String get(String url, Function<String, String> loader) {
        return cache.get(url, key -> {
            String text = loader.apply(key);
            return text != null ? text : "";
        });
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all page cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
