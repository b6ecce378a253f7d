package com.company.resolution.cache;

import com.company.resolution.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PageContentCacheTest {

    @Nested
    @DisplayName("NoOpPageContentCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void testGetAlwaysEmpty() {
            NoOpPageContentCache cache = new NoOpPageContentCache();
            cache.put("https://acme.com", "Acme Corporation");
            assertTrue(cache.get("https://acme.com").isEmpty());
        }

        @Test
        @DisplayName("Should call the loader every time")
        void testLoaderAlwaysCalled() {
            NoOpPageContentCache cache = new NoOpPageContentCache();
            AtomicInteger calls = new AtomicInteger();

            cache.get("https://acme.com", url -> "page" + calls.incrementAndGet());
            cache.get("https://acme.com", url -> "page" + calls.incrementAndGet());

            assertEquals(2, calls.get());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("CaffeinePageContentCache")
    class CaffeineTests {

        private final CaffeinePageContentCache cache = new CaffeinePageContentCache(new CacheConfig(100, 60, true));

        @Test
        @DisplayName("Should return cached text on hit")
        void testPutAndGet() {
            cache.put("https://acme.com", "Acme Corporation");
            assertEquals("Acme Corporation", cache.get("https://acme.com").orElseThrow());
            assertTrue(cache.get("https://globex.com").isEmpty());
        }

        @Test
        @DisplayName("Should load once and serve later lookups from the cache")
        void testLoaderCalledOnce() {
            AtomicInteger calls = new AtomicInteger();

            assertEquals("Acme", cache.get("https://acme.com", url -> {
                calls.incrementAndGet();
                return "Acme";
            }));
            assertEquals("Acme", cache.get("https://acme.com", url -> {
                calls.incrementAndGet();
                return "other";
            }));

            assertEquals(1, calls.get());
            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("Should store null page text as empty")
        void testNullText() {
            cache.put("https://acme.com", null);
            assertEquals("", cache.get("https://acme.com").orElseThrow());
        }

        @Test
        @DisplayName("Should clear all entries on invalidate")
        void testInvalidateAll() {
            cache.put("https://acme.com", "Acme");
            cache.invalidateAll();
            assertTrue(cache.get("https://acme.com").isEmpty());
        }
    }

    @Test
    @DisplayName("Factory should honor the enabled flag")
    void testCreate() {
        assertInstanceOf(CaffeinePageContentCache.class, PageContentCache.create(CacheConfig.defaults()));
        assertInstanceOf(NoOpPageContentCache.class, PageContentCache.create(CacheConfig.disabled()));
    }

    @Test
    @DisplayName("Should reject non-positive sizes")
    void testInvalidConfig() {
        assertThrows(ConfigurationException.class, () -> new CacheConfig(0, 60, true));
        assertThrows(ConfigurationException.class, () -> new CacheConfig(10, 0, true));
    }
}
