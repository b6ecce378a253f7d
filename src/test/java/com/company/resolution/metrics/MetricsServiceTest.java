package com.company.resolution.metrics;

import com.company.resolution.core.model.EnrichmentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            MetricsService noOp = NoOpMetricsService.INSTANCE;

            assertDoesNotThrow(() -> {
                noOp.recordClusteringDuration(Duration.ofMillis(100));
                noOp.recordClusterCount(12);
                noOp.incrementClusterStatus(EnrichmentStatus.VERIFIED);
                noOp.recordSearchDuration(Duration.ofMillis(30));
                noOp.incrementSearchRetry();
                noOp.recordCandidateScore(0.8);
                noOp.recordBatchSize(50);
                noOp.incrementDroppedRecords(3);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count enriched clusters by status")
        void incrementClusterStatus() {
            metrics.incrementClusterStatus(EnrichmentStatus.VERIFIED);
            metrics.incrementClusterStatus(EnrichmentStatus.VERIFIED);
            metrics.incrementClusterStatus(EnrichmentStatus.ERROR);

            Counter verified = registry.find("company.enrichment.clusters").tag("status", "VERIFIED").counter();
            Counter error = registry.find("company.enrichment.clusters").tag("status", "ERROR").counter();
            Counter noCandidate = registry.find("company.enrichment.clusters").tag("status", "NO_CANDIDATE").counter();

            assertNotNull(verified);
            assertEquals(2.0, verified.count());
            assertEquals(1.0, error.count());
            assertEquals(0.0, noCandidate.count());
        }

        @Test
        @DisplayName("Should record clustering and search durations as timers")
        void recordDurations() {
            metrics.recordClusteringDuration(Duration.ofMillis(150));
            metrics.recordSearchDuration(Duration.ofMillis(20));
            metrics.recordSearchDuration(Duration.ofMillis(40));

            Timer clustering = registry.find("company.clustering.duration").timer();
            Timer search = registry.find("company.search.duration").timer();

            assertNotNull(clustering);
            assertEquals(1, clustering.count());
            assertEquals(2, search.count());
        }

        @Test
        @DisplayName("Should record candidate scores and batch sizes as distributions")
        void recordDistributions() {
            metrics.recordCandidateScore(0.5);
            metrics.recordCandidateScore(0.9);
            metrics.recordBatchSize(25);

            DistributionSummary scores = registry.find("company.candidate.score").summary();
            DistributionSummary batches = registry.find("company.batch.size").summary();

            assertNotNull(scores);
            assertEquals(2, scores.count());
            assertEquals(1.4, scores.totalAmount(), 1e-9);
            assertEquals(25.0, batches.totalAmount());
        }

        @Test
        @DisplayName("Should count retries, dropped rows and page cache lookups")
        void counters() {
            metrics.incrementSearchRetry();
            metrics.incrementDroppedRecords(4);
            metrics.incrementDroppedRecords(0);
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("company.search.retries").counter().count());
            assertEquals(4.0, registry.find("company.records.dropped").counter().count());
            assertEquals(1.0, registry.find("company.page.cache.hit").counter().count());
            assertEquals(2.0, registry.find("company.page.cache.miss").counter().count());
        }
    }
}
