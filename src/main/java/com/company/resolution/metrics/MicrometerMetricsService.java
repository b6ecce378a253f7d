package com.company.resolution.metrics;

import com.company.resolution.core.model.EnrichmentStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code company.clustering.duration}: Timer</li>
 *   <li>{@code company.clustering.clusters}: DistributionSummary</li>
 *   <li>{@code company.enrichment.clusters}: Counter (tag: status)</li>
 *   <li>{@code company.search.duration}: Timer</li>
 *   <li>{@code company.search.retries}: Counter</li>
 *   <li>{@code company.candidate.score}: DistributionSummary</li>
 *   <li>{@code company.batch.size}: DistributionSummary</li>
 *   <li>{@code company.records.dropped}: Counter</li>
 *   <li>{@code company.page.cache.hit} and {@code company.page.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer clusteringTimer;
    private final DistributionSummary clusterCountSummary;
    private final Map<EnrichmentStatus, Counter> statusCounters = new EnumMap<>(EnrichmentStatus.class);
    private final Timer searchTimer;
    private final Counter searchRetryCounter;
    private final DistributionSummary candidateScoreSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter droppedCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.clusteringTimer = Timer.builder("company.clustering.duration")
                .description("Duration of normalization and clustering")
                .register(registry);
        this.clusterCountSummary = DistributionSummary.builder("company.clustering.clusters")
                .description("Number of clusters produced per clustering run")
                .register(registry);
        for (EnrichmentStatus status : EnrichmentStatus.values()) {
            statusCounters.put(status, Counter.builder("company.enrichment.clusters")
                    .description("Enriched clusters by outcome")
                    .tag("status", status.name())
                    .register(registry));
        }
        this.searchTimer = Timer.builder("company.search.duration")
                .description("Duration of website candidate searches")
                .register(registry);
        this.searchRetryCounter = Counter.builder("company.search.retries")
                .description("Number of retried candidate searches")
                .register(registry);
        this.candidateScoreSummary = DistributionSummary.builder("company.candidate.score")
                .description("Distribution of selected candidate scores")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("company.batch.size")
                .description("Number of clusters per processed batch")
                .register(registry);
        this.droppedCounter = Counter.builder("company.records.dropped")
                .description("Input rows rejected by validation")
                .register(registry);
        this.cacheHitCounter = Counter.builder("company.page.cache.hit")
                .description("Number of page cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("company.page.cache.miss")
                .description("Number of page cache misses")
                .register(registry);
    }

    @Override
    public void recordClusteringDuration(Duration duration) {
        clusteringTimer.record(duration);
    }

    @Override
    public void recordClusterCount(int clusters) {
        clusterCountSummary.record(clusters);
    }

    @Override
    public void incrementClusterStatus(EnrichmentStatus status) {
        statusCounters.get(status).increment();
    }

    @Override
    public void recordSearchDuration(Duration duration) {
        searchTimer.record(duration);
    }

    @Override
    public void incrementSearchRetry() {
        searchRetryCounter.increment();
    }

    @Override
    public void recordCandidateScore(double score) {
        candidateScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementDroppedRecords(int count) {
        if (count > 0) {
            droppedCounter.increment(count);
        }
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
