package com.company.resolution.metrics;

import com.company.resolution.core.model.EnrichmentStatus;

import java.time.Duration;

/**
 * Records pipeline metrics.
 * The default {@link NoOpMetricsService} does nothing, so callers never need a registry.
 */
public interface MetricsService {

    void recordClusteringDuration(Duration duration);

    void recordClusterCount(int clusters);

    void incrementClusterStatus(EnrichmentStatus status);

    void recordSearchDuration(Duration duration);

    void incrementSearchRetry();

    void recordCandidateScore(double score);

    void recordBatchSize(int size);

    void incrementDroppedRecords(int count);

    void recordCacheHit();

    void recordCacheMiss();
}
