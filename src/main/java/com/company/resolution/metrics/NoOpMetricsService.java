package com.company.resolution.metrics;

import com.company.resolution.core.model.EnrichmentStatus;

import java.time.Duration;

/**
 * Metrics service that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordClusteringDuration(Duration duration) {
    }

    @Override
    public void recordClusterCount(int clusters) {
    }

    @Override
    public void incrementClusterStatus(EnrichmentStatus status) {
    }

    @Override
    public void recordSearchDuration(Duration duration) {
    }

    @Override
    public void incrementSearchRetry() {
    }

    @Override
    public void recordCandidateScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementDroppedRecords(int count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
