package com.company.resolution.search;

import com.company.resolution.config.RetryConfig;
import com.company.resolution.core.model.Candidate;
import com.company.resolution.metrics.MetricsService;
import com.company.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Stream;

/**
 * Decorator that retries {@link TransientEnrichmentException}s with exponential backoff.
 * Other exceptions propagate on the first attempt.
 */
public class RetryingCandidateFinder implements CandidateFinder {
    private static final Logger log = LoggerFactory.getLogger(RetryingCandidateFinder.class);

    private final CandidateFinder delegate;
    private final RetryConfig retryConfig;
    private final MetricsService metrics;

    public RetryingCandidateFinder(CandidateFinder delegate, RetryConfig retryConfig) {
        this(delegate, retryConfig, NoOpMetricsService.INSTANCE);
    }

    public RetryingCandidateFinder(CandidateFinder delegate, RetryConfig retryConfig, MetricsService metrics) {
        this.delegate = delegate;
        this.retryConfig = retryConfig;
        this.metrics = metrics;
    }

    @Override
    public Stream<Candidate> findCandidates(String representativeName) {
        TransientEnrichmentException lastFailure = null;
        for (int attempt = 1; attempt <= retryConfig.maxAttempts(); attempt++) {
            try {
                return delegate.findCandidates(representativeName);
            } catch (TransientEnrichmentException e) {
                lastFailure = e;
                if (attempt == retryConfig.maxAttempts()) {
                    break;
                }
                long backoff = retryConfig.backoffMsAfter(attempt);
                log.warn("search.retry name='{}' attempt={}/{} backoffMs={} reason={}",
                        representativeName, attempt, retryConfig.maxAttempts(), backoff, e.getMessage());
                metrics.incrementSearchRetry();
                sleep(backoff);
            }
        }
        log.warn("search.exhausted name='{}' attempts={}", representativeName, retryConfig.maxAttempts());
        throw lastFailure;
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnrichmentException("Interrupted while waiting to retry", e);
        }
    }
}
