package com.company.resolution.enrichment;

import com.company.resolution.core.model.Batch;
import com.company.resolution.core.model.Candidate;
import com.company.resolution.core.model.Cluster;
import com.company.resolution.core.model.EnrichedCluster;
import com.company.resolution.core.model.EnrichmentStatus;
import com.company.resolution.logging.LogContext;
import com.company.resolution.metrics.MetricsService;
import com.company.resolution.metrics.NoOpMetricsService;
import com.company.resolution.search.CandidateFinder;
import com.company.resolution.store.EnrichmentStore;
import com.company.resolution.verify.CandidateSelection;
import com.company.resolution.verify.CandidateVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Drives website enrichment of clusters, batch by batch, into an {@link EnrichmentStore}.
 *
 * <p>Usage:</p>
 * <pre>
 * EnrichmentOrchestrator orchestrator = EnrichmentOrchestrator.builder()
 *     .candidateFinder(finder)
 *     .verifier(verifier)
 *     .store(new CsvEnrichmentStore(path))
 *     .workerThreads(4)
 *     .build();
 * EnrichmentSummary summary = orchestrator.run(clusters, batches,
 *     EnrichmentRunOptions.defaults(), ProgressListener.NOOP, CancellationToken.create());
 * </pre>
 *
 * <p>Results already in the store are read once before any worker starts. Clusters
 * with a terminal result are skipped, so an interrupted run resumes where it stopped.
 * Batches run in parallel on a fixed pool; clusters within a batch run sequentially.
 * Appending a result, counting it and reporting progress happen together under one lock.</p>
 */
public class EnrichmentOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentOrchestrator.class);

    private final CandidateFinder candidateFinder;
    private final CandidateVerifier verifier;
    private final EnrichmentStore store;
    private final int workerThreads;
    private final MetricsService metrics;

    private EnrichmentOrchestrator(Builder builder) {
        this.candidateFinder = Objects.requireNonNull(builder.candidateFinder, "candidateFinder is required");
        this.verifier = Objects.requireNonNull(builder.verifier, "verifier is required");
        this.store = Objects.requireNonNull(builder.store, "store is required");
        this.workerThreads = builder.workerThreads;
        this.metrics = builder.metrics != null ? builder.metrics : NoOpMetricsService.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Enriches every cluster of the given batches that has no kept result yet.
     *
     * @throws ResumeConflictException  if the store holds results of a different cluster set
     * @throws IllegalArgumentException if a batch names a cluster that is not given
     */
    public EnrichmentSummary run(Collection<Cluster> clusters, List<Batch> batches, EnrichmentRunOptions options,
                                 ProgressListener listener, CancellationToken cancellation) {
        long start = System.nanoTime();
        Map<String, Cluster> clustersById = new LinkedHashMap<>();
        for (Cluster cluster : clusters) {
            clustersById.put(cluster.clusterId(), cluster);
        }

        Map<String, EnrichedCluster> existing = store.readAll();
        checkResumeConflicts(clustersById, existing);

        RunState state = new RunState(listener != null ? listener : ProgressListener.NOOP);
        List<ScheduledBatch> scheduled = schedule(batches, clustersById, existing, options, state);
        state.total = scheduled.stream().mapToInt(b -> b.clusters.size()).sum();

        String runId = LogContext.generateRunId();
        try (LogContext ignored = LogContext.forRun(runId, "enrich")) {
            log.info("enrichment.started batches={} scheduled={} skipped={} workers={}",
                    scheduled.size(), state.total, state.skipped, workerThreads);
        }

        if (state.total > 0) {
            execute(runId, scheduled, state, cancellation);
        }

        EnrichmentSummary summary = state.toSummary(Duration.ofNanos(System.nanoTime() - start));
        try (LogContext ignored = LogContext.forRun(runId, "enrich")) {
            log.info("enrichment.completed summary={}", summary);
        }
        return summary;
    }

    private void execute(String runId, List<ScheduledBatch> scheduled, RunState state,
                         CancellationToken cancellation) {
        int poolSize = Math.max(1, Math.min(workerThreads, scheduled.size()));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, new WorkerThreadFactory());
        try {
            List<Future<?>> futures = new ArrayList<>(scheduled.size());
            for (ScheduledBatch batch : scheduled) {
                futures.add(pool.submit(() -> processBatch(runId, batch, state, cancellation)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            cancellation.cancel();
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            log.warn("enrichment.interrupted done={} total={}", state.done, state.total);
        } catch (ExecutionException e) {
            cancellation.cancel();
            pool.shutdownNow();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Enrichment worker failed", cause);
        } finally {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void processBatch(String runId, ScheduledBatch batch, RunState state, CancellationToken cancellation) {
        try (LogContext ignored = LogContext.forBatch(runId, batch.batchId)) {
            if (isCancelled(cancellation)) {
                return;
            }
            log.info("batch.started clusters={}", batch.clusters.size());
            metrics.recordBatchSize(batch.clusters.size());
            int completed = 0;
            for (Cluster cluster : batch.clusters) {
                if (isCancelled(cancellation)) {
                    log.info("batch.cancelled completed={} remaining={}", completed, batch.clusters.size() - completed);
                    return;
                }
                EnrichedCluster result = enrich(cluster);
                if (result == null) {
                    cancellation.cancel();
                    return;
                }
                state.record(result, batch.batchId, store, metrics);
                completed++;
            }
            log.info("batch.completed clusters={}", completed);
        }
    }

    /**
     * Finds and verifies candidates for one cluster.
     * Returns {@code null} if the worker was interrupted.
     */
    EnrichedCluster enrich(Cluster cluster) {
        try (LogContext ignored = LogContext.forCluster(cluster.clusterId())) {
            try (Stream<Candidate> candidates = candidateFinder.findCandidates(cluster.representativeName())) {
                CandidateSelection selection = verifier.select(cluster, candidates);
                selection.chosenCandidate().ifPresent(c -> metrics.recordCandidateScore(c.score()));
                EnrichedCluster result = selection.toEnriched(cluster);
                log.debug("cluster.enriched name='{}' status={} url={}",
                        cluster.representativeName(), result.status(), result.chosenUrl());
                return result;
            } catch (RuntimeException e) {
                if (Thread.currentThread().isInterrupted()) {
                    return null;
                }
                log.warn("cluster.failed name='{}' reason={}", cluster.representativeName(), e.getMessage());
                return EnrichedCluster.error(cluster, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    private static boolean isCancelled(CancellationToken cancellation) {
        return cancellation.isCancelled() || Thread.currentThread().isInterrupted();
    }

    static void checkResumeConflicts(Map<String, Cluster> clustersById, Map<String, EnrichedCluster> existing) {
        List<String> conflicts = new ArrayList<>();
        for (EnrichedCluster row : existing.values()) {
            Cluster cluster = clustersById.get(row.clusterId());
            if (cluster == null || !cluster.representativeName().equals(row.representativeName())) {
                conflicts.add(row.clusterId());
            }
        }
        if (!conflicts.isEmpty()) {
            log.error("enrichment.resume-conflict conflicting={} first={}", conflicts.size(), conflicts.get(0));
            throw new ResumeConflictException("Existing results do not match the current clusters ("
                    + conflicts.size() + " conflicting cluster ids, first " + conflicts.get(0) + ")", conflicts);
        }
    }

    private static List<ScheduledBatch> schedule(List<Batch> batches, Map<String, Cluster> clustersById,
                                                 Map<String, EnrichedCluster> existing,
                                                 EnrichmentRunOptions options, RunState state) {
        List<ScheduledBatch> scheduled = new ArrayList<>();
        for (Batch batch : batches) {
            List<Cluster> pending = new ArrayList<>();
            for (String clusterId : batch.clusterIds()) {
                Cluster cluster = clustersById.get(clusterId);
                if (cluster == null) {
                    throw new IllegalArgumentException("Batch " + batch.batchId() + " names unknown cluster " + clusterId);
                }
                EnrichedCluster previous = existing.get(clusterId);
                if (previous != null
                        && (previous.status().isTerminal() || !options.retryUnresolved())) {
                    state.skipped++;
                    continue;
                }
                pending.add(cluster);
            }
            if (!pending.isEmpty()) {
                scheduled.add(new ScheduledBatch(batch.batchId(), pending));
            }
        }
        return scheduled;
    }

    private record ScheduledBatch(String batchId, List<Cluster> clusters) {
    }

    /**
     * Counters of a run. Written only while holding the instance lock.
     */
    private static final class RunState {
        private final ProgressListener listener;
        private int total;
        private int done;
        private int skipped;
        private final Map<EnrichmentStatus, Integer> byStatus = new LinkedHashMap<>();

        RunState(ProgressListener listener) {
            this.listener = listener;
        }

        synchronized void record(EnrichedCluster result, String batchId, EnrichmentStore store,
                                 MetricsService metrics) {
            store.append(result);
            done++;
            byStatus.merge(result.status(), 1, Integer::sum);
            metrics.incrementClusterStatus(result.status());
            try {
                listener.onProgress(done, total, batchId);
            } catch (RuntimeException e) {
                log.warn("progress.listener-failed reason={}", e.getMessage());
            }
        }

        synchronized EnrichmentSummary toSummary(Duration duration) {
            return new EnrichmentSummary(
                    total,
                    byStatus.getOrDefault(EnrichmentStatus.VERIFIED, 0),
                    byStatus.getOrDefault(EnrichmentStatus.UNVERIFIED, 0),
                    byStatus.getOrDefault(EnrichmentStatus.NO_CANDIDATE, 0),
                    byStatus.getOrDefault(EnrichmentStatus.ERROR, 0),
                    skipped,
                    0,
                    done < total,
                    duration);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "enrichment-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private CandidateFinder candidateFinder;
        private CandidateVerifier verifier;
        private EnrichmentStore store;
        private int workerThreads = 1;
        private MetricsService metrics;

        public Builder candidateFinder(CandidateFinder candidateFinder) {
            this.candidateFinder = candidateFinder;
            return this;
        }

        public Builder verifier(CandidateVerifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public Builder store(EnrichmentStore store) {
            this.store = store;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public EnrichmentOrchestrator build() {
            return new EnrichmentOrchestrator(this);
        }
    }
}
