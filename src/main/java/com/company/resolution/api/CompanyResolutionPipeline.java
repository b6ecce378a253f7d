package com.company.resolution.api;

import com.company.resolution.batch.Batcher;
import com.company.resolution.cache.PageContentCache;
import com.company.resolution.clustering.ClusteringResult;
import com.company.resolution.clustering.CompanyClusterer;
import com.company.resolution.config.PipelineConfig;
import com.company.resolution.core.model.Batch;
import com.company.resolution.core.model.Cluster;
import com.company.resolution.core.model.NormalizedRecord;
import com.company.resolution.core.model.RawRecord;
import com.company.resolution.enrichment.CancellationToken;
import com.company.resolution.enrichment.EnrichmentOrchestrator;
import com.company.resolution.enrichment.EnrichmentRunOptions;
import com.company.resolution.enrichment.EnrichmentSummary;
import com.company.resolution.enrichment.ProgressListener;
import com.company.resolution.ingest.CsvRecordReader;
import com.company.resolution.ingest.IngestResult;
import com.company.resolution.ingest.RecordValidator;
import com.company.resolution.logging.LogContext;
import com.company.resolution.metrics.MetricsService;
import com.company.resolution.metrics.NoOpMetricsService;
import com.company.resolution.rules.DefaultNormalizationRules;
import com.company.resolution.rules.NormalizationEngine;
import com.company.resolution.search.CandidateFinder;
import com.company.resolution.search.DuckDuckGoSearchClient;
import com.company.resolution.search.HomepageFetcher;
import com.company.resolution.search.RetryingCandidateFinder;
import com.company.resolution.search.WebSearchCandidateFinder;
import com.company.resolution.search.WebSearchClient;
import com.company.resolution.store.ClusterArtifacts;
import com.company.resolution.store.CsvEnrichmentStore;
import com.company.resolution.verify.CandidateVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point of the company resolution pipeline.
 *
 * <p>Usage:</p>
 * <pre>
 * CompanyResolutionPipeline pipeline = CompanyResolutionPipeline.builder()
 *     .config(new PipelineConfigLoader().load(Path.of("pipeline.json")))
 *     .build();
 *
 * pipeline.normalizeAndCluster(Path.of("companies.csv"), workDir);
 * EnrichmentSummary summary = pipeline.enrich(workDir, EnrichmentRunOptions.defaults(),
 *     (done, total, batch) -&gt; log.info("{}/{}", done, total), CancellationToken.create());
 * </pre>
 *
 * <p>Both steps communicate only through files in the working directory, so
 * {@link #enrich} can resume in a later process.</p>
 */
public class CompanyResolutionPipeline {
    private static final Logger log = LoggerFactory.getLogger(CompanyResolutionPipeline.class);

    private final PipelineConfig config;
    private final NormalizationEngine engine;
    private final CandidateFinder candidateFinder;
    private final MetricsService metrics;

    private CompanyResolutionPipeline(Builder builder) {
        this.config = builder.config != null ? builder.config : PipelineConfig.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : NoOpMetricsService.INSTANCE;
        this.engine = DefaultNormalizationRules.createEngine(config);

        CandidateFinder finder = builder.candidateFinder;
        if (finder == null) {
            WebSearchClient client = builder.searchClient != null
                    ? builder.searchClient
                    : DuckDuckGoSearchClient.builder().timeout(config.getSearchTimeout()).build();
            HomepageFetcher fetcher = config.isFetchPages()
                    ? new HomepageFetcher(config.getSearchTimeout(), PageContentCache.create(config.getPageCache()), metrics)
                    : null;
            finder = new WebSearchCandidateFinder(client, fetcher, config.getMaxSearchResults(), metrics);
        }
        this.candidateFinder = new RetryingCandidateFinder(finder, config.getRetry(), metrics);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads, validates, normalizes and clusters the input file, then writes the cluster
     * table, batch files and dropped rows to the working directory.
     */
    public ClusteringOutcome normalizeAndCluster(Path input, Path workDir) {
        try (LogContext ignored = LogContext.forRun(LogContext.generateRunId(), "cluster")) {
            long start = System.nanoTime();
            List<RawRecord> rows = new CsvRecordReader(config.getNameColumn()).read(input);
            IngestResult ingest = new RecordValidator().partition(rows);
            metrics.incrementDroppedRecords(ingest.droppedCount());

            ClusteringResult clustering = cluster(ingest.records());
            List<Batch> batches = Batcher.makeBatches(clustering.clusters(), config.getMaxBatchSize());
            metrics.recordClusteringDuration(Duration.ofNanos(System.nanoTime() - start));
            metrics.recordClusterCount(clustering.clusterCount());

            ClusterArtifacts artifacts = new ClusterArtifacts(workDir);
            artifacts.writeClusters(clustering.clusters());
            artifacts.writeBatches(batches, CompanyClusterer.byId(clustering.clusters()));
            artifacts.writeDropped(ingest.dropped());

            log.info("cluster.completed rows={} dropped={} clusters={} batches={}",
                    rows.size(), ingest.droppedCount(), clustering.clusterCount(), batches.size());
            return new ClusteringOutcome(ingest, clustering, batches, workDir);
        }
    }

    /**
     * Normalizes and clusters records already in memory.
     */
    public ClusteringResult cluster(List<RawRecord> records) {
        List<NormalizedRecord> normalized = records.stream()
                .map(r -> new NormalizedRecord(r, engine.normalize(r.rawName())))
                .collect(Collectors.toList());
        return new CompanyClusterer(config).cluster(normalized);
    }

    /**
     * Enriches the clusters of a working directory prepared by {@link #normalizeAndCluster},
     * appending results to its {@code enriched.csv}.
     *
     * @throws IllegalStateException if the working directory has no cluster table
     */
    public EnrichmentSummary enrich(Path workDir, EnrichmentRunOptions options, ProgressListener listener,
                                    CancellationToken cancellation) {
        ClusterArtifacts artifacts = new ClusterArtifacts(workDir);
        if (!artifacts.hasClusters()) {
            throw new IllegalStateException("No cluster table in " + workDir + "; run normalizeAndCluster first");
        }
        List<Cluster> clusters = artifacts.readClusters();
        List<Batch> batches = artifacts.readBatches();
        if (batches.isEmpty() && !clusters.isEmpty()) {
            batches = Batcher.makeBatches(clusters, config.getMaxBatchSize());
        }

        EnrichmentOrchestrator orchestrator = EnrichmentOrchestrator.builder()
                .candidateFinder(candidateFinder)
                .verifier(new CandidateVerifier(engine, config.getSignalWeights(),
                        config.getAcceptanceThreshold(), config.getDenylist()))
                .store(new CsvEnrichmentStore(artifacts.enrichedFile()))
                .workerThreads(config.getWorkerThreads())
                .metrics(metrics)
                .build();
        EnrichmentSummary summary = orchestrator.run(clusters, batches, options,
                listener != null ? listener : ProgressListener.NOOP,
                cancellation != null ? cancellation : CancellationToken.create());
        return summary.withDroppedRecords(artifacts.readDroppedCount());
    }

    /**
     * Runs both steps.
     */
    public EnrichmentSummary run(Path input, Path workDir, ProgressListener listener, CancellationToken cancellation) {
        normalizeAndCluster(input, workDir);
        return enrich(workDir, EnrichmentRunOptions.defaults(), listener, cancellation);
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public static class Builder {
        private PipelineConfig config;
        private WebSearchClient searchClient;
        private CandidateFinder candidateFinder;
        private MetricsService metrics;

        public Builder config(PipelineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Search backend to use instead of DuckDuckGo.
         */
        public Builder searchClient(WebSearchClient searchClient) {
            this.searchClient = searchClient;
            return this;
        }

        /**
         * Candidate finder to use instead of web search. It is still wrapped with retries.
         */
        public Builder candidateFinder(CandidateFinder candidateFinder) {
            this.candidateFinder = candidateFinder;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public CompanyResolutionPipeline build() {
            return new CompanyResolutionPipeline(this);
        }
    }
}
