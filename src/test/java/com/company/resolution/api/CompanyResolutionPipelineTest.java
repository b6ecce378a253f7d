package com.company.resolution.api;

import com.company.resolution.clustering.ClusteringResult;
import com.company.resolution.config.PipelineConfig;
import com.company.resolution.config.RetryConfig;
import com.company.resolution.core.model.Candidate;
import com.company.resolution.core.model.Cluster;
import com.company.resolution.core.model.EnrichedCluster;
import com.company.resolution.core.model.EnrichmentStatus;
import com.company.resolution.core.model.RawRecord;
import com.company.resolution.enrichment.CancellationToken;
import com.company.resolution.enrichment.EnrichmentRunOptions;
import com.company.resolution.enrichment.EnrichmentSummary;
import com.company.resolution.enrichment.ResumeConflictException;
import com.company.resolution.search.CandidateFinder;
import com.company.resolution.search.TransientEnrichmentException;
import com.company.resolution.store.ClusterArtifacts;
import com.company.resolution.store.CsvEnrichmentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs over a working directory, with web search replaced by a scripted finder.
 */
class CompanyResolutionPipelineTest {

    private static final PipelineConfig CONFIG = PipelineConfig.builder()
            .retry(RetryConfig.noRetry())
            .fetchPages(false)
            .maxBatchSize(2)
            .build();

    @TempDir
    Path tempDir;

    private Path input;
    private Path workDir;
    private AtomicInteger searches;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("companies.csv");
        workDir = tempDir.resolve("work");
        searches = new AtomicInteger();
        Files.writeString(input, """
                company,country
                Acme Inc.,US
                ACME INC,US
                Globex LLC,DE
                "",FR
                Initech,US
                """);
    }

    private CandidateFinder finder(boolean globexFails) {
        return name -> {
            searches.incrementAndGet();
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.contains("acme")) {
                return Stream.of(Candidate.unscored("https://acme.com", "Acme Inc", "", 0));
            }
            if (lower.contains("globex")) {
                if (globexFails) {
                    throw new TransientEnrichmentException("HTTP 503");
                }
                return Stream.of(Candidate.unscored("https://globex.com", "Globex Corporation", "", 0));
            }
            return Stream.empty();
        };
    }

    private CompanyResolutionPipeline pipeline(boolean globexFails) {
        return CompanyResolutionPipeline.builder()
                .config(CONFIG)
                .candidateFinder(finder(globexFails))
                .build();
    }

    @Test
    @DisplayName("Clustering should write clusters, batches and dropped rows")
    void testNormalizeAndCluster() {
        ClusteringOutcome outcome = pipeline(false).normalizeAndCluster(input, workDir);

        assertEquals(3, outcome.clusterCount());
        assertEquals(1, outcome.droppedCount());
        assertEquals(2, outcome.batches().size());
        assertEquals(4, outcome.clustering().recordCount());

        Cluster acme = outcome.clustering().clusterOf("1").orElseThrow();
        assertEquals(acme, outcome.clustering().clusterOf("2").orElseThrow());
        assertEquals("ACME INC", acme.representativeName());
        assertTrue(outcome.clustering().clusterOf("4").isEmpty());

        ClusterArtifacts artifacts = new ClusterArtifacts(workDir);
        assertTrue(artifacts.hasClusters());
        assertEquals(outcome.clustering().clusters(), artifacts.readClusters());
        assertEquals(outcome.batches(), artifacts.readBatches());
        assertEquals(1, artifacts.readDroppedCount());
    }

    @Test
    @DisplayName("A full run should enrich every cluster and report progress")
    void testRun() {
        AtomicLong lastDone = new AtomicLong();
        AtomicLong lastTotal = new AtomicLong();

        EnrichmentSummary summary = pipeline(false).run(input, workDir,
                (done, total, batchId) -> {
                    lastDone.set(done);
                    lastTotal.set(total);
                }, CancellationToken.create());

        assertEquals(3, summary.scheduled());
        assertEquals(2, summary.verified());
        assertEquals(1, summary.noCandidate());
        assertEquals(1, summary.droppedRecords());
        assertEquals(3, lastDone.get());
        assertEquals(3, lastTotal.get());

        Map<String, EnrichedCluster> rows = new CsvEnrichmentStore(new ClusterArtifacts(workDir).enrichedFile()).readAll();
        assertEquals(3, rows.size());
        assertTrue(rows.values().stream()
                .anyMatch(r -> "https://acme.com".equals(r.chosenUrl()) && r.status() == EnrichmentStatus.VERIFIED));
    }

    @Test
    @DisplayName("A later process should resume from the files and retry only when asked")
    void testResumeAcrossInstances() {
        pipeline(true).normalizeAndCluster(input, workDir);
        EnrichmentSummary first = pipeline(true).enrich(workDir, EnrichmentRunOptions.defaults(), null, null);
        assertEquals(1, first.errors());
        assertEquals(3, searches.get());

        EnrichmentSummary second = pipeline(false).enrich(workDir, EnrichmentRunOptions.defaults(), null, null);
        assertEquals(0, second.scheduled());
        assertEquals(3, second.skipped());
        assertEquals(3, searches.get());

        EnrichmentSummary third = pipeline(false).enrich(workDir, EnrichmentRunOptions.retryingUnresolved(), null, null);
        assertEquals(1, third.scheduled());
        assertEquals(1, third.verified());
        assertEquals(4, searches.get());

        Map<String, EnrichedCluster> rows = new CsvEnrichmentStore(new ClusterArtifacts(workDir).enrichedFile()).readAll();
        assertTrue(rows.values().stream().noneMatch(r -> r.status() == EnrichmentStatus.ERROR));
    }

    @Test
    @DisplayName("Re-clustering different input over old results should be reported as a conflict")
    void testConflict() throws IOException {
        pipeline(false).run(input, workDir, null, null);

        Files.writeString(input, "company\nUmbrella Corp\n");
        pipeline(false).normalizeAndCluster(input, workDir);

        ResumeConflictException e = assertThrows(ResumeConflictException.class,
                () -> pipeline(false).enrich(workDir, EnrichmentRunOptions.defaults(), null, null));
        assertEquals(3, e.getConflictingClusterIds().size());
    }

    @Test
    @DisplayName("Enriching a directory without clusters should fail")
    void testEnrichWithoutClusters() {
        assertThrows(IllegalStateException.class,
                () -> pipeline(false).enrich(workDir, EnrichmentRunOptions.defaults(), null, null));
    }

    @Test
    @DisplayName("In-memory clustering should agree with file-based clustering")
    void testClusterInMemory() {
        ClusteringResult result = pipeline(false).cluster(List.of(
                RawRecord.of("a", "The Acme Company"),
                RawRecord.of("b", "Acme Co."),
                RawRecord.of("c", "Globex")));

        assertEquals(2, result.clusterCount());
        assertEquals(result.clusterOf("a"), result.clusterOf("b"));
    }
}
