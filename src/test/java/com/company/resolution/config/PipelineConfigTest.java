package com.company.resolution.config;

import com.company.resolution.similarity.ClusteringWeights;
import com.company.resolution.verify.SignalWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    @DisplayName("Defaults should match the documented values")
    void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertEquals(0.85, config.getClusteringThreshold());
        assertEquals(0.70, config.getAcceptanceThreshold());
        assertEquals(2_000, config.getMaxBatchSize());
        assertEquals(SignalWeights.defaultWeights(), config.getSignalWeights());
        assertEquals(ClusteringWeights.defaultWeights(), config.getClusteringWeights());
        assertEquals(RetryConfig.defaults(), config.getRetry());
        assertTrue(config.getLegalSuffixes().contains("inc"));
        assertTrue(config.getDenylist().contains("linkedin.com"));
        assertNull(config.getNameColumn());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    @DisplayName("Should reject thresholds outside [0, 1]")
    void testInvalidThresholds(double value) {
        assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().clusteringThreshold(value));
        assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().acceptanceThreshold(value));
    }

    @Test
    @DisplayName("Should reject non-positive sizes and durations")
    void testInvalidSizes() {
        assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().maxBatchSize(0));
        assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().maxSearchResults(0));
        assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().workerThreads(0));
        assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().searchTimeout(Duration.ZERO));
    }

    @Test
    @DisplayName("Should lower-case vocabularies and reject blank entries")
    void testVocabularies() {
        PipelineConfig config = PipelineConfig.builder()
                .legalSuffixes(Set.of(" GmbH ", "AG"))
                .ignoredPrefixes(List.of("The"))
                .abbreviations(Map.of("Intl", "International"))
                .build();

        assertEquals(Set.of("gmbh", "ag"), config.getLegalSuffixes());
        assertEquals(List.of("the"), config.getIgnoredPrefixes());
        assertEquals(Map.of("intl", "international"), config.getAbbreviations());

        assertThrows(ConfigurationException.class, () -> PipelineConfig.builder().legalSuffixes(Set.of(" ")));
    }

    @Test
    @DisplayName("Should reject abbreviations whose expansion contains another abbreviation")
    void testRecursiveAbbreviations() {
        assertThrows(ConfigurationException.class,
                () -> PipelineConfig.builder().abbreviations(Map.of("co", "company", "company", "firm")));
        assertThrows(ConfigurationException.class,
                () -> PipelineConfig.builder().abbreviations(Map.of("two words", "x")));
    }

    @Test
    @DisplayName("Weights must be non-negative and sum to one")
    void testWeights() {
        assertThrows(ConfigurationException.class, () -> new SignalWeights(0.5, 0.5, 0.5, 0.0));
        assertThrows(ConfigurationException.class, () -> new SignalWeights(-0.1, 0.5, 0.5, 0.1));
        assertThrows(ConfigurationException.class, () -> new ClusteringWeights(0.6, 0.6));
    }

    @Test
    @DisplayName("Retry backoff should grow geometrically")
    void testRetryBackoff() {
        RetryConfig retry = new RetryConfig(4, 100, 2.0);

        assertEquals(100, retry.backoffMsAfter(1));
        assertEquals(200, retry.backoffMsAfter(2));
        assertEquals(400, retry.backoffMsAfter(3));
        assertThrows(ConfigurationException.class, () -> new RetryConfig(0, 100, 2.0));
        assertThrows(ConfigurationException.class, () -> new RetryConfig(3, 100, 0.5));
    }

    @Test
    @DisplayName("toBuilder should copy every setting")
    void testToBuilder() {
        PipelineConfig original = PipelineConfig.builder()
                .clusteringThreshold(0.9)
                .maxBatchSize(10)
                .nameColumn("company")
                .fetchPages(false)
                .build();

        PipelineConfig copy = original.toBuilder().build();

        assertEquals(0.9, copy.getClusteringThreshold());
        assertEquals(10, copy.getMaxBatchSize());
        assertEquals("company", copy.getNameColumn());
        assertFalse(copy.isFetchPages());
    }
}
