package com.company.resolution.config;

import com.company.resolution.verify.SignalWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigLoaderTest {

    private final PipelineConfigLoader loader = new PipelineConfigLoader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should override only the fields present")
    void testOverrides() {
        PipelineConfig config = loader.load(json("""
                {
                  "clusteringThreshold": 0.9,
                  "maxBatchSize": 500,
                  "signalWeights": {
                    "domainTokenMatchWeight": 0.5,
                    "nameInTitleWeight": 0.3,
                    "nonAggregatorWeight": 0.1,
                    "searchRankPriorWeight": 0.1
                  },
                  "retry": { "maxAttempts": 4, "initialBackoffMs": 500, "backoffMultiplier": 2.0 },
                  "denylist": ["Crunchbase.com"],
                  "searchTimeoutMs": 8000,
                  "fetchPages": false,
                  "nameColumn": "company"
                }
                """));

        assertEquals(0.9, config.getClusteringThreshold());
        assertEquals(500, config.getMaxBatchSize());
        assertEquals(new SignalWeights(0.5, 0.3, 0.1, 0.1), config.getSignalWeights());
        assertEquals(new RetryConfig(4, 500, 2.0), config.getRetry());
        assertEquals(Set.of("crunchbase.com"), config.getDenylist());
        assertEquals(Duration.ofMillis(8000), config.getSearchTimeout());
        assertFalse(config.isFetchPages());
        assertEquals("company", config.getNameColumn());
        assertEquals(PipelineConfig.DEFAULT_ACCEPTANCE_THRESHOLD, config.getAcceptanceThreshold());
    }

    @Test
    @DisplayName("An empty document yields the defaults")
    void testEmpty() {
        assertEquals(PipelineConfig.DEFAULT_MAX_BATCH_SIZE, loader.load(json("")).getMaxBatchSize());
        assertEquals(PipelineConfig.DEFAULT_MAX_BATCH_SIZE, loader.load(json("{}")).getMaxBatchSize());
    }

    @Test
    @DisplayName("Should reject unknown fields")
    void testUnknownField() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> loader.load(json("{\"clusterThreshold\": 0.9}")));
        assertTrue(e.getMessage().contains("clusterThreshold"));
    }

    @Test
    @DisplayName("Should surface validation errors from nested objects")
    void testInvalidWeights() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(json("""
                {"signalWeights": {"domainTokenMatchWeight": 0.9, "nameInTitleWeight": 0.9,
                                   "nonAggregatorWeight": 0.0, "searchRankPriorWeight": 0.0}}
                """)));
        assertTrue(e.getMessage().contains("sum to 1.0"));
    }

    @Test
    @DisplayName("Should reject wrongly typed and malformed values")
    void testInvalidValues() {
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"maxBatchSize\": \"ten\"}")));
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"maxBatchSize\": 0}")));
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"fetchPages\": \"yes\"}")));
        assertThrows(ConfigurationException.class, () -> loader.load(json("[1, 2]")));
        assertThrows(ConfigurationException.class, () -> loader.load(json("{\"maxBatchSize\": ")));
    }

    @Test
    @DisplayName("Should load from a file")
    void testLoadFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pipeline.json");
        Files.writeString(file, "{\"acceptanceThreshold\": 0.75, \"workerThreads\": 4}");

        PipelineConfig config = loader.load(file);
        assertEquals(0.75, config.getAcceptanceThreshold());
        assertEquals(4, config.getWorkerThreads());
    }
}
