package com.company.resolution.config;

import com.company.resolution.cache.CacheConfig;
import com.company.resolution.similarity.ClusteringWeights;
import com.company.resolution.verify.SignalWeights;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a {@link PipelineConfig} from JSON. Every field is optional and overrides
 * the corresponding default; unknown fields are rejected so typos do not go unnoticed.
 *
 * <pre>
 * {
 *   "clusteringThreshold": 0.9,
 *   "clusteringWeights": { "tokenSetWeight": 0.6, "editDistanceWeight": 0.4 },
 *   "legalSuffixes": ["inc", "llc", "ltd"],
 *   "maxBatchSize": 500,
 *   "acceptanceThreshold": 0.75,
 *   "retry": { "maxAttempts": 4, "initialBackoffMs": 500, "backoffMultiplier": 2.0 },
 *   "searchTimeoutMs": 8000
 * }
 * </pre>
 */
public final class PipelineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "clusteringThreshold", "tokenMatchThreshold", "clusteringWeights", "legalSuffixes",
            "ignoredPrefixes", "abbreviations", "maxBatchSize", "acceptanceThreshold",
            "signalWeights", "denylist", "retry", "searchTimeoutMs", "maxSearchResults",
            "workerThreads", "fetchPages", "pageCache", "nameColumn");

    private final ObjectMapper objectMapper;

    public PipelineConfigLoader() {
        this(new ObjectMapper());
    }

    public PipelineConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the configuration file at the given path.
     */
    public PipelineConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            PipelineConfig config = load(in);
            log.info("config.loaded path={} config={}", path, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read configuration " + path, e);
        }
    }

    public PipelineConfig load(InputStream in) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return PipelineConfig.defaults();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }
        return fromTree(root);
    }

    private PipelineConfig fromTree(JsonNode root) {
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_FIELDS.contains(name)) {
                throw new ConfigurationException("Unknown configuration field '" + name + "'");
            }
        }

        PipelineConfig.Builder builder = PipelineConfig.builder();
        if (root.has("clusteringThreshold")) {
            builder.clusteringThreshold(number(root, "clusteringThreshold"));
        }
        if (root.has("tokenMatchThreshold")) {
            builder.tokenMatchThreshold(number(root, "tokenMatchThreshold"));
        }
        if (root.has("clusteringWeights")) {
            builder.clusteringWeights(convert(root.get("clusteringWeights"), ClusteringWeights.class));
        }
        if (root.has("legalSuffixes")) {
            builder.legalSuffixes(new LinkedHashSet<>(stringList(root, "legalSuffixes")));
        }
        if (root.has("ignoredPrefixes")) {
            builder.ignoredPrefixes(stringList(root, "ignoredPrefixes"));
        }
        if (root.has("abbreviations")) {
            builder.abbreviations(convert(root.get("abbreviations"), new TypeReference<Map<String, String>>() {}));
        }
        if (root.has("maxBatchSize")) {
            builder.maxBatchSize(integer(root, "maxBatchSize"));
        }
        if (root.has("acceptanceThreshold")) {
            builder.acceptanceThreshold(number(root, "acceptanceThreshold"));
        }
        if (root.has("signalWeights")) {
            builder.signalWeights(convert(root.get("signalWeights"), SignalWeights.class));
        }
        if (root.has("denylist")) {
            builder.denylist(new LinkedHashSet<>(stringList(root, "denylist")));
        }
        if (root.has("retry")) {
            builder.retry(convert(root.get("retry"), RetryConfig.class));
        }
        if (root.has("searchTimeoutMs")) {
            builder.searchTimeout(Duration.ofMillis(integer(root, "searchTimeoutMs")));
        }
        if (root.has("maxSearchResults")) {
            builder.maxSearchResults(integer(root, "maxSearchResults"));
        }
        if (root.has("workerThreads")) {
            builder.workerThreads(integer(root, "workerThreads"));
        }
        if (root.has("fetchPages")) {
            JsonNode node = root.get("fetchPages");
            if (!node.isBoolean()) {
                throw new ConfigurationException("fetchPages must be a boolean");
            }
            builder.fetchPages(node.booleanValue());
        }
        if (root.has("pageCache")) {
            builder.pageCache(convert(root.get("pageCache"), CacheConfig.class));
        }
        if (root.has("nameColumn")) {
            builder.nameColumn(root.get("nameColumn").asText(null));
        }
        return builder.build();
    }

    private static double number(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (!node.isNumber()) {
            throw new ConfigurationException(field + " must be a number");
        }
        return node.doubleValue();
    }

    private static int integer(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new ConfigurationException(field + " must be an integer");
        }
        return node.intValue();
    }

    private List<String> stringList(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (!node.isArray()) {
            throw new ConfigurationException(field + " must be an array of strings");
        }
        return convert(node, new TypeReference<List<String>>() {});
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (ValueInstantiationException e) {
            throw unwrap(e);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type) {
        try {
            return objectMapper.readerFor(type).readValue(node);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid value: " + e.getMessage(), e);
        }
    }

    private static ConfigurationException unwrap(ValueInstantiationException e) {
        if (e.getCause() instanceof ConfigurationException ce) {
            return ce;
        }
        return new ConfigurationException(e.getOriginalMessage(), e);
    }
}
