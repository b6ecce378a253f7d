package com.company.resolution.config;

import com.company.resolution.cache.CacheConfig;
import com.company.resolution.similarity.ClusteringWeights;
import com.company.resolution.verify.SignalWeights;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tunable settings for normalization, clustering, batching and enrichment.
 * Every setter of the {@link Builder} validates its argument, so an invalid value
 * surfaces as a {@link ConfigurationException} before any processing starts.
 */
public class PipelineConfig {

    public static final double DEFAULT_CLUSTERING_THRESHOLD = 0.85;
    public static final double DEFAULT_TOKEN_MATCH_THRESHOLD = 0.80;
    public static final double DEFAULT_ACCEPTANCE_THRESHOLD = 0.70;
    public static final int DEFAULT_MAX_BATCH_SIZE = 2_000;
    public static final int DEFAULT_MAX_SEARCH_RESULTS = 5;
    public static final Duration DEFAULT_SEARCH_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_WORKER_THREADS = 1;

    public static final Set<String> DEFAULT_LEGAL_SUFFIXES = Set.of(
            "inc", "incorporated", "llc", "ltd", "limited", "corp", "corporation",
            "co", "company", "plc", "gmbh", "ag", "sa", "nv", "bv", "lp", "llp",
            "pty", "pte", "srl", "spa");

    public static final List<String> DEFAULT_IGNORED_PREFIXES = List.of("the");

    public static final Map<String, String> DEFAULT_ABBREVIATIONS = Map.of(
            "intl", "international",
            "tech", "technology",
            "elec", "electronic",
            "ind", "industry",
            "mfg", "manufacturing",
            "bros", "brothers");

    public static final Set<String> DEFAULT_DENYLIST = Set.of(
            "linkedin.com", "facebook.com", "crunchbase.com", "bloomberg.com",
            "wikipedia.org", "youtube.com", "twitter.com", "x.com", "instagram.com",
            "glassdoor.com", "indeed.com", "yelp.com", "zoominfo.com", "dnb.com",
            "opencorporates.com");

    private final double clusteringThreshold;
    private final double tokenMatchThreshold;
    private final ClusteringWeights clusteringWeights;
    private final Set<String> legalSuffixes;
    private final List<String> ignoredPrefixes;
    private final Map<String, String> abbreviations;
    private final int maxBatchSize;
    private final double acceptanceThreshold;
    private final SignalWeights signalWeights;
    private final Set<String> denylist;
    private final RetryConfig retry;
    private final Duration searchTimeout;
    private final int maxSearchResults;
    private final int workerThreads;
    private final boolean fetchPages;
    private final CacheConfig pageCache;
    private final String nameColumn;

    private PipelineConfig(Builder builder) {
        this.clusteringThreshold = builder.clusteringThreshold;
        this.tokenMatchThreshold = builder.tokenMatchThreshold;
        this.clusteringWeights = builder.clusteringWeights;
        this.legalSuffixes = Set.copyOf(builder.legalSuffixes);
        this.ignoredPrefixes = List.copyOf(builder.ignoredPrefixes);
        this.abbreviations = Map.copyOf(builder.abbreviations);
        this.maxBatchSize = builder.maxBatchSize;
        this.acceptanceThreshold = builder.acceptanceThreshold;
        this.signalWeights = builder.signalWeights;
        this.denylist = Set.copyOf(builder.denylist);
        this.retry = builder.retry;
        this.searchTimeout = builder.searchTimeout;
        this.maxSearchResults = builder.maxSearchResults;
        this.workerThreads = builder.workerThreads;
        this.fetchPages = builder.fetchPages;
        this.pageCache = builder.pageCache;
        this.nameColumn = builder.nameColumn;
    }

    public double getClusteringThreshold() {
        return clusteringThreshold;
    }

    public double getTokenMatchThreshold() {
        return tokenMatchThreshold;
    }

    public ClusteringWeights getClusteringWeights() {
        return clusteringWeights;
    }

    public Set<String> getLegalSuffixes() {
        return legalSuffixes;
    }

    public List<String> getIgnoredPrefixes() {
        return ignoredPrefixes;
    }

    public Map<String, String> getAbbreviations() {
        return abbreviations;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public SignalWeights getSignalWeights() {
        return signalWeights;
    }

    public Set<String> getDenylist() {
        return denylist;
    }

    public RetryConfig getRetry() {
        return retry;
    }

    public Duration getSearchTimeout() {
        return searchTimeout;
    }

    public int getMaxSearchResults() {
        return maxSearchResults;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public boolean isFetchPages() {
        return fetchPages;
    }

    public CacheConfig getPageCache() {
        return pageCache;
    }

    /**
     * Header of the input column holding company names, or {@code null} for the first column.
     */
    public String getNameColumn() {
        return nameColumn;
    }

    public static PipelineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .clusteringThreshold(clusteringThreshold)
                .tokenMatchThreshold(tokenMatchThreshold)
                .clusteringWeights(clusteringWeights)
                .legalSuffixes(legalSuffixes)
                .ignoredPrefixes(ignoredPrefixes)
                .abbreviations(abbreviations)
                .maxBatchSize(maxBatchSize)
                .acceptanceThreshold(acceptanceThreshold)
                .signalWeights(signalWeights)
                .denylist(denylist)
                .retry(retry)
                .searchTimeout(searchTimeout)
                .maxSearchResults(maxSearchResults)
                .workerThreads(workerThreads)
                .fetchPages(fetchPages)
                .pageCache(pageCache)
                .nameColumn(nameColumn);
    }

    public static class Builder {
        private double clusteringThreshold = DEFAULT_CLUSTERING_THRESHOLD;
        private double tokenMatchThreshold = DEFAULT_TOKEN_MATCH_THRESHOLD;
        private ClusteringWeights clusteringWeights = ClusteringWeights.defaultWeights();
        private Set<String> legalSuffixes = DEFAULT_LEGAL_SUFFIXES;
        private List<String> ignoredPrefixes = DEFAULT_IGNORED_PREFIXES;
        private Map<String, String> abbreviations = DEFAULT_ABBREVIATIONS;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private double acceptanceThreshold = DEFAULT_ACCEPTANCE_THRESHOLD;
        private SignalWeights signalWeights = SignalWeights.defaultWeights();
        private Set<String> denylist = DEFAULT_DENYLIST;
        private RetryConfig retry = RetryConfig.defaults();
        private Duration searchTimeout = DEFAULT_SEARCH_TIMEOUT;
        private int maxSearchResults = DEFAULT_MAX_SEARCH_RESULTS;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private boolean fetchPages = true;
        private CacheConfig pageCache = CacheConfig.defaults();
        private String nameColumn;

        public Builder clusteringThreshold(double clusteringThreshold) {
            validateThreshold(clusteringThreshold, "clusteringThreshold");
            this.clusteringThreshold = clusteringThreshold;
            return this;
        }

        public Builder tokenMatchThreshold(double tokenMatchThreshold) {
            validateThreshold(tokenMatchThreshold, "tokenMatchThreshold");
            this.tokenMatchThreshold = tokenMatchThreshold;
            return this;
        }

        public Builder clusteringWeights(ClusteringWeights clusteringWeights) {
            this.clusteringWeights = requireSet(clusteringWeights, "clusteringWeights");
            return this;
        }

        public Builder legalSuffixes(Set<String> legalSuffixes) {
            this.legalSuffixes = lowerCaseTokens(requireSet(legalSuffixes, "legalSuffixes"), "legalSuffixes");
            return this;
        }

        public Builder ignoredPrefixes(List<String> ignoredPrefixes) {
            this.ignoredPrefixes = List.copyOf(
                    lowerCaseTokens(requireSet(ignoredPrefixes, "ignoredPrefixes"), "ignoredPrefixes"));
            return this;
        }

        public Builder abbreviations(Map<String, String> abbreviations) {
            requireSet(abbreviations, "abbreviations");
            Map<String, String> normalized = new LinkedHashMap<>();
            abbreviations.forEach((key, value) -> {
                if (key == null || key.isBlank() || key.strip().contains(" ")) {
                    throw new ConfigurationException("Abbreviation keys must be single tokens, got '" + key + "'");
                }
                if (value == null || value.isBlank()) {
                    throw new ConfigurationException("Abbreviation '" + key + "' has no expansion");
                }
                normalized.put(key.strip().toLowerCase(Locale.ROOT), value.strip().toLowerCase(Locale.ROOT));
            });
            for (Map.Entry<String, String> entry : normalized.entrySet()) {
                for (String token : entry.getValue().split("\\s+")) {
                    if (normalized.containsKey(token)) {
                        throw new ConfigurationException("Expansion of '" + entry.getKey()
                                + "' contains the abbreviation '" + token + "'");
                    }
                }
            }
            this.abbreviations = normalized;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize < 1) {
                throw new ConfigurationException("maxBatchSize must be >= 1, got " + maxBatchSize);
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder acceptanceThreshold(double acceptanceThreshold) {
            validateThreshold(acceptanceThreshold, "acceptanceThreshold");
            this.acceptanceThreshold = acceptanceThreshold;
            return this;
        }

        public Builder signalWeights(SignalWeights signalWeights) {
            this.signalWeights = requireSet(signalWeights, "signalWeights");
            return this;
        }

        public Builder denylist(Set<String> denylist) {
            this.denylist = lowerCaseTokens(requireSet(denylist, "denylist"), "denylist");
            return this;
        }

        public Builder retry(RetryConfig retry) {
            this.retry = requireSet(retry, "retry");
            return this;
        }

        public Builder searchTimeout(Duration searchTimeout) {
            requireSet(searchTimeout, "searchTimeout");
            if (searchTimeout.isZero() || searchTimeout.isNegative()) {
                throw new ConfigurationException("searchTimeout must be positive");
            }
            this.searchTimeout = searchTimeout;
            return this;
        }

        public Builder maxSearchResults(int maxSearchResults) {
            if (maxSearchResults < 1) {
                throw new ConfigurationException("maxSearchResults must be >= 1, got " + maxSearchResults);
            }
            this.maxSearchResults = maxSearchResults;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new ConfigurationException("workerThreads must be >= 1, got " + workerThreads);
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder fetchPages(boolean fetchPages) {
            this.fetchPages = fetchPages;
            return this;
        }

        public Builder pageCache(CacheConfig pageCache) {
            this.pageCache = requireSet(pageCache, "pageCache");
            return this;
        }

        public Builder nameColumn(String nameColumn) {
            this.nameColumn = nameColumn == null || nameColumn.isBlank() ? null : nameColumn.strip();
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
                throw new ConfigurationException(name + " must be between 0.0 and 1.0, got " + value);
            }
        }

        private static <T> T requireSet(T value, String name) {
            if (value == null) {
                throw new ConfigurationException(name + " is required");
            }
            return value;
        }

        private static Set<String> lowerCaseTokens(Iterable<String> values, String name) {
            Set<String> result = new LinkedHashSet<>();
            for (String value : values) {
                if (value == null || value.isBlank()) {
                    throw new ConfigurationException(name + " must not contain blank entries");
                }
                result.add(value.strip().toLowerCase(Locale.ROOT));
            }
            return result;
        }
    }

    @Override
    public String toString() {
        return "PipelineConfig{" +
                "clusteringThreshold=" + clusteringThreshold +
                ", tokenMatchThreshold=" + tokenMatchThreshold +
                ", clusteringWeights=" + clusteringWeights +
                ", legalSuffixes=" + new TreeSet<>(legalSuffixes) +
                ", ignoredPrefixes=" + ignoredPrefixes +
                ", maxBatchSize=" + maxBatchSize +
                ", acceptanceThreshold=" + acceptanceThreshold +
                ", signalWeights=" + signalWeights +
                ", retry=" + retry +
                ", searchTimeout=" + searchTimeout +
                ", maxSearchResults=" + maxSearchResults +
                ", workerThreads=" + workerThreads +
                ", fetchPages=" + fetchPages +
                '}';
    }
}
