package com.company.resolution.clustering;

import com.company.resolution.config.ConfigurationException;
import com.company.resolution.config.PipelineConfig;
import com.company.resolution.core.model.Cluster;
import com.company.resolution.core.model.NormalizedRecord;
import com.company.resolution.similarity.BlockingKeyStrategy;
import com.company.resolution.similarity.DefaultBlockingKeyStrategy;
import com.company.resolution.similarity.KeySimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Groups normalized records into company clusters.
 *
 * <p>Records with equal canonical keys are merged first. Distinct keys are then compared
 * pairwise, and every pair scoring at least the clustering threshold is unioned, so merges
 * are transitive regardless of comparison order. Up to {@value #DEFAULT_EXHAUSTIVE_KEY_LIMIT}
 * distinct keys (by default) every pair is compared; above that only keys sharing a blocking
 * key are, so a similar pair that shares no block can be missed.
 * Records with an empty key each form their own singleton cluster.</p>
 *
 * <p>The representative of a cluster is its most frequent display name; ties go to
 * the shortest, then the lexicographically smallest. The output depends only on the
 * set of input records, never on their order.</p>
 */
public class CompanyClusterer {
    private static final Logger log = LoggerFactory.getLogger(CompanyClusterer.class);

    private static final int LARGE_BLOCK_WARNING = 5_000;

    /** Largest number of distinct keys compared all-pairs instead of through blocking. */
    public static final int DEFAULT_EXHAUSTIVE_KEY_LIMIT = 2_000;

    static final Comparator<Map.Entry<String, Long>> REPRESENTATIVE_ORDER =
            Comparator.<Map.Entry<String, Long>>comparingLong(Map.Entry::getValue).reversed()
                    .thenComparingInt(e -> e.getKey().length())
                    .thenComparing(Map.Entry::getKey);

    private final KeySimilarityScorer scorer;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final double threshold;
    private final int exhaustiveKeyLimit;

    public CompanyClusterer(PipelineConfig config) {
        this(new KeySimilarityScorer(config.getClusteringWeights(), config.getTokenMatchThreshold()),
                new DefaultBlockingKeyStrategy(), config.getClusteringThreshold());
    }

    public CompanyClusterer(KeySimilarityScorer scorer, BlockingKeyStrategy blockingKeyStrategy, double threshold) {
        this(scorer, blockingKeyStrategy, threshold, DEFAULT_EXHAUSTIVE_KEY_LIMIT);
    }

    public CompanyClusterer(KeySimilarityScorer scorer, BlockingKeyStrategy blockingKeyStrategy, double threshold,
                            int exhaustiveKeyLimit) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new ConfigurationException("clusteringThreshold must be between 0.0 and 1.0, got " + threshold);
        }
        if (exhaustiveKeyLimit < 0) {
            throw new ConfigurationException("exhaustiveKeyLimit must be non-negative, got " + exhaustiveKeyLimit);
        }
        this.scorer = scorer;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.threshold = threshold;
        this.exhaustiveKeyLimit = exhaustiveKeyLimit;
    }

    /**
     * Clusters the given records.
     */
    public ClusteringResult cluster(Collection<NormalizedRecord> records) {
        TreeMap<String, List<NormalizedRecord>> byKey = new TreeMap<>();
        List<NormalizedRecord> unclusterable = new ArrayList<>();
        for (NormalizedRecord record : records) {
            if (record.isClusterable()) {
                byKey.computeIfAbsent(record.canonicalKey(), k -> new ArrayList<>()).add(record);
            } else {
                unclusterable.add(record);
            }
        }

        List<String> keys = new ArrayList<>(byKey.keySet());
        UnionFind unionFind = new UnionFind(keys.size());
        int merges = mergeSimilarKeys(keys, unionFind);

        Map<Integer, List<NormalizedRecord>> groups = new TreeMap<>();
        for (int i = 0; i < keys.size(); i++) {
            groups.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>()).addAll(byKey.get(keys.get(i)));
        }

        List<Cluster> clusters = new ArrayList<>(groups.size() + unclusterable.size());
        for (List<NormalizedRecord> members : groups.values()) {
            clusters.add(buildCluster(members));
        }
        for (NormalizedRecord record : unclusterable) {
            String representative = record.displayName();
            clusters.add(new Cluster(
                    Cluster.idForUnclusterable(representative, record.id()),
                    representative, "", new TreeSet<>(List.of(record.id())), List.of(representative)));
        }
        clusters.sort(Comparator.comparing(Cluster::clusterId));

        Map<String, String> assignments = new HashMap<>();
        for (Cluster cluster : clusters) {
            for (String memberId : cluster.memberIds()) {
                assignments.put(memberId, cluster.clusterId());
            }
        }

        ClusteringResult result = new ClusteringResult(clusters, assignments, keys.size(), merges,
                unclusterable.size());
        log.info("clustering.completed result={}", result);
        return result;
    }

    /**
     * Chooses a representative display name for the given members.
     */
    public static String selectRepresentative(Collection<NormalizedRecord> members) {
        Map<String, Long> frequencies = members.stream()
                .collect(Collectors.groupingBy(NormalizedRecord::displayName, Collectors.counting()));
        return frequencies.entrySet().stream()
                .min(REPRESENTATIVE_ORDER)
                .map(Map.Entry::getKey)
                .orElseThrow(() -> new IllegalArgumentException("Cannot choose a representative of no members"));
    }

    private int mergeSimilarKeys(List<String> keys, UnionFind unionFind) {
        boolean exhaustive = keys.size() <= exhaustiveKeyLimit;
        Map<String, List<Integer>> blocks = exhaustive ? Map.of() : buildBlocks(keys);

        int merges = 0;
        long comparisons = 0;
        for (int i = 0; i < keys.size(); i++) {
            Collection<Integer> neighbours = exhaustive ? allAfter(i, keys.size()) : blockNeighbours(i, keys, blocks);
            for (int j : neighbours) {
                if (unionFind.connected(i, j)) {
                    continue;
                }
                comparisons++;
                // keys are sorted, so keys.get(i) is always the smaller argument
                double similarity = scorer.compute(keys.get(i), keys.get(j));
                if (similarity >= threshold) {
                    unionFind.union(i, j);
                    merges++;
                    log.debug("Merged '{}' and '{}' (similarity={})", keys.get(i), keys.get(j), similarity);
                }
            }
        }
        log.debug("clustering.compared keys={} exhaustive={} comparisons={} merges={}",
                keys.size(), exhaustive, comparisons, merges);
        return merges;
    }

    private Map<String, List<Integer>> buildBlocks(List<String> keys) {
        Map<String, List<Integer>> blocks = new HashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            for (String blockKey : blockingKeyStrategy.generateKeys(keys.get(i))) {
                blocks.computeIfAbsent(blockKey, k -> new ArrayList<>()).add(i);
            }
        }
        blocks.forEach((blockKey, members) -> {
            if (members.size() > LARGE_BLOCK_WARNING) {
                log.warn("clustering.large-block key={} size={}", blockKey, members.size());
            }
        });
        return blocks;
    }

    private SortedSet<Integer> blockNeighbours(int i, List<String> keys, Map<String, List<Integer>> blocks) {
        SortedSet<Integer> neighbours = new TreeSet<>();
        for (String blockKey : blockingKeyStrategy.generateKeys(keys.get(i))) {
            for (int j : blocks.get(blockKey)) {
                if (j > i) {
                    neighbours.add(j);
                }
            }
        }
        return neighbours;
    }

    private static List<Integer> allAfter(int i, int size) {
        List<Integer> neighbours = new ArrayList<>(size - i - 1);
        for (int j = i + 1; j < size; j++) {
            neighbours.add(j);
        }
        return neighbours;
    }

    private static Cluster buildCluster(List<NormalizedRecord> members) {
        String representative = selectRepresentative(members);
        String canonicalKey = members.stream()
                .filter(m -> m.displayName().equals(representative))
                .map(NormalizedRecord::canonicalKey)
                .min(Comparator.naturalOrder())
                .orElseThrow();
        SortedSet<String> memberIds = members.stream()
                .map(NormalizedRecord::id)
                .collect(Collectors.toCollection(TreeSet::new));
        List<String> memberNames = members.stream()
                .map(NormalizedRecord::displayName)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
        return new Cluster(Cluster.idFor(representative, canonicalKey), representative, canonicalKey,
                memberIds, memberNames);
    }

    /**
     * Indexes clusters by id.
     */
    public static Map<String, Cluster> byId(Collection<Cluster> clusters) {
        return clusters.stream().collect(Collectors.toMap(Cluster::clusterId, Function.identity(),
                (a, b) -> a, TreeMap::new));
    }
}
