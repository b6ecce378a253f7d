package com.company.resolution.clustering;

import com.company.resolution.core.model.Cluster;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of clustering.
 *
 * @param clusters           clusters sorted by cluster id
 * @param assignments        record id to cluster id, for every input record
 * @param distinctKeys       number of distinct non-empty canonical keys
 * @param fuzzyMerges        number of unions performed between distinct keys
 * @param unclusterableCount number of records with an empty canonical key
 */
public record ClusteringResult(
        List<Cluster> clusters,
        Map<String, String> assignments,
        int distinctKeys,
        int fuzzyMerges,
        int unclusterableCount
) {
    public ClusteringResult {
        clusters = List.copyOf(clusters);
        assignments = Map.copyOf(assignments);
    }

    public int clusterCount() {
        return clusters.size();
    }

    public int recordCount() {
        return assignments.size();
    }

    public Optional<Cluster> clusterOf(String recordId) {
        String clusterId = assignments.get(recordId);
        if (clusterId == null) {
            return Optional.empty();
        }
        return clusters.stream().filter(c -> c.clusterId().equals(clusterId)).findFirst();
    }

    @Override
    public String toString() {
        return "ClusteringResult{records=" + assignments.size() +
                ", clusters=" + clusters.size() +
                ", distinctKeys=" + distinctKeys +
                ", fuzzyMerges=" + fuzzyMerges +
                ", unclusterable=" + unclusterableCount + '}';
    }
}
