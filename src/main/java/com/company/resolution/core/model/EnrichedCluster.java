package com.company.resolution.core.model;

import java.util.Objects;

/**
 * Terminal output row: a cluster annotated with its chosen website.
 */
public record EnrichedCluster(
        String clusterId,
        String representativeName,
        int memberCount,
        String chosenUrl,
        double confidence,
        EnrichmentStatus status,
        String detail
) {
    public EnrichedCluster {
        Objects.requireNonNull(clusterId, "clusterId is required");
        Objects.requireNonNull(status, "status is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        if (chosenUrl != null && chosenUrl.isBlank()) {
            chosenUrl = null;
        }
        detail = detail != null ? detail : "";
    }

    public static EnrichedCluster noCandidate(Cluster cluster) {
        return new EnrichedCluster(cluster.clusterId(), cluster.representativeName(),
                cluster.memberCount(), null, 0.0, EnrichmentStatus.NO_CANDIDATE, "");
    }

    public static EnrichedCluster error(Cluster cluster, String message) {
        return new EnrichedCluster(cluster.clusterId(), cluster.representativeName(),
                cluster.memberCount(), null, 0.0, EnrichmentStatus.ERROR, message);
    }
}
