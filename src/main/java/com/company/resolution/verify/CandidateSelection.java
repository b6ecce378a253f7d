package com.company.resolution.verify;

import com.company.resolution.core.model.Candidate;
import com.company.resolution.core.model.Cluster;
import com.company.resolution.core.model.EnrichedCluster;
import com.company.resolution.core.model.EnrichmentStatus;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of verifying the candidates of one cluster.
 *
 * @param clusterId the cluster the candidates were found for
 * @param chosen    the best candidate, or {@code null} when there were none
 * @param scored    all candidates with scores, best first
 * @param status    VERIFIED, UNVERIFIED or NO_CANDIDATE
 */
public record CandidateSelection(
        String clusterId,
        Candidate chosen,
        List<Candidate> scored,
        EnrichmentStatus status
) {
    public CandidateSelection {
        Objects.requireNonNull(clusterId, "clusterId is required");
        Objects.requireNonNull(status, "status is required");
        scored = scored != null ? List.copyOf(scored) : List.of();
        if (status == EnrichmentStatus.ERROR) {
            throw new IllegalArgumentException("A selection cannot carry an ERROR status");
        }
        if ((chosen == null) != (status == EnrichmentStatus.NO_CANDIDATE)) {
            throw new IllegalArgumentException("Only NO_CANDIDATE selections have no chosen candidate");
        }
    }

    public static CandidateSelection noCandidate(String clusterId) {
        return new CandidateSelection(clusterId, null, List.of(), EnrichmentStatus.NO_CANDIDATE);
    }

    public Optional<Candidate> chosenCandidate() {
        return Optional.ofNullable(chosen);
    }

    /**
     * Converts this selection into an output row for the cluster.
     */
    public EnrichedCluster toEnriched(Cluster cluster) {
        if (chosen == null) {
            return EnrichedCluster.noCandidate(cluster);
        }
        return new EnrichedCluster(cluster.clusterId(), cluster.representativeName(), cluster.memberCount(),
                chosen.url(), chosen.score(), status, chosen.evidence() != null ? chosen.evidence().toString() : "");
    }
}
