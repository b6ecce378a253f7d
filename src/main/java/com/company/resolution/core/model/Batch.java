package com.company.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A checkpointable unit of clusters processed together during enrichment.
 */
public record Batch(String batchId, List<String> clusterIds) {

    public Batch {
        Objects.requireNonNull(batchId, "batchId is required");
        clusterIds = List.copyOf(clusterIds);
    }

    public int size() {
        return clusterIds.size();
    }
}
