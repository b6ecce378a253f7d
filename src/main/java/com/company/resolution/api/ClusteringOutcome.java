package com.company.resolution.api;

import com.company.resolution.clustering.ClusteringResult;
import com.company.resolution.core.model.Batch;
import com.company.resolution.ingest.IngestResult;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of the normalize-and-cluster step.
 *
 * @param ingest     accepted and dropped input rows
 * @param clustering clusters and record assignments
 * @param batches    batches written to the working directory
 * @param workDir    working directory holding the artifacts
 */
public record ClusteringOutcome(
        IngestResult ingest,
        ClusteringResult clustering,
        List<Batch> batches,
        Path workDir
) {
    public ClusteringOutcome {
        batches = List.copyOf(batches);
    }

    public int clusterCount() {
        return clustering.clusterCount();
    }

    public int droppedCount() {
        return ingest.droppedCount();
    }
}
