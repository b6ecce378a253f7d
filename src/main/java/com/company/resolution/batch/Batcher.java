package com.company.resolution.batch;

import com.company.resolution.config.ConfigurationException;
import com.company.resolution.core.model.Batch;
import com.company.resolution.core.model.Cluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Partitions clusters into bounded batches.
 *
 * <p>Clusters are ordered by cluster id before chunking, so a given cluster set
 * always yields the same batches. Every cluster lands in exactly one batch.</p>
 */
public final class Batcher {
    private static final Logger log = LoggerFactory.getLogger(Batcher.class);

    private Batcher() {
    }

    /**
     * Formats the id of the batch at the given 1-based position.
     */
    public static String batchId(int position) {
        return String.format("batch_%03d", position);
    }

    public static List<Batch> makeBatches(Collection<Cluster> clusters, int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new ConfigurationException("maxBatchSize must be >= 1, got " + maxBatchSize);
        }
        List<String> ids = clusters.stream()
                .map(Cluster::clusterId)
                .sorted()
                .distinct()
                .toList();

        List<Batch> batches = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += maxBatchSize) {
            int to = Math.min(from + maxBatchSize, ids.size());
            batches.add(new Batch(batchId(batches.size() + 1), ids.subList(from, to)));
        }
        log.info("batching.completed clusters={} batches={} maxBatchSize={}",
                ids.size(), batches.size(), maxBatchSize);
        return batches;
    }
}
