package com.company.resolution.store;

import com.company.resolution.core.model.EnrichedCluster;

import java.util.Map;

/**
 * Durable keyed store of enrichment results.
 *
 * <p>Rows are appended; when a cluster id appears more than once the last row wins.
 * Callers serialize appends, implementations need not.</p>
 */
public interface EnrichmentStore {

    /**
     * Reads the current result of every stored cluster, keyed by cluster id.
     */
    Map<String, EnrichedCluster> readAll();

    /**
     * Durably appends a result row.
     */
    void append(EnrichedCluster result);
}
