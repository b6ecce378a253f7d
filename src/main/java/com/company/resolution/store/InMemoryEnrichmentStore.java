package com.company.resolution.store;

import com.company.resolution.core.model.EnrichedCluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Store kept in memory. Keeps every appended row for inspection in tests and embedded use.
 */
public class InMemoryEnrichmentStore implements EnrichmentStore {

    private final List<EnrichedCluster> rows = Collections.synchronizedList(new ArrayList<>());

    @Override
    public Map<String, EnrichedCluster> readAll() {
        Map<String, EnrichedCluster> current = new LinkedHashMap<>();
        synchronized (rows) {
            for (EnrichedCluster row : rows) {
                current.put(row.clusterId(), row);
            }
        }
        return current;
    }

    @Override
    public void append(EnrichedCluster result) {
        rows.add(result);
    }

    /**
     * Returns all rows in append order, including superseded ones.
     */
    public List<EnrichedCluster> rows() {
        synchronized (rows) {
            return List.copyOf(rows);
        }
    }
}
