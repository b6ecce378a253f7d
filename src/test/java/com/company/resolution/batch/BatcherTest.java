package com.company.resolution.batch;

import com.company.resolution.config.ConfigurationException;
import com.company.resolution.core.model.Batch;
import com.company.resolution.core.model.Cluster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BatcherTest {

    private static List<Cluster> clusters(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> new Cluster(Cluster.idFor("Company " + i, "company " + i), "Company " + i,
                        "company " + i, new TreeSet<>(Set.of(String.valueOf(i))), List.of("Company " + i)))
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Should chunk clusters into bounded, numbered batches")
    void testChunking() {
        List<Batch> batches = Batcher.makeBatches(clusters(5), 2);

        assertEquals(3, batches.size());
        assertEquals(List.of("batch_001", "batch_002", "batch_003"),
                batches.stream().map(Batch::batchId).collect(Collectors.toList()));
        assertEquals(List.of(2, 2, 1), batches.stream().map(Batch::size).collect(Collectors.toList()));
    }

    @ParameterizedTest
    @DisplayName("Every cluster is in exactly one batch")
    @ValueSource(ints = {1, 3, 7, 100})
    void testCoverage(int maxBatchSize) {
        List<Cluster> clusters = clusters(23);
        List<Batch> batches = Batcher.makeBatches(clusters, maxBatchSize);

        List<String> batched = batches.stream().flatMap(b -> b.clusterIds().stream()).collect(Collectors.toList());
        assertEquals(clusters.size(), batched.size());
        assertEquals(clusters.stream().map(Cluster::clusterId).collect(Collectors.toSet()), Set.copyOf(batched));
        assertTrue(batches.stream().allMatch(b -> b.size() <= maxBatchSize));
    }

    @Test
    @DisplayName("Batches do not depend on cluster order")
    void testOrderIndependence() {
        List<Cluster> clusters = clusters(10);
        List<Batch> expected = Batcher.makeBatches(clusters, 3);

        List<Cluster> shuffled = new ArrayList<>(clusters);
        Collections.shuffle(shuffled, new Random(7));
        assertEquals(expected, Batcher.makeBatches(shuffled, 3));
    }

    @Test
    @DisplayName("No clusters yields no batches")
    void testEmpty() {
        assertTrue(Batcher.makeBatches(List.of(), 10).isEmpty());
    }

    @Test
    @DisplayName("Should reject a batch size below one")
    void testInvalidSize() {
        assertThrows(ConfigurationException.class, () -> Batcher.makeBatches(clusters(2), 0));
    }

    @Test
    @DisplayName("Should format batch ids with three digits")
    void testBatchId() {
        assertEquals("batch_001", Batcher.batchId(1));
        assertEquals("batch_042", Batcher.batchId(42));
        assertEquals("batch_1000", Batcher.batchId(1000));
    }
}
