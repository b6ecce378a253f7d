package com.company.resolution.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * A group of records believed to denote the same company.
 *
 * <p>The cluster id is derived from the representative name and canonical key,
 * so the same input set always yields the same ids whatever order it was read in.</p>
 */
public record Cluster(
        String clusterId,
        String representativeName,
        String canonicalKey,
        SortedSet<String> memberIds,
        List<String> memberNames
) {
    public Cluster {
        Objects.requireNonNull(clusterId, "clusterId is required");
        Objects.requireNonNull(representativeName, "representativeName is required");
        canonicalKey = canonicalKey != null ? canonicalKey : "";
        memberIds = Collections.unmodifiableSortedSet(new TreeSet<>(memberIds));
        memberNames = memberNames != null ? List.copyOf(memberNames) : List.of();
        if (memberIds.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
    }

    public int memberCount() {
        return memberIds.size();
    }

    /**
     * Computes the id of a cluster of clusterable records.
     */
    public static String idFor(String representativeName, String canonicalKey) {
        return nameBasedId(canonicalKey + "\n" + representativeName);
    }

    /**
     * Computes the id of a singleton cluster holding a record with an empty key.
     * The record id is included so that two such records never share a cluster id.
     */
    public static String idForUnclusterable(String representativeName, String recordId) {
        return nameBasedId("~\n" + representativeName + "\n" + recordId);
    }

    private static String nameBasedId(String seed) {
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
