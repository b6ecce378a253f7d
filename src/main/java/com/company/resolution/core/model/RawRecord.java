package com.company.resolution.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A company name record as it arrived from the input file.
 *
 * @param id             stable record identifier (the 1-based input row number)
 * @param rawName        the name exactly as supplied
 * @param sourceMetadata the remaining input columns, keyed by header
 */
public record RawRecord(String id, String rawName, Map<String, String> sourceMetadata) {

    public RawRecord {
        Objects.requireNonNull(id, "id is required");
        sourceMetadata = sourceMetadata != null ? Map.copyOf(sourceMetadata) : Map.of();
    }

    public static RawRecord of(String id, String rawName) {
        return new RawRecord(id, rawName, Map.of());
    }

    /**
     * The raw name trimmed with internal whitespace collapsed.
     * This is the form counted when choosing a cluster's representative.
     */
    public String displayName() {
        return rawName == null ? "" : rawName.trim().replaceAll("\\s+", " ");
    }
}
