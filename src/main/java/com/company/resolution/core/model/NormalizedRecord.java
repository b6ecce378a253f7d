package com.company.resolution.core.model;

import java.util.Objects;

/**
 * A raw record paired with its canonical comparison key.
 */
public record NormalizedRecord(RawRecord record, String canonicalKey) {

    public NormalizedRecord {
        Objects.requireNonNull(record, "record is required");
        canonicalKey = canonicalKey != null ? canonicalKey : "";
    }

    public String id() {
        return record.id();
    }

    public String displayName() {
        return record.displayName();
    }

    /**
     * Records whose key is the empty sentinel are never merged with anything.
     */
    public boolean isClusterable() {
        return !canonicalKey.isEmpty();
    }
}
