package com.company.resolution.ingest;

import com.company.resolution.core.model.RawRecord;

import java.util.List;

/**
 * Records accepted for clustering, plus the rows dropped by validation.
 *
 * @param records accepted records in input order
 * @param dropped rows rejected by validation
 */
public record IngestResult(List<RawRecord> records, List<DroppedRecord> dropped) {

    public IngestResult {
        records = records != null ? List.copyOf(records) : List.of();
        dropped = dropped != null ? List.copyOf(dropped) : List.of();
    }

    public int acceptedCount() {
        return records.size();
    }

    public int droppedCount() {
        return dropped.size();
    }

    /**
     * A row rejected during validation.
     *
     * @param recordId the record id (input row number)
     * @param rawName  the rejected name, possibly null
     * @param reason   why it was rejected
     */
    public record DroppedRecord(String recordId, String rawName, String reason) {}

    @Override
    public String toString() {
        return "IngestResult{accepted=" + records.size() + ", dropped=" + dropped.size() + '}';
    }
}
