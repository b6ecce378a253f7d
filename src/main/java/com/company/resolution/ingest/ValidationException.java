package com.company.resolution.ingest;

/**
 * Thrown for a malformed input row. The row is dropped and counted; the run continues.
 */
public class ValidationException extends RuntimeException {

    private final String recordId;

    public ValidationException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
