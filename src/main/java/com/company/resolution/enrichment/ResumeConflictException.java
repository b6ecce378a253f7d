package com.company.resolution.enrichment;

import java.util.List;

/**
 * Raised before any work starts when the existing results were produced from a different cluster set.
 */
public class ResumeConflictException extends RuntimeException {

    private final List<String> conflictingClusterIds;

    public ResumeConflictException(String message, List<String> conflictingClusterIds) {
        super(message);
        this.conflictingClusterIds = List.copyOf(conflictingClusterIds);
    }

    public List<String> getConflictingClusterIds() {
        return conflictingClusterIds;
    }
}
