package com.company.resolution.core.model;

/**
 * Outcome of website enrichment for one cluster.
 */
public enum EnrichmentStatus {
    /**
     * The best candidate reached the acceptance threshold.
     */
    VERIFIED,

    /**
     * Candidates were found but none reached the threshold.
     * The best one is still recorded.
     */
    UNVERIFIED,

    /**
     * The search returned no usable candidates.
     */
    NO_CANDIDATE,

    /**
     * The search failed after all retries.
     */
    ERROR;

    /**
     * Terminal statuses are never re-processed when a run is resumed.
     */
    public boolean isTerminal() {
        return this == VERIFIED || this == NO_CANDIDATE;
    }
}
