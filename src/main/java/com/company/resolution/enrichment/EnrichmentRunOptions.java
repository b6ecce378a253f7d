package com.company.resolution.enrichment;

/**
 * Options for one enrichment run.
 *
 * @param retryUnresolved also reprocess clusters whose stored status is UNVERIFIED or ERROR
 */
public record EnrichmentRunOptions(boolean retryUnresolved) {

    public static EnrichmentRunOptions defaults() {
        return new EnrichmentRunOptions(false);
    }

    public static EnrichmentRunOptions retryingUnresolved() {
        return new EnrichmentRunOptions(true);
    }
}
