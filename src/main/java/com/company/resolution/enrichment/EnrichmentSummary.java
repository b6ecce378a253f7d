package com.company.resolution.enrichment;

import java.time.Duration;

/**
 * Counts of one enrichment run.
 *
 * @param scheduled      clusters scheduled for processing in this run
 * @param verified       clusters that ended VERIFIED
 * @param unverified     clusters that ended UNVERIFIED
 * @param noCandidate    clusters that ended NO_CANDIDATE
 * @param errors         clusters that ended ERROR
 * @param skipped        clusters not scheduled because a stored result was kept
 * @param droppedRecords input rows rejected during ingest, when known
 * @param cancelled      whether the run stopped before all scheduled clusters were processed
 * @param duration       wall-clock time of the run
 */
public record EnrichmentSummary(
        int scheduled,
        int verified,
        int unverified,
        int noCandidate,
        int errors,
        int skipped,
        int droppedRecords,
        boolean cancelled,
        Duration duration
) {

    public int processed() {
        return verified + unverified + noCandidate + errors;
    }

    public EnrichmentSummary withDroppedRecords(int dropped) {
        return new EnrichmentSummary(scheduled, verified, unverified, noCandidate, errors, skipped,
                dropped, cancelled, duration);
    }

    @Override
    public String toString() {
        return "EnrichmentSummary{scheduled=" + scheduled +
                ", verified=" + verified +
                ", unverified=" + unverified +
                ", noCandidate=" + noCandidate +
                ", errors=" + errors +
                ", skipped=" + skipped +
                ", dropped=" + droppedRecords +
                ", cancelled=" + cancelled +
                ", durationMs=" + (duration != null ? duration.toMillis() : 0) + '}';
    }
}
