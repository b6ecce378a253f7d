package com.company.resolution.enrichment;

/**
 * Receives enrichment progress. Called once per completed cluster, never concurrently.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param clustersDone   clusters completed so far in this run
     * @param clustersTotal  clusters scheduled in this run
     * @param currentBatchId batch of the cluster that just completed
     */
    void onProgress(long clustersDone, long clustersTotal, String currentBatchId);

    /**
     * A listener that ignores progress.
     */
    ProgressListener NOOP = (done, total, batchId) -> {};
}
