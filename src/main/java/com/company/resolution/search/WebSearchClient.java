package com.company.resolution.search;

import java.util.List;

/**
 * Web search capability used to find candidate websites.
 */
public interface WebSearchClient {

    /**
     * Runs a search query.
     *
     * @param query      free-text query
     * @param maxResults upper bound on the number of hits returned
     * @return hits in rank order, possibly empty
     * @throws TransientEnrichmentException when the call may succeed on retry
     * @throws EnrichmentException          for any other failure
     */
    List<SearchHit> search(String query, int maxResults);

    /**
     * Returns a human-readable name of this search backend.
     */
    String getName();
}
