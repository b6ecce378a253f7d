package com.company.resolution.search;

import com.company.resolution.core.model.Candidate;

import java.util.stream.Stream;

/**
 * Finds prospective websites for a company name.
 */
@FunctionalInterface
public interface CandidateFinder {

    /**
     * Looks up website candidates for the given representative name.
     * The returned stream is finite and may be empty.
     *
     * @throws EnrichmentException if the lookup fails
     */
    Stream<Candidate> findCandidates(String representativeName);
}
