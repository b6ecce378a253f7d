package com.company.resolution.similarity;

/**
 * Similarity between two canonical keys.
 * All implementations return a score between 0.0 (no similarity) and 1.0 (identical)
 * and are symmetric in their arguments.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two keys.
     *
     * @param s1 first key
     * @param s2 second key
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
