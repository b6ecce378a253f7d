package com.company.resolution.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Similarity of two canonical keys used to decide cluster merges.
 * Formula: score = w1*tokenSet + w2*levenshtein
 */
public class KeySimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(KeySimilarityScorer.class);

    private final TokenSetSimilarity tokenSet;
    private final LevenshteinSimilarity levenshtein;
    private final ClusteringWeights weights;

    public KeySimilarityScorer() {
        this(ClusteringWeights.defaultWeights(), 0.8);
    }

    public KeySimilarityScorer(ClusteringWeights weights, double tokenMatchThreshold) {
        this.tokenSet = new TokenSetSimilarity(tokenMatchThreshold);
        this.levenshtein = new LevenshteinSimilarity();
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        return computeWithBreakdown(s1, s2).compositeScore();
    }

    @Override
    public String getName() {
        return "KeySimilarity";
    }

    /**
     * Computes detailed similarity breakdown.
     */
    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return new SimilarityBreakdown(0.0, 0.0, 0.0, weights);
        }
        if (s1.equals(s2)) {
            return new SimilarityBreakdown(1.0, 1.0, 1.0, weights);
        }
        double tokenScore = tokenSet.compute(s1, s2);
        double editScore = levenshtein.compute(s1, s2);
        double composite = weights.tokenSetWeight() * tokenScore
                + weights.editDistanceWeight() * editScore;

        SimilarityBreakdown breakdown = new SimilarityBreakdown(tokenScore, editScore, composite, weights);
        log.trace("Key similarity '{}' vs '{}': {}", s1, s2, breakdown);
        return breakdown;
    }

    public ClusteringWeights getWeights() {
        return weights;
    }

    /**
     * Detailed breakdown of the key similarity.
     */
    public record SimilarityBreakdown(
            double tokenSetScore,
            double levenshteinScore,
            double compositeScore,
            ClusteringWeights weights
    ) {
        @Override
        public String toString() {
            return String.format(
                    "SimilarityBreakdown{tokenSet=%.4f (w=%.2f), levenshtein=%.4f (w=%.2f), composite=%.4f}",
                    tokenSetScore, weights.tokenSetWeight(),
                    levenshteinScore, weights.editDistanceWeight(),
                    compositeScore
            );
        }
    }
}
