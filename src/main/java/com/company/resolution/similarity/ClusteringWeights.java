package com.company.resolution.similarity;

import com.company.resolution.config.ConfigurationException;

/**
 * Weights combining token-set overlap and edit-distance similarity of canonical keys.
 */
public record ClusteringWeights(double tokenSetWeight, double editDistanceWeight) {

    public ClusteringWeights {
        if (tokenSetWeight < 0 || editDistanceWeight < 0) {
            throw new ConfigurationException("Weights must be non-negative");
        }
        double sum = tokenSetWeight + editDistanceWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new ConfigurationException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Equal weight for token overlap and edit distance.
     */
    public static ClusteringWeights defaultWeights() {
        return new ClusteringWeights(0.5, 0.5);
    }

    /**
     * Weights favoring token overlap (good for reordered multi-word names).
     */
    public static ClusteringWeights tokenFocused() {
        return new ClusteringWeights(0.7, 0.3);
    }
}
