package com.company.resolution.verify;

import com.company.resolution.config.ConfigurationException;
import com.company.resolution.core.model.SignalScores;

/**
 * Weights of the candidate evidence signals. Validated once, at construction.
 */
public record SignalWeights(
        double domainTokenMatchWeight,
        double nameInTitleWeight,
        double nonAggregatorWeight,
        double searchRankPriorWeight
) {
    public SignalWeights {
        if (domainTokenMatchWeight < 0 || nameInTitleWeight < 0
                || nonAggregatorWeight < 0 || searchRankPriorWeight < 0) {
            throw new ConfigurationException("Weights must be non-negative");
        }
        double sum = domainTokenMatchWeight + nameInTitleWeight + nonAggregatorWeight + searchRankPriorWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new ConfigurationException("Weights must sum to 1.0, got " + sum);
        }
    }

    public static SignalWeights defaultWeights() {
        return new SignalWeights(0.4, 0.3, 0.2, 0.1);
    }

    /**
     * Weighted sum of the signals, clamped to [0, 1] against rounding.
     */
    public double combine(SignalScores signals) {
        double score = domainTokenMatchWeight * signals.domainTokenMatch()
                + nameInTitleWeight * signals.nameInTitle()
                + nonAggregatorWeight * signals.nonAggregator()
                + searchRankPriorWeight * signals.searchRankPrior();
        return Math.max(0.0, Math.min(1.0, score));
    }
}
