package com.company.resolution.core.model;

/**
 * Evidence sub-scores collected for one website candidate. Each value is in [0, 1].
 *
 * @param domainTokenMatch share of name tokens found in the domain label
 * @param nameInTitle      how strongly the name appears in the page title, snippet or text
 * @param nonAggregator    0 for denylisted directory or social domains, 1 otherwise
 * @param searchRankPrior  prior confidence taken from the search engine's ranking
 */
public record SignalScores(
        double domainTokenMatch,
        double nameInTitle,
        double nonAggregator,
        double searchRankPrior
) {
    public SignalScores {
        check(domainTokenMatch, "domainTokenMatch");
        check(nameInTitle, "nameInTitle");
        check(nonAggregator, "nonAggregator");
        check(searchRankPrior, "searchRankPrior");
    }

    private static void check(double value, String name) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got " + value);
        }
    }

    @Override
    public String toString() {
        return String.format("SignalScores{domain=%.3f, title=%.3f, nonAggregator=%.1f, rank=%.3f}",
                domainTokenMatch, nameInTitle, nonAggregator, searchRankPrior);
    }
}
