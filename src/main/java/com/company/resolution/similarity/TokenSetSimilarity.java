package com.company.resolution.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Token-set overlap with typo tolerance.
 *
 * <p>Computes {@code |matched| / |union|} over the distinct tokens of both keys, where
 * two tokens match when they are equal or their normalized edit similarity reaches
 * the token match threshold. Matching is greedy over sorted tokens, preferring the
 * most similar partner and then the lexicographically smallest one, so results are
 * independent of token order.</p>
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private final double tokenMatchThreshold;
    private final LevenshteinSimilarity tokenSimilarity = new LevenshteinSimilarity();

    public TokenSetSimilarity() {
        this(1.0);
    }

    public TokenSetSimilarity(double tokenMatchThreshold) {
        if (tokenMatchThreshold < 0.0 || tokenMatchThreshold > 1.0) {
            throw new IllegalArgumentException("tokenMatchThreshold must be between 0.0 and 1.0");
        }
        this.tokenMatchThreshold = tokenMatchThreshold;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        TreeSet<String> tokens1 = tokenize(s1);
        TreeSet<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        // Iterate the smaller set against the larger so compute(a, b) == compute(b, a)
        boolean firstIsSmaller = tokens1.size() < tokens2.size()
                || (tokens1.size() == tokens2.size() && s1.compareTo(s2) <= 0);
        TreeSet<String> outer = firstIsSmaller ? tokens1 : tokens2;
        List<String> remaining = new ArrayList<>(firstIsSmaller ? tokens2 : tokens1);

        int matched = 0;
        for (String token : outer) {
            int best = -1;
            double bestScore = -1.0;
            for (int i = 0; i < remaining.size(); i++) {
                double score = tokenSimilarity.compute(token, remaining.get(i));
                if (score >= tokenMatchThreshold && score > bestScore) {
                    best = i;
                    bestScore = score;
                }
            }
            if (best >= 0) {
                remaining.remove(best);
                matched++;
            }
        }

        int unionSize = tokens1.size() + tokens2.size() - matched;
        return (double) matched / unionSize;
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    private static TreeSet<String> tokenize(String s) {
        TreeSet<String> tokens = new TreeSet<>();
        for (String token : s.strip().split("\\s+")) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
