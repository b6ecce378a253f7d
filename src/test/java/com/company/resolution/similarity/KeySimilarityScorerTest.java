package com.company.resolution.similarity;

import com.company.resolution.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeySimilarityScorerTest {

    private final KeySimilarityScorer scorer = new KeySimilarityScorer(ClusteringWeights.defaultWeights(), 0.8);

    @Test
    @DisplayName("Identical keys score 1 and empty keys score 0")
    void testBoundaries() {
        assertEquals(1.0, scorer.compute("acme", "acme"));
        assertEquals(0.0, scorer.compute("", "acme"));
        assertEquals(0.0, scorer.compute("acme", ""));
        assertEquals(0.0, scorer.compute(null, "acme"));
    }

    @Test
    @DisplayName("Near-identical keys score above the default clustering threshold")
    void testNearDuplicates() {
        assertTrue(scorer.compute("acme widget", "acme widgets") >= 0.85);
        assertTrue(scorer.compute("microsoft", "microsft") >= 0.85);
    }

    @Test
    @DisplayName("Unrelated keys score low")
    void testUnrelated() {
        assertTrue(scorer.compute("acme", "globex") < 0.5);
        assertTrue(scorer.compute("acme widgets", "acme bank") < 0.85);
    }

    @ParameterizedTest
    @DisplayName("Scores are symmetric")
    @CsvSource({
            "acme widget,acme widgets",
            "alpha beta gamma,alpha betta",
            "globex,globex international",
            "a b c,c b a d"
    })
    void testSymmetry(String a, String b) {
        assertEquals(scorer.compute(a, b), scorer.compute(b, a));
    }

    @Test
    @DisplayName("Breakdown exposes the component scores")
    void testBreakdown() {
        KeySimilarityScorer.SimilarityBreakdown breakdown = scorer.computeWithBreakdown("widgets acme", "acme widgets");
        assertEquals(1.0, breakdown.tokenSetScore());
        assertTrue(breakdown.levenshteinScore() < 1.0);
        assertEquals(0.5 * breakdown.tokenSetScore() + 0.5 * breakdown.levenshteinScore(),
                breakdown.compositeScore(), 1e-9);
    }

    @Nested
    @DisplayName("Component algorithms")
    class Components {

        @Test
        @DisplayName("Levenshtein distance")
        void testLevenshteinDistance() {
            assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting"));
            assertEquals(0, LevenshteinSimilarity.distance("acme", "acme"));
            assertEquals(4, LevenshteinSimilarity.distance("", "acme"));
            assertEquals(0.5, new LevenshteinSimilarity().compute("abcd", "abxy"), 1e-9);
        }

        @Test
        @DisplayName("Token set similarity tolerates small typos within tokens")
        void testFuzzyTokenSet() {
            TokenSetSimilarity tokenSet = new TokenSetSimilarity(0.8);
            assertEquals(1.0, tokenSet.compute("acme widgets", "acme widget"), 1e-9);
            assertEquals(0.5, tokenSet.compute("acme", "acme globex"), 1e-9);
            assertEquals(0.0, tokenSet.compute("acme", "globex"), 1e-9);
        }

        @Test
        @DisplayName("Weights must sum to one")
        void testWeightsValidation() {
            assertThrows(ConfigurationException.class, () -> new ClusteringWeights(0.5, 0.6));
            assertThrows(ConfigurationException.class, () -> new ClusteringWeights(-0.5, 1.5));
            assertDoesNotThrow(ClusteringWeights::tokenFocused);
        }
    }

    @Nested
    @DisplayName("Blocking keys")
    class Blocking {

        private final BlockingKeyStrategy strategy = new DefaultBlockingKeyStrategy();

        @Test
        @DisplayName("Should emit one key per token plus single-deletion prefix keys")
        void testKeys() {
            assertEquals(Set.of("tok:acme", "tok:widgets", "pfx:cme", "pfx:ame", "pfx:ace", "pfx:acm"),
                    strategy.generateKeys("acme widgets"));
            assertEquals(Set.of("tok:ab", "pfx:ab"), strategy.generateKeys("ab"));
            assertTrue(strategy.generateKeys("").isEmpty());
        }

        @Test
        @DisplayName("Single-word typos still share a block")
        void testTyposShareBlock() {
            Set<String> a = strategy.generateKeys("microsoft");
            Set<String> b = strategy.generateKeys("microsft");
            assertTrue(a.stream().anyMatch(b::contains));
        }

        @ParameterizedTest
        @CsvSource({"microsoft, mcrosoft", "microsoft, imcrosoft", "globex, glboex", "initech, nitech"})
        @DisplayName("A typo within the first characters still shares a block")
        void testEarlyTyposShareBlock(String correct, String typo) {
            Set<String> a = strategy.generateKeys(correct);
            Set<String> b = strategy.generateKeys(typo);
            assertTrue(a.stream().anyMatch(b::contains), correct + " / " + typo);
        }
    }
}
