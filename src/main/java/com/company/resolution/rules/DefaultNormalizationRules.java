package com.company.resolution.rules;

import com.company.resolution.config.PipelineConfig;

import java.util.List;

/**
 * Built-in character rules for company names.
 * Rules operate on case-folded text with diacritics already removed.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with the default rules and vocabulary.
     */
    public static NormalizationEngine createDefaultEngine() {
        return createEngine(PipelineConfig.defaults());
    }

    /**
     * Creates a NormalizationEngine with the default rules and the configured
     * legal suffixes, ignored prefixes and abbreviations.
     */
    public static NormalizationEngine createEngine(PipelineConfig config) {
        return new NormalizationEngine(getCharacterRules(), config.getLegalSuffixes(),
                config.getIgnoredPrefixes(), config.getAbbreviations());
    }

    /**
     * Gets the character-level rules applied before tokenization.
     */
    public static List<NormalizationRule> getCharacterRules() {
        return List.of(
                // "&", "@", "/" and "\" join words: "AT&T" -> "at and t"
                NormalizationRule.builder()
                        .name("symbol-and")
                        .pattern("\\s*[&@/\\\\]+\\s*")
                        .replacement(" and ")
                        .priority(10)
                        .build(),

                // Apostrophes and periods vanish so "L.L.C." -> "llc", "Int'l" -> "intl"
                NormalizationRule.builder()
                        .name("drop-apostrophes-periods")
                        .pattern("['‘’ʼ`´.]")
                        .replacement("")
                        .priority(20)
                        .build(),

                // Any other punctuation separates words; letters and digits are kept
                NormalizationRule.builder()
                        .name("punctuation")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}
