package com.company.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a raw company name into its canonical comparison key.
 *
 * <p>The key is case-folded, free of diacritics and punctuation, and has its
 * configured legal-entity suffixes and ignored prefixes removed. The empty string
 * is the sentinel for names with nothing left to compare.</p>
 *
 * <p>Normalizing a key again returns the same key.</p>
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final String TRAILING_CONNECTOR = "and";

    private static final Map<Character, String> TRANSLITERATIONS = Map.of(
            'ß', "ss",
            'æ', "ae",
            'ø', "o",
            'œ', "oe",
            'ł', "l",
            'đ', "d",
            'ð', "d",
            'þ', "th",
            'ı', "i");

    private final List<NormalizationRule> rules;
    private final Set<String> legalSuffixes;
    private final List<String> ignoredPrefixes;
    private final Map<String, String> abbreviations;

    public NormalizationEngine(List<NormalizationRule> rules, Set<String> legalSuffixes,
                               List<String> ignoredPrefixes, Map<String, String> abbreviations) {
        this.rules = new ArrayList<>(rules);
        this.legalSuffixes = Set.copyOf(legalSuffixes);
        this.ignoredPrefixes = List.copyOf(ignoredPrefixes);
        this.abbreviations = Map.copyOf(abbreviations);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    /**
     * Gets all rules currently in the engine.
     */
    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    public Set<String> getLegalSuffixes() {
        return legalSuffixes;
    }

    /**
     * Normalizes the given name into a canonical key.
     *
     * @return the key, or {@code ""} for null, blank or punctuation-only names
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = Normalizer.normalize(name, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        result = foldToBaseCharacters(result);

        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        result = result.strip();
        if (result.isEmpty()) {
            return "";
        }
        return String.join(" ", reduceTokens(result.split("\\s+")));
    }

    /**
     * Checks if two names share the same canonical key.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }

    /**
     * Splits a canonical key into its tokens.
     */
    public static List<String> tokens(String key) {
        if (key == null || key.isBlank()) {
            return List.of();
        }
        return Arrays.asList(key.strip().split("\\s+"));
    }

    private List<String> reduceTokens(String[] rawTokens) {
        List<String> tokens = new ArrayList<>(rawTokens.length);
        for (String token : rawTokens) {
            String expansion = abbreviations.get(token);
            if (expansion != null) {
                tokens.addAll(Arrays.asList(expansion.split("\\s+")));
            } else {
                tokens.add(token);
            }
        }

        // Never strip the last remaining token
        while (tokens.size() > 1 && ignoredPrefixes.contains(tokens.get(0))) {
            tokens.remove(0);
        }
        while (tokens.size() > 1) {
            String last = tokens.get(tokens.size() - 1);
            if (!legalSuffixes.contains(last) && !TRAILING_CONNECTOR.equals(last)) {
                break;
            }
            tokens.remove(tokens.size() - 1);
        }
        return tokens;
    }

    private static String foldToBaseCharacters(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        StringBuilder sb = new StringBuilder(stripped.length());
        for (int i = 0; i < stripped.length(); i++) {
            char c = stripped.charAt(i);
            String replacement = TRANSLITERATIONS.get(c);
            if (replacement != null) {
                sb.append(replacement);
            } else {
                sb.append(c);
            }
        }
        return Normalizer.normalize(sb, Normalizer.Form.NFC);
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
