package com.company.resolution.similarity;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default blocking key strategy using two complementary keys:
 * <ul>
 *   <li><b>Token keys</b>: every token of the key (e.g., {@code tok:acme}), so names sharing a word meet</li>
 *   <li><b>Prefix keys</b>: the first 4 characters with spaces removed, each with one character
 *       deleted (e.g., {@code micr} gives {@code pfx:icr}, {@code pfx:mcr}, {@code pfx:mir}, {@code pfx:mic}),
 *       so a single-word name with one typo near its start still meets its correct spelling</li>
 * </ul>
 * Keys shorter than 4 compact characters get their whole compact form as the only prefix key.
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int HEAD_LENGTH = 4;

    @Override
    public Set<String> generateKeys(String canonicalKey) {
        Set<String> keys = new LinkedHashSet<>();
        if (canonicalKey == null || canonicalKey.isBlank()) {
            return keys;
        }

        String cleaned = canonicalKey.strip();
        for (String token : cleaned.split("\\s+")) {
            keys.add("tok:" + token);
        }

        String compact = cleaned.replace(" ", "");
        if (compact.length() < HEAD_LENGTH) {
            keys.add("pfx:" + compact);
            return keys;
        }
        String head = compact.substring(0, HEAD_LENGTH);
        for (int i = 0; i < HEAD_LENGTH; i++) {
            keys.add("pfx:" + head.substring(0, i) + head.substring(i + 1));
        }
        return keys;
    }
}
