package com.company.resolution.similarity;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from canonical keys.
 * Only canonical keys that share at least one blocking key are compared during
 * fuzzy clustering, avoiding a full quadratic scan over all distinct keys.
 */
public interface BlockingKeyStrategy {

    /**
     * Generates a set of blocking keys for a canonical key.
     *
     * @param canonicalKey the normalized company key
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String canonicalKey);
}
