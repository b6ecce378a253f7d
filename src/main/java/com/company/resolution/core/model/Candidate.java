package com.company.resolution.core.model;

import java.util.Objects;

/**
 * A prospective website for a cluster, together with the evidence gathered for it.
 * Candidates are unscored ({@code evidence == null}) until the verifier has seen them.
 */
public record Candidate(
        String url,
        String title,
        String snippet,
        String pageText,
        int searchRank,
        double score,
        SignalScores evidence
) {
    public Candidate {
        Objects.requireNonNull(url, "url is required");
        title = title != null ? title : "";
        snippet = snippet != null ? snippet : "";
        pageText = pageText != null ? pageText : "";
        if (searchRank < 0) {
            throw new IllegalArgumentException("searchRank must be >= 0");
        }
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    /**
     * Creates an unscored candidate as returned by a search.
     */
    public static Candidate unscored(String url, String title, String snippet, int searchRank) {
        return new Candidate(url, title, snippet, "", searchRank, 0.0, null);
    }

    public Candidate withPageText(String text) {
        return new Candidate(url, title, snippet, text, searchRank, score, evidence);
    }

    public Candidate withScore(double newScore, SignalScores newEvidence) {
        return new Candidate(url, title, snippet, pageText, searchRank, newScore, newEvidence);
    }

    public boolean isScored() {
        return evidence != null;
    }
}
