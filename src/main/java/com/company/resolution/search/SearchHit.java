package com.company.resolution.search;

import java.util.Objects;

/**
 * One organic result returned by a web search.
 *
 * @param url     target URL of the result
 * @param title   result title
 * @param snippet result snippet, possibly empty
 * @param rank    0-based position in the result list
 */
public record SearchHit(String url, String title, String snippet, int rank) {

    public SearchHit {
        Objects.requireNonNull(url, "url is required");
        title = title != null ? title : "";
        snippet = snippet != null ? snippet : "";
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be >= 0");
        }
    }
}
