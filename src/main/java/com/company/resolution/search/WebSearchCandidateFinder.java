package com.company.resolution.search;

import com.company.resolution.core.model.Candidate;
import com.company.resolution.metrics.MetricsService;
import com.company.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/**
 * Candidate finder backed by a web search.
 *
 * <p>The search runs when {@link #findCandidates} is called, so its failures surface
 * to the caller immediately. Homepages are fetched lazily while the returned stream
 * is consumed.</p>
 */
public class WebSearchCandidateFinder implements CandidateFinder {
    private static final Logger log = LoggerFactory.getLogger(WebSearchCandidateFinder.class);

    static final String QUERY_SUFFIX = " official site";

    private final WebSearchClient searchClient;
    private final HomepageFetcher homepageFetcher;
    private final int maxResults;
    private final MetricsService metrics;

    /**
     * @param homepageFetcher fetcher for page evidence, or {@code null} to use search results only
     */
    public WebSearchCandidateFinder(WebSearchClient searchClient, HomepageFetcher homepageFetcher,
                                    int maxResults, MetricsService metrics) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be >= 1");
        }
        this.searchClient = searchClient;
        this.homepageFetcher = homepageFetcher;
        this.maxResults = maxResults;
        this.metrics = metrics != null ? metrics : NoOpMetricsService.INSTANCE;
    }

    public WebSearchCandidateFinder(WebSearchClient searchClient, int maxResults) {
        this(searchClient, null, maxResults, NoOpMetricsService.INSTANCE);
    }

    @Override
    public Stream<Candidate> findCandidates(String representativeName) {
        if (representativeName == null || representativeName.isBlank()) {
            return Stream.empty();
        }
        long start = System.nanoTime();
        List<SearchHit> hits = searchClient.search(representativeName.strip() + QUERY_SUFFIX, maxResults);
        metrics.recordSearchDuration(Duration.ofNanos(System.nanoTime() - start));
        log.debug("candidates.found name='{}' backend={} hits={}",
                representativeName, searchClient.getName(), hits.size());

        Stream<Candidate> candidates = hits.stream()
                .limit(maxResults)
                .map(hit -> Candidate.unscored(hit.url(), hit.title(), hit.snippet(), hit.rank()));
        if (homepageFetcher == null) {
            return candidates;
        }
        return candidates.map(c -> c.withPageText(homepageFetcher.fetch(c.url())));
    }
}
