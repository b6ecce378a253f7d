package com.company.resolution.search;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Web search client using the DuckDuckGo HTML endpoint.
 *
 * <p>Usage:</p>
 * <pre>
 * WebSearchClient client = DuckDuckGoSearchClient.builder()
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 * List&lt;SearchHit&gt; hits = client.search("acme official site", 5);
 * </pre>
 *
 * <p>Result links on this endpoint are redirects carrying the target in the
 * {@code uddg} query parameter; they are unwrapped before being returned.
 * Sponsored results are skipped.</p>
 */
public class DuckDuckGoSearchClient implements WebSearchClient {
    private static final Logger log = LoggerFactory.getLogger(DuckDuckGoSearchClient.class);

    private static final String DEFAULT_BASE_URL = "https://html.duckduckgo.com/html/";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    private static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    private final String baseUrl;
    private final Duration timeout;
    private final String userAgent;
    private final HttpClient httpClient;

    private DuckDuckGoSearchClient(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.userAgent = builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<SearchHit> search(String query, int maxResults) {
        URI uri = URI.create(baseUrl + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "text/html")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientEnrichmentException("Search timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new TransientEnrichmentException("Search request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnrichmentException("Interrupted while searching", e);
        }

        int status = response.statusCode();
        // 202 is how this endpoint signals rate limiting
        if (status == 202 || status == 429 || status >= 500) {
            throw new TransientEnrichmentException("Search returned status " + status);
        }
        if (status != 200) {
            throw new EnrichmentException("Search returned unexpected status " + status);
        }

        List<SearchHit> hits = parseResults(response.body(), baseUrl, maxResults);
        log.debug("search.completed query='{}' hits={}", query, hits.size());
        return hits;
    }

    @Override
    public String getName() {
        return "DuckDuckGo";
    }

    /**
     * Extracts organic results from a result page.
     */
    static List<SearchHit> parseResults(String html, String baseUri, int maxResults) {
        Document doc = Jsoup.parse(html, baseUri);
        List<SearchHit> hits = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element result : doc.select("div.result")) {
            if (hits.size() >= maxResults) {
                break;
            }
            if (result.hasClass("result--ad")) {
                continue;
            }
            Element anchor = result.selectFirst("a.result__a");
            if (anchor == null) {
                continue;
            }
            String url = unwrapRedirect(anchor.attr("href"));
            if (url == null || !seen.add(url)) {
                continue;
            }
            Element snippet = result.selectFirst(".result__snippet");
            hits.add(new SearchHit(url, anchor.text(), snippet != null ? snippet.text() : "", hits.size()));
        }
        return hits;
    }

    /**
     * Resolves a result link to its target URL, or returns {@code null} if it is not an http(s) link.
     */
    static String unwrapRedirect(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String target = href.strip();
        int query = target.indexOf('?');
        if (query >= 0 && target.contains("/l/")) {
            for (String param : target.substring(query + 1).split("&")) {
                if (param.startsWith("uddg=")) {
                    target = URLDecoder.decode(param.substring(5), StandardCharsets.UTF_8);
                    break;
                }
            }
        }
        if (target.startsWith("//")) {
            target = "https:" + target;
        }
        String lower = target.toLowerCase();
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return null;
        }
        return target;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private Duration timeout;
        private String userAgent;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public DuckDuckGoSearchClient build() {
            return new DuckDuckGoSearchClient(this);
        }
    }
}
