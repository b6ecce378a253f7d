package com.company.resolution.search;

import com.company.resolution.cache.NoOpPageContentCache;
import com.company.resolution.cache.PageContentCache;
import com.company.resolution.metrics.MetricsService;
import com.company.resolution.metrics.NoOpMetricsService;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fetches the identifying text of a candidate homepage: its title, meta contents and {@code h1} headings.
 * Pages are loaded through the {@link PageContentCache}; a failed fetch yields empty text and is never cached.
 */
public class HomepageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HomepageFetcher.class);

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; CompanyResolution/1.0)";
    private static final int MAX_TEXT_LENGTH = 4_000;

    private final Duration timeout;
    private final PageContentCache cache;
    private final MetricsService metrics;

    public HomepageFetcher(Duration timeout) {
        this(timeout, new NoOpPageContentCache(), NoOpMetricsService.INSTANCE);
    }

    public HomepageFetcher(Duration timeout, PageContentCache cache, MetricsService metrics) {
        this.timeout = timeout;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Returns the page text for the URL, or an empty string if it cannot be fetched.
     */
    public String fetch(String url) {
        AtomicBoolean loaded = new AtomicBoolean();
        try {
            return cache.get(url, key -> {
                loaded.set(true);
                try {
                    return extractText(download(key));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.debug("page.fetch-failed url={} reason={}", url, e.getMessage());
            return "";
        } finally {
            if (loaded.get()) {
                metrics.recordCacheMiss();
            } else {
                metrics.recordCacheHit();
            }
        }
    }

    /**
     * Downloads and parses the page.
     */
    protected Document download(String url) throws IOException {
        return Jsoup.connect(url)
                .userAgent(USER_AGENT)
                .timeout((int) timeout.toMillis())
                .followRedirects(true)
                .get();
    }

    static String extractText(Document doc) {
        StringJoiner text = new StringJoiner(" ");
        if (!doc.title().isBlank()) {
            text.add(doc.title());
        }
        for (Element meta : doc.select("meta[content]")) {
            String name = (meta.attr("name") + " " + meta.attr("property")).toLowerCase();
            if (name.contains("description") || name.contains("title") || name.contains("site_name")) {
                text.add(meta.attr("content"));
            }
        }
        for (Element h1 : doc.select("h1")) {
            text.add(h1.text());
        }
        String result = text.toString().replace('\u00A0', ' ').replaceAll("\\s{2,}", " ").strip();
        return result.length() > MAX_TEXT_LENGTH ? result.substring(0, MAX_TEXT_LENGTH) : result;
    }
}
