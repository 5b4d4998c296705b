package com.smurthy.ai.derma.service;

import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.net.URLConnection;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Google News RSS search. Needs no API key, which makes it the default web provider for local
 * runs; results lean towards recent coverage (research news, product launches).
 *
 * The connection carries its own connect and read timeouts, so a stalled feed releases the
 * worker thread instead of relying on the caller's cancellation.
 */
public class GoogleNewsSearchClient implements WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleNewsSearchClient.class);
    private static final String GOOGLE_NEWS_RSS_BASE = "https://news.google.com/rss";

    private final String rssBase;
    private final int timeoutMillis;

    public GoogleNewsSearchClient(Duration timeout) {
        this(GOOGLE_NEWS_RSS_BASE, timeout);
    }

    GoogleNewsSearchClient(String rssBase, Duration timeout) {
        this.rssBase = rssBase;
        this.timeoutMillis = (int) Math.max(1, timeout.toMillis());
    }

    @Override
    public List<WebSearchResult> search(String query, int limit) {
        String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
        String rssUrl = rssBase + "/search?q=" + encodedQuery + "&hl=en-IN&gl=IN&ceid=IN:en";

        log.info("Fetching Google News RSS: {}", query);
        try {
            URLConnection connection = new URL(rssUrl).openConnection();
            connection.setConnectTimeout(timeoutMillis);
            connection.setReadTimeout(timeoutMillis);
            SyndFeed feed;
            try (XmlReader reader = new XmlReader(connection)) {
                feed = new SyndFeedInput().build(reader);
            }
            List<WebSearchResult> results = feed.getEntries().stream()
                    .limit(limit > 0 ? limit : 3)
                    .map(GoogleNewsSearchClient::toResult)
                    .collect(Collectors.toList());
            log.info("Fetched {} entries from Google News", results.size());
            return results;
        } catch (Exception e) {
            throw new WebSearchException("Google News RSS fetch failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String providerName() {
        return "google-news";
    }

    static WebSearchResult toResult(SyndEntry entry) {
        String snippet = entry.getDescription() != null
                ? stripHtml(entry.getDescription().getValue())
                : "";
        return new WebSearchResult(entry.getTitle(), snippet, entry.getLink());
    }

    static String stripHtml(String html) {
        if (html == null) {
            return "";
        }
        return html.replaceAll("<[^>]+>", " ")
                .replace("&nbsp;", " ")
                .replace("&amp;", "&")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
