package com.smurthy.ai.derma.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Google organic results through SerpAPI.
 *
 * Requires {@code derma.web-search.api-key}; without it every search raises
 * {@link WebSearchException} so the caller treats web search as unavailable.
 */
public class SerpApiSearchClient implements WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(SerpApiSearchClient.class);
    private static final String SERPAPI_BASE = "https://serpapi.com";

    private final RestClient restClient;
    private final String apiKey;

    /**
     * @param timeout connect and read timeout of the HTTP client
     */
    public SerpApiSearchClient(String apiKey, Duration timeout) {
        this(SERPAPI_BASE, apiKey, timeout);
    }

    SerpApiSearchClient(String baseUrl, String apiKey, Duration timeout) {
        this(RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeout))
                .build(), apiKey);
    }

    SerpApiSearchClient(RestClient restClient, String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        log.info("SerpApiSearchClient initialized (key configured: {})", StringUtils.hasText(apiKey));
    }

    @Override
    public List<WebSearchResult> search(String query, int limit) {
        if (!StringUtils.hasText(apiKey)) {
            throw new WebSearchException("SerpAPI key is not configured");
        }

        log.info("Searching SerpAPI: {}", query);
        JsonNode body;
        try {
            body = restClient.get()
                    .uri("/search.json?engine=google&q={q}&num={num}&api_key={key}", query, limit, apiKey)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new WebSearchException("SerpAPI request failed: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new WebSearchException("SerpAPI returned an empty body");
        }
        if (body.hasNonNull("error")) {
            throw new WebSearchException("SerpAPI error: " + body.get("error").asText());
        }

        List<WebSearchResult> results = new ArrayList<>();
        for (JsonNode hit : body.path("organic_results")) {
            if (results.size() >= limit) {
                break;
            }
            results.add(new WebSearchResult(
                    hit.path("title").asText("No title"),
                    hit.path("snippet").asText("No description available"),
                    hit.path("link").asText("")
            ));
        }
        return results;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }

    @Override
    public String providerName() {
        return "serpapi";
    }
}
