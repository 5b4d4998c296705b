package com.smurthy.ai.derma.service;

import java.util.List;

/**
 * Open web search capability backing the general-knowledge agent.
 */
public interface WebSearchClient {

    /**
     * @param query search query
     * @param limit maximum number of results
     * @return results in provider rank order; empty when the provider found nothing
     * @throws WebSearchException when the provider is unreachable or not configured
     */
    List<WebSearchResult> search(String query, int limit);

    String providerName();
}
