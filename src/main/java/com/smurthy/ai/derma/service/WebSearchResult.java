package com.smurthy.ai.derma.service;

/**
 * One organic web search hit.
 */
public record WebSearchResult(String title, String snippet, String url) {
}
