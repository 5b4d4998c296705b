package com.smurthy.ai.derma.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the open web search source
 *
 * @param provider {@code google-news} (keyless RSS) or {@code serpapi}
 */
@ConfigurationProperties(prefix = "derma.web-search")
public record WebSearchProperties(
        @DefaultValue("google-news") String provider,
        @DefaultValue("") String apiKey,
        @DefaultValue("skincare dermatology") String querySuffix
) {
}
