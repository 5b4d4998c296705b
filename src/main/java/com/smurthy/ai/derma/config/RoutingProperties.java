package com.smurthy.ai.derma.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Configuration properties for intent routing
 *
 * @param minScore      keyword hits an intent needs to win outright
 * @param historyWindow recent turns handed to the classifier
 * @param brands        brand names recognized in queries; empty uses the built-in list
 */
@ConfigurationProperties(prefix = "derma.routing")
public record RoutingProperties(
        @DefaultValue("1") int minScore,
        @DefaultValue("6") int historyWindow,
        @DefaultValue ModelAssist modelAssist,
        @DefaultValue List<String> brands
) {
    public record ModelAssist(@DefaultValue("false") boolean enabled) {
    }
}
