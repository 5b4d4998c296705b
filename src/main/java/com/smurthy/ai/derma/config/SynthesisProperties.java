package com.smurthy.ai.derma.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration properties for answer generation
 */
@ConfigurationProperties(prefix = "derma.synthesis")
public record SynthesisProperties(
        @DefaultValue("20s") Duration timeout,
        @DefaultValue("0.3") double temperature,
        @DefaultValue("3") int maxAttempts,
        @DefaultValue("4") int workerThreads
) {
}
