package com.smurthy.ai.derma.config;

import org.springframework.ai.retry.TransientAiException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate generationRetryTemplate(SynthesisProperties synthesisProperties) {
        RetryTemplate retryTemplate = new RetryTemplate();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(1000); // Initial wait time: 1 second
        backOffPolicy.setMultiplier(2);         // Double wait time on each retry
        backOffPolicy.setMaxInterval(5000);     // Max wait time: 5 seconds, well inside the generation timeout
        retryTemplate.setBackOffPolicy(backOffPolicy);

        // Only rate limits and 5xx-style errors are worth another attempt
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(
                synthesisProperties.maxAttempts(), Map.of(TransientAiException.class, true), true);
        retryTemplate.setRetryPolicy(retryPolicy);

        return retryTemplate;
    }
}
