package com.smurthy.ai.derma.config;

import com.smurthy.ai.derma.agents.IntentClassifier;
import com.smurthy.ai.derma.agents.ResponseSynthesizer;
import com.smurthy.ai.derma.agents.SpecialistAgent;
import com.smurthy.ai.derma.history.ConversationStore;
import com.smurthy.ai.derma.history.InMemoryConversationStore;
import com.smurthy.ai.derma.observability.RoutingMetrics;
import com.smurthy.ai.derma.orchestration.SkincareOrchestrator;
import com.smurthy.ai.derma.service.ChatService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Main configuration class
 */
@Configuration
@EnableConfigurationProperties({
        RetrievalProperties.class,
        RoutingProperties.class,
        SynthesisProperties.class,
        WebSearchProperties.class
})
public class OrchestrationConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoutingMetrics routingMetrics() {
        return new RoutingMetrics();
    }

    @Bean
    @ConditionalOnProperty(name = "derma.history.dynamodb.enabled", havingValue = "false", matchIfMissing = true)
    public ConversationStore inMemoryConversationStore(
            @Value("${derma.history.in-memory.max-sessions:10000}") int maxSessions,
            @Value("${derma.history.in-memory.max-turns-per-session:200}") int maxTurnsPerSession) {
        return new InMemoryConversationStore(maxSessions, maxTurnsPerSession);
    }

    @Bean
    public SkincareOrchestrator skincareOrchestrator(IntentClassifier queryRouterAgent,
                                                     List<SpecialistAgent> specialists,
                                                     ResponseSynthesizer responseSynthesizer,
                                                     ConversationStore conversationStore,
                                                     RoutingMetrics routingMetrics,
                                                     Clock clock) {
        return new SkincareOrchestrator(queryRouterAgent, specialists, responseSynthesizer,
                conversationStore, routingMetrics, clock);
    }

    @Bean
    public ChatService chatService(SkincareOrchestrator skincareOrchestrator,
                                   ConversationStore conversationStore,
                                   RoutingMetrics routingMetrics,
                                   RoutingProperties routingProperties) {
        return new ChatService(skincareOrchestrator, conversationStore, routingMetrics,
                routingProperties.historyWindow());
    }
}
