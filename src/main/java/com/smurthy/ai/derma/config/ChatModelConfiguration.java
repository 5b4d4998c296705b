package com.smurthy.ai.derma.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.derma.agents.ConstraintExtractor;
import com.smurthy.ai.derma.agents.QueryRouterAgent;
import com.smurthy.ai.derma.agents.ResponseSynthesizer;
import com.smurthy.ai.derma.agents.RoutingModel;
import com.smurthy.ai.derma.agents.RuleBasedIntentClassifier;
import com.smurthy.ai.derma.service.ChatClientGenerationClient;
import com.smurthy.ai.derma.service.GenerationClient;
import com.smurthy.ai.derma.thread.MdcAwareTimeoutExecutor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Chat model wiring: the router (temperature 0) and the answer generator.
 *
 * {@link ChatClient.Builder} is a prototype bean, so each method gets its own builder and the
 * two clients do not share options.
 */
@Configuration
public class ChatModelConfiguration {

    @Bean
    public RoutingModel routingModel(ChatClient.Builder chatClientBuilder) {
        ChatClient routerChatClient = chatClientBuilder
                .defaultOptions(ChatOptions.builder().temperature(0.0).build())
                .build();
        return (systemPrompt, userPrompt) -> routerChatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
    }

    @Bean
    public QueryRouterAgent queryRouterAgent(RoutingModel routingModel,
                                             ObjectMapper objectMapper,
                                             RoutingProperties properties) {
        RuleBasedIntentClassifier rules = new RuleBasedIntentClassifier(
                new ConstraintExtractor(properties.brands()), properties.minScore());
        return new QueryRouterAgent(rules, routingModel, objectMapper, properties.modelAssist().enabled());
    }

    /**
     * Answer generation gets a pool of its own so slow model calls never queue behind retrieval.
     */
    @Bean(destroyMethod = "shutdown")
    public MdcAwareTimeoutExecutor generationExecutor(SynthesisProperties properties) {
        return MdcAwareTimeoutExecutor.dedicated("generation", properties.workerThreads());
    }

    @Bean
    public GenerationClient generationClient(ChatClient.Builder chatClientBuilder,
                                             RetryTemplate generationRetryTemplate,
                                             @Qualifier("generationExecutor") MdcAwareTimeoutExecutor generationExecutor,
                                             SynthesisProperties properties) {
        ChatClient answerChatClient = chatClientBuilder
                .defaultOptions(ChatOptions.builder().temperature(properties.temperature()).build())
                .build();
        return new ChatClientGenerationClient(answerChatClient, generationRetryTemplate, generationExecutor, properties.timeout());
    }

    @Bean
    public ResponseSynthesizer responseSynthesizer(GenerationClient generationClient) {
        return new ResponseSynthesizer(generationClient);
    }
}
