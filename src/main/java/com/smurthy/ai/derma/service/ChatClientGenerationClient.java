package com.smurthy.ai.derma.service;

import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.thread.MdcAwareTimeoutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * {@link GenerationClient} over a Spring AI {@link ChatClient}.
 *
 * Transient model errors are retried with the shared {@link RetryTemplate}; the whole call,
 * retries included, is bounded by the generation timeout.
 */
public class ChatClientGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationClient.class);

    private final ChatClient chatClient;
    private final RetryTemplate retryTemplate;
    private final MdcAwareTimeoutExecutor executor;
    private final Duration timeout;

    public ChatClientGenerationClient(ChatClient chatClient,
                                      RetryTemplate retryTemplate,
                                      MdcAwareTimeoutExecutor executor,
                                      Duration timeout) {
        this.chatClient = chatClient;
        this.retryTemplate = retryTemplate;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public String generate(String prompt, List<EvidenceItem> contextItems) {
        String userMessage = "EVIDENCE:\n" + numberedContext(contextItems) + "\n\n" + prompt;
        long startTime = System.currentTimeMillis();

        try {
            String content = executor.call(() -> retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying generation, attempt {}", context.getRetryCount() + 1);
                }
                return chatClient.prompt()
                        .user(userMessage)
                        .call()
                        .content();
            }), timeout);

            log.info("Generated answer over {} evidence items in {}ms",
                    contextItems.size(), System.currentTimeMillis() - startTime);
            return content;

        } catch (TimeoutException e) {
            throw new GenerationException("Generation timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            throw new GenerationException("Generation failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Generation interrupted", e);
        }
    }

    /**
     * Renders evidence as {@code [1] ...}, {@code [2] ...} in list order.
     */
    public static String numberedContext(List<EvidenceItem> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            sb.append("[").append(i + 1).append("] ").append(items.get(i).contentExcerpt()).append("\n\n");
        }
        return sb.toString().trim();
    }
}
