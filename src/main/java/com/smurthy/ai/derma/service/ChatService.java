package com.smurthy.ai.derma.service;

import com.smurthy.ai.derma.history.ConversationContext;
import com.smurthy.ai.derma.history.ConversationStore;
import com.smurthy.ai.derma.history.Turn;
import com.smurthy.ai.derma.observability.RoutingMetrics;
import com.smurthy.ai.derma.orchestration.FailureReason;
import com.smurthy.ai.derma.orchestration.SkincareOrchestrator;
import com.smurthy.ai.derma.orchestration.TurnFailedException;
import com.smurthy.ai.derma.orchestration.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for the chat surface: loads the session history, runs the turn, and serves
 * history reads.
 */
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    private final SkincareOrchestrator orchestrator;
    private final ConversationStore conversationStore;
    private final RoutingMetrics metrics;
    private final int historyWindow;

    public ChatService(SkincareOrchestrator orchestrator, ConversationStore conversationStore,
                       RoutingMetrics metrics, int historyWindow) {
        this.orchestrator = orchestrator;
        this.conversationStore = conversationStore;
        this.metrics = metrics;
        this.historyWindow = historyWindow;
    }

    /**
     * @param sessionId existing session, or {@code null} to start a new one
     */
    public TurnResult chat(String sessionId, String query) {
        String session = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId;

        ConversationContext context;
        try {
            context = conversationStore.open(session, historyWindow);
        } catch (RuntimeException e) {
            log.error("Could not load history of session '{}'", session, e);
            metrics.recordFailure(FailureReason.HISTORY_UNAVAILABLE);
            throw new TurnFailedException(FailureReason.HISTORY_UNAVAILABLE, e.getMessage(), e);
        }
        log.debug("Session '{}' has {} prior turns", session, context.nextSequence());

        return orchestrator.process(context, query);
    }

    /**
     * @return the last {@code limit} turns of the session, oldest first
     */
    public List<Turn> history(String sessionId, int limit) {
        List<Turn> turns = conversationStore.read(sessionId);
        return turns.size() <= limit ? turns : turns.subList(turns.size() - limit, turns.size());
    }
}
