package com.smurthy.ai.derma.history;

import java.util.List;
import java.util.Objects;

/**
 * Explicit per-call session context handed to the orchestrator.
 *
 * @param sessionId    conversation the turn belongs to
 * @param recentTurns  most recent turns, oldest first, read-only
 * @param nextSequence position the new turn must take in the session history; the store rejects an
 *                     append at any other position
 */
public record ConversationContext(String sessionId, List<Turn> recentTurns, long nextSequence) {

    public ConversationContext {
        Objects.requireNonNull(sessionId, "sessionId");
        recentTurns = recentTurns == null ? List.of() : List.copyOf(recentTurns);
    }

    public static ConversationContext newSession(String sessionId) {
        return new ConversationContext(sessionId, List.of(), 0);
    }
}
