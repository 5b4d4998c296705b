package com.smurthy.ai.derma.history;

import java.util.List;

/**
 * Conversation persistence: ordered read plus an append sink.
 *
 * Stores enforce per-session ordering with a monotonic sequence: a turn is only accepted at the
 * next free position, one past the last sequence ever stored for the session, so two concurrent
 * turns that read the same history cannot both be appended. Stores that expire or trim old turns
 * must override {@link #open} so the next position does not fall back onto a used one.
 */
public interface ConversationStore {

    /**
     * @return all turns of the session, oldest first; empty for an unknown session
     */
    List<Turn> read(String sessionId);

    /**
     * @throws ConcurrentTurnException when {@code sequence} is not the next free position
     */
    void append(String sessionId, long sequence, Turn turn);

    /**
     * Reads the session and keeps the last {@code window} turns as context for the next turn.
     * The default derives the next position from the history size, which only holds while
     * {@link #read} returns every turn ever stored.
     */
    default ConversationContext open(String sessionId, int window) {
        List<Turn> turns = read(sessionId);
        List<Turn> recent = turns.size() <= window
                ? turns
                : turns.subList(turns.size() - window, turns.size());
        return new ConversationContext(sessionId, recent, turns.size());
    }
}
