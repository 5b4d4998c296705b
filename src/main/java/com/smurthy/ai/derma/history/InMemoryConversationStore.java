package com.smurthy.ai.derma.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local conversation store. Default when DynamoDB persistence is disabled, meant for
 * development and single-node runs: history is lost on restart and not shared between instances.
 *
 * Memory is bounded two ways. Once more than {@code maxSessions} sessions exist the least recently
 * used one is evicted, and a session keeps only its last {@code maxTurnsPerSession} turns. Trimmed
 * turns still count towards the sequence, so positions keep increasing.
 */
public class InMemoryConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);

    public static final int DEFAULT_MAX_SESSIONS = 10_000;
    public static final int DEFAULT_MAX_TURNS_PER_SESSION = 200;

    private final int maxTurnsPerSession;
    private final Map<String, Session> sessions;

    public InMemoryConversationStore() {
        this(DEFAULT_MAX_SESSIONS, DEFAULT_MAX_TURNS_PER_SESSION);
    }

    public InMemoryConversationStore(int maxSessions, int maxTurnsPerSession) {
        if (maxSessions < 1 || maxTurnsPerSession < 1) {
            throw new IllegalArgumentException("maxSessions and maxTurnsPerSession must be positive");
        }
        this.maxTurnsPerSession = maxTurnsPerSession;
        this.sessions = Collections.synchronizedMap(new LinkedHashMap<String, Session>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Session> eldest) {
                if (size() > maxSessions) {
                    log.info("Evicting least recently used session '{}' ({} sessions held)", eldest.getKey(), size() - 1);
                    return true;
                }
                return false;
            }
        });
    }

    @Override
    public List<Turn> read(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return List.of();
        }
        synchronized (session) {
            return List.copyOf(session.turns);
        }
    }

    @Override
    public ConversationContext open(String sessionId, int window) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return new ConversationContext(sessionId, List.of(), 0);
        }
        synchronized (session) {
            List<Turn> recent = session.turns.subList(Math.max(0, session.turns.size() - window), session.turns.size());
            return new ConversationContext(sessionId, List.copyOf(recent), session.nextSequence());
        }
    }

    @Override
    public void append(String sessionId, long sequence, Turn turn) {
        Session session = sessions.computeIfAbsent(sessionId, id -> new Session());
        synchronized (session) {
            if (sequence != session.nextSequence()) {
                throw new ConcurrentTurnException(sessionId, sequence, session.nextSequence());
            }
            session.turns.add(turn);
            if (session.turns.size() > maxTurnsPerSession) {
                session.turns.remove(0);
                session.trimmed++;
            }
        }
        log.debug("Appended turn #{} to session '{}'", sequence, sessionId);
    }

    int sessionCount() {
        return sessions.size();
    }

    private static final class Session {
        private final List<Turn> turns = new ArrayList<>();
        private long trimmed;

        long nextSequence() {
            return trimmed + turns.size();
        }
    }
}
