package com.smurthy.ai.derma.history;

/**
 * Another turn of the same session was appended first; the caller's view of the history is stale.
 */
public class ConcurrentTurnException extends RuntimeException {

    public ConcurrentTurnException(String sessionId, long expectedSequence, long actualSequence) {
        super("Session '" + sessionId + "' expected turn #" + expectedSequence + " but history is at #" + actualSequence);
    }

    public ConcurrentTurnException(String sessionId, long sequence, Throwable cause) {
        super("Session '" + sessionId + "' already has turn #" + sequence, cause);
    }
}
