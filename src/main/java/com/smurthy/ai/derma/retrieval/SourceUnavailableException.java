package com.smurthy.ai.derma.retrieval;

/**
 * Raised by a {@link RetrievalSourceAdapter} when its backing store cannot be reached or does not
 * answer within the configured timeout.
 *
 * Distinct from an empty result: an adapter that reached its store and found nothing returns an
 * empty list instead.
 */
public class SourceUnavailableException extends Exception {

    private final SourceKind sourceKind;

    public SourceUnavailableException(SourceKind sourceKind, String message) {
        super(message);
        this.sourceKind = sourceKind;
    }

    public SourceUnavailableException(SourceKind sourceKind, String message, Throwable cause) {
        super(message, cause);
        this.sourceKind = sourceKind;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }
}
