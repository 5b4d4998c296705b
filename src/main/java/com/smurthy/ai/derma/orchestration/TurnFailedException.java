package com.smurthy.ai.derma.orchestration;

/**
 * The only exception that leaves the orchestrator. Nothing was appended to history.
 *
 * {@link #getUserMessage()} is safe to show to end users; the internal cause stays in the logs.
 */
public class TurnFailedException extends RuntimeException {

    public static final String DEFAULT_USER_MESSAGE =
            "Sorry, I couldn't answer that right now. Please try again in a moment.";

    private final FailureReason reason;
    private final String userMessage;

    public TurnFailedException(FailureReason reason, String detail, Throwable cause) {
        this(reason, detail, DEFAULT_USER_MESSAGE, cause);
    }

    public TurnFailedException(FailureReason reason, String detail, String userMessage, Throwable cause) {
        super(reason + ": " + detail, cause);
        this.reason = reason;
        this.userMessage = userMessage;
    }

    public FailureReason getReason() {
        return reason;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
