package com.smurthy.ai.derma.service;

/**
 * The web search provider could not be reached, rejected the request, or is not configured.
 */
public class WebSearchException extends RuntimeException {

    public WebSearchException(String message) {
        super(message);
    }

    public WebSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
