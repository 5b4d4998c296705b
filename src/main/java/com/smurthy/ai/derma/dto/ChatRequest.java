package com.smurthy.ai.derma.dto;

/**
 * Request body of {@code POST /api/chat}. A missing session id starts a new conversation.
 */
public record ChatRequest(String query, String sessionId) {
}
