package com.smurthy.ai.derma.dto;

import com.smurthy.ai.derma.agents.Citation;
import com.smurthy.ai.derma.orchestration.TurnResult;

import java.util.List;

/**
 * Response DTO with the answer and the routing provenance of the turn
 */
public record ChatResponse(
    String response,
    String agentUsed,
    String intent,
    List<Citation> citations,
    boolean degraded,
    boolean fallbackTriggered,
    String sessionId
) {
    public static ChatResponse from(TurnResult result) {
        return new ChatResponse(
                result.answer(),
                result.agentUsed(),
                result.turn().intent().label(),
                result.citations(),
                result.degraded(),
                result.fallbackTriggered(),
                result.sessionId());
    }
}
