package com.smurthy.ai.derma.dto;

import com.smurthy.ai.derma.agents.Citation;
import com.smurthy.ai.derma.history.Turn;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public record HistoryEntry(
    String query,
    String answer,
    String intent,
    String agentUsed,
    List<String> constraints,
    List<Citation> citations,
    Instant timestamp
) {
    public static HistoryEntry from(Turn turn) {
        return new HistoryEntry(
                turn.query(),
                turn.answer(),
                turn.intent().label(),
                turn.agentUsed(),
                turn.constraints().stream().map(Object::toString).collect(Collectors.toList()),
                turn.citations(),
                turn.timestamp());
    }
}
