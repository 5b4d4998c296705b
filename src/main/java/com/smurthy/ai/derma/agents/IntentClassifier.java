package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.history.Turn;

import java.util.List;

/**
 * Maps a query plus recent conversation turns to one intent and its constraints.
 *
 * Implementations must be total (never leave a query unrouted) and deterministic for identical
 * input.
 */
public interface IntentClassifier {

    QueryIntent classify(String query, List<Turn> recentHistory);
}
