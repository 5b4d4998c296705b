package com.smurthy.ai.derma.agents;

/**
 * Generative model used as a routing assist. Implementations must pin sampling temperature to 0.
 */
@FunctionalInterface
public interface RoutingModel {

    String complete(String systemPrompt, String userPrompt);
}
