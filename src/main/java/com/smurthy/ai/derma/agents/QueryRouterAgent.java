package com.smurthy.ai.derma.agents;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.derma.history.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Query Router Agent
 *
 * Front door of the routing pipeline. The rule-based classifier always decides first; when its
 * decision is ambiguous and model assist is enabled, a temperature-0 model is asked to pick one
 * intent in strict JSON. The model's answer is validated against the closed {@link Intent} set
 * and discarded when invalid, so the rule decision stands. Constraints always come from the
 * deterministic extractor.
 */
public class QueryRouterAgent implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(QueryRouterAgent.class);

    static final String ROUTING_SYSTEM_PROMPT = """
            You are the query router of a skincare assistant. Pick exactly ONE specialist for the query.

            SPECIALISTS:

            1. **catalog-lookup** - Use for:
               - Product recommendations, "best moisturizer for oily skin"
               - Price, budget, brand or ingredient based shopping questions
               - "Where can I buy...", "show me serums under 1000"

            2. **document-lookup** - Use for:
               - Educational questions answered by our skincare articles
               - Routines, ingredient explanations, causes and treatment of skin concerns
               - "How do I layer retinol and niacinamide?"

            3. **general-knowledge** - Use for:
               - Latest research, news, regulatory updates, trends
               - Anything not covered by the product catalog or our articles

            Respond ONLY with valid JSON in this exact format:
            {
              "intent": "catalog-lookup",
              "reasoning": "User asks for a product under a budget"
            }
            """;

    private final IntentClassifier ruleClassifier;
    private final RoutingModel routingModel;
    private final ObjectMapper objectMapper;
    private final boolean modelAssistEnabled;

    public QueryRouterAgent(IntentClassifier ruleClassifier,
                            RoutingModel routingModel,
                            ObjectMapper objectMapper,
                            boolean modelAssistEnabled) {
        this.ruleClassifier = ruleClassifier;
        this.routingModel = routingModel;
        this.objectMapper = objectMapper;
        this.modelAssistEnabled = modelAssistEnabled && routingModel != null;

        log.info("QueryRouterAgent initialized (model assist {})", this.modelAssistEnabled ? "enabled" : "disabled");
    }

    @Override
    public QueryIntent classify(String query, List<Turn> recentHistory) {
        QueryIntent ruleDecision = ruleClassifier.classify(query, recentHistory);
        QueryIntent decision = ruleDecision;

        if (ruleDecision.ambiguous() && modelAssistEnabled) {
            decision = askModel(query, ruleDecision)
                    .map(proposal -> ruleDecision.withIntent(proposal.intent(), "model assist: " + proposal.reasoning()))
                    .orElse(ruleDecision);
        }

        log.info("Routing decision for '{}': {} {} | Reasoning: {}",
                query, decision.intent().label(), decision.constraints(), decision.reasoning());
        return decision;
    }

    private Optional<RoutingProposal> askModel(String query, QueryIntent ruleDecision) {
        String routingPrompt = String.format("""
                Analyze this query:

                "%s"

                Respond with JSON naming the one specialist that should handle it.
                """, query);

        try {
            String response = routingModel.complete(ROUTING_SYSTEM_PROMPT, routingPrompt);
            log.debug("Router model response: {}", response);
            Optional<RoutingProposal> proposal = parseProposal(response);
            if (proposal.isEmpty()) {
                log.warn("Router model returned an invalid intent, keeping rule decision {}",
                        ruleDecision.intent().label());
            }
            return proposal;
        } catch (RuntimeException e) {
            log.warn("Router model failed, keeping rule decision {}: {}",
                    ruleDecision.intent().label(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parses the model's JSON reply; anything but a known intent label yields empty.
     */
    Optional<RoutingProposal> parseProposal(String jsonResponse) {
        if (jsonResponse == null || jsonResponse.isBlank()) {
            return Optional.empty();
        }
        // Models sometimes wrap JSON in markdown code fences
        String cleanJson = jsonResponse
                .replaceAll("```json\\s*", "")
                .replaceAll("```\\s*", "")
                .trim();
        try {
            JsonNode node = objectMapper.readTree(cleanJson);
            JsonNode intentNode = node.get("intent");
            if (intentNode == null || !intentNode.isTextual()) {
                return Optional.empty();
            }
            String reasoning = node.hasNonNull("reasoning") ? node.get("reasoning").asText() : "";
            return Intent.fromLabel(intentNode.asText())
                    .map(intent -> new RoutingProposal(intent, reasoning));
        } catch (JsonProcessingException e) {
            log.debug("Router model reply is not JSON: {}", cleanJson);
            return Optional.empty();
        }
    }

    record RoutingProposal(Intent intent, String reasoning) {
    }
}
