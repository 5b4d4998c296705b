package com.smurthy.ai.derma.orchestration;

import com.smurthy.ai.derma.agents.EvidenceBundle;
import com.smurthy.ai.derma.agents.Intent;
import com.smurthy.ai.derma.agents.IntentClassifier;
import com.smurthy.ai.derma.agents.QueryIntent;
import com.smurthy.ai.derma.agents.ResponseSynthesizer;
import com.smurthy.ai.derma.agents.SpecialistAgent;
import com.smurthy.ai.derma.agents.SynthesisResult;
import com.smurthy.ai.derma.history.ConversationContext;
import com.smurthy.ai.derma.history.ConversationStore;
import com.smurthy.ai.derma.history.Turn;
import com.smurthy.ai.derma.observability.RoutingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Skincare Orchestrator
 *
 * Runs one turn through the pipeline:
 *
 * RECEIVED → CLASSIFIED → DISPATCHED → EVIDENCE_COLLECTED → SYNTHESIZED → COMPLETED
 *
 * 1. Classify the query against the recent history
 * 2. Dispatch the specialist for the intent
 * 3. If that specialist's source failed and it found nothing, dispatch general-knowledge once
 * 4. Synthesize the answer with citations
 * 5. Append the turn to history
 *
 * Any failure ends the turn in FAILED with a {@link TurnFailedException}; a failed turn is never
 * appended. The session id and history come in with every call; the orchestrator keeps no
 * session state.
 */
public class SkincareOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SkincareOrchestrator.class);

    public static final String MDC_SESSION_ID = "sessionId";

    private final IntentClassifier classifier;
    private final Map<Intent, SpecialistAgent> agents;
    private final ResponseSynthesizer synthesizer;
    private final ConversationStore conversationStore;
    private final RoutingMetrics metrics;
    private final Clock clock;

    public SkincareOrchestrator(IntentClassifier classifier,
                                List<SpecialistAgent> specialists,
                                ResponseSynthesizer synthesizer,
                                ConversationStore conversationStore,
                                RoutingMetrics metrics,
                                Clock clock) {
        this.classifier = classifier;
        this.synthesizer = synthesizer;
        this.conversationStore = conversationStore;
        this.metrics = metrics;
        this.clock = clock;
        this.agents = new EnumMap<>(Intent.class);
        for (SpecialistAgent agent : specialists) {
            if (agents.put(agent.intent(), agent) != null) {
                throw new IllegalArgumentException("Two specialists registered for " + agent.intent().label());
            }
        }
        for (Intent intent : Intent.values()) {
            if (!agents.containsKey(intent)) {
                throw new IllegalArgumentException("No specialist registered for " + intent.label());
            }
        }

        log.info("SkincareOrchestrator initialized with agents {}", agents.keySet());
    }

    /**
     * Runs one turn and appends it to the session history.
     *
     * @throws IllegalArgumentException when the query is blank
     * @throws TurnFailedException      when any stage fails; history is left untouched
     */
    public TurnResult process(ConversationContext context, String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }
        String trimmed = query.trim();

        MDC.put(MDC_SESSION_ID, context.sessionId());
        TurnTrace trace = new TurnTrace();
        try {
            TurnResult result = runTurn(context, trimmed, trace);
            log.info("Turn completed: agent={} degraded={} citations={} trace={}",
                    result.agentUsed(), result.degraded(), result.citations().size(), trace);
            return result;
        } catch (TurnFailedException e) {
            if (!trace.current().isTerminal()) {
                trace.transition(TurnState.FAILED);
            }
            metrics.recordFailure(e.getReason());
            log.error("Turn failed with {} after {}", e.getReason(), trace, e);
            throw e;
        } finally {
            MDC.remove(MDC_SESSION_ID);
        }
    }

    private TurnResult runTurn(ConversationContext context, String query, TurnTrace trace) {
        // 1. Classify
        checkCancelled("before classification");
        QueryIntent queryIntent;
        try {
            queryIntent = classifier.classify(query, context.recentTurns());
        } catch (RuntimeException e) {
            throw new TurnFailedException(FailureReason.CLASSIFICATION_FAILED, e.getMessage(), e);
        }
        trace.transition(TurnState.CLASSIFIED);

        // 2. Dispatch primary specialist
        EvidenceBundle bundle = dispatch(agents.get(queryIntent.intent()), query, queryIntent, trace);

        // 3. One fallback hop
        if (bundle.degraded() && bundle.isEmpty() && queryIntent.intent() != Intent.GENERAL_KNOWLEDGE) {
            log.warn("{} source unavailable with no evidence, falling back to {}",
                    bundle.agentName(), Intent.GENERAL_KNOWLEDGE.label());
            EvidenceBundle fallback = dispatch(agents.get(Intent.GENERAL_KNOWLEDGE), query, queryIntent, trace);
            bundle = EvidenceBundle.withFallback(bundle, fallback);
        }
        trace.transition(TurnState.EVIDENCE_COLLECTED);

        // 4. Synthesize
        checkCancelled("before synthesis");
        SynthesisResult synthesis;
        try {
            synthesis = synthesizer.synthesize(query, bundle);
        } catch (RuntimeException e) {
            checkCancelled("during synthesis");
            throw new TurnFailedException(FailureReason.SYNTHESIS_FAILED, e.getMessage(), e);
        }
        trace.transition(TurnState.SYNTHESIZED);

        // 5. Persist
        checkCancelled("before history append");
        Turn turn = new Turn(
                query,
                queryIntent.intent(),
                queryIntent.constraints(),
                bundle,
                synthesis.answer(),
                synthesis.citations(),
                bundle.agentName(),
                clock.instant()
        );
        try {
            conversationStore.append(context.sessionId(), context.nextSequence(), turn);
        } catch (RuntimeException e) {
            throw new TurnFailedException(FailureReason.PERSISTENCE_FAILED, e.getMessage(), e);
        }
        trace.transition(TurnState.COMPLETED);

        metrics.recordCompletedTurn(queryIntent.intent(), bundle.degraded(), bundle.fallbackTriggered(),
                synthesis.grounded(), trace.elapsedMillis());
        return new TurnResult(context.sessionId(), turn, trace.states(), trace.dispatches());
    }

    private EvidenceBundle dispatch(SpecialistAgent agent, String query, QueryIntent queryIntent, TurnTrace trace) {
        checkCancelled("before dispatching " + agent.name());
        trace.dispatched(agent.name());
        EvidenceBundle bundle;
        try {
            bundle = agent.handle(query, queryIntent.constraints());
        } catch (RuntimeException e) {
            throw new TurnFailedException(FailureReason.DISPATCH_FAILED,
                    agent.name() + " failed: " + e.getMessage(), e);
        }
        checkCancelled("after " + agent.name());
        return bundle;
    }

    /**
     * Adapters restore the interrupt flag when a blocking call is interrupted, so a cancelled turn
     * is detected here between stages.
     */
    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new TurnFailedException(FailureReason.CANCELLED, "cancelled " + stage, null);
        }
    }

    /**
     * Status of every specialist and the history store.
     */
    public Map<String, Object> healthCheck() {
        Map<String, String> agentStatus = new LinkedHashMap<>();
        agents.forEach((intent, agent) -> agentStatus.put(agent.name(), "active"));

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "healthy");
        health.put("agents", agentStatus);
        health.put("historyStore", conversationStore.getClass().getSimpleName());
        return health;
    }
}
