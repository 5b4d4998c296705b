package com.smurthy.ai.derma.orchestration;

import com.smurthy.ai.derma.agents.ConstraintExtractor;
import com.smurthy.ai.derma.agents.EvidenceBundle;
import com.smurthy.ai.derma.agents.Intent;
import com.smurthy.ai.derma.agents.ResponseSynthesizer;
import com.smurthy.ai.derma.agents.RuleBasedIntentClassifier;
import com.smurthy.ai.derma.agents.SpecialistAgent;
import com.smurthy.ai.derma.history.ConversationContext;
import com.smurthy.ai.derma.history.InMemoryConversationStore;
import com.smurthy.ai.derma.history.Turn;
import com.smurthy.ai.derma.observability.RoutingMetrics;
import com.smurthy.ai.derma.retrieval.Constraint;
import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.retrieval.SourceKind;
import com.smurthy.ai.derma.service.GenerationClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SkincareOrchestrator.
 *
 * The classifier, synthesizer and history store are real; specialists are scripted and the
 * model behind the synthesizer is mocked.
 *
 * These tests verify:
 * - Routing of catalog, document and general-knowledge queries end to end
 * - The single fallback hop when a primary source is down
 * - Failed turns leave history untouched and report a reason
 * - Cancellation and concurrent-turn conflicts
 */
@ExtendWith(MockitoExtension.class)
class SkincareOrchestratorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:30:00Z");

    @Mock
    private GenerationClient generationClient;

    private InMemoryConversationStore store;
    private RoutingMetrics metrics;
    private ScriptedAgent catalog;
    private ScriptedAgent documents;
    private ScriptedAgent web;
    private SkincareOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore();
        metrics = new RoutingMetrics();
        catalog = new ScriptedAgent(Intent.CATALOG_LOOKUP,
                (query, constraints) -> EvidenceBundle.of("catalog-lookup", List.of(
                        item("p-1", SourceKind.CATALOG, "Oil-Free Gel"),
                        item("p-2", SourceKind.CATALOG, "Matte Moisturizer")), constraints));
        documents = new ScriptedAgent(Intent.DOCUMENT_LOOKUP,
                (query, constraints) -> EvidenceBundle.of("document-lookup", List.of(
                        item("a-7#0", SourceKind.DOCUMENT, "Acne Routine Basics")), List.of()));
        web = new ScriptedAgent(Intent.GENERAL_KNOWLEDGE,
                (query, constraints) -> EvidenceBundle.of("general-knowledge", List.of(
                        item("https://example.org/news", SourceKind.WEB, "Sunscreen news")), List.of()));
        orchestrator = new SkincareOrchestrator(
                new RuleBasedIntentClassifier(new ConstraintExtractor()),
                List.of(catalog, documents, web),
                new ResponseSynthesizer(generationClient),
                store,
                metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(generationClient.generate(anyString(), anyList())).thenReturn("Here you go [1].");
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Should answer a product query from the catalog with the extracted constraints")
    void testCatalogTurn() {
        // When
        TurnResult result = orchestrator.process(ConversationContext.newSession("s-1"),
                "moisturizer for oily skin under ₹1200");

        // Then
        assertThat(result.agentUsed()).isEqualTo("catalog-lookup");
        assertThat(result.dispatches()).containsExactly("catalog-lookup");
        assertThat(result.states()).containsExactly(TurnState.RECEIVED, TurnState.CLASSIFIED, TurnState.DISPATCHED,
                TurnState.EVIDENCE_COLLECTED, TurnState.SYNTHESIZED, TurnState.COMPLETED);
        assertThat(catalog.lastConstraints).contains(
                Constraint.atMost("price", 1200),
                Constraint.containsAny("skin_type", List.of("oily")));
        assertThat(result.citations()).extracting(c -> c.sourceId()).containsExactly("p-1");
        assertThat(result.degraded()).isFalse();

        List<Turn> history = store.read("s-1");
        assertThat(history).hasSize(1);
        assertThat(history.get(0).intent()).isEqualTo(Intent.CATALOG_LOOKUP);
        assertThat(history.get(0).timestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should answer an educational question from the articles")
    void testDocumentTurn() {
        // When
        TurnResult result = orchestrator.process(ConversationContext.newSession("s-2"),
                "How to build a routine for acne-prone skin");

        // Then
        assertThat(result.agentUsed()).isEqualTo("document-lookup");
        assertThat(catalog.calls).isZero();
        assertThat(web.calls).isZero();
    }

    @Test
    @DisplayName("Should fall back to web search once when the catalog is down")
    void testFallbackWhenCatalogDown() {
        // Given
        catalog.behaviour = (query, constraints) -> EvidenceBundle.degraded("catalog-lookup", List.of(), constraints);

        // When
        TurnResult result = orchestrator.process(ConversationContext.newSession("s-3"),
                "best sunscreen under 800");

        // Then
        assertThat(result.dispatches()).containsExactly("catalog-lookup", "general-knowledge");
        assertThat(result.agentUsed()).isEqualTo("general-knowledge (fallback)");
        assertThat(result.degraded()).isTrue();
        assertThat(result.fallbackTriggered()).isTrue();
        assertThat(result.citations()).extracting(c -> c.sourceKind()).containsExactly(SourceKind.WEB);
        assertThat(metrics.getMetricsSummary().fallbacks()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should stop after one fallback and answer without evidence when every source is down")
    void testFallbackBound() {
        // Given
        catalog.behaviour = (query, constraints) -> EvidenceBundle.degraded("catalog-lookup", List.of(), constraints);
        web.behaviour = (query, constraints) -> EvidenceBundle.degraded("general-knowledge", List.of(), List.of());

        // When
        TurnResult result = orchestrator.process(ConversationContext.newSession("s-4"), "buy a serum");

        // Then
        assertThat(result.dispatches()).hasSize(2);
        assertThat(result.answer()).isEqualTo(ResponseSynthesizer.NO_EVIDENCE_ANSWER);
        assertThat(result.citations()).isEmpty();
        verifyNoInteractions(generationClient);
    }

    @Test
    @DisplayName("Should not fall back from a degraded general-knowledge dispatch")
    void testNoFallbackFromGeneral() {
        // Given
        web.behaviour = (query, constraints) -> EvidenceBundle.degraded("general-knowledge", List.of(), List.of());

        // When
        TurnResult result = orchestrator.process(ConversationContext.newSession("s-5"),
                "latest sunscreen research 2025");

        // Then
        assertThat(result.dispatches()).containsExactly("general-knowledge");
        assertThat(result.fallbackTriggered()).isFalse();
    }

    @Test
    @DisplayName("Should not fall back when a degraded source still returned evidence")
    void testPartialEvidenceKept() {
        // Given
        catalog.behaviour = (query, constraints) -> EvidenceBundle.degraded("catalog-lookup",
                List.of(item("p-9", SourceKind.CATALOG, "Sun Fluid")), constraints);

        // When
        TurnResult result = orchestrator.process(ConversationContext.newSession("s-6"), "buy sunscreen");

        // Then
        assertThat(result.dispatches()).containsExactly("catalog-lookup");
        assertThat(result.degraded()).isTrue();
    }

    @Test
    @DisplayName("Should fail the turn without touching history when synthesis fails")
    void testSynthesisFailure() {
        // Given
        when(generationClient.generate(anyString(), anyList())).thenThrow(new IllegalStateException("model down"));

        // When / Then
        assertThatThrownBy(() -> orchestrator.process(ConversationContext.newSession("s-7"), "buy a serum"))
                .isInstanceOf(TurnFailedException.class)
                .extracting(e -> ((TurnFailedException) e).getReason())
                .isEqualTo(FailureReason.SYNTHESIS_FAILED);
        assertThat(store.read("s-7")).isEmpty();
        assertThat(metrics.getMetricsSummary().failuresByReason()).containsEntry("SYNTHESIS_FAILED", 1L);
    }

    @Test
    @DisplayName("Should report a dispatch failure when a specialist throws")
    void testDispatchFailure() {
        // Given
        documents.behaviour = (query, constraints) -> {
            throw new IllegalStateException("bug");
        };

        // When / Then
        assertThatThrownBy(() -> orchestrator.process(ConversationContext.newSession("s-8"), "explain retinol"))
                .isInstanceOf(TurnFailedException.class)
                .extracting(e -> ((TurnFailedException) e).getReason())
                .isEqualTo(FailureReason.DISPATCH_FAILED);
        assertThat(store.read("s-8")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a turn whose history position was taken by a concurrent turn")
    void testConcurrentTurnConflict() {
        // Given
        ConversationContext stale = ConversationContext.newSession("s-9");
        orchestrator.process(stale, "buy a serum");

        // When / Then
        assertThatThrownBy(() -> orchestrator.process(stale, "buy a toner"))
                .isInstanceOf(TurnFailedException.class)
                .extracting(e -> ((TurnFailedException) e).getReason())
                .isEqualTo(FailureReason.PERSISTENCE_FAILED);
        assertThat(store.read("s-9")).hasSize(1);
    }

    @Test
    @DisplayName("Should end a cancelled turn in CANCELLED before any dispatch")
    void testCancelledTurn() {
        // Given
        Thread.currentThread().interrupt();

        // When / Then
        assertThatThrownBy(() -> orchestrator.process(ConversationContext.newSession("s-10"), "buy a serum"))
                .isInstanceOf(TurnFailedException.class)
                .extracting(e -> ((TurnFailedException) e).getReason())
                .isEqualTo(FailureReason.CANCELLED);
        assertThat(catalog.calls).isZero();
        assertThat(store.read("s-10")).isEmpty();
    }

    @Test
    @DisplayName("Should carry a follow-up's inherited intent and constraints into the next turn")
    void testFollowUpTurn() {
        // Given
        orchestrator.process(ConversationContext.newSession("s-11"), "moisturizer under 1200");
        ConversationContext next = store.open("s-11", 6);

        // When
        TurnResult result = orchestrator.process(next, "what about for dry skin");

        // Then
        assertThat(result.agentUsed()).isEqualTo("catalog-lookup");
        assertThat(catalog.lastConstraints).contains(
                Constraint.atMost("price", 1200),
                Constraint.containsAny("skin_type", List.of("dry")));
        assertThat(store.read("s-11")).hasSize(2);
    }

    @Test
    @DisplayName("Should reject blank queries and incomplete agent wiring")
    void testInvalidInput() {
        assertThatThrownBy(() -> orchestrator.process(ConversationContext.newSession("s-12"), "   "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SkincareOrchestrator(
                new RuleBasedIntentClassifier(new ConstraintExtractor()),
                List.of(catalog, documents),
                new ResponseSynthesizer(generationClient),
                store, metrics, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("general-knowledge");
    }

    @Test
    @DisplayName("Should report every specialist as active")
    void testHealthCheck() {
        // When
        Map<String, Object> health = orchestrator.healthCheck();

        // Then
        assertThat(health).containsEntry("status", "healthy");
        assertThat(health.get("agents")).isEqualTo(Map.of(
                "catalog-lookup", "active",
                "document-lookup", "active",
                "general-knowledge", "active"));
    }

    private static EvidenceItem item(String id, SourceKind kind, String title) {
        return new EvidenceItem(id, kind, 0.9, title, Map.of("title", title));
    }

    private static final class ScriptedAgent implements SpecialistAgent {

        private final Intent intent;
        private BiFunction<String, List<Constraint>, EvidenceBundle> behaviour;
        private List<Constraint> lastConstraints = new ArrayList<>();
        private int calls;

        ScriptedAgent(Intent intent, BiFunction<String, List<Constraint>, EvidenceBundle> behaviour) {
            this.intent = intent;
            this.behaviour = behaviour;
        }

        @Override
        public Intent intent() {
            return intent;
        }

        @Override
        public EvidenceBundle handle(String query, List<Constraint> constraints) {
            calls++;
            lastConstraints = constraints;
            return behaviour.apply(query, constraints);
        }
    }
}
