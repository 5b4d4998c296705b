package com.smurthy.ai.derma.agents;

import com.smurthy.ai.derma.retrieval.Constraint;
import com.smurthy.ai.derma.retrieval.EvidenceItem;
import com.smurthy.ai.derma.retrieval.RetrievalSourceAdapter;
import com.smurthy.ai.derma.retrieval.SourceKind;
import com.smurthy.ai.derma.retrieval.SourceSchema;
import com.smurthy.ai.derma.retrieval.SourceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CatalogAgent.
 *
 * These tests verify:
 * - Constraints reach the catalog adapter unchanged when results are found
 * - The relaxation ladder (all constraints, most important attribute, none)
 * - An unavailable catalog yields a degraded bundle instead of an exception
 */
@ExtendWith(MockitoExtension.class)
class CatalogAgentTest {

    @Mock
    private RetrievalSourceAdapter adapter;

    private CatalogAgent agent;

    @BeforeEach
    void setUp() {
        agent = new CatalogAgent(adapter, SourceSchema.catalog(), 5, 1);
    }

    @Test
    @DisplayName("Should search once with all constraints when products match")
    void testSingleSearch() throws Exception {
        // Given
        List<Constraint> constraints = List.of(
                Constraint.atMost("price", 1200),
                Constraint.containsAny("skin_type", List.of("oily")));
        when(adapter.search(anyString(), anyList(), anyInt())).thenReturn(List.of(product("p-800"), product("p-1100")));

        // When
        EvidenceBundle bundle = agent.handle("moisturizer for oily skin", constraints);

        // Then
        assertThat(bundle.agentName()).isEqualTo("catalog-lookup");
        assertThat(bundle.items()).extracting(EvidenceItem::sourceId).containsExactly("p-800", "p-1100");
        assertThat(bundle.degraded()).isFalse();
        assertThat(bundle.appliedConstraints()).isEqualTo(constraints);
        verify(adapter, times(1)).search("moisturizer for oily skin", constraints, 5);
    }

    @Test
    @DisplayName("Should pass a brand extracted from the query through to the catalog search")
    void testBrandReachesAdapter() throws Exception {
        // Given
        List<Constraint> constraints = new ConstraintExtractor().extract("Minimalist brand products under 800");
        when(adapter.search(anyString(), anyList(), anyInt())).thenReturn(List.of(product("p-599")));

        // When
        EvidenceBundle bundle = agent.handle("Minimalist brand products under 800", constraints);

        // Then
        assertThat(bundle.appliedConstraints()).contains(
                Constraint.equalTo("brand", "minimalist"),
                Constraint.atMost("price", 800));
        verify(adapter).search("Minimalist brand products under 800", constraints, 5);
    }

    @Test
    @DisplayName("Should relax to the price constraints, keeping a price range intact")
    void testRelaxToPrice() throws Exception {
        // Given
        List<Constraint> constraints = List.of(
                Constraint.containsAny("skin_type", List.of("sensitive")),
                Constraint.atLeast("price", 500),
                Constraint.atMost("price", 1500),
                Constraint.oneOf("category", List.of("serum")));
        when(adapter.search(anyString(), anyList(), anyInt()))
                .thenReturn(List.of())
                .thenReturn(List.of(product("p-700")));

        // When
        EvidenceBundle bundle = agent.handle("gentle serum", constraints);

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Constraint>> captor = ArgumentCaptor.forClass(List.class);
        verify(adapter, times(2)).search(eq("gentle serum"), captor.capture(), eq(5));
        assertThat(captor.getAllValues().get(1)).containsExactly(
                Constraint.atLeast("price", 500),
                Constraint.atMost("price", 1500));
        assertThat(bundle.items()).hasSize(1);
        assertThat(bundle.appliedConstraints()).isEqualTo(captor.getAllValues().get(1));
    }

    @Test
    @DisplayName("Should end with an unconstrained search and make at most three calls")
    void testFullRelaxation() throws Exception {
        // Given
        when(adapter.search(anyString(), anyList(), anyInt())).thenReturn(List.of());

        // When
        EvidenceBundle bundle = agent.handle("toner", List.of(
                Constraint.oneOf("category", List.of("toner")),
                Constraint.containsAny("key_ingredients", List.of("glycolic acid"))));

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Constraint>> captor = ArgumentCaptor.forClass(List.class);
        verify(adapter, times(3)).search(eq("toner"), captor.capture(), eq(5));
        assertThat(captor.getAllValues().get(1)).containsExactly(Constraint.oneOf("category", List.of("toner")));
        assertThat(captor.getAllValues().get(2)).isEmpty();
        assertThat(bundle.isEmpty()).isTrue();
        assertThat(bundle.degraded()).isFalse();
    }

    @Test
    @DisplayName("Should skip a relaxation step identical to the previous one")
    void testSingleAttributeLadder() throws Exception {
        // Given
        when(adapter.search(anyString(), anyList(), anyInt())).thenReturn(List.of());

        // When
        agent.handle("cheap serum", List.of(Constraint.atMost("price", 300)));

        // Then
        verify(adapter, times(2)).search(anyString(), anyList(), anyInt());
    }

    @Test
    @DisplayName("Should leave constraints the catalog does not carry to other sources")
    void testConcernNotSentToCatalog() throws Exception {
        // Given
        when(adapter.search(anyString(), anyList(), anyInt())).thenReturn(List.of(product("p-1")));

        // When
        agent.handle("serum for acne", List.of(
                Constraint.containsAny("concern", List.of("acne")),
                Constraint.oneOf("category", List.of("serum"))));

        // Then
        verify(adapter).search("serum for acne", List.of(Constraint.oneOf("category", List.of("serum"))), 5);
    }

    @Test
    @DisplayName("Should return a degraded bundle when the catalog is unavailable")
    void testCatalogUnavailable() throws Exception {
        // Given
        when(adapter.search(anyString(), anyList(), anyInt()))
                .thenThrow(new SourceUnavailableException(SourceKind.CATALOG, "connection refused"));

        // When
        EvidenceBundle bundle = agent.handle("moisturizer", List.of(Constraint.atMost("price", 1200)));

        // Then
        assertThat(bundle.degraded()).isTrue();
        assertThat(bundle.isEmpty()).isTrue();
        assertThat(bundle.fallbackTriggered()).isFalse();
    }

    static EvidenceItem product(String id) {
        return new EvidenceItem(id, SourceKind.CATALOG, 0.9, "Product: " + id, Map.of("product_id", id, "name", "Product " + id));
    }
}
