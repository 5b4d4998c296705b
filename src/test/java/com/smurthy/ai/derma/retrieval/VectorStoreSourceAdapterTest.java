package com.smurthy.ai.derma.retrieval;

import com.smurthy.ai.derma.thread.MdcAwareTimeoutExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.SimpleVectorStore;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for VectorStoreSourceAdapter against an in-memory SimpleVectorStore.
 *
 * These tests verify:
 * - Similarity search combined with numeric and set-valued constraints
 * - Pushed-down and post-filtered constraints select the same records
 * - Over-fetching only when a post-filter is needed
 * - Deterministic ordering and the k bound
 * - Store failures and timeouts surface as SourceUnavailableException
 */
class VectorStoreSourceAdapterTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private ExecutorService executorService;
    private MdcAwareTimeoutExecutor executor;
    private SimpleVectorStore catalogStore;

    @BeforeEach
    void setUp() {
        executorService = Executors.newFixedThreadPool(2);
        executor = new MdcAwareTimeoutExecutor(executorService);

        catalogStore = SimpleVectorStore.builder(new TestEmbeddingModel()).build();
        catalogStore.add(List.of(
                product("p-800", "Oil-free gel moisturizer for oily skin with niacinamide", 800.0, "moisturizer", List.of("oily", "combination")),
                product("p-1500", "Mattifying moisturizer for oily skin", 1500.0, "moisturizer", List.of("oily")),
                product("p-1100", "Lightweight water moisturizer for oily and acne-prone skin", 1100.0, "moisturizer", List.of("oily", "acne-prone")),
                product("p-950", "Rich ceramide moisturizer for dry skin", 950.0, "moisturizer", List.of("dry"))
        ));
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    @DisplayName("Should return only products within budget for the requested skin type")
    void testPriceAndSkinTypeConstraints() throws Exception {
        // Given
        VectorStoreSourceAdapter adapter = catalogAdapter(catalogStore, true);
        List<Constraint> constraints = List.of(
                Constraint.atMost("price", 1200),
                Constraint.containsAny("skin_type", List.of("oily")));

        // When
        List<EvidenceItem> items = adapter.search("moisturizer for oily skin", constraints, 5);

        // Then
        assertThat(items).extracting(EvidenceItem::sourceId).containsExactlyInAnyOrder("p-800", "p-1100");
        assertThat(items).isSortedAccordingTo(EvidenceItem.RANKING);
        assertThat(items).allMatch(item -> item.sourceKind() == SourceKind.CATALOG);
        assertThat(items.get(0).contentExcerpt()).startsWith("Product: ");
    }

    @Test
    @DisplayName("Should select the same records whether constraints are pushed down or post-filtered")
    void testFilterEquivalence() throws Exception {
        // Given
        List<Constraint> constraints = List.of(
                Constraint.atLeast("price", 900),
                Constraint.atMost("price", 1600),
                Constraint.oneOf("category", List.of("moisturizer")),
                Constraint.containsAny("skin_type", List.of("oily")));

        // When
        List<EvidenceItem> pushedDown = catalogAdapter(catalogStore, true).search("oily skin moisturizer", constraints, 3);
        List<EvidenceItem> postFiltered = catalogAdapter(catalogStore, false).search("oily skin moisturizer", constraints, 3);

        // Then
        assertThat(pushedDown).extracting(EvidenceItem::sourceId)
                .containsExactlyElementsOf(postFiltered.stream().map(EvidenceItem::sourceId).collect(Collectors.toList()));
        assertThat(pushedDown).extracting(EvidenceItem::sourceId).containsExactlyInAnyOrder("p-1500", "p-1100");
    }

    @Test
    @DisplayName("Should match a brand regardless of the case it was stored with")
    void testBrandEquivalence() throws Exception {
        // Given
        List<Constraint> constraints = List.of(
                Constraint.equalTo("brand", "derma labs"),
                Constraint.atMost("price", 1200));

        // When
        List<EvidenceItem> pushedDown = catalogAdapter(catalogStore, true).search("moisturizer", constraints, 5);
        List<EvidenceItem> postFiltered = catalogAdapter(catalogStore, false).search("moisturizer", constraints, 5);

        // Then
        assertThat(pushedDown).isNotEmpty();
        assertThat(pushedDown).extracting(EvidenceItem::sourceId)
                .containsExactlyElementsOf(postFiltered.stream().map(EvidenceItem::sourceId).collect(Collectors.toList()));
        assertThat(pushedDown).allMatch(item -> "Derma Labs".equals(item.metadata().get("brand")));
    }

    @Test
    @DisplayName("Should never return more than k items")
    void testTopKBound() throws Exception {
        // When
        List<EvidenceItem> items = catalogAdapter(catalogStore, true).search("moisturizer", List.of(), 2);

        // Then
        assertThat(items).hasSize(2);
    }

    @Test
    @DisplayName("Should drop constraints on unknown attributes instead of failing")
    void testInvalidConstraintDropped() throws Exception {
        // Given
        List<Constraint> constraints = List.of(
                Constraint.equalTo("color", "blue"),
                Constraint.atMost("price", 1000));

        // When
        List<EvidenceItem> items = catalogAdapter(catalogStore, true).search("moisturizer", constraints, 5);

        // Then
        assertThat(items).extracting(EvidenceItem::sourceId).containsExactlyInAnyOrder("p-800", "p-950");
    }

    @Test
    @DisplayName("Should over-fetch only when a constraint must be post-filtered")
    void testOverfetchOnlyForPostFilter() throws Exception {
        // Given
        VectorStore vectorStore = mock(VectorStore.class);
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());
        VectorStoreSourceAdapter adapter = catalogAdapter(vectorStore, true);
        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);

        // When
        adapter.search("serum", List.of(Constraint.atMost("price", 1200)), 5);
        adapter.search("serum", List.of(Constraint.containsAny("skin_type", List.of("dry"))), 5);

        // Then
        verify(vectorStore, times(2)).similaritySearch(captor.capture());
        SearchRequest pushedOnly = captor.getAllValues().get(0);
        SearchRequest withPostFilter = captor.getAllValues().get(1);

        assertThat(pushedOnly.getTopK()).isEqualTo(5);
        assertThat(pushedOnly.hasFilterExpression()).isTrue();
        assertThat(withPostFilter.getTopK()).isEqualTo(20);
        assertThat(withPostFilter.hasFilterExpression()).isFalse();
    }

    @Test
    @DisplayName("Should break score ties by source id")
    void testDeterministicTieBreak() throws Exception {
        // Given
        VectorStore vectorStore = mock(VectorStore.class);
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                scored("p-b", 0.8), scored("p-c", 0.9), scored("p-a", 0.8)));

        // When
        List<EvidenceItem> items = catalogAdapter(vectorStore, true).search("toner", List.of(), 3);

        // Then
        assertThat(items).extracting(EvidenceItem::sourceId).containsExactly("p-c", "p-a", "p-b");
    }

    @Test
    @DisplayName("Should report an unreachable store as unavailable")
    void testStoreFailure() {
        // Given
        VectorStore vectorStore = mock(VectorStore.class);
        when(vectorStore.similaritySearch(any(SearchRequest.class)))
                .thenThrow(new IllegalStateException("connection refused"));

        // When / Then
        assertThatThrownBy(() -> catalogAdapter(vectorStore, true).search("serum", List.of(), 3))
                .isInstanceOf(SourceUnavailableException.class)
                .satisfies(e -> assertThat(((SourceUnavailableException) e).getSourceKind()).isEqualTo(SourceKind.CATALOG));
    }

    @Test
    @DisplayName("Should report a slow store as unavailable after the timeout")
    void testStoreTimeout() {
        // Given
        VectorStore vectorStore = mock(VectorStore.class);
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return List.of();
        });
        VectorStoreSourceAdapter adapter = new VectorStoreSourceAdapter(
                vectorStore, SourceSchema.catalog(), executor, Duration.ofMillis(100), 4, 0.0, true);

        // When / Then
        assertThatThrownBy(() -> adapter.search("serum", List.of(), 3))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @DisplayName("Should AND-combine pushed-down constraints into one filter expression")
    void testFilterExpression() {
        // When
        Filter.Expression expression = VectorStoreSourceAdapter.toFilterExpression(List.of(
                Constraint.atLeast("price", 500),
                Constraint.atMost("price", 1500),
                Constraint.oneOf("category", List.of("serum", "toner"))));

        // Then
        assertThat(expression.type()).isEqualTo(Filter.ExpressionType.AND);
    }

    private VectorStoreSourceAdapter catalogAdapter(VectorStore store, boolean serverSideFiltering) {
        return new VectorStoreSourceAdapter(store, SourceSchema.catalog(), executor, TIMEOUT, 4, 0.0, serverSideFiltering);
    }

    private static Document product(String id, String description, double price, String category, List<String> skinTypes) {
        return new Document(description, Map.of(
                "product_id", id,
                "name", description,
                "brand", "Derma Labs",
                "price", price,
                "category", category,
                "skin_type", skinTypes));
    }

    private static Document scored(String id, double score) {
        return Document.builder()
                .id(id)
                .text("Hydrating toner")
                .metadata(Map.of("product_id", id, "price", 500.0))
                .score(score)
                .build();
    }
}
