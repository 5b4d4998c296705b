package com.smurthy.ai.derma.retrieval;

import com.smurthy.ai.derma.service.WebSearchClient;
import com.smurthy.ai.derma.service.WebSearchResult;
import com.smurthy.ai.derma.thread.MdcAwareTimeoutExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.LockSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A backend stuck in a call that ignores interrupts keeps its worker thread after the timeout.
 * These tests check that with one pool per source the stuck backend only starves itself.
 */
class SourcePoolIsolationTest {

    private final AtomicBoolean released = new AtomicBoolean();
    private final MdcAwareTimeoutExecutor catalogExecutor = MdcAwareTimeoutExecutor.dedicated("catalog", 1);
    private final MdcAwareTimeoutExecutor webExecutor = MdcAwareTimeoutExecutor.dedicated("web", 1);

    @AfterEach
    void tearDown() {
        released.set(true);
        catalogExecutor.shutdown();
        webExecutor.shutdown();
    }

    @Test
    @DisplayName("Should keep web search answering while the catalog store hangs")
    void testHungCatalogDoesNotStarveWeb() throws Exception {
        // Given
        VectorStore hungStore = mock(VectorStore.class);
        when(hungStore.similaritySearch(any(SearchRequest.class))).thenAnswer(invocation -> {
            while (!released.get()) {
                LockSupport.parkNanos(10_000_000L);
            }
            return List.of();
        });
        VectorStoreSourceAdapter catalog = new VectorStoreSourceAdapter(
                hungStore, SourceSchema.catalog(), catalogExecutor, Duration.ofMillis(100), 4, 0.0, true);

        WebSearchClient webClient = mock(WebSearchClient.class);
        when(webClient.search(anyString(), anyInt())).thenReturn(List.of(
                new WebSearchResult("Sunscreen basics", "Reapply every two hours", "https://example.org/spf")));
        WebSearchSourceAdapter web = new WebSearchSourceAdapter(webClient, webExecutor, Duration.ofSeconds(2), "");

        // When the catalog call times out but keeps its only thread
        assertThatThrownBy(() -> catalog.search("serum", List.of(), 3))
                .isInstanceOf(SourceUnavailableException.class);
        assertThatThrownBy(() -> catalog.search("serum", List.of(), 3))
                .isInstanceOf(SourceUnavailableException.class);

        // Then
        List<EvidenceItem> items = web.search("how often to reapply sunscreen", List.of(), 3);
        assertThat(items).extracting(EvidenceItem::sourceId).containsExactly("https://example.org/spf");
    }
}
