package com.smurthy.ai.derma.config;

import com.smurthy.ai.derma.agents.CatalogAgent;
import com.smurthy.ai.derma.agents.DocumentAgent;
import com.smurthy.ai.derma.agents.GeneralKnowledgeAgent;
import com.smurthy.ai.derma.retrieval.SourceSchema;
import com.smurthy.ai.derma.retrieval.VectorStoreSourceAdapter;
import com.smurthy.ai.derma.retrieval.WebSearchSourceAdapter;
import com.smurthy.ai.derma.service.GoogleNewsSearchClient;
import com.smurthy.ai.derma.service.SerpApiSearchClient;
import com.smurthy.ai.derma.service.WebSearchClient;
import com.smurthy.ai.derma.thread.MdcAwareTimeoutExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.pgvector.PgVectorStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Retrieval sources and the specialist agents on top of them.
 *
 * Products and blog articles live in two pgvector tables of the same database, each behind its
 * own {@link PgVectorStore}. Each source runs on its own worker pool, so a backend that hangs
 * can exhaust only its own threads and the other sources keep answering.
 */
@Configuration
public class RetrievalConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RetrievalConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    public MdcAwareTimeoutExecutor catalogExecutor(RetrievalProperties properties) {
        log.info("Starting catalog worker pool with {} threads", properties.workerThreads());
        return MdcAwareTimeoutExecutor.dedicated("catalog", properties.workerThreads());
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareTimeoutExecutor documentExecutor(RetrievalProperties properties) {
        log.info("Starting document worker pool with {} threads", properties.workerThreads());
        return MdcAwareTimeoutExecutor.dedicated("document", properties.workerThreads());
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareTimeoutExecutor webSearchExecutor(RetrievalProperties properties) {
        log.info("Starting web search worker pool with {} threads", properties.workerThreads());
        return MdcAwareTimeoutExecutor.dedicated("web", properties.workerThreads());
    }

    @Bean
    public PgVectorStore catalogVectorStore(DataSource dataSource, EmbeddingModel embeddingModel,
                                            RetrievalProperties properties) {
        return PgVectorStore.builder(queryTimeoutTemplate(dataSource, properties.timeout()), embeddingModel)
                .vectorTableName(properties.catalogTable())
                .dimensions(properties.embeddingDimensions())
                .initializeSchema(true)
                .build();
    }

    @Bean
    public PgVectorStore documentVectorStore(DataSource dataSource, EmbeddingModel embeddingModel,
                                             RetrievalProperties properties) {
        return PgVectorStore.builder(queryTimeoutTemplate(dataSource, properties.timeout()), embeddingModel)
                .vectorTableName(properties.documentTable())
                .dimensions(properties.embeddingDimensions())
                .initializeSchema(true)
                .build();
    }

    /**
     * JDBC statements time out on the database side, whole seconds rounded up, so a slow query
     * frees its worker thread shortly after the caller gave up on it.
     */
    static JdbcTemplate queryTimeoutTemplate(DataSource dataSource, Duration timeout) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) Math.max(1, (timeout.toMillis() + 999) / 1000));
        return jdbcTemplate;
    }

    @Bean
    public WebSearchClient webSearchClient(WebSearchProperties properties, RetrievalProperties retrievalProperties) {
        WebSearchClient client = "serpapi".equalsIgnoreCase(properties.provider())
                ? new SerpApiSearchClient(properties.apiKey(), retrievalProperties.timeout())
                : new GoogleNewsSearchClient(retrievalProperties.timeout());
        log.info("Web search provider: {}", client.providerName());
        return client;
    }

    @Bean
    public CatalogAgent catalogAgent(@Qualifier("catalogVectorStore") PgVectorStore catalogVectorStore,
                                     @Qualifier("catalogExecutor") MdcAwareTimeoutExecutor catalogExecutor,
                                     RetrievalProperties properties) {
        SourceSchema schema = SourceSchema.catalog();
        VectorStoreSourceAdapter adapter = new VectorStoreSourceAdapter(
                catalogVectorStore, schema, catalogExecutor, properties.timeout(),
                properties.overfetchFactor(), properties.similarityThreshold(), properties.serverSideFiltering());
        return new CatalogAgent(adapter, schema, properties.catalogTopK(), properties.minCatalogResults());
    }

    @Bean
    public DocumentAgent documentAgent(@Qualifier("documentVectorStore") PgVectorStore documentVectorStore,
                                       @Qualifier("documentExecutor") MdcAwareTimeoutExecutor documentExecutor,
                                       RetrievalProperties properties) {
        VectorStoreSourceAdapter adapter = new VectorStoreSourceAdapter(
                documentVectorStore, SourceSchema.documents(), documentExecutor, properties.timeout(),
                properties.overfetchFactor(), properties.similarityThreshold(), properties.serverSideFiltering());
        return new DocumentAgent(adapter, properties.documentTopK(), properties.documentChunkOverfetch());
    }

    @Bean
    public GeneralKnowledgeAgent generalKnowledgeAgent(WebSearchClient webSearchClient,
                                                       @Qualifier("webSearchExecutor") MdcAwareTimeoutExecutor webSearchExecutor,
                                                       RetrievalProperties retrievalProperties,
                                                       WebSearchProperties webSearchProperties) {
        WebSearchSourceAdapter adapter = new WebSearchSourceAdapter(
                webSearchClient, webSearchExecutor, retrievalProperties.timeout(), webSearchProperties.querySuffix());
        return new GeneralKnowledgeAgent(adapter, retrievalProperties.webTopK());
    }
}
