package com.neorag.service;

import com.neorag.config.JacksonConfiguration;
import com.neorag.config.NeoragProperties;
import com.neorag.exception.GenerationException;
import com.neorag.model.QueryResult;
import com.neorag.model.SourceInfo;
import com.neorag.repository.InMemorySemanticCacheStore;
import com.neorag.service.cache.MutableClock;
import com.neorag.service.cache.SemanticCache;
import com.neorag.service.embedding.EmbeddingService;
import com.neorag.service.retrieval.HybridRetriever;
import com.neorag.service.workflow.QueryWorkflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for QueryService: cache consulted first, workflow only on a miss.
 */
class QueryServiceTest {

    private static final float[] ML_EMBEDDING = {0.5f, 0.5f, 0.5f, 0.5f};

    private NeoragProperties properties;
    private SemanticCache semanticCache;
    private EmbeddingService embeddingService;
    private QueryWorkflow workflow;
    private QueryService queryService;

    @BeforeEach
    void setUp() {
        properties = new NeoragProperties();
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        semanticCache = new SemanticCache(new InMemorySemanticCacheStore(clock), properties.getCache(),
                JacksonConfiguration.createObjectMapper(), clock);
        embeddingService = mock(EmbeddingService.class);
        workflow = mock(QueryWorkflow.class);
        queryService = new QueryService(semanticCache, embeddingService, workflow,
                mock(HybridRetriever.class), properties);

        when(embeddingService.embed(anyString())).thenReturn(ML_EMBEDDING);
        when(workflow.run(anyString(), any(float[].class), anyInt())).thenAnswer(invocation -> QueryResult.builder()
                .question(invocation.getArgument(0))
                .answer("Machine learning lets computers learn from data.")
                .sources(List.of(SourceInfo.builder().text("ML text").score(0.9).docTitle("ML Basics").build()))
                .searchType("vector")
                .processingSteps(List.of("Route: vector search", "Vector search: 1 results", "Answer generated"))
                .build());
    }

    @Test
    void testMissRunsWorkflowAndCachesAnswer() {
        QueryResult first = queryService.answer("What is machine learning?", null);

        assertThat(first.isCached()).isFalse();
        assertThat(semanticCache.stats().getCacheSize()).isEqualTo(1);
        verify(workflow).run(eq("What is machine learning?"), eq(ML_EMBEDDING), eq(3));
    }

    @Test
    void testNearDuplicateServedFromCache() {
        queryService.answer("What is machine learning?", null);

        QueryResult second = queryService.answer("What's ML?", 5);

        assertThat(second.isCached()).isTrue();
        assertThat(second.getQuestion()).isEqualTo("What's ML?");
        assertThat(second.getOriginalQuery()).isEqualTo("What is machine learning?");
        assertThat(second.getCacheSimilarity()).isGreaterThanOrEqualTo(0.95);
        assertThat(second.getProcessingSteps()).endsWith("Retrieved from cache");
        assertThat(second.getSearchType()).isEqualTo("vector");
        verify(workflow, times(1)).run(anyString(), any(float[].class), anyInt());
    }

    @Test
    void testFailedGenerationIsNotCached() {
        when(workflow.run(anyString(), any(float[].class), anyInt()))
                .thenThrow(new GenerationException("model down", null));

        assertThatThrownBy(() -> queryService.answer("What is ML?", null)).isInstanceOf(GenerationException.class);
        assertThat(semanticCache.stats().getTotalCached()).isZero();
        assertThat(semanticCache.stats().getCacheSize()).isZero();
    }

    @Test
    void testDisabledCacheIsBypassed() {
        properties.getCache().setEnabled(false);

        queryService.answer("What is ML?", null);
        queryService.answer("What is ML?", null);

        verify(workflow, times(2)).run(anyString(), any(float[].class), anyInt());
        assertThat(semanticCache.stats().getTotalRequests()).isZero();
        assertThat(semanticCache.stats().getCacheSize()).isZero();
    }

    @Test
    void testRejectsInvalidInput() {
        assertThatThrownBy(() -> queryService.answer("  ", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.answer("What is ML?", 11)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.answer("What is ML?", 0)).isInstanceOf(IllegalArgumentException.class);
        verify(embeddingService, never()).embed(anyString());
    }

    @Test
    void testBatchAnswersInOrder() {
        StepVerifier.create(queryService.batch(List.of("What is ML?", "What is ML?"), 2))
                .assertNext(response -> {
                    assertThat(response.getTotal()).isEqualTo(2);
                    assertThat(response.getResults()).extracting(QueryResult::isCached).containsExactly(false, true);
                })
                .verifyComplete();
    }

    @Test
    void testBatchSizeLimits() {
        StepVerifier.create(queryService.batch(List.of(), null))
                .expectError(IllegalArgumentException.class)
                .verify();
        StepVerifier.create(queryService.batch(List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10", "11"), null))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void testSimilarValidatesK() {
        StepVerifier.create(queryService.similar("text", 21))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void testQueryRunsReactively() {
        StepVerifier.create(queryService.query("What is ML?", null))
                .assertNext(result -> assertThat(result.getAnswer()).startsWith("Machine learning"))
                .verifyComplete();
    }
}
