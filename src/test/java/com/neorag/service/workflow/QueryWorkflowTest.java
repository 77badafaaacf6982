package com.neorag.service.workflow;

import com.neorag.config.NeoragProperties;
import com.neorag.exception.GenerationException;
import com.neorag.model.ChunkResult;
import com.neorag.model.QueryResult;
import com.neorag.provider.LlmProvider;
import com.neorag.service.retrieval.HybridRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for QueryWorkflow.
 */
class QueryWorkflowTest {

    private static final float[] EMBEDDING = {0.1f, 0.2f};

    private HybridRetriever retriever;
    private LlmProvider llmProvider;
    private QueryWorkflow workflow;

    @BeforeEach
    void setUp() {
        NeoragProperties properties = new NeoragProperties();
        retriever = mock(HybridRetriever.class);
        llmProvider = mock(LlmProvider.class);
        workflow = new QueryWorkflow(new KeywordRouteClassifier(properties), retriever, llmProvider, properties);
    }

    @Test
    void testDefinitionalQuestionRunsVectorPath() {
        when(retriever.vectorSearch(EMBEDDING, 3)).thenReturn(List.of(
                ChunkResult.builder().chunkId("c1").text("ML is a subfield of AI.").score(0.9).build()));
        when(llmProvider.generate(anyString())).thenReturn(Mono.just("Machine learning is a subfield of AI."));

        QueryResult result = workflow.run("What is ML?", EMBEDDING, 3);

        assertEquals("vector", result.getSearchType());
        assertEquals("Machine learning is a subfield of AI.", result.getAnswer());
        assertEquals(List.of("Route: vector search", "Vector search: 1 results", "Answer generated"),
                result.getProcessingSteps());
        assertEquals(1, result.getSources().size());
        assertEquals("Unknown", result.getSources().get(0).getDocTitle());
        assertFalse(result.isCached());
        verify(retriever, never()).hybridSearch(any(float[].class), anyInt());
    }

    @Test
    void testOtherQuestionRunsHybridPath() {
        when(retriever.hybridSearch(EMBEDDING, 2)).thenReturn(List.of(
                ChunkResult.builder().chunkId("c1").text("a").enrichedText("[Main]: a").score(0.8).docTitle("Doc").build(),
                ChunkResult.builder().chunkId("c2").text("b").enrichedText("[Main]: b").score(0.7).docTitle("Doc").build()));
        when(llmProvider.generate(anyString())).thenReturn(Mono.just("answer"));

        QueryResult result = workflow.run("How do models learn?", EMBEDDING, 2);

        assertEquals("hybrid", result.getSearchType());
        assertEquals("Hybrid search: 2 results", result.getProcessingSteps().get(1));
        assertEquals("[Main]: a", result.getSources().get(0).getText());
    }

    @Test
    void testPromptListsNumberedSources() {
        when(retriever.hybridSearch(EMBEDDING, 3)).thenReturn(List.of(
                ChunkResult.builder().chunkId("c1").text("first").score(0.8).build(),
                ChunkResult.builder().chunkId("c2").text("second").score(0.7).build()));
        when(llmProvider.generate(anyString())).thenReturn(Mono.just("answer"));

        workflow.run("How do models learn?", EMBEDDING, 3);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(llmProvider).generate(prompt.capture());
        assertTrue(prompt.getValue().startsWith(QueryWorkflow.INSTRUCTION));
        assertTrue(prompt.getValue().contains("Source 1:\nfirst"));
        assertTrue(prompt.getValue().contains("Source 2:\nsecond"));
        assertTrue(prompt.getValue().endsWith("Question: How do models learn?\n\nAnswer:"));
    }

    @Test
    void testGenerationFailureSurfaces() {
        when(retriever.vectorSearch(eq(EMBEDDING), anyInt())).thenReturn(List.of());
        when(llmProvider.generate(anyString())).thenReturn(Mono.error(new IllegalStateException("model crashed")));

        assertThrows(GenerationException.class, () -> workflow.run("What is ML?", EMBEDDING, 3));
    }

    @Test
    void testEmptyGenerationFails() {
        when(retriever.vectorSearch(eq(EMBEDDING), anyInt())).thenReturn(List.of());
        when(llmProvider.generate(anyString())).thenReturn(Mono.empty());

        assertThrows(GenerationException.class, () -> workflow.run("What is ML?", EMBEDDING, 3));
    }
}
