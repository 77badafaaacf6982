package com.neorag.service.workflow;

import com.neorag.config.NeoragProperties;
import com.neorag.exception.GenerationException;
import com.neorag.exception.NeoragException;
import com.neorag.model.ChunkResult;
import com.neorag.model.QueryResult;
import com.neorag.model.SearchType;
import com.neorag.provider.LlmProvider;
import com.neorag.service.retrieval.HybridRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Retrieval and generation for a single question, as a small state machine:
 * ROUTE -> VECTOR | HYBRID -> GENERATE -> DONE.
 *
 * Blocking; the caller schedules it on the bounded-elastic pool.
 */
@Slf4j
@Service
public class QueryWorkflow {

    static final String INSTRUCTION =
            "Answer the question using only the context below. Be brief and precise.";

    private final RouteClassifier routeClassifier;
    private final HybridRetriever retriever;
    private final LlmProvider llmProvider;
    private final Duration generationTimeout;

    public QueryWorkflow(RouteClassifier routeClassifier,
                         HybridRetriever retriever,
                         LlmProvider llmProvider,
                         NeoragProperties properties) {
        this.routeClassifier = routeClassifier;
        this.retriever = retriever;
        this.llmProvider = llmProvider;
        this.generationTimeout = properties.getOllama().getTimeout();
    }

    public QueryResult run(String question, float[] embedding, int topK) {
        WorkflowContext ctx = new WorkflowContext(question, embedding, topK);

        while (ctx.getState() != WorkflowState.DONE) {
            switch (ctx.getState()) {
                case ROUTE:
                    route(ctx);
                    break;
                case VECTOR:
                    vectorSearch(ctx);
                    break;
                case HYBRID:
                    hybridSearch(ctx);
                    break;
                case GENERATE:
                    generate(ctx);
                    break;
                default:
                    throw new IllegalStateException("Unexpected workflow state: " + ctx.getState());
            }
        }

        return QueryResult.builder()
                .question(question)
                .answer(ctx.getAnswer())
                .sources(ctx.getContext().stream().map(ChunkResult::toSource).collect(Collectors.toList()))
                .searchType(ctx.getSearchType().getTag())
                .processingSteps(List.copyOf(ctx.getSteps()))
                .cached(false)
                .build();
    }

    private void route(WorkflowContext ctx) {
        SearchType searchType = routeClassifier.classify(ctx.getQuestion());
        ctx.setSearchType(searchType);
        ctx.addStep("Route: " + searchType.getTag() + " search");
        ctx.setState(searchType == SearchType.VECTOR ? WorkflowState.VECTOR : WorkflowState.HYBRID);
        log.debug("Routed question to {} search", searchType.getTag());
    }

    private void vectorSearch(WorkflowContext ctx) {
        List<ChunkResult> results = retriever.vectorSearch(ctx.getEmbedding(), ctx.getTopK());
        ctx.getContext().addAll(results);
        ctx.addStep("Vector search: " + results.size() + " results");
        ctx.setState(WorkflowState.GENERATE);
    }

    private void hybridSearch(WorkflowContext ctx) {
        List<ChunkResult> results = retriever.hybridSearch(ctx.getEmbedding(), ctx.getTopK());
        ctx.getContext().addAll(results);
        ctx.addStep("Hybrid search: " + results.size() + " results");
        ctx.setState(WorkflowState.GENERATE);
    }

    private void generate(WorkflowContext ctx) {
        String prompt = buildPrompt(ctx.getQuestion(), ctx.getContext());

        String answer;
        try {
            answer = llmProvider.generate(prompt).block(generationTimeout);
        } catch (NeoragException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Answer generation failed: " + e.getMessage(), e);
        }
        if (answer == null) {
            throw new GenerationException("Language model returned no answer", null);
        }

        ctx.setAnswer(answer);
        ctx.addStep("Answer generated");
        ctx.setState(WorkflowState.DONE);
    }

    static String buildPrompt(String question, List<ChunkResult> context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append(INSTRUCTION).append("\n\nContext:\n");
        for (int i = 0; i < context.size(); i++) {
            prompt.append("Source ").append(i + 1).append(":\n")
                    .append(context.get(i).contextText())
                    .append("\n\n");
        }
        prompt.append("Question: ").append(question).append("\n\nAnswer:");
        return prompt.toString();
    }
}
