package com.neorag.service;

import com.neorag.config.NeoragProperties;
import com.neorag.model.BatchQueryResponse;
import com.neorag.model.CachedResult;
import com.neorag.model.ChunkNeighborhood;
import com.neorag.model.ChunkResult;
import com.neorag.model.QueryResult;
import com.neorag.service.cache.SemanticCache;
import com.neorag.service.embedding.EmbeddingService;
import com.neorag.service.retrieval.HybridRetriever;
import com.neorag.service.workflow.QueryWorkflow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main query service that orchestrates semantic cache lookup and the retrieval workflow.
 */
@Slf4j
@Service
public class QueryService {

    static final String CACHE_STEP = "Retrieved from cache";
    static final int MAX_BATCH_SIZE = 10;
    static final int MAX_SIMILAR_K = 20;

    private final SemanticCache semanticCache;
    private final EmbeddingService embeddingService;
    private final QueryWorkflow workflow;
    private final HybridRetriever retriever;
    private final NeoragProperties properties;

    public QueryService(SemanticCache semanticCache,
                        EmbeddingService embeddingService,
                        QueryWorkflow workflow,
                        HybridRetriever retriever,
                        NeoragProperties properties) {
        this.semanticCache = semanticCache;
        this.embeddingService = embeddingService;
        this.workflow = workflow;
        this.retriever = retriever;
        this.properties = properties;
    }

    /**
     * Answer a question, from the cache when a close enough question was answered before.
     */
    public Mono<QueryResult> query(String question, Integer topK) {
        return Mono.fromCallable(() -> answer(question, topK))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Answer several questions one after another. The first failure fails the batch.
     */
    public Mono<BatchQueryResponse> batch(List<String> questions, Integer topK) {
        if (questions == null || questions.isEmpty() || questions.size() > MAX_BATCH_SIZE) {
            return Mono.error(new IllegalArgumentException(
                    "questions must contain between 1 and " + MAX_BATCH_SIZE + " entries"));
        }
        return Flux.fromIterable(questions)
                .concatMap(question -> query(question, topK))
                .collectList()
                .map(results -> BatchQueryResponse.builder()
                        .results(results)
                        .total(results.size())
                        .build());
    }

    /**
     * Raw vector search without generation.
     */
    public Mono<List<ChunkResult>> similar(String text, int k) {
        if (text == null || text.isBlank()) {
            return Mono.error(new IllegalArgumentException("text must not be blank"));
        }
        if (k < 1 || k > MAX_SIMILAR_K) {
            return Mono.error(new IllegalArgumentException("k must be between 1 and " + MAX_SIMILAR_K));
        }
        return Mono.fromCallable(() -> retriever.vectorSearch(text, k))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * A chunk with its neighbours; empty when the chunk does not exist.
     */
    public Mono<ChunkNeighborhood> context(String chunkId) {
        return Mono.fromCallable(() -> retriever.context(chunkId).orElse(null))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Blocking query path: embed, consult the cache, run the workflow on a miss, cache the answer.
     */
    public QueryResult answer(String question, Integer topK) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        int k = resolveTopK(topK);
        boolean cacheEnabled = properties.getCache().isEnabled();

        float[] embedding = embeddingService.embed(question);

        if (cacheEnabled) {
            Optional<CachedResult> cached = semanticCache.get(question, embedding);
            if (cached.isPresent()) {
                CachedResult hit = cached.get();
                log.info("Serving cached answer (similarity={}, original: {})",
                        hit.getSimilarity(), hit.getOriginalQuery());

                List<String> steps = new ArrayList<>(hit.getProcessingSteps());
                steps.add(CACHE_STEP);

                return QueryResult.builder()
                        .question(question)
                        .answer(hit.getAnswer())
                        .sources(hit.getSources())
                        .searchType(hit.getSearchType())
                        .processingSteps(steps)
                        .cached(true)
                        .cacheSimilarity(hit.getSimilarity())
                        .originalQuery(hit.getOriginalQuery())
                        .build();
            }
        }

        log.info("Cache miss - running retrieval workflow");
        QueryResult result = workflow.run(question, embedding, k);

        if (cacheEnabled) {
            boolean stored = semanticCache.put(question, embedding, result.getAnswer(),
                    result.getSources(), result.getSearchType(), result.getProcessingSteps());
            if (!stored) {
                log.warn("Answer was not cached; the next identical question will run the workflow again");
            }
        }
        return result;
    }

    private int resolveTopK(Integer topK) {
        NeoragProperties.RetrievalConfig retrieval = properties.getRetrieval();
        if (topK == null) {
            return retrieval.getTopK();
        }
        if (topK < 1 || topK > retrieval.getMaxTopK()) {
            throw new IllegalArgumentException("top_k must be between 1 and " + retrieval.getMaxTopK());
        }
        return topK;
    }
}
