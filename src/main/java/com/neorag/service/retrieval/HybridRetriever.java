package com.neorag.service.retrieval;

import com.neorag.model.ChunkNeighborhood;
import com.neorag.model.ChunkResult;
import com.neorag.service.embedding.EmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Vector search over chunks, optionally enriched with each hit's neighbouring chunks.
 */
@Slf4j
@Service
public class HybridRetriever {

    private final EmbeddingService embeddingService;
    private final VectorIndex vectorIndex;
    private final ChunkGraph chunkGraph;

    public HybridRetriever(EmbeddingService embeddingService, VectorIndex vectorIndex, ChunkGraph chunkGraph) {
        this.embeddingService = embeddingService;
        this.vectorIndex = vectorIndex;
        this.chunkGraph = chunkGraph;
    }

    public List<ChunkResult> vectorSearch(String question, int k) {
        return vectorSearch(embeddingService.embed(question), k);
    }

    /**
     * Search with an embedding the caller already has. Results keep the index order.
     */
    public List<ChunkResult> vectorSearch(float[] embedding, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        return vectorIndex.query(embedding, k);
    }

    public List<ChunkResult> hybridSearch(String question, int k) {
        return hybridSearch(embeddingService.embed(question), k);
    }

    /**
     * Vector search, then replace each hit's text with its previous/main/next passage.
     * A hit whose neighbourhood cannot be read is dropped; so is one whose chunk is gone.
     */
    public List<ChunkResult> hybridSearch(float[] embedding, int k) {
        List<ChunkResult> hits = vectorSearch(embedding, k);
        List<ChunkResult> enriched = new ArrayList<>(hits.size());

        for (ChunkResult hit : hits) {
            Optional<ChunkNeighborhood> neighborhood;
            try {
                neighborhood = chunkGraph.neighbors(hit.getChunkId());
            } catch (RuntimeException e) {
                log.warn("Dropping chunk {} from hybrid results: {}", hit.getChunkId(), e.getMessage());
                continue;
            }

            if (neighborhood.isEmpty()) {
                log.debug("Chunk {} no longer exists, dropping it", hit.getChunkId());
                continue;
            }

            ChunkNeighborhood context = neighborhood.get();
            enriched.add(ChunkResult.builder()
                    .chunkId(hit.getChunkId())
                    .text(hit.getText())
                    .score(hit.getScore())
                    .enrichedText(ContextEnricher.enrich(context))
                    .docTitle(context.getDocumentTitle() != null ? context.getDocumentTitle() : "Unknown")
                    .build());
        }

        log.debug("Hybrid search kept {} of {} hits", enriched.size(), hits.size());
        return enriched;
    }

    public Optional<ChunkNeighborhood> context(String chunkId) {
        return chunkGraph.neighbors(chunkId);
    }
}
