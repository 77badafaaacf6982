package com.neorag.service.retrieval;

import com.neorag.model.ChunkResult;

import java.util.List;

/**
 * Nearest-neighbour lookup over chunk embeddings.
 */
public interface VectorIndex {

    /**
     * @return up to k chunks, best score first
     * @throws com.neorag.exception.RetrievalException if the index could not be queried
     */
    List<ChunkResult> query(float[] embedding, int k);
}
