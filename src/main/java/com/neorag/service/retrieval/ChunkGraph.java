package com.neorag.service.retrieval;

import com.neorag.model.ChunkNeighborhood;

import java.util.Optional;

/**
 * Read access to the chunk chain: a chunk, the chunks linked before and after it,
 * and the document that owns it.
 */
public interface ChunkGraph {

    /**
     * @return empty if no chunk with this id exists
     */
    Optional<ChunkNeighborhood> neighbors(String chunkId);

    boolean isAvailable();
}
