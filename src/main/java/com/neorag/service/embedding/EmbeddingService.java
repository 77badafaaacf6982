package com.neorag.service.embedding;

/**
 * Service for generating text embeddings.
 */
public interface EmbeddingService {

    /**
     * Generate embedding vector for text.
     *
     * @param text input text
     * @return embedding vector (float array)
     * @throws com.neorag.exception.RetrievalException if no embedding could be produced
     */
    float[] embed(String text);

    /**
     * Get embedding dimensions.
     *
     * @return number of dimensions in output vector
     */
    int dimensions();

    /**
     * Get model name/identifier.
     *
     * @return model name
     */
    String modelName();

    /**
     * Check if service is ready.
     *
     * @return true if ready to embed
     */
    boolean isReady();
}
