package com.neorag.service.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.neorag.config.NeoragProperties;
import com.neorag.exception.NeoragException;
import com.neorag.exception.RetrievalException;
import com.neorag.provider.AbstractOllamaClient;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Embeddings from Ollama's /api/embeddings endpoint.
 * Blocking: callers run on the bounded-elastic scheduler.
 */
@Slf4j
@Service
public class OllamaEmbeddingService extends AbstractOllamaClient implements EmbeddingService {

    private final int dimensions;

    public OllamaEmbeddingService(WebClient ollamaWebClient, NeoragProperties properties) {
        super(ollamaWebClient, properties);
        this.dimensions = properties.getNeo4j().getEmbeddingDimension();
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to embed must not be blank");
        }

        EmbeddingResponse response;
        try {
            response = executeWithRetry(webClient.post()
                    .uri("/api/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbeddingRequest(config.getEmbeddingModel(), text))
                    .retrieve()
                    .bodyToMono(EmbeddingResponse.class), "embeddings")
                    .block(config.getTimeout());
        } catch (NeoragException e) {
            throw e;
        } catch (RuntimeException e) {
            // block(timeout) reports an elapsed timeout as IllegalStateException(TimeoutException)
            Throwable cause = e.getCause() instanceof TimeoutException ? e.getCause() : Exceptions.unwrap(e);
            if (isConnectivityFailure(cause)) {
                throw unavailable(cause);
            }
            throw new RetrievalException("Embedding request failed: " + cause.getMessage(), cause);
        }

        if (response == null || response.getEmbedding() == null || response.getEmbedding().isEmpty()) {
            throw new RetrievalException("Ollama returned no embedding for model " + config.getEmbeddingModel(), null);
        }

        List<Double> values = response.getEmbedding();
        float[] embedding = new float[values.size()];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = values.get(i).floatValue();
        }

        if (embedding.length != dimensions) {
            log.warn("Embedding model {} returned {} dimensions, index expects {}",
                    config.getEmbeddingModel(), embedding.length, dimensions);
        }
        return embedding;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelName() {
        return config.getEmbeddingModel();
    }

    @Override
    public boolean isReady() {
        return ping();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class EmbeddingRequest {
        private String model;
        private String prompt;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingResponse {
        private List<Double> embedding;
    }
}
