package com.neorag.provider;

import com.neorag.config.NeoragProperties;
import com.neorag.exception.ConnectivityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Common plumbing for clients of the Ollama HTTP API.
 */
@Slf4j
public abstract class AbstractOllamaClient {

    protected static final String BACKEND = "ollama";

    protected final WebClient webClient;
    protected final NeoragProperties.OllamaConfig config;

    protected AbstractOllamaClient(WebClient webClient, NeoragProperties properties) {
        this.webClient = webClient;
        this.config = properties.getOllama();
    }

    /**
     * Execute request with retry logic.
     */
    protected <T> Mono<T> executeWithRetry(Mono<T> request, String operation) {
        return request
                .retryWhen(Retry.backoff(config.getMaxRetries(), Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(10))
                        .filter(this::isRetryable)
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .doOnSuccess(response -> log.debug("Ollama {} succeeded", operation))
                .doOnError(error -> log.error("Ollama {} failed: {}", operation, error.getMessage()));
    }

    /**
     * Check if an error is retryable.
     */
    protected boolean isRetryable(Throwable throwable) {
        if (throwable instanceof WebClientRequestException || throwable instanceof TimeoutException) {
            return true;
        }
        if (throwable instanceof WebClientResponseException) {
            return ((WebClientResponseException) throwable).getStatusCode().is5xxServerError();
        }
        return false;
    }

    /**
     * Transport errors mean Ollama is down; everything else is left to the caller to wrap.
     */
    protected boolean isConnectivityFailure(Throwable throwable) {
        return throwable instanceof WebClientRequestException || throwable instanceof TimeoutException;
    }

    protected ConnectivityException unavailable(Throwable cause) {
        return new ConnectivityException(BACKEND, cause.getMessage(), cause);
    }

    /**
     * Probe GET /api/tags.
     */
    protected boolean ping() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(Map.class)
                    .block(Duration.ofSeconds(5));
            return true;
        } catch (Exception e) {
            log.warn("Ollama not reachable at {}: {}", config.getBaseUrl(), e.getMessage());
            return false;
        }
    }
}
