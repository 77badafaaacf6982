package com.neorag.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.neorag.config.NeoragProperties;
import com.neorag.exception.GenerationException;
import com.neorag.exception.NeoragException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Answer generation through Ollama's /api/generate endpoint (non-streaming).
 */
@Slf4j
@Component
public class OllamaProvider extends AbstractOllamaClient implements LlmProvider {

    public OllamaProvider(WebClient ollamaWebClient, NeoragProperties properties) {
        super(ollamaWebClient, properties);
    }

    @Override
    public String getName() {
        return BACKEND;
    }

    @Override
    public Mono<String> generate(String prompt) {
        log.debug("Generating with model={} ({} prompt chars)", config.getModel(), prompt.length());

        GenerateRequest body = GenerateRequest.builder()
                .model(config.getModel())
                .prompt(prompt)
                .stream(false)
                .options(Map.of("temperature", config.getTemperature()))
                .build();

        Mono<GenerateResponse> responseMono = webClient.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(GenerateResponse.class);

        return executeWithRetry(responseMono, "generate")
                .flatMap(response -> response.getResponse() == null
                        ? Mono.<String>error(new GenerationException("Ollama returned no response text", null))
                        : Mono.just(response.getResponse().trim()))
                .switchIfEmpty(Mono.error(new GenerationException("Ollama returned an empty body", null)))
                .onErrorMap(error -> !(error instanceof NeoragException),
                        error -> isConnectivityFailure(error)
                                ? unavailable(error)
                                : new GenerationException("Answer generation failed: " + error.getMessage(), error));
    }

    @Override
    public boolean isAvailable() {
        return ping();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    static class GenerateRequest {
        private String model;
        private String prompt;
        private boolean stream;
        private Map<String, Object> options;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class GenerateResponse {
        private String model;
        private String response;
        private boolean done;
    }
}
