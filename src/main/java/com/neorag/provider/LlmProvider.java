package com.neorag.provider;

import reactor.core.publisher.Mono;

/**
 * Interface for text generation providers.
 */
public interface LlmProvider {

    /**
     * Get provider name (e.g., "ollama").
     *
     * @return provider name
     */
    String getName();

    /**
     * Generate a completion for a single prompt.
     *
     * @param prompt full prompt text
     * @return generated text
     */
    Mono<String> generate(String prompt);

    /**
     * Check if the provider answers at all.
     *
     * @return true if reachable
     */
    boolean isAvailable();
}
