package com.neorag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for the Ollama HTTP API.
 */
@Configuration
public class WebClientConfiguration {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    private final NeoragProperties properties;

    public WebClientConfiguration(NeoragProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient ollamaWebClient(ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(properties.getOllama().getTimeout());

        // Ollama speaks snake_case too, so the shared mapper works both ways
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> {
                    codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE);
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(objectMapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(objectMapper));
                })
                .build();

        return WebClient.builder()
                .baseUrl(properties.getOllama().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
