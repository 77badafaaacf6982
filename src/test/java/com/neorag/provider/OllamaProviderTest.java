package com.neorag.provider;

import com.neorag.config.NeoragProperties;
import com.neorag.exception.ConnectivityException;
import com.neorag.exception.GenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for OllamaProvider against a stubbed exchange function.
 */
class OllamaProviderTest {

    private NeoragProperties properties;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new NeoragProperties();
        properties.getOllama().setMaxRetries(0);
    }

    @Test
    void testGenerateReturnsTrimmedResponse() {
        OllamaProvider provider = providerAnswering(HttpStatus.OK,
                "{\"model\":\"llama3.1\",\"response\":\"  Machine learning is a subfield of AI.\\n\",\"done\":true}");

        StepVerifier.create(provider.generate("prompt"))
                .expectNext("Machine learning is a subfield of AI.")
                .verifyComplete();

        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).method()).isEqualTo(HttpMethod.POST);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/generate");
    }

    @Test
    void testClientErrorBecomesGenerationException() {
        OllamaProvider provider = providerAnswering(HttpStatus.NOT_FOUND, "{\"error\":\"model not found\"}");

        StepVerifier.create(provider.generate("prompt"))
                .expectError(GenerationException.class)
                .verify();
    }

    @Test
    void testMissingResponseFieldBecomesGenerationException() {
        OllamaProvider provider = providerAnswering(HttpStatus.OK, "{\"done\":true}");

        StepVerifier.create(provider.generate("prompt"))
                .expectError(GenerationException.class)
                .verify();
    }

    @Test
    void testUnreachableServerBecomesConnectivityException() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.error(new WebClientRequestException(
                        new ConnectException("Connection refused"), HttpMethod.POST,
                        URI.create("http://localhost:11434/api/generate"), new HttpHeaders())))
                .build();
        OllamaProvider provider = new OllamaProvider(webClient, properties);

        StepVerifier.create(provider.generate("prompt"))
                .expectError(ConnectivityException.class)
                .verify();
    }

    @Test
    void testServerErrorIsRetried() {
        properties.getOllama().setMaxRetries(1);
        AtomicInteger calls = new AtomicInteger();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> calls.incrementAndGet() == 1
                        ? Mono.just(response(HttpStatus.SERVICE_UNAVAILABLE, "{}"))
                        : Mono.just(response(HttpStatus.OK, "{\"response\":\"ok\",\"done\":true}")))
                .build();
        OllamaProvider provider = new OllamaProvider(webClient, properties);

        StepVerifier.create(provider.generate("prompt"))
                .expectNext("ok")
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(2);
    }

    private OllamaProvider providerAnswering(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(response(status, body));
                })
                .build();
        return new OllamaProvider(webClient, properties);
    }

    static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }
}
