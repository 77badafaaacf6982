package com.neorag.controller;

import com.neorag.service.extraction.ExtractionChain;
import com.neorag.service.extraction.PatternEntityStage;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

/**
 * Tests for ExtractionController with the pattern stage only.
 */
class ExtractionControllerTest {

    private final WebTestClient client = ControllerTestSupport.bind(new ExtractionController(
            new ExtractionChain(List.of(new PatternEntityStage(List.of(), 10)))));

    @Test
    void testExtractsEntities() {
        client.post().uri("/api/v1/extraction/entities")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"text\":\"Alan Turing worked in Manchester.\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stage").isEqualTo("pattern")
                .jsonPath("$.entities[0].name").isEqualTo("Alan Turing")
                .jsonPath("$.entities[1].name").isEqualTo("Manchester")
                .jsonPath("$.entities[1].type").isEqualTo("CONCEPT");
    }

    @Test
    void testBlankTextIsBadRequest() {
        client.post().uri("/api/v1/extraction/entities")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"text\":\"\"}")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
