package com.neorag.controller;

import com.neorag.model.ExtractionRequest;
import com.neorag.model.ExtractionResult;
import com.neorag.service.extraction.ExtractionChain;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entity extraction preview. Nothing is written to the graph.
 */
@RestController
@RequestMapping("/api/v1/extraction")
public class ExtractionController {

    private final ExtractionChain extractionChain;

    public ExtractionController(ExtractionChain extractionChain) {
        this.extractionChain = extractionChain;
    }

    @PostMapping(value = "/entities", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ExtractionResult> extractEntities(@RequestBody ExtractionRequest request) {
        if (request.getText() == null || request.getText().isBlank()) {
            return Mono.error(new IllegalArgumentException("text must not be blank"));
        }
        return Mono.fromCallable(() -> extractionChain.extract(request.getText()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
