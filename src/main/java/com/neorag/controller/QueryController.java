package com.neorag.controller;

import com.neorag.model.BatchQueryRequest;
import com.neorag.model.BatchQueryResponse;
import com.neorag.model.ChunkNeighborhood;
import com.neorag.model.ChunkResult;
import com.neorag.model.QueryRequest;
import com.neorag.model.QueryResult;
import com.neorag.service.QueryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Question answering endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/query")
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Answer one question, from the semantic cache when possible.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryResult> query(@RequestBody QueryRequest request) {
        if (request.getQuestion() == null || request.getQuestion().isBlank()) {
            return Mono.error(new IllegalArgumentException("question must not be blank"));
        }
        log.info("Received query: {}", request.getQuestion());
        return queryService.query(request.getQuestion(), request.getTopK());
    }

    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<BatchQueryResponse> batch(@RequestBody BatchQueryRequest request) {
        log.info("Received batch of {} questions",
                request.getQuestions() != null ? request.getQuestions().size() : 0);
        return queryService.batch(request.getQuestions(), request.getTopK());
    }

    /**
     * Chunks nearest to the text, without answer generation.
     */
    @GetMapping("/similar")
    public Mono<List<ChunkResult>> similar(@RequestParam("text") String text,
                                           @RequestParam(value = "k", defaultValue = "5") int k) {
        return queryService.similar(text, k);
    }

    @GetMapping("/context/{chunkId}")
    public Mono<ResponseEntity<ChunkNeighborhood>> context(@PathVariable("chunkId") String chunkId) {
        return queryService.context(chunkId)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }
}
