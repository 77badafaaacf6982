package com.neorag.controller;

import com.neorag.model.dto.CacheStatistics;
import com.neorag.service.cache.SemanticCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Semantic cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cache")
public class CacheController {

    private final SemanticCache semanticCache;

    public CacheController(SemanticCache semanticCache) {
        this.semanticCache = semanticCache;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public Mono<CacheStatistics> getStats() {
        return Mono.fromCallable(semanticCache::stats)
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Remove every cached answer and reset the counters.
     */
    @DeleteMapping("/clear")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache() {
        log.info("Cache clear requested");
        return Mono.fromCallable(semanticCache::clear)
                .subscribeOn(Schedulers.boundedElastic())
                .map(cleared -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("success", cleared);
                    body.put("message", cleared ? "Cache cleared" : "Failed to clear cache");
                    return ResponseEntity.status(cleared ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(body);
                });
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.fromCallable(semanticCache::isAvailable)
                .subscribeOn(Schedulers.boundedElastic())
                .map(available -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", available ? "healthy" : "unhealthy");
                    body.put("store", available ? "connected" : "disconnected");
                    return ResponseEntity.status(available ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                            .body(body);
                });
    }
}
