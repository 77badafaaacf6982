package com.neorag.controller;

import com.neorag.service.HealthService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness, readiness and backend health.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    static final String VERSION = "1.0.0";

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    /**
     * Status of Neo4j, the LLM backend and the cache store.
     */
    @GetMapping("/health")
    public Mono<Map<String, Object>> health() {
        return Mono.fromCallable(healthService::componentStatus)
                .subscribeOn(Schedulers.boundedElastic())
                .map(components -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", HealthService.allHealthy(components)
                            ? HealthService.HEALTHY : HealthService.UNHEALTHY);
                    body.put("components", components);
                    body.put("version", VERSION);
                    return body;
                });
    }

    @GetMapping("/ready")
    public Mono<ResponseEntity<Map<String, Object>>> ready() {
        return Mono.fromCallable(healthService::componentStatus)
                .subscribeOn(Schedulers.boundedElastic())
                .map(components -> {
                    boolean ready = HealthService.allHealthy(components);
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("status", ready ? "ready" : "not_ready");
                    body.put("components", components);
                    return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                            .body(body);
                });
    }

    @GetMapping("/live")
    public Map<String, String> live() {
        return Map.of("status", "alive");
    }
}
