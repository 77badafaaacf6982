package com.neorag.service;

import com.neorag.provider.LlmProvider;
import com.neorag.service.cache.SemanticCache;
import com.neorag.service.retrieval.ChunkGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reachability of the three backends.
 */
@Slf4j
@Service
public class HealthService {

    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";

    private final ChunkGraph chunkGraph;
    private final LlmProvider llmProvider;
    private final SemanticCache semanticCache;

    public HealthService(ChunkGraph chunkGraph, LlmProvider llmProvider, SemanticCache semanticCache) {
        this.chunkGraph = chunkGraph;
        this.llmProvider = llmProvider;
        this.semanticCache = semanticCache;
    }

    /**
     * Component name to "healthy" / "unhealthy", in a stable order.
     */
    public Map<String, String> componentStatus() {
        Map<String, String> components = new LinkedHashMap<>();
        components.put("neo4j", status(chunkGraph.isAvailable()));
        components.put(llmProvider.getName(), status(llmProvider.isAvailable()));
        components.put("redis", status(semanticCache.isAvailable()));
        log.debug("Component health: {}", components);
        return components;
    }

    public static boolean allHealthy(Map<String, String> components) {
        return components.values().stream().allMatch(HEALTHY::equals);
    }

    private static String status(boolean up) {
        return up ? HEALTHY : UNHEALTHY;
    }
}
