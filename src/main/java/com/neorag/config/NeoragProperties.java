package com.neorag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for neorag.
 */
@Data
@Component
@ConfigurationProperties(prefix = "neorag")
public class NeoragProperties {

    private CacheConfig cache = new CacheConfig();
    private RedisConfig redis = new RedisConfig();
    private OllamaConfig ollama = new OllamaConfig();
    private Neo4jConfig neo4j = new Neo4jConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private ExtractionConfig extraction = new ExtractionConfig();

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        /**
         * "redis" or "memory".
         */
        private String backend = "redis";
        private Duration ttl = Duration.ofHours(1);
        private double similarityThreshold = 0.95;
        private int maxSize = 10000;
        private String keyPrefix = "semantic_cache";
    }

    @Data
    public static class RedisConfig {
        private String host = "localhost";
        private int port = 6379;
        private String password;
        private int database = 0;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class OllamaConfig {
        private String baseUrl = "http://localhost:11434";
        private String model = "llama3.1";
        private String embeddingModel = "nomic-embed-text";
        private double temperature = 0.0;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRetries = 2;
    }

    @Data
    public static class Neo4jConfig {
        private String uri = "bolt://localhost:7687";
        private String username = "neo4j";
        private String password = "password123";
        private String database = "neo4j";
        private String vectorIndexName = "chunk_embeddings";
        private int embeddingDimension = 768;
    }

    @Data
    public static class RetrievalConfig {
        private int topK = 3;
        private int maxTopK = 10;
        private List<String> definitionalPhrases = new ArrayList<>(List.of(
                "what is", "explain", "tell me about",
                "что такое", "объясни", "расскажи"));
    }

    @Data
    public static class ExtractionConfig {
        private boolean llmEnabled = true;
        private int maxEntities = 10;
        private List<String> stopWords = new ArrayList<>(List.of(
                "This", "That", "There", "These", "Those", "When", "What", "Where",
                "Привет", "Доброе", "Это", "Все", "Может", "Надо", "Будет"));
    }
}
