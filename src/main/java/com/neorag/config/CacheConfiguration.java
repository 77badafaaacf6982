package com.neorag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neorag.repository.InMemorySemanticCacheStore;
import com.neorag.repository.SemanticCacheStore;
import com.neorag.service.cache.CacheCounters;
import com.neorag.service.cache.SemanticCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Semantic cache wiring. The store comes from {@link RedisConfiguration} or, with
 * neorag.cache.backend=memory, from an in-process Caffeine store.
 */
@Slf4j
@Configuration
public class CacheConfiguration {

    private final NeoragProperties properties;

    public CacheConfiguration(NeoragProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnProperty(prefix = "neorag.cache", name = "backend", havingValue = "memory")
    public SemanticCacheStore inMemorySemanticCacheStore() {
        log.info("Semantic cache backend: memory");
        return new InMemorySemanticCacheStore();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Counters live in the store hash {key-prefix}:stats, next to the entries they describe.
     */
    @Bean
    public CacheCounters cacheCounters(SemanticCacheStore store) {
        return new CacheCounters(store, properties.getCache().getKeyPrefix() + ":stats");
    }

    @Bean(destroyMethod = "close")
    public SemanticCache semanticCache(SemanticCacheStore store,
                                       CacheCounters cacheCounters,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        return new SemanticCache(store, cacheCounters, properties.getCache(), objectMapper, clock);
    }
}
