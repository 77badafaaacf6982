package com.neorag.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neorag.config.NeoragProperties;
import com.neorag.exception.CacheSerializationException;
import com.neorag.model.CacheEntry;
import com.neorag.model.CachedAnswer;
import com.neorag.model.CachedResult;
import com.neorag.model.SourceInfo;
import com.neorag.model.dto.CacheStatistics;
import com.neorag.repository.SemanticCacheStore;
import com.neorag.repository.converter.VectorConverter;
import com.neorag.service.cache.CacheCounters.Counter;
import com.neorag.service.similarity.CosineSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Semantic cache of answered questions, keyed by embedding similarity.
 *
 * Flow:
 * 1. get: scan every live entry, compute cosine similarity against the query embedding
 * 2. Best match at or above the threshold is a hit, anything else a miss
 * 3. put: evict the oldest entry (FIFO by insertion time) when full, then write
 *
 * Store layout under the key prefix (default "semantic_cache"):
 * {prefix}:embeddings          sorted set, id scored by insertion time (epoch millis, strictly increasing per instance)
 * {prefix}:embeddings:{id}     float32 embedding bytes, with TTL
 * {prefix}:queries:{id}        question text, with TTL
 * {prefix}:answers:{id}        answer payload JSON, with TTL
 * {prefix}:stats               counters hash
 *
 * The cache is an optimization only: no public method throws. Store failures are logged,
 * counted in total_errors and reported as a miss or as false.
 */
@Slf4j
public class SemanticCache {

    private final SemanticCacheStore store;
    private final CacheCounters counters;
    private final QuestionIdGenerator idGenerator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Duration ttl;
    private final double similarityThreshold;
    private final int maxCacheSize;

    private final String keyPrefix;
    private final String indexKey;

    // Serializes check-evict-insert in put() and clear()
    private final ReentrantLock writeLock = new ReentrantLock();

    // Last index score handed out, guarded by writeLock
    private double lastScore = Double.NEGATIVE_INFINITY;

    public SemanticCache(SemanticCacheStore store,
                         NeoragProperties.CacheConfig config,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this(store, new CacheCounters(store, config.getKeyPrefix() + ":stats"), config, objectMapper, clock);
    }

    public SemanticCache(SemanticCacheStore store,
                         CacheCounters counters,
                         NeoragProperties.CacheConfig config,
                         ObjectMapper objectMapper,
                         Clock clock) {
        if (config.getSimilarityThreshold() <= 0.0 || config.getSimilarityThreshold() > 1.0) {
            throw new IllegalArgumentException(
                    "similarity threshold must be in (0, 1], was " + config.getSimilarityThreshold());
        }
        if (config.getMaxSize() <= 0) {
            throw new IllegalArgumentException("max cache size must be positive, was " + config.getMaxSize());
        }
        if (config.getTtl() == null || config.getTtl().isZero() || config.getTtl().isNegative()) {
            throw new IllegalArgumentException("cache ttl must be positive, was " + config.getTtl());
        }

        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.ttl = config.getTtl();
        this.similarityThreshold = config.getSimilarityThreshold();
        this.maxCacheSize = config.getMaxSize();
        this.keyPrefix = config.getKeyPrefix() + ":";
        this.indexKey = keyPrefix + "embeddings";
        this.idGenerator = new QuestionIdGenerator();
        this.counters = counters;

        if (store.ping()) {
            counters.initialize();
            log.info("Semantic cache ready: threshold={}, maxSize={}, ttl={}",
                    similarityThreshold, maxCacheSize, ttl);
        } else {
            log.warn("Semantic cache store not reachable at startup, lookups will miss until it is");
        }
    }

    /**
     * Store an answered question.
     *
     * @return true if written; false means the cache was not updated, never that the query failed
     */
    public boolean put(String question,
                       float[] embedding,
                       String answer,
                       List<SourceInfo> sources,
                       String searchType,
                       List<String> steps) {
        if (counters.isClosed()) {
            return false;
        }
        try {
            Instant now = clock.instant();
            CacheEntry entry = CacheEntry.builder()
                    .id(idGenerator.generate(question))
                    .embedding(embedding)
                    .question(question)
                    .payload(CachedAnswer.builder()
                            .answer(answer)
                            .sources(sources != null ? new ArrayList<>(sources) : List.of())
                            .searchType(searchType)
                            .processingSteps(steps != null ? new ArrayList<>(steps) : List.of())
                            .timestamp(now.toEpochMilli())
                            .build())
                    .createdAt(now)
                    .build();

            byte[] answerBytes = objectMapper.writeValueAsBytes(entry.getPayload());

            writeLock.lock();
            try {
                pruneExpired(now);

                long currentSize = store.indexSize(indexKey);
                if (currentSize >= maxCacheSize) {
                    evictOldest();
                }

                // Records first, index last: a concurrent scan never sees an id without its records
                store.set(embeddingKey(entry.getId()), VectorConverter.toBytes(entry.getEmbedding()), ttl);
                store.set(questionKey(entry.getId()), question.getBytes(StandardCharsets.UTF_8), ttl);
                store.set(answerKey(entry.getId()), answerBytes, ttl);
                store.addToIndex(indexKey, entry.getId(), nextScore(entry.getCreatedAt()));
            } finally {
                writeLock.unlock();
            }

            counters.increment(Counter.TOTAL_CACHED);
            log.debug("Cached question: {} (id={})", abbreviate(question), entry.getId());
            return true;

        } catch (Exception e) {
            log.error("Failed to cache question: {}", abbreviate(question), e);
            counters.incrementQuietly(Counter.TOTAL_ERRORS);
            return false;
        }
    }

    /**
     * Look up the most similar previously answered question.
     *
     * @return the cached answer if the best similarity reaches the threshold
     */
    public Optional<CachedResult> get(String question, float[] embedding) {
        if (counters.isClosed()) {
            return Optional.empty();
        }
        try {
            pruneExpired(clock.instant());

            List<String> ids = store.indexMembers(indexKey);
            if (ids.isEmpty()) {
                log.debug("Cache is empty");
                counters.increment(Counter.TOTAL_MISSES);
                return Optional.empty();
            }

            double bestSimilarity = 0.0;
            String bestMatchId = null;

            for (String id : ids) {
                Optional<byte[]> stored = store.get(embeddingKey(id));
                if (stored.isEmpty()) {
                    // Expired or evicted since the index was read
                    continue;
                }

                double similarity;
                try {
                    similarity = CosineSimilarity.compute(embedding, VectorConverter.fromBytes(stored.get()));
                } catch (CacheSerializationException | IllegalArgumentException e) {
                    log.warn("Skipping unreadable cache entry {}: {}", id, e.getMessage());
                    counters.increment(Counter.TOTAL_ERRORS);
                    continue;
                }

                // Strictly greater: on equal similarity the earlier-inserted entry stays the match
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestMatchId = id;
                }
            }

            if (bestMatchId == null || bestSimilarity < similarityThreshold) {
                log.debug("Best similarity {} below threshold {}", bestSimilarity, similarityThreshold);
                counters.increment(Counter.TOTAL_MISSES);
                return Optional.empty();
            }

            Optional<byte[]> answerBytes = store.get(answerKey(bestMatchId));
            if (answerBytes.isEmpty()) {
                log.debug("Best match {} expired before its answer could be read", bestMatchId);
                counters.increment(Counter.TOTAL_MISSES);
                return Optional.empty();
            }

            CachedAnswer payload;
            try {
                payload = decodeAnswer(answerBytes.get());
            } catch (CacheSerializationException e) {
                log.warn("Skipping cache entry {} with corrupt answer payload: {}", bestMatchId, e.getMessage());
                counters.increment(Counter.TOTAL_ERRORS);
                counters.increment(Counter.TOTAL_MISSES);
                return Optional.empty();
            }

            String originalQuery = store.get(questionKey(bestMatchId))
                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                    .orElse(null);

            counters.increment(Counter.TOTAL_HITS);
            log.info("Cache HIT, similarity={} (query: {})", bestSimilarity, abbreviate(question));

            return Optional.of(CachedResult.builder()
                    .answer(payload.getAnswer())
                    .sources(payload.getSources() != null ? payload.getSources() : List.of())
                    .searchType(payload.getSearchType())
                    .processingSteps(payload.getProcessingSteps() != null ? payload.getProcessingSteps() : List.of())
                    .similarity(bestSimilarity)
                    .originalQuery(originalQuery)
                    .build());

        } catch (Exception e) {
            log.error("Failed to read from cache", e);
            counters.incrementQuietly(Counter.TOTAL_ERRORS);
            return Optional.empty();
        }
    }

    /**
     * Remove every entry and reset the counters.
     * A get() running concurrently may still see part of the old data and report a miss.
     */
    public boolean clear() {
        writeLock.lock();
        try {
            long deleted = store.deleteByPrefix(keyPrefix);
            counters.reset();
            log.info("Cache cleared ({} keys removed)", deleted);
            return true;
        } catch (Exception e) {
            log.error("Failed to clear cache", e);
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    public CacheStatistics stats() {
        try {
            pruneExpired(clock.instant());
            long cacheSize = store.indexSize(indexKey);
            return buildStatistics(cacheSize, counters.snapshot());
        } catch (Exception e) {
            log.error("Failed to read cache statistics", e);
            return buildStatistics(0, Map.of());
        }
    }

    public boolean isAvailable() {
        try {
            return store.ping();
        } catch (Exception e) {
            log.warn("Cache store ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Release the counters. Later calls behave like a failing store: misses and false.
     */
    public void close() {
        counters.close();
        log.info("Semantic cache closed");
    }

    private CacheStatistics buildStatistics(long cacheSize, Map<Counter, Long> values) {
        long hits = values.getOrDefault(Counter.TOTAL_HITS, 0L);
        long misses = values.getOrDefault(Counter.TOTAL_MISSES, 0L);
        long totalRequests = hits + misses;
        double hitRate = totalRequests > 0
                ? Math.round(hits * 100.0 / totalRequests * 100.0) / 100.0
                : 0.0;

        return CacheStatistics.builder()
                .cacheSize(cacheSize)
                .maxCacheSize(maxCacheSize)
                .totalCached(values.getOrDefault(Counter.TOTAL_CACHED, 0L))
                .totalHits(hits)
                .totalMisses(misses)
                .totalErrors(values.getOrDefault(Counter.TOTAL_ERRORS, 0L))
                .totalRequests(totalRequests)
                .hitRate(hitRate)
                .similarityThreshold(similarityThreshold)
                .ttlSeconds(ttl.getSeconds())
                .build();
    }

    /**
     * Drop index members whose records have outlived the TTL.
     */
    private void pruneExpired(Instant now) {
        long removed = store.removeFromIndexUpTo(indexKey, now.minus(ttl).toEpochMilli());
        if (removed > 0) {
            log.debug("Pruned {} expired entries from the cache index", removed);
        }
    }

    /**
     * Insertion time in millis, bumped past the previous score so that puts within the
     * same millisecond keep their insertion order. Caller holds writeLock.
     */
    private double nextScore(Instant createdAt) {
        double score = Math.max(createdAt.toEpochMilli(), lastScore + 1);
        lastScore = score;
        return score;
    }

    private void evictOldest() {
        List<String> evicted = store.popLowest(indexKey, 1);
        for (String id : evicted) {
            store.delete(List.of(embeddingKey(id), questionKey(id), answerKey(id)));
            log.debug("Evicted oldest cache entry {}", id);
        }
    }

    private CachedAnswer decodeAnswer(byte[] bytes) {
        try {
            CachedAnswer payload = objectMapper.readValue(bytes, CachedAnswer.class);
            if (payload == null || payload.getAnswer() == null) {
                throw new CacheSerializationException("Answer payload has no answer");
            }
            return payload;
        } catch (IOException e) {
            throw new CacheSerializationException("Answer payload is not valid JSON", e);
        }
    }

    private String embeddingKey(String id) {
        return indexKey + ":" + id;
    }

    private String questionKey(String id) {
        return keyPrefix + "queries:" + id;
    }

    private String answerKey(String id) {
        return keyPrefix + "answers:" + id;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
