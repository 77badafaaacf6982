package com.neorag.service.cache;

import com.neorag.repository.SemanticCacheStore;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Hit/miss/error tallies of one semantic cache instance, kept in a single store hash
 * so that every node sharing the store sees the same numbers.
 */
@Slf4j
public class CacheCounters {

    public enum Counter {
        TOTAL_CACHED("total_cached"),
        TOTAL_HITS("total_hits"),
        TOTAL_MISSES("total_misses"),
        TOTAL_ERRORS("total_errors");

        private final String field;

        Counter(String field) {
            this.field = field;
        }

        public String field() {
            return field;
        }
    }

    private final SemanticCacheStore store;
    private final String hashKey;
    private volatile boolean closed;

    public CacheCounters(SemanticCacheStore store, String hashKey) {
        this.store = store;
        this.hashKey = hashKey;
    }

    /**
     * Create every counter field at zero, keeping existing values.
     */
    public void initialize() {
        try {
            for (Counter counter : Counter.values()) {
                store.increment(hashKey, counter.field(), 0);
            }
            log.debug("Cache counters initialized under {}", hashKey);
        } catch (Exception e) {
            log.warn("Could not initialize cache counters: {}", e.getMessage());
        }
    }

    public long increment(Counter counter) {
        if (closed) {
            throw new IllegalStateException("Cache counters are closed");
        }
        return store.increment(hashKey, counter.field(), 1);
    }

    /**
     * Increment without propagating store failures. Used on paths that are already handling one.
     */
    public void incrementQuietly(Counter counter) {
        try {
            increment(counter);
        } catch (Exception e) {
            log.warn("Could not record {}: {}", counter.field(), e.getMessage());
        }
    }

    public Map<Counter, Long> snapshot() {
        Map<String, Long> raw = store.readCounters(hashKey);
        Map<Counter, Long> values = new EnumMap<>(Counter.class);
        for (Counter counter : Counter.values()) {
            values.put(counter, raw.getOrDefault(counter.field(), 0L));
        }
        return values;
    }

    public void reset() {
        store.delete(List.of(hashKey));
    }

    /**
     * Stop recording. Stored values are kept for the next instance sharing the store.
     */
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
