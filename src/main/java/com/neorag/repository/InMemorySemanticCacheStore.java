package com.neorag.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process cache store for single-node deployments and tests.
 * Values live in a Caffeine cache with per-entry expiry; indexes and counters are plain maps.
 */
public class InMemorySemanticCacheStore implements SemanticCacheStore {

    private final Cache<String, TimedValue> values;
    private final Map<String, Map<String, Double>> indexes = new ConcurrentHashMap<>();
    private final Map<String, Map<String, AtomicLong>> counters = new ConcurrentHashMap<>();

    public InMemorySemanticCacheStore() {
        this(Ticker.systemTicker());
    }

    public InMemorySemanticCacheStore(Ticker ticker) {
        this.values = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .build();
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        values.put(key, new TimedValue(value.clone(), ttl.toNanos()));
    }

    @Override
    public Optional<byte[]> get(String key) {
        TimedValue value = values.getIfPresent(key);
        return value != null ? Optional.of(value.bytes.clone()) : Optional.empty();
    }

    @Override
    public void delete(Collection<String> keys) {
        values.invalidateAll(keys);
    }

    @Override
    public long deleteByPrefix(String prefix) {
        long deleted = 0;
        for (String key : new ArrayList<>(values.asMap().keySet())) {
            if (key.startsWith(prefix)) {
                values.invalidate(key);
                deleted++;
            }
        }
        deleted += removeKeys(indexes, prefix);
        deleted += removeKeys(counters, prefix);
        return deleted;
    }

    @Override
    public void addToIndex(String indexKey, String member, double score) {
        Map<String, Double> index = indexes.computeIfAbsent(indexKey, k -> new HashMap<>());
        synchronized (index) {
            index.put(member, score);
        }
    }

    @Override
    public long indexSize(String indexKey) {
        Map<String, Double> index = indexes.get(indexKey);
        if (index == null) {
            return 0;
        }
        synchronized (index) {
            return index.size();
        }
    }

    @Override
    public List<String> indexMembers(String indexKey) {
        Map<String, Double> index = indexes.get(indexKey);
        if (index == null) {
            return List.of();
        }
        synchronized (index) {
            return sorted(index);
        }
    }

    @Override
    public List<String> popLowest(String indexKey, long count) {
        Map<String, Double> index = indexes.get(indexKey);
        if (index == null) {
            return List.of();
        }
        synchronized (index) {
            List<String> members = sorted(index);
            List<String> popped = new ArrayList<>(members.subList(0, (int) Math.min(count, members.size())));
            popped.forEach(index::remove);
            return popped;
        }
    }

    @Override
    public long removeFromIndexUpTo(String indexKey, double maxScore) {
        Map<String, Double> index = indexes.get(indexKey);
        if (index == null) {
            return 0;
        }
        synchronized (index) {
            int before = index.size();
            index.values().removeIf(score -> score <= maxScore);
            return before - index.size();
        }
    }

    @Override
    public long increment(String hashKey, String field, long delta) {
        return counters.computeIfAbsent(hashKey, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(field, k -> new AtomicLong())
                .addAndGet(delta);
    }

    @Override
    public Map<String, Long> readCounters(String hashKey) {
        Map<String, AtomicLong> hash = counters.get(hashKey);
        Map<String, Long> snapshot = new HashMap<>();
        if (hash != null) {
            hash.forEach((field, value) -> snapshot.put(field, value.get()));
        }
        return snapshot;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private static List<String> sorted(Map<String, Double> index) {
        List<Map.Entry<String, Double>> entries = new ArrayList<>(index.entrySet());
        entries.sort(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey()));
        List<String> members = new ArrayList<>(entries.size());
        for (Map.Entry<String, Double> entry : entries) {
            members.add(entry.getKey());
        }
        return members;
    }

    private static long removeKeys(Map<String, ?> map, String prefix) {
        long removed = 0;
        for (String key : new ArrayList<>(map.keySet())) {
            if (key.startsWith(prefix) && map.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    private static final class TimedValue {
        private final byte[] bytes;
        private final long ttlNanos;

        private TimedValue(byte[] bytes, long ttlNanos) {
            this.bytes = bytes;
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class PerEntryExpiry implements Expiry<String, TimedValue> {

        @Override
        public long expireAfterCreate(String key, TimedValue value, long currentTime) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, TimedValue value, long currentTime, long currentDuration) {
            return value.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, TimedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
