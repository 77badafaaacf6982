package com.neorag.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed cache store.
 * Values are raw bytes under their own TTL; the index is a sorted set and the counters a hash.
 */
@Slf4j
public class RedisSemanticCacheStore implements SemanticCacheStore {

    private final RedisTemplate<String, byte[]> bytesTemplate;
    private final StringRedisTemplate stringTemplate;

    public RedisSemanticCacheStore(RedisTemplate<String, byte[]> bytesTemplate,
                                   StringRedisTemplate stringTemplate) {
        this.bytesTemplate = bytesTemplate;
        this.stringTemplate = stringTemplate;
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        bytesTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(bytesTemplate.opsForValue().get(key));
    }

    @Override
    public void delete(Collection<String> keys) {
        if (!keys.isEmpty()) {
            bytesTemplate.delete(keys);
        }
    }

    @Override
    public long deleteByPrefix(String prefix) {
        Set<String> keys = stringTemplate.keys(prefix + "*");
        if (keys == null || keys.isEmpty()) {
            return 0;
        }
        Long deleted = stringTemplate.delete(keys);
        log.debug("Deleted {} Redis keys with prefix {}", deleted, prefix);
        return deleted != null ? deleted : 0;
    }

    @Override
    public void addToIndex(String indexKey, String member, double score) {
        stringTemplate.opsForZSet().add(indexKey, member, score);
    }

    @Override
    public long indexSize(String indexKey) {
        Long size = stringTemplate.opsForZSet().zCard(indexKey);
        return size != null ? size : 0;
    }

    @Override
    public List<String> indexMembers(String indexKey) {
        Set<String> members = stringTemplate.opsForZSet().range(indexKey, 0, -1);
        return members != null ? new ArrayList<>(members) : List.of();
    }

    @Override
    public List<String> popLowest(String indexKey, long count) {
        Set<ZSetOperations.TypedTuple<String>> popped = stringTemplate.opsForZSet().popMin(indexKey, count);
        List<String> members = new ArrayList<>();
        if (popped != null) {
            for (ZSetOperations.TypedTuple<String> tuple : popped) {
                members.add(tuple.getValue());
            }
        }
        return members;
    }

    @Override
    public long removeFromIndexUpTo(String indexKey, double maxScore) {
        Long removed = stringTemplate.opsForZSet().removeRangeByScore(indexKey, Double.NEGATIVE_INFINITY, maxScore);
        return removed != null ? removed : 0;
    }

    @Override
    public long increment(String hashKey, String field, long delta) {
        return stringTemplate.opsForHash().increment(hashKey, field, delta);
    }

    @Override
    public Map<String, Long> readCounters(String hashKey) {
        Map<Object, Object> entries = stringTemplate.opsForHash().entries(hashKey);
        Map<String, Long> counters = new HashMap<>();
        entries.forEach((field, value) -> counters.put(field.toString(), Long.parseLong(value.toString())));
        return counters;
    }

    @Override
    public boolean ping() {
        try {
            String reply = stringTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (Exception e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
