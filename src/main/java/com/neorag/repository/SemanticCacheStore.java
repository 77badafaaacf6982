package com.neorag.repository;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store backing the semantic cache.
 *
 * Besides plain values with a TTL it needs a score-ordered index (insertion time drives
 * FIFO eviction and scan order) and atomic counters. Implementations may throw any
 * runtime exception; the cache turns those into misses.
 */
public interface SemanticCacheStore {

    /**
     * Store a value that expires after the given TTL.
     */
    void set(String key, byte[] value, Duration ttl);

    /**
     * @return the value, or empty if absent or expired
     */
    Optional<byte[]> get(String key);

    void delete(Collection<String> keys);

    /**
     * Delete every key, index and counter hash whose name starts with the prefix.
     *
     * @return number of keys deleted
     */
    long deleteByPrefix(String prefix);

    /**
     * Add a member to the index, or move it to the new score if already present.
     */
    void addToIndex(String indexKey, String member, double score);

    long indexSize(String indexKey);

    /**
     * @return all members, lowest score first; ties in member order
     */
    List<String> indexMembers(String indexKey);

    /**
     * Remove and return the lowest-scored members.
     */
    List<String> popLowest(String indexKey, long count);

    /**
     * Remove every member with a score less than or equal to maxScore.
     *
     * @return number of members removed
     */
    long removeFromIndexUpTo(String indexKey, double maxScore);

    /**
     * Atomically add delta to a counter field.
     *
     * @return the new value
     */
    long increment(String hashKey, String field, long delta);

    /**
     * @return all counter fields of the hash; empty if it does not exist
     */
    Map<String, Long> readCounters(String hashKey);

    /**
     * Liveness probe.
     */
    boolean ping();
}
