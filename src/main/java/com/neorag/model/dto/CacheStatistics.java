package com.neorag.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Semantic cache statistics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Number of live entries in the cache index.
     */
    private long cacheSize;

    private long maxCacheSize;

    /**
     * Successful writes since the last clear.
     */
    private long totalCached;

    private long totalHits;

    private long totalMisses;

    /**
     * Store failures and undecodable entries.
     */
    private long totalErrors;

    /**
     * Always totalHits + totalMisses.
     */
    private long totalRequests;

    /**
     * Hit rate in percent (0-100), rounded to two decimals; 0 when there were no requests.
     */
    private double hitRate;

    private double similarityThreshold;

    private long ttlSeconds;
}
