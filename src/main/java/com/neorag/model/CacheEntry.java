package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One previously answered question as written to the cache store.
 * The id is a hash of the normalized question; two different questions may in principle
 * share an id, in which case the later one replaces the earlier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private String id;
    private float[] embedding;
    private String question;
    private CachedAnswer payload;
    private Instant createdAt;
}
