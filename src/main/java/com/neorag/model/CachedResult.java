package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Cache hit: the stored answer plus how it matched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedResult {

    private String answer;
    private List<SourceInfo> sources;
    private String searchType;
    private List<String> processingSteps;

    /**
     * Cosine similarity between the incoming and the cached question embedding.
     */
    private double similarity;

    /**
     * Question text of the cache entry that matched.
     */
    private String originalQuery;
}
