package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer to a question, either freshly generated or served from the semantic cache.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    private String question;
    private String answer;
    private List<SourceInfo> sources;
    private String searchType;
    private List<String> processingSteps;
    private boolean cached;
    private Double cacheSimilarity;
    private String originalQuery;
}
