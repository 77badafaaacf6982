package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer payload stored per cache entry (the "answers" record).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedAnswer {

    private String answer;
    private List<SourceInfo> sources;
    private String searchType;
    private List<String> processingSteps;

    /**
     * Insertion time, epoch millis.
     */
    private long timestamp;
}
