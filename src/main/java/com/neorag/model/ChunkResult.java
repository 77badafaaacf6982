package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One retrieved passage. Lives only for the duration of a single retrieval call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResult {

    private String chunkId;
    private String text;
    private double score;

    /**
     * Passage text with its neighbours; null for plain vector search results.
     */
    private String enrichedText;

    private String docTitle;

    /**
     * Text that goes into the prompt and into the answer sources.
     */
    public String contextText() {
        return enrichedText != null ? enrichedText : text;
    }

    public SourceInfo toSource() {
        return SourceInfo.builder()
                .text(contextText())
                .score(score)
                .docTitle(docTitle != null ? docTitle : "Unknown")
                .build();
    }
}
