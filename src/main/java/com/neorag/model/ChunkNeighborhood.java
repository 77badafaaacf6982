package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk together with the chunks linked before and after it and its owning document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkNeighborhood {

    private String chunkId;
    private String current;
    private Long position;
    private String previous;
    private String next;
    private String documentTitle;
    private String documentId;
}
