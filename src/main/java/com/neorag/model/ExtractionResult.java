package com.neorag.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Entities found by the extraction chain and the stage that found them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResult {

    /**
     * Name of the stage that produced the entities, or "none".
     */
    private String stage;

    private List<ExtractedEntity> entities;
}
