package com.neorag.service.extraction;

import com.neorag.model.ExtractedEntity;

import java.util.List;
import java.util.Optional;

/**
 * One strategy for finding entities in text.
 */
public interface ExtractionStage {

    String name();

    /**
     * @return entities found, or empty when this stage has nothing to offer
     */
    Optional<List<ExtractedEntity>> run(String text);
}
