package com.neorag.service.extraction;

import com.neorag.model.ExtractedEntity;
import com.neorag.model.ExtractionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered list of extraction stages; the first stage with a non-empty result wins.
 */
@Slf4j
public class ExtractionChain {

    static final String NO_STAGE = "none";

    private final List<ExtractionStage> stages;

    public ExtractionChain(List<ExtractionStage> stages) {
        this.stages = List.copyOf(stages);
    }

    public ExtractionResult extract(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text must not be blank");
        }

        for (ExtractionStage stage : stages) {
            Optional<List<ExtractedEntity>> entities;
            try {
                entities = stage.run(text);
            } catch (RuntimeException e) {
                log.warn("Extraction stage {} failed, trying the next one", stage.name(), e);
                continue;
            }

            if (entities.isPresent() && !entities.get().isEmpty()) {
                log.info("Extracted {} entities with stage {}", entities.get().size(), stage.name());
                return ExtractionResult.builder()
                        .stage(stage.name())
                        .entities(entities.get())
                        .build();
            }
            log.debug("Stage {} found no entities", stage.name());
        }

        return ExtractionResult.builder()
                .stage(NO_STAGE)
                .entities(List.of())
                .build();
    }

    public List<String> stageNames() {
        return stages.stream().map(ExtractionStage::name).collect(Collectors.toList());
    }
}
