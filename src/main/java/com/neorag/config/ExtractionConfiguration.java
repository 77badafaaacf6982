package com.neorag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neorag.provider.LlmProvider;
import com.neorag.service.extraction.ExtractionChain;
import com.neorag.service.extraction.ExtractionStage;
import com.neorag.service.extraction.LlmEntityStage;
import com.neorag.service.extraction.PatternEntityStage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Entity extraction chain: LLM first when enabled, capitalised-phrase pattern as fallback.
 */
@Slf4j
@Configuration
public class ExtractionConfiguration {

    @Bean
    public ExtractionChain extractionChain(NeoragProperties properties,
                                           LlmProvider llmProvider,
                                           ObjectMapper objectMapper) {
        NeoragProperties.ExtractionConfig extraction = properties.getExtraction();

        List<ExtractionStage> stages = new ArrayList<>();
        if (extraction.isLlmEnabled()) {
            stages.add(new LlmEntityStage(llmProvider, objectMapper,
                    properties.getOllama().getTimeout(), extraction.getMaxEntities()));
        }
        stages.add(new PatternEntityStage(extraction.getStopWords(), extraction.getMaxEntities()));

        ExtractionChain chain = new ExtractionChain(stages);
        log.info("Entity extraction stages: {}", chain.stageNames());
        return chain;
    }
}
