package com.neorag.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neorag.model.ExtractedEntity;
import com.neorag.provider.LlmProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the language model for entities. The reply is read as NAME|TYPE lines first,
 * then as a JSON array, then as a JSON object with an "entities" array.
 */
@Slf4j
public class LlmEntityStage implements ExtractionStage {

    static final Set<String> ACCEPTED_TYPES = Set.of("PERSON", "LOCATION", "ORGANIZATION", "DATE", "CONCEPT");

    private static final int MAX_TEXT_CHARS = 1000;

    private static final String PROMPT = """
            Extract person names, locations, organizations and dates from the text.
            Reply ONLY with this format (one per line):
            NAME|TYPE
            Where TYPE is: PERSON, LOCATION, ORGANIZATION or DATE

            Example:
            Ada Lovelace|PERSON
            London|LOCATION
            Google|ORGANIZATION

            Text: %s

            Entities:""";

    private static final Pattern CODE_FENCE = Pattern.compile("```\\w*\\s*");
    private static final Pattern JSON_ARRAY = Pattern.compile("\\[.*\\]", Pattern.DOTALL);
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*\\}", Pattern.DOTALL);

    private final LlmProvider llmProvider;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final int maxEntities;

    public LlmEntityStage(LlmProvider llmProvider, ObjectMapper objectMapper, Duration timeout, int maxEntities) {
        this.llmProvider = llmProvider;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.maxEntities = maxEntities;
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public Optional<List<ExtractedEntity>> run(String text) {
        String input = text.length() > MAX_TEXT_CHARS ? text.substring(0, MAX_TEXT_CHARS) : text;
        String response = llmProvider.generate(String.format(PROMPT, input)).block(timeout);
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        log.debug("LLM extraction reply:\n{}", response);

        List<ExtractedEntity> entities = parseLines(response);
        if (entities.isEmpty()) {
            entities = parseJsonArray(response);
        }
        if (entities.isEmpty()) {
            entities = parseJsonObject(response);
        }
        if (entities.isEmpty()) {
            log.debug("Could not read any entities from the LLM reply");
            return Optional.empty();
        }
        return Optional.of(entities.size() > maxEntities ? entities.subList(0, maxEntities) : entities);
    }

    List<ExtractedEntity> parseLines(String response) {
        List<ExtractedEntity> entities = new ArrayList<>();
        for (String line : response.strip().split("\\R")) {
            String[] parts = line.strip().split("\\|");
            if (parts.length < 2) {
                continue;
            }
            addIfValid(entities, parts[0], parts[1]);
        }
        return entities;
    }

    List<ExtractedEntity> parseJsonArray(String response) {
        Matcher matcher = JSON_ARRAY.matcher(stripFences(response));
        if (!matcher.find()) {
            return List.of();
        }
        try {
            return fromNodes(objectMapper.readTree(matcher.group()));
        } catch (JsonProcessingException e) {
            log.debug("LLM reply is not a JSON array: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    List<ExtractedEntity> parseJsonObject(String response) {
        Matcher matcher = JSON_OBJECT.matcher(stripFences(response));
        if (!matcher.find()) {
            return List.of();
        }
        try {
            return fromNodes(objectMapper.readTree(matcher.group()).path("entities"));
        } catch (JsonProcessingException e) {
            log.debug("LLM reply is not a JSON object: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private List<ExtractedEntity> fromNodes(JsonNode array) {
        List<ExtractedEntity> entities = new ArrayList<>();
        if (!array.isArray()) {
            return entities;
        }
        for (JsonNode node : array) {
            if (node.isObject() && node.hasNonNull("name") && node.hasNonNull("type")) {
                addIfValid(entities, node.get("name").asText(), node.get("type").asText());
            }
        }
        return entities;
    }

    private static void addIfValid(List<ExtractedEntity> entities, String rawName, String rawType) {
        String name = rawName.strip();
        String type = rawType.strip().toUpperCase(Locale.ROOT);
        if (name.isEmpty() || !ACCEPTED_TYPES.contains(type)) {
            return;
        }
        entities.add(ExtractedEntity.builder()
                .name(name)
                .type(type)
                .description("Type: " + type)
                .build());
    }

    private static String stripFences(String response) {
        return CODE_FENCE.matcher(response.strip()).replaceAll("");
    }
}
