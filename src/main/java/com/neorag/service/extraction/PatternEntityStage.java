package com.neorag.service.extraction;

import com.neorag.model.ExtractedEntity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Capitalised word runs ("Alan Turing", "Москва") as CONCEPT entities.
 * Works for any script with upper/lower case letters.
 */
public class PatternEntityStage implements ExtractionStage {

    private static final Pattern CAPITALISED_PHRASE =
            Pattern.compile("\\b\\p{Lu}\\p{Ll}+(?:\\s+\\p{Lu}\\p{Ll}+)*\\b");

    private static final int MIN_LENGTH_EXCLUSIVE = 3;

    private final Set<String> stopWords;
    private final int maxEntities;

    public PatternEntityStage(List<String> stopWords, int maxEntities) {
        this.stopWords = Set.copyOf(stopWords);
        this.maxEntities = maxEntities;
    }

    @Override
    public String name() {
        return "pattern";
    }

    @Override
    public Optional<List<ExtractedEntity>> run(String text) {
        Set<String> seen = new LinkedHashSet<>();
        Matcher matcher = CAPITALISED_PHRASE.matcher(text);
        while (matcher.find() && seen.size() < maxEntities) {
            String match = matcher.group();
            if (match.length() > MIN_LENGTH_EXCLUSIVE && !stopWords.contains(match)) {
                seen.add(match);
            }
        }

        if (seen.isEmpty()) {
            return Optional.empty();
        }

        List<ExtractedEntity> entities = new ArrayList<>(seen.size());
        for (String name : seen) {
            entities.add(ExtractedEntity.builder()
                    .name(name)
                    .type("CONCEPT")
                    .description("Extracted by pattern")
                    .build());
        }
        return Optional.of(entities);
    }
}
