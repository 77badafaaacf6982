package com.neorag.service.workflow;

import com.neorag.config.NeoragProperties;
import com.neorag.model.SearchType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Definitional questions ("what is", "explain", ...) go to plain vector search,
 * everything else to hybrid search.
 */
@Component
public class KeywordRouteClassifier implements RouteClassifier {

    private final List<String> definitionalPhrases;

    @Autowired
    public KeywordRouteClassifier(NeoragProperties properties) {
        this(properties.getRetrieval().getDefinitionalPhrases());
    }

    public KeywordRouteClassifier(List<String> definitionalPhrases) {
        this.definitionalPhrases = definitionalPhrases.stream()
                .map(phrase -> phrase.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    @Override
    public SearchType classify(String question) {
        String lower = question.toLowerCase(Locale.ROOT);
        for (String phrase : definitionalPhrases) {
            if (lower.contains(phrase)) {
                return SearchType.VECTOR;
            }
        }
        return SearchType.HYBRID;
    }
}
