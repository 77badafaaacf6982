package com.neorag.service.retrieval;

import com.neorag.model.ChunkNeighborhood;

import java.util.ArrayList;
import java.util.List;

/**
 * Joins a chunk with its neighbours into one labelled passage.
 */
public final class ContextEnricher {

    static final String PREVIOUS_LABEL = "[Previous]: ";
    static final String MAIN_LABEL = "[Main]: ";
    static final String NEXT_LABEL = "[Next]: ";

    private static final String SEPARATOR = "\n\n";

    private ContextEnricher() {
    }

    /**
     * Missing neighbours (start or end of a document) are left out rather than rendered empty.
     */
    public static String enrich(ChunkNeighborhood neighborhood) {
        List<String> blocks = new ArrayList<>(3);
        if (hasText(neighborhood.getPrevious())) {
            blocks.add(PREVIOUS_LABEL + neighborhood.getPrevious());
        }
        blocks.add(MAIN_LABEL + (neighborhood.getCurrent() != null ? neighborhood.getCurrent() : ""));
        if (hasText(neighborhood.getNext())) {
            blocks.add(NEXT_LABEL + neighborhood.getNext());
        }
        return String.join(SEPARATOR, blocks);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
