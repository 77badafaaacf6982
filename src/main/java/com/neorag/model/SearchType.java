package com.neorag.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval route that produced an answer.
 */
public enum SearchType {

    VECTOR("vector"),
    HYBRID("hybrid");

    private final String tag;

    SearchType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
