package com.pharmafinder.matcher.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Discriminant telling which cascade stage produced a {@link MatchResult}.
 */
public enum MatchMethod {
    EXACT("exact"),
    TRIGRAM("trigram"),
    FUZZY("fuzzy"),
    EMBEDDING("embedding"),
    NL_EXTRACTED("nl_extracted"),
    NONE("none");

    private final String wireName;

    MatchMethod(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
