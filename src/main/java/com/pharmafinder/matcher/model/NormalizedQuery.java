package com.pharmafinder.matcher.model;

import java.util.Arrays;
import java.util.List;

/**
 * A user query paired with its accent-free, lower-cased, punctuation-free form.
 */
public record NormalizedQuery(String original, String normalized) {

    public NormalizedQuery {
        original = original == null ? "" : original;
        normalized = normalized == null ? "" : normalized;
    }

    public boolean isEmpty() {
        return normalized.isEmpty();
    }

    public List<String> tokens() {
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}
