package com.pharmafinder.matcher.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Terminal outcome of the matching cascade for a single query.
 */
public record MatchResult(
        String originalQuery,
        String normalizedQuery,
        String matchedCommune,
        double confidence,
        MatchMethod method,
        List<String> suggestions,
        LocationIntent locationIntent,
        long generation
) {
    public MatchResult {
        confidence = Scores.clamp(confidence);
        method = method == null ? MatchMethod.NONE : method;
        List<String> cleaned = new ArrayList<>();
        if (suggestions != null) {
            for (String suggestion : suggestions) {
                if (suggestion != null && !suggestion.equals(matchedCommune) && !cleaned.contains(suggestion)) {
                    cleaned.add(suggestion);
                }
            }
        }
        suggestions = List.copyOf(cleaned);
    }

    public boolean isMatched() {
        return matchedCommune != null;
    }

    public Optional<LocationIntent> intent() {
        return Optional.ofNullable(locationIntent);
    }
}
