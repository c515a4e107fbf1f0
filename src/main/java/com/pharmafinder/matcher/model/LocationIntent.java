package com.pharmafinder.matcher.model;

/**
 * Structured interpretation of a natural-language location request.
 * {@code reasoning} is for logs only and is never parsed.
 */
public record LocationIntent(
        String originalQuery,
        String extractedLocation,
        IntentType intentType,
        double confidence,
        String reasoning,
        Source source
) {
    public enum Source {
        LLM,
        FALLBACK
    }

    public LocationIntent {
        originalQuery = originalQuery == null ? "" : originalQuery;
        extractedLocation = extractedLocation == null ? "" : extractedLocation.trim();
        intentType = intentType == null ? IntentType.GENERAL : intentType;
        confidence = Scores.clamp(confidence);
        reasoning = reasoning == null ? "" : reasoning;
        source = source == null ? Source.FALLBACK : source;
    }

    public boolean hasLocation() {
        return !extractedLocation.isEmpty();
    }
}
