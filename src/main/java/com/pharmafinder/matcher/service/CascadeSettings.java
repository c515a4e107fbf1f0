package com.pharmafinder.matcher.service;

/**
 * Acceptance thresholds and limits of the matching cascade. The defaults come from the
 * first deployment and are not calibrated against query logs.
 *
 * @param embeddingAccept    minimum cosine for an embedding win
 * @param fuzzyAccept        minimum fuzzy ratio for an immediate fuzzy win
 * @param trigramAccept      minimum Jaccard for a trigram win
 * @param defaultConfidence  caller threshold used when none is given
 * @param suggestionLimit    default number of suggestions
 * @param maxNameTokens      longest commune name, in tokens, before a query reads as a sentence
 * @param maxQueryLength     characters of user text considered; the rest is ignored
 */
public record CascadeSettings(
        double embeddingAccept,
        double fuzzyAccept,
        double trigramAccept,
        double defaultConfidence,
        int suggestionLimit,
        int maxNameTokens,
        int maxQueryLength
) {
    public static CascadeSettings defaults() {
        return new CascadeSettings(0.85, 0.9, 0.6, 0.7, SuggestionRanker.DEFAULT_LIMIT, 5, 200);
    }
}
