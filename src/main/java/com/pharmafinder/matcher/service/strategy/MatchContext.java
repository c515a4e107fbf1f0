package com.pharmafinder.matcher.service.strategy;

import com.pharmafinder.matcher.model.NormalizedQuery;
import com.pharmafinder.matcher.service.MatcherGeneration;

/**
 * Inputs of one strategy run: the generation captured for the query, the raw user text and
 * the current working query (possibly rewritten by location extraction).
 */
public record MatchContext(MatcherGeneration generation, String originalQuery, NormalizedQuery workingQuery) {

    public MatchContext withWorkingQuery(NormalizedQuery rewritten) {
        return new MatchContext(generation, originalQuery, rewritten);
    }
}
