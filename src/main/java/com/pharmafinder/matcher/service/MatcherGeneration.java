package com.pharmafinder.matcher.service;

import java.time.Instant;
import java.util.Optional;

/**
 * One fully built, immutable set of indices. Queries capture a generation once and use it
 * for their whole run; reloads replace it as a unit.
 */
public final class MatcherGeneration {

    private final long number;
    private final Instant builtAt;
    private final Gazetteer gazetteer;
    private final TrigramIndex trigramIndex;
    private final FuzzyMatcher fuzzyMatcher;
    private final EmbeddingIndex embeddingIndex;

    public MatcherGeneration(long number,
                             Instant builtAt,
                             Gazetteer gazetteer,
                             TrigramIndex trigramIndex,
                             FuzzyMatcher fuzzyMatcher,
                             EmbeddingIndex embeddingIndex) {
        this.number = number;
        this.builtAt = builtAt;
        this.gazetteer = gazetteer;
        this.trigramIndex = trigramIndex;
        this.fuzzyMatcher = fuzzyMatcher;
        this.embeddingIndex = embeddingIndex;
    }

    public long number() {
        return number;
    }

    public Instant builtAt() {
        return builtAt;
    }

    public Gazetteer gazetteer() {
        return gazetteer;
    }

    public TrigramIndex trigramIndex() {
        return trigramIndex;
    }

    public FuzzyMatcher fuzzyMatcher() {
        return fuzzyMatcher;
    }

    /**
     * Absent when embeddings are disabled or the provider failed while this generation was built.
     */
    public Optional<EmbeddingIndex> embeddingIndex() {
        return Optional.ofNullable(embeddingIndex);
    }
}
