package com.pharmafinder.matcher.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A commune proposed by one strategy with that strategy's score.
 */
public record ScoredCandidate(String commune, double score) {

    /** Highest score first, then canonical name so equal scores order deterministically. */
    public static final Comparator<ScoredCandidate> BY_SCORE_DESC =
            Comparator.comparingDouble(ScoredCandidate::score).reversed()
                    .thenComparing(ScoredCandidate::commune);

    public ScoredCandidate {
        Objects.requireNonNull(commune, "commune");
        score = Scores.clamp(score);
    }
}
