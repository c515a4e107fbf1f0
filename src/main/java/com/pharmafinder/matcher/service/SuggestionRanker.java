package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.ScoredCandidate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges candidate lists from several strategies into one ordered suggestion list.
 */
@Component
public class SuggestionRanker {

    public static final int DEFAULT_LIMIT = 5;

    public List<String> rank(Collection<? extends Collection<ScoredCandidate>> candidateLists, String excluding) {
        return rank(candidateLists, excluding, DEFAULT_LIMIT);
    }

    /**
     * Drops {@code excluding}, keeps each commune's highest score across lists, orders by
     * score descending (name on ties) and truncates to {@code limit}.
     */
    public List<String> rank(Collection<? extends Collection<ScoredCandidate>> candidateLists,
                             String excluding,
                             int limit) {
        if (candidateLists == null || limit <= 0) {
            return List.of();
        }
        Map<String, Double> best = new HashMap<>();
        for (Collection<ScoredCandidate> candidates : candidateLists) {
            if (candidates == null) {
                continue;
            }
            for (ScoredCandidate candidate : candidates) {
                if (candidate == null || candidate.commune().equals(excluding)) {
                    continue;
                }
                best.merge(candidate.commune(), candidate.score(), Math::max);
            }
        }
        List<ScoredCandidate> merged = new ArrayList<>(best.size());
        best.forEach((commune, score) -> merged.add(new ScoredCandidate(commune, score)));
        merged.sort(ScoredCandidate.BY_SCORE_DESC);

        List<String> ranked = new ArrayList<>(Math.min(limit, merged.size()));
        for (ScoredCandidate candidate : merged) {
            if (ranked.size() >= limit) {
                break;
            }
            ranked.add(candidate.commune());
        }
        return List.copyOf(ranked);
    }
}
