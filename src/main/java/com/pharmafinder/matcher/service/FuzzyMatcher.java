package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Edit-similarity matcher over every normalized alias of a gazetteer generation.
 * O(aliases) per query.
 */
public final class FuzzyMatcher {

    private static final int MIN_SUBSTRING_LENGTH = 3;

    private final Gazetteer gazetteer;
    private final double substringBonus;

    public FuzzyMatcher(Gazetteer gazetteer, double substringBonus) {
        this.gazetteer = gazetteer;
        this.substringBonus = Math.max(0.0, substringBonus);
    }

    /**
     * Scores every commune by its best alias ratio and returns those at or above
     * {@code threshold}, best first.
     */
    public List<ScoredCandidate> search(String normalizedQuery, double threshold) {
        if (normalizedQuery == null || normalizedQuery.isEmpty()) {
            return List.of();
        }
        Map<String, Double> best = new HashMap<>();
        for (Map.Entry<String, String> entry : gazetteer.allAliases().entrySet()) {
            double score = score(normalizedQuery, entry.getKey());
            best.merge(entry.getValue(), score, Math::max);
        }
        List<ScoredCandidate> matches = new ArrayList<>();
        best.forEach((commune, score) -> {
            if (score >= threshold && score > 0.0) {
                matches.add(new ScoredCandidate(commune, score));
            }
        });
        matches.sort(ScoredCandidate.BY_SCORE_DESC);
        return List.copyOf(matches);
    }

    double score(String query, String alias) {
        double ratio = SequenceSimilarity.ratio(query, alias);
        boolean queryIsShorter = query.length() <= alias.length();
        String shorter = queryIsShorter ? query : alias;
        String longer = queryIsShorter ? alias : query;
        if (shorter.length() >= MIN_SUBSTRING_LENGTH && longer.contains(shorter)) {
            ratio += substringBonus;
        }
        return Math.min(1.0, ratio);
    }
}
