package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.ScoredCandidate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shingle index from padded 3-character substrings to communes. Built once per gazetteer
 * generation and shared read-only across queries.
 */
public final class TrigramIndex {

    private static final String PADDING = "  ";

    private final Map<String, Set<String>> communesByShingle;
    private final Map<String, Set<String>> shinglesByCommune;

    private TrigramIndex(Map<String, Set<String>> communesByShingle, Map<String, Set<String>> shinglesByCommune) {
        this.communesByShingle = communesByShingle;
        this.shinglesByCommune = shinglesByCommune;
    }

    public static TrigramIndex build(Gazetteer gazetteer) {
        Map<String, Set<String>> communesByShingle = new HashMap<>();
        Map<String, Set<String>> shinglesByCommune = new HashMap<>();
        for (Map.Entry<String, String> entry : gazetteer.allAliases().entrySet()) {
            String commune = entry.getValue();
            for (String shingle : shingles(entry.getKey())) {
                communesByShingle.computeIfAbsent(shingle, key -> new HashSet<>()).add(commune);
                shinglesByCommune.computeIfAbsent(commune, key -> new HashSet<>()).add(shingle);
            }
        }
        Map<String, Set<String>> frozenIndex = new HashMap<>();
        communesByShingle.forEach((key, value) -> frozenIndex.put(key, Collections.unmodifiableSet(value)));
        Map<String, Set<String>> frozenSets = new HashMap<>();
        shinglesByCommune.forEach((key, value) -> frozenSets.put(key, Collections.unmodifiableSet(value)));
        return new TrigramIndex(Collections.unmodifiableMap(frozenIndex), Collections.unmodifiableMap(frozenSets));
    }

    /**
     * Padded sliding-window shingles of a normalized string: "ab" gives "  a", " ab", "ab ", "b  ".
     */
    public static Set<String> shingles(String normalized) {
        Set<String> result = new LinkedHashSet<>();
        if (normalized == null || normalized.isEmpty()) {
            return result;
        }
        String padded = PADDING + normalized + PADDING;
        for (int i = 0; i + 3 <= padded.length(); i++) {
            result.add(padded.substring(i, i + 3));
        }
        return result;
    }

    /**
     * Jaccard similarity between the query's shingles and each candidate commune's
     * aggregated shingles. Only communes sharing at least one shingle are scored.
     */
    public List<ScoredCandidate> search(String normalizedQuery, int topK) {
        Set<String> queryShingles = shingles(normalizedQuery);
        if (queryShingles.isEmpty() || topK <= 0) {
            return List.of();
        }
        Set<String> candidates = new HashSet<>();
        for (String shingle : queryShingles) {
            candidates.addAll(communesByShingle.getOrDefault(shingle, Set.of()));
        }
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (String commune : candidates) {
            Set<String> communeShingles = shinglesByCommune.get(commune);
            int intersection = 0;
            for (String shingle : queryShingles) {
                if (communeShingles.contains(shingle)) {
                    intersection++;
                }
            }
            int union = queryShingles.size() + communeShingles.size() - intersection;
            double jaccard = union == 0 ? 0.0 : (double) intersection / union;
            if (jaccard > 0.0) {
                scored.add(new ScoredCandidate(commune, jaccard));
            }
        }
        scored.sort(ScoredCandidate.BY_SCORE_DESC);
        return scored.size() > topK ? List.copyOf(scored.subList(0, topK)) : List.copyOf(scored);
    }

    public int shingleCount() {
        return communesByShingle.size();
    }
}
