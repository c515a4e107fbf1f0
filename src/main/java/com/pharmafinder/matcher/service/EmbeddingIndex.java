package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Precomputed alias embeddings grouped by commune. A commune scores the best cosine
 * similarity across its aliases.
 */
public final class EmbeddingIndex {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddingIndex.class);

    private final Map<String, List<float[]>> vectorsByCommune;
    private final int dimension;

    private EmbeddingIndex(Map<String, List<float[]>> vectorsByCommune, int dimension) {
        this.vectorsByCommune = vectorsByCommune;
        this.dimension = dimension;
    }

    /**
     * Encodes every distinct alias of the gazetteer once.
     *
     * @throws SignalUnavailableException when the provider fails for any alias
     */
    public static EmbeddingIndex build(Gazetteer gazetteer, EmbeddingProvider provider) {
        Map<String, float[]> encoded = new HashMap<>();
        Map<String, List<float[]>> vectors = new LinkedHashMap<>();
        int dimension = -1;
        for (String commune : gazetteer.canonicalNames()) {
            List<float[]> communeVectors = new ArrayList<>();
            for (String alias : gazetteer.aliasesOf(commune)) {
                float[] vector = encoded.get(alias);
                if (vector == null) {
                    vector = provider.encode(alias);
                    if (vector == null || vector.length == 0) {
                        throw new SignalUnavailableException("Empty embedding for alias '" + alias + "'");
                    }
                    if (dimension < 0) {
                        dimension = vector.length;
                    } else if (vector.length != dimension) {
                        throw new SignalUnavailableException("Embedding dimension changed from " + dimension
                                + " to " + vector.length);
                    }
                    encoded.put(alias, vector);
                }
                communeVectors.add(vector);
            }
            vectors.put(commune, Collections.unmodifiableList(communeVectors));
        }
        logger.info("Embedding index built: {} vectors for {} communes (dimension {})",
                encoded.size(), vectors.size(), dimension);
        return new EmbeddingIndex(Collections.unmodifiableMap(vectors), dimension);
    }

    public List<ScoredCandidate> search(float[] queryVector, int topK) {
        if (queryVector == null || queryVector.length != dimension || topK <= 0) {
            return List.of();
        }
        List<ScoredCandidate> scored = new ArrayList<>(vectorsByCommune.size());
        for (Map.Entry<String, List<float[]>> entry : vectorsByCommune.entrySet()) {
            double best = 0.0;
            for (float[] vector : entry.getValue()) {
                best = Math.max(best, cosine(queryVector, vector));
            }
            if (best > 0.0) {
                scored.add(new ScoredCandidate(entry.getKey(), best));
            }
        }
        scored.sort(ScoredCandidate.BY_SCORE_DESC);
        return scored.size() > topK ? List.copyOf(scored.subList(0, topK)) : List.copyOf(scored);
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public int dimension() {
        return dimension;
    }

    public int communeCount() {
        return vectorsByCommune.size();
    }
}
