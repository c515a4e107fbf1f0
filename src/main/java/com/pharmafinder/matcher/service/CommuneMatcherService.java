package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.CommuneRecord;
import com.pharmafinder.matcher.model.MatchResult;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for resolving free-text locations to canonical Chilean communes.
 * Matching is synchronous and safe to call from any number of threads; each call captures
 * the active generation once, so a concurrent reload never mixes two generations.
 */
@Service
public class CommuneMatcherService {

    private static final Logger logger = LoggerFactory.getLogger(CommuneMatcherService.class);

    private final GazetteerRegistry registry;
    private final MatchingCascade cascade;
    private final ReferenceDataLoader referenceDataLoader;
    private final TextNormalizer normalizer;
    private final Object sourceLock = new Object();
    private volatile String loadedContentHash;

    public CommuneMatcherService(GazetteerRegistry registry,
                                 MatchingCascade cascade,
                                 ReferenceDataLoader referenceDataLoader,
                                 TextNormalizer normalizer) {
        this.registry = registry;
        this.cascade = cascade;
        this.referenceDataLoader = referenceDataLoader;
        this.normalizer = normalizer;
    }

    /**
     * Loads the configured reference data. Missing or empty data stops the application.
     */
    @PostConstruct
    public void initialize() {
        ReferenceDataLoader.Snapshot snapshot = referenceDataLoader.load();
        synchronized (sourceLock) {
            registry.install(snapshot.records());
            loadedContentHash = snapshot.contentHash();
        }
    }

    public MatchResult match(String query) {
        return match(query, cascade.settings().defaultConfidence());
    }

    /**
     * @param confidenceThreshold minimum fuzzy ratio accepted after the trigram step, in [0, 1]
     * @throws IllegalArgumentException when the threshold is outside [0, 1]
     * @throws DataUnavailableException when no reference data has been loaded
     */
    public MatchResult match(String query, double confidenceThreshold) {
        requireUnitInterval(confidenceThreshold);
        return cascade.match(registry.current(), query, confidenceThreshold);
    }

    public List<String> suggestions(String query) {
        return suggestions(query, cascade.settings().suggestionLimit());
    }

    /**
     * Ranked communes for a partially typed query, the matched commune (if any) first.
     * An empty query yields the most popular communes.
     */
    public List<String> suggestions(String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        MatchResult result = cascade.match(registry.current(), query, cascade.settings().defaultConfidence(), limit);
        List<String> ranked = new ArrayList<>(limit);
        if (result.isMatched()) {
            ranked.add(result.matchedCommune());
        }
        for (String suggestion : result.suggestions()) {
            if (ranked.size() >= limit) {
                break;
            }
            ranked.add(suggestion);
        }
        return List.copyOf(ranked);
    }

    /**
     * Replaces the active generation with one built from {@code records}. In-flight queries
     * finish on the generation they captured.
     *
     * @throws DataUnavailableException when the records are empty; the previous generation stays active
     */
    public void reload(Collection<CommuneRecord> records) {
        Objects.requireNonNull(records, "records");
        synchronized (sourceLock) {
            registry.install(records);
            loadedContentHash = null;
        }
    }

    /**
     * Re-reads the configured reference data and installs it when its content changed.
     *
     * @return whether a new generation was installed
     * @throws DataUnavailableException when the source is missing or invalid; the previous generation stays active
     */
    public boolean reloadFromSource() {
        synchronized (sourceLock) {
            ReferenceDataLoader.Snapshot snapshot = referenceDataLoader.load();
            if (snapshot.contentHash() != null && snapshot.contentHash().equals(loadedContentHash)) {
                logger.debug("Reference data at {} unchanged", referenceDataLoader.location());
                return false;
            }
            registry.install(snapshot.records());
            loadedContentHash = snapshot.contentHash();
            return true;
        }
    }

    /**
     * Looks up a commune by canonical name or any alias.
     */
    public Optional<CommuneRecord> describe(String commune) {
        if (commune == null) {
            return Optional.empty();
        }
        Gazetteer gazetteer = registry.current().gazetteer();
        return gazetteer.exactLookup(normalizer.normalizeText(commune)).flatMap(gazetteer::record);
    }

    public long currentGeneration() {
        return registry.current().number();
    }

    private static void requireUnitInterval(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]: " + threshold);
        }
    }
}
