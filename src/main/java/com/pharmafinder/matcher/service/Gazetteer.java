package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.CommuneRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable reference structure of canonical communes and their normalized aliases.
 * Construction is the only mutation point; every read afterwards is thread-safe.
 */
public final class Gazetteer {

    private static final Logger logger = LoggerFactory.getLogger(Gazetteer.class);

    private static final int TIER_CANONICAL = 0;
    private static final int TIER_EXPLICIT = 1;
    private static final int TIER_DERIVED = 2;

    private final Map<String, CommuneRecord> records;
    private final Map<String, String> aliasIndex;
    private final Map<String, Set<String>> aliasesByCommune;
    private final List<String> popularityOrder;

    private Gazetteer(Map<String, CommuneRecord> records,
                      Map<String, String> aliasIndex,
                      Map<String, Set<String>> aliasesByCommune) {
        this.records = Collections.unmodifiableMap(records);
        this.aliasIndex = Collections.unmodifiableMap(aliasIndex);
        this.aliasesByCommune = Collections.unmodifiableMap(aliasesByCommune);

        List<String> order = new ArrayList<>(records.keySet());
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            position.put(order.get(i), i);
        }
        order.sort(Comparator.comparingInt((String name) -> records.get(name).popularity()).reversed()
                .thenComparing(position::get));
        this.popularityOrder = List.copyOf(order);
    }

    /**
     * Builds a gazetteer from reference records.
     *
     * @throws DataUnavailableException when no records are supplied or a canonical name repeats
     */
    public static Gazetteer build(Collection<CommuneRecord> input,
                                  TextNormalizer normalizer,
                                  AliasDeriver aliasDeriver) {
        if (input == null || input.isEmpty()) {
            throw new DataUnavailableException("Commune reference data is empty; cannot build gazetteer");
        }

        Map<String, CommuneRecord> byName = new LinkedHashMap<>();
        for (CommuneRecord record : input) {
            if (record == null || record.canonicalName().isBlank()) {
                continue;
            }
            if (byName.putIfAbsent(record.canonicalName(), record) != null) {
                throw new DataUnavailableException("Duplicate canonical commune name: " + record.canonicalName());
            }
        }
        if (byName.isEmpty()) {
            throw new DataUnavailableException("Commune reference data has no named records");
        }

        Map<String, String> owner = new HashMap<>();
        Map<String, Integer> ownerTier = new HashMap<>();
        Set<String> ambiguous = new HashSet<>();

        for (CommuneRecord record : byName.values()) {
            claim(normalizer.normalizeText(record.canonicalName()), record.canonicalName(), TIER_CANONICAL,
                    owner, ownerTier, ambiguous);
        }
        for (CommuneRecord record : byName.values()) {
            for (String alias : record.aliases()) {
                claim(normalizer.normalizeText(alias), record.canonicalName(), TIER_EXPLICIT,
                        owner, ownerTier, ambiguous);
            }
        }
        Map<String, Set<String>> derivedByCommune = new LinkedHashMap<>();
        for (CommuneRecord record : byName.values()) {
            Set<String> derived = aliasDeriver.derive(record.canonicalName());
            derivedByCommune.put(record.canonicalName(), derived);
            for (String alias : derived) {
                claim(normalizer.normalizeText(alias), record.canonicalName(), TIER_DERIVED,
                        owner, ownerTier, ambiguous);
            }
        }
        for (String alias : ambiguous) {
            owner.remove(alias);
        }

        Map<String, String> aliasIndex = new HashMap<>(owner);
        Map<String, Set<String>> aliasesByCommune = new LinkedHashMap<>();
        for (String name : byName.keySet()) {
            aliasesByCommune.put(name, new LinkedHashSet<>());
        }
        List<String> sortedAliases = new ArrayList<>(owner.keySet());
        Collections.sort(sortedAliases);
        for (String alias : sortedAliases) {
            aliasesByCommune.get(owner.get(alias)).add(alias);
        }

        Map<String, CommuneRecord> finalRecords = new LinkedHashMap<>();
        for (CommuneRecord record : byName.values()) {
            Set<String> kept = new LinkedHashSet<>(record.aliases());
            for (String alias : derivedByCommune.get(record.canonicalName())) {
                if (record.canonicalName().equals(owner.get(normalizer.normalizeText(alias)))) {
                    kept.add(alias);
                }
            }
            finalRecords.put(record.canonicalName(), record.withAliases(kept));
            aliasesByCommune.put(record.canonicalName(),
                    Collections.unmodifiableSet(aliasesByCommune.get(record.canonicalName())));
        }

        logger.info("Gazetteer built with {} communes and {} normalized aliases ({} ambiguous aliases dropped)",
                finalRecords.size(), aliasIndex.size(), ambiguous.size());
        return new Gazetteer(finalRecords, aliasIndex, aliasesByCommune);
    }

    private static void claim(String alias,
                              String commune,
                              int tier,
                              Map<String, String> owner,
                              Map<String, Integer> ownerTier,
                              Set<String> ambiguous) {
        if (alias.isEmpty()) {
            return;
        }
        String current = owner.get(alias);
        if (current == null) {
            owner.put(alias, commune);
            ownerTier.put(alias, tier);
            return;
        }
        if (current.equals(commune)) {
            ownerTier.put(alias, Math.min(tier, ownerTier.get(alias)));
            return;
        }
        int currentTier = ownerTier.get(alias);
        if (tier > currentTier) {
            logger.debug("Alias '{}' of {} shadowed by {}", alias, commune, current);
        } else if (tier == TIER_DERIVED) {
            ambiguous.add(alias);
        } else {
            logger.warn("Alias '{}' claimed by both {} and {}; keeping {}", alias, current, commune, current);
        }
    }

    public Optional<String> exactLookup(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliasIndex.get(normalized));
    }

    /**
     * Every normalized alias mapped to its canonical commune name.
     */
    public Map<String, String> allAliases() {
        return aliasIndex;
    }

    public Set<String> aliasesOf(String commune) {
        return aliasesByCommune.getOrDefault(commune, Set.of());
    }

    public Optional<CommuneRecord> record(String commune) {
        return Optional.ofNullable(records.get(commune));
    }

    /**
     * Canonical names in reference-data order.
     */
    public List<String> canonicalNames() {
        return List.copyOf(records.keySet());
    }

    public Collection<CommuneRecord> records() {
        return records.values();
    }

    /**
     * Most popular communes first; reference order breaks ties.
     */
    public List<String> mostPopular(int limit) {
        return popularityOrder.subList(0, Math.min(Math.max(0, limit), popularityOrder.size()));
    }

    public int size() {
        return records.size();
    }
}
