package com.pharmafinder.matcher.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical commune entry of a gazetteer generation.
 *
 * @param canonicalName unique display name, e.g. "Quilpué"
 * @param region        administrative region the commune belongs to
 * @param aliases       every spelling that resolves to this commune, explicit and derived
 * @param popularity    relative weight (pharmacy count) used for cold-start suggestions
 */
public record CommuneRecord(
        String canonicalName,
        String region,
        Set<String> aliases,
        int popularity
) {
    public CommuneRecord {
        Objects.requireNonNull(canonicalName, "canonicalName");
        aliases = aliases == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(aliases));
        popularity = Math.max(0, popularity);
    }

    public static CommuneRecord of(String canonicalName, String region) {
        return new CommuneRecord(canonicalName, region, Set.of(), 0);
    }

    public CommuneRecord withAliases(Set<String> merged) {
        return new CommuneRecord(canonicalName, region, merged, popularity);
    }
}
