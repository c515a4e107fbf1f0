package com.pharmafinder.matcher.service;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives the spelling variants users type for a canonical commune name.
 */
@Component
public class AliasDeriver {

    private static final Set<String> LEADING_ARTICLES = Set.of("la", "las", "el", "los", "de", "del");
    private static final Set<String> TRAILING_QUALIFIERS = Set.of("norte", "sur", "este", "oeste", "alto", "bajo");

    private final TextNormalizer normalizer;

    public AliasDeriver(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Returns the canonical name followed by its derived variants, in a stable order.
     * "La Florida" yields "Florida"; "Puente Alto" yields "Puente".
     */
    public Set<String> derive(String canonicalName) {
        Set<String> variants = new LinkedHashSet<>();
        if (canonicalName == null || canonicalName.isBlank()) {
            return variants;
        }
        String name = canonicalName.trim();
        variants.add(name);
        variants.add(normalizer.normalizeText(name));
        variants.add(normalizer.stripAccents(name));
        variants.add(name.toUpperCase(Locale.ROOT));
        variants.add(name.toLowerCase(Locale.ROOT));

        List<String> words = Arrays.asList(name.split("\\s+"));
        if (words.size() > 1) {
            String first = normalizer.normalizeText(words.get(0));
            if (LEADING_ARTICLES.contains(first)) {
                variants.add(String.join(" ", words.subList(1, words.size())));
            }
            String last = normalizer.normalizeText(words.get(words.size() - 1));
            if (TRAILING_QUALIFIERS.contains(last)) {
                variants.add(String.join(" ", words.subList(0, words.size() - 1)));
            }
        }
        variants.remove("");
        return variants;
    }
}
