package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.NormalizedQuery;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Accent-stripping, case-folding normalizer shared by every index and strategy.
 * Pure and total: {@code null} or blank input yields an empty normalized string.
 */
@Component
public class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    // Apostrophes and dots glue words together ("O'Higgins", "Gral.")
    private static final Pattern JOINING_PUNCTUATION = Pattern.compile("['’`´.]");
    private static final Pattern OTHER_PUNCTUATION = Pattern.compile("[^\\p{L}\\p{Nd}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public NormalizedQuery normalize(String text) {
        return new NormalizedQuery(text, normalizeText(text));
    }

    public String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String lower = stripped.toLowerCase(Locale.ROOT);
        String joined = JOINING_PUNCTUATION.matcher(lower).replaceAll("");
        String spaced = OTHER_PUNCTUATION.matcher(joined).replaceAll(" ");
        return WHITESPACE.matcher(spaced).replaceAll(" ").trim();
    }

    /**
     * Removes diacritics but keeps case and punctuation, e.g. "Quilpué" to "Quilpue".
     */
    public String stripAccents(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("");
    }

    public List<String> tokens(String text) {
        String normalized = normalizeText(text);
        return normalized.isEmpty() ? List.of() : Arrays.asList(normalized.split(" "));
    }
}
