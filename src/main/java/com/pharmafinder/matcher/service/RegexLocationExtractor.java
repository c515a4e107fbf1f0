package com.pharmafinder.matcher.service;

import com.pharmafinder.matcher.model.IntentType;
import com.pharmafinder.matcher.model.LocationIntent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic location extraction used whenever the LLM is unavailable or unsure:
 * removes request words (plurals included), trims edge prepositions and stray articles and
 * title-cases what remains.
 * Never throws.
 */
@Component
public class RegexLocationExtractor {

    private static final double FALLBACK_CONFIDENCE = 0.4;
    private static final List<String> LOWER_CASE_JOINERS = List.of("de", "del", "la", "las", "el", "los", "y");

    private final TextNormalizer normalizer;

    public RegexLocationExtractor(TextNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * "farmacias de turno en la florida" gives "La Florida"; "dónde hay farmacias" gives "".
     */
    public String extractLocation(String query) {
        List<String> tokens = new ArrayList<>(normalizer.tokens(query));
        tokens.removeIf(SpanishQueryLexicon::isIntentWord);
        while (!tokens.isEmpty() && isLeadingFiller(tokens)) {
            tokens.remove(0);
        }
        while (!tokens.isEmpty() && isTrailingFiller(tokens)) {
            tokens.remove(tokens.size() - 1);
        }
        if (tokens.stream().allMatch(SpanishQueryLexicon.ARTICLES::contains)) {
            return "";
        }
        return titleCase(tokens);
    }

    // An article stays at the edge only when it starts or ends a name ("La Florida").
    private static boolean isLeadingFiller(List<String> tokens) {
        String first = tokens.get(0);
        if (SpanishQueryLexicon.EDGE_PREPOSITIONS.contains(first)) {
            return true;
        }
        return SpanishQueryLexicon.ARTICLES.contains(first)
                && tokens.size() > 1 && SpanishQueryLexicon.EDGE_PREPOSITIONS.contains(tokens.get(1));
    }

    private static boolean isTrailingFiller(List<String> tokens) {
        int last = tokens.size() - 1;
        if (SpanishQueryLexicon.EDGE_PREPOSITIONS.contains(tokens.get(last))) {
            return true;
        }
        return SpanishQueryLexicon.ARTICLES.contains(tokens.get(last))
                && (last == 0 || SpanishQueryLexicon.EDGE_PREPOSITIONS.contains(tokens.get(last - 1)));
    }

    public LocationIntent extract(String query, String reason) {
        String location = extractLocation(query);
        List<String> tokens = normalizer.tokens(query);
        IntentType intentType;
        if (SpanishQueryLexicon.mentionsPharmacy(tokens)) {
            intentType = IntentType.PHARMACY_SEARCH;
        } else if (!location.isEmpty()) {
            intentType = IntentType.LOCATION_QUERY;
        } else {
            intentType = IntentType.GENERAL;
        }
        return new LocationIntent(
                query,
                location,
                intentType,
                location.isEmpty() ? 0.0 : FALLBACK_CONFIDENCE,
                "regex fallback: " + reason,
                LocationIntent.Source.FALLBACK
        );
    }

    private static String titleCase(List<String> tokens) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            String token = tokens.get(i);
            if (builder.length() > 0) {
                builder.append(' ');
            }
            if (i > 0 && LOWER_CASE_JOINERS.contains(token)) {
                builder.append(token);
            } else {
                builder.append(token.substring(0, 1).toUpperCase(Locale.ROOT)).append(token.substring(1));
            }
        }
        return builder.toString();
    }
}
