package com.pharmafinder.matcher.service;

import java.util.List;
import java.util.Set;

/**
 * Spanish words that mark a query as a request phrased in natural language rather than a
 * bare commune name. All entries are in normalized (accent-free, lower-case) form.
 */
public final class SpanishQueryLexicon {

    /** Verbs, nouns and fillers of a pharmacy request; dropped anywhere in the phrase. */
    public static final Set<String> INTENT_WORDS = Set.of(
            "farmacia", "farmacias", "botica", "boticas", "turno", "turnos", "abierta", "abiertas",
            "abierto", "abiertos", "buscar", "busco", "buscando", "encontrar", "encuentra", "necesito",
            "necesita", "quiero", "queria", "dame", "muestrame", "mostrar", "hay", "donde", "cual",
            "cuales", "que", "medicamento", "medicamentos", "remedio", "remedios", "comuna", "sector",
            "por", "favor", "hola", "porfa", "urgente", "hoy", "ahora", "cerca", "cercana", "cercanas",
            "mi", "me", "alguna", "algunas", "una", "unas", "un", "esta", "estan", "ciudad", "zona"
    );

    /** Prepositions trimmed from the edges of an extracted phrase; kept inside names. */
    public static final Set<String> EDGE_PREPOSITIONS = Set.of(
            "en", "de", "del", "a", "al", "para", "por", "con", "sin", "cerca", "y", "o", "u", "hacia", "desde"
    );

    /** Articles; meaningless as a location on their own. */
    public static final Set<String> ARTICLES = Set.of("el", "la", "los", "las", "lo");

    private SpanishQueryLexicon() {
    }

    /**
     * Lexicon lookup that also folds Spanish plurals ("urgentes", "sectores") onto their
     * singular entry.
     */
    public static boolean isIntentWord(String token) {
        if (INTENT_WORDS.contains(token)) {
            return true;
        }
        if (token.length() > 3 && token.endsWith("es") && INTENT_WORDS.contains(token.substring(0, token.length() - 2))) {
            return true;
        }
        return token.length() > 2 && token.endsWith("s") && INTENT_WORDS.contains(token.substring(0, token.length() - 1));
    }

    /**
     * Whether the normalized tokens read as a sentence: an intent word anywhere, a leading
     * preposition, or more tokens than a commune name has.
     */
    public static boolean looksLikeSentence(List<String> tokens, int maxNameTokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        if (tokens.size() > maxNameTokens) {
            return true;
        }
        if (EDGE_PREPOSITIONS.contains(tokens.get(0)) && tokens.size() > 1) {
            return true;
        }
        for (String token : tokens) {
            if (isIntentWord(token)) {
                return true;
            }
        }
        return false;
    }

    public static boolean mentionsPharmacy(List<String> tokens) {
        for (String token : tokens) {
            if (token.startsWith("farmacia") || token.startsWith("botica") || token.startsWith("turno")
                    || token.startsWith("medicamento") || token.startsWith("remedio")) {
                return true;
            }
        }
        return false;
    }
}
