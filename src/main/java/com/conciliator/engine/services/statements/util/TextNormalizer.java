package com.conciliator.engine.services.statements.util;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Locale LOCALE_ES_MX = new Locale("es", "MX");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}");
    private static final Pattern UNICODE_SEPARATORS = Pattern.compile("\\p{Z}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION_NOISE = Pattern.compile("[^a-z0-9 ]");

    private TextNormalizer() {
    }

    /**
     * Lower-cases, strips accents, folds PDF separators and collapses spaces.
     * Example: "DEPÓSITO  Electrónico" => "deposito electronico"
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";

        String result = text.toLowerCase(LOCALE_ES_MX);

        result = Normalizer.normalize(result, Normalizer.Form.NFD);
        result = COMBINING_MARKS.matcher(result).replaceAll("");

        // NBSP and other separators coming from PDF extraction do not match \s.
        result = result.replace('\u00A0', ' ');
        result = UNICODE_SEPARATORS.matcher(result).replaceAll(" ");

        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Normalization used for dedup keys: {@link #normalize(String)} plus removal of punctuation noise.
     * "Pago  servicio, (CFE)." and "PAGO SERVICIO CFE" produce the same key.
     */
    public static String normalizeDescription(String text) {
        String result = PUNCTUATION_NOISE.matcher(normalize(text)).replaceAll(" ");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Word-bounded phrase lookup, both sides normalized and stripped of punctuation.
     */
    public static boolean containsPhrase(String text, String phrase) {
        String p = normalizeDescription(phrase);
        if (p.isEmpty()) return false;
        String t = normalizeDescription(text);
        if (t.isEmpty()) return false;
        return (" " + t + " ").contains(" " + p + " ");
    }

    public static boolean containsAny(String text, Collection<String> phrases) {
        if (text == null || phrases == null || phrases.isEmpty()) return false;
        String padded = " " + normalizeDescription(text) + " ";
        for (String phrase : phrases) {
            String p = normalizeDescription(phrase);
            if (!p.isEmpty() && padded.contains(" " + p + " ")) {
                return true;
            }
        }
        return false;
    }
}
