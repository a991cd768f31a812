package com.conciliator.engine.services.statements.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DescriptionCleaner {

    private static final Pattern REFERENCE_TOKEN = Pattern.compile("\\b(?=[A-Z0-9]*\\d)[A-Z0-9]{6,}\\b");
    private static final Pattern REF_FRAGMENT = Pattern.compile("(?i)\\bref(?:erencia)?\\b[:.]?\\s*[\\w-]+");
    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b\\d{1,2}[/\\-]\\d{1,2}(?:[/\\-]\\d{2,4})?\\b");
    private static final Pattern AMOUNT = Pattern.compile("(?<![\\w.])-?\\$?\\s?\\d{1,3}(?:,\\d{3})*\\.\\d{2}(?![\\d])");
    private static final Pattern EMPTY_PARENS = Pattern.compile("\\(\\s*\\)");
    private static final Pattern LEADING_FOLIO = Pattern.compile("^\\d{6,}\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DescriptionCleaner() {
    }

    /**
     * Removes dates, amounts, "Ref: ..." fragments, empty parentheses and a leading folio number.
     */
    public static String clean(String raw) {
        if (raw == null) return "";
        String s = WHITESPACE.matcher(raw).replaceAll(" ").trim();
        s = REF_FRAGMENT.matcher(s).replaceAll(" ");
        s = NUMERIC_DATE.matcher(s).replaceAll(" ");
        s = AMOUNT.matcher(s).replaceAll(" ");
        s = EMPTY_PARENS.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        s = LEADING_FOLIO.matcher(s).replaceFirst("");
        return s.trim();
    }

    /**
     * Longest upper-case alphanumeric token of 6+ characters that contains a digit.
     */
    public static String extractReference(String line) {
        if (line == null || line.isBlank()) return null;
        Matcher m = REFERENCE_TOKEN.matcher(line);
        String best = null;
        while (m.find()) {
            String token = m.group();
            if (best == null || token.length() > best.length()) {
                best = token;
            }
        }
        return best;
    }
}
