package com.conciliator.engine.services.statements.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Parses money tokens as printed on Mexican statements ("1,234.56", "$ 1,234.56", "-350.00",
 * "350.00-", "(350.00)", "MXN 12.5"). European style "1.234,56" is also accepted.
 */
public final class AmountParser {

    /** Amount with mandatory cents, optional currency sign and thousands separators. */
    public static final String STRICT_AMOUNT = "-?\\$?\\s?\\d{1,3}(?:,\\d{3})*\\.\\d{2}|-?\\$?\\s?\\d+\\.\\d{2}";

    /** Looser token used by fallback strategies: optional cents, trailing minus, parentheses. */
    public static final String FLEXIBLE_AMOUNT =
            "[-+]?\\(?(?:\\$|MXN|USD)?\\s?\\d{1,3}(?:[,.]\\d{3})*(?:[.,]\\d{1,2})\\)?-?"
                    + "|[-+]?\\(?(?:\\$|MXN|USD)?\\s?\\d+(?:[.,]\\d{1,2})\\)?-?";

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.,]");

    private AmountParser() {
    }

    public static BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) return null;

        String s = raw.trim();
        boolean negative = s.startsWith("-")
                || s.endsWith("-")
                || (s.startsWith("(") && s.endsWith(")"));

        String digits = NON_NUMERIC.matcher(s).replaceAll("");
        if (digits.isEmpty() || digits.chars().noneMatch(Character::isDigit)) return null;

        String canonical = canonicalize(digits);
        if (canonical == null) return null;

        BigDecimal value;
        try {
            value = new BigDecimal(canonical);
        } catch (NumberFormatException e) {
            return null;
        }
        value = value.setScale(2, RoundingMode.HALF_UP);
        return negative ? value.negate() : value;
    }

    private static String canonicalize(String digits) {
        int lastComma = digits.lastIndexOf(',');
        int lastDot = digits.lastIndexOf('.');

        if (lastComma >= 0 && lastDot >= 0) {
            if (lastComma > lastDot) {
                // 1.234,56
                return digits.replace(".", "").replace(',', '.');
            }
            return digits.replace(",", "");
        }

        if (lastComma >= 0) {
            int decimals = digits.length() - lastComma - 1;
            boolean single = digits.indexOf(',') == lastComma;
            if (single && decimals >= 1 && decimals <= 2) {
                return digits.replace(',', '.');
            }
            return digits.replace(",", "");
        }

        if (lastDot >= 0 && digits.indexOf('.') != lastDot) {
            // 1.234.567 thousands only
            return digits.replace(".", "");
        }

        if (digits.startsWith(".") || digits.endsWith(".")) {
            String trimmed = digits.replace(".", "");
            return trimmed.isEmpty() ? null : trimmed;
        }
        return digits;
    }
}
