package com.conciliator.engine.services.statements.util;

import java.util.List;

/**
 * Rows that only carry a balance forward ("BALANCE INICIAL", "SALDO ANTERIOR") or close the
 * statement ("SALDO FINAL").
 */
public final class CarryRows {

    public static final List<String> OPENING_PHRASES = List.of(
            "balance inicial", "saldo inicial", "saldo anterior", "balance anterior", "opening balance", "previous balance");

    public static final List<String> CLOSING_PHRASES = List.of(
            "saldo final", "saldo al corte", "balance final", "closing balance");

    private CarryRows() {
    }

    public static boolean isOpening(String description) {
        return TextNormalizer.containsAny(description, OPENING_PHRASES);
    }

    public static boolean isClosing(String description) {
        return TextNormalizer.containsAny(description, CLOSING_PHRASES);
    }

    public static boolean isCarry(String description) {
        return isOpening(description) || isClosing(description);
    }
}
