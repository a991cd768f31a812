package com.conciliator.engine.services.statements.classification;

import java.util.Optional;

import com.conciliator.engine.enums.KnownBank;
import com.conciliator.engine.services.statements.util.TextNormalizer;

public final class BankDetector {

    /** Only the first pages carry the bank letterhead. */
    static final int HEADER_WINDOW = 4000;

    private BankDetector() {
    }

    /**
     * Bank whose name appears earliest in the document header.
     */
    public static Optional<KnownBank> detect(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String header = text.length() > HEADER_WINDOW ? text.substring(0, HEADER_WINDOW) : text;
        String padded = " " + TextNormalizer.normalizeDescription(header) + " ";

        KnownBank best = null;
        int bestAt = Integer.MAX_VALUE;
        for (KnownBank bank : KnownBank.values()) {
            for (String phrase : bank.getPhrases()) {
                int at = padded.indexOf(" " + TextNormalizer.normalizeDescription(phrase) + " ");
                if (at >= 0 && at < bestAt) {
                    best = bank;
                    bestAt = at;
                }
            }
        }
        return Optional.ofNullable(best);
    }
}
