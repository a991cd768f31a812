package com.conciliator.engine.services.statements.quality;

import java.util.Set;

/**
 * Structural facts about the statement text, reported in diagnostics.
 */
public record DocumentProfile(
        int lineCount,
        int candidateLines,
        double transactionDensity,
        String monthTokenStyle,
        Set<String> dateFormats,
        boolean hasOpeningBalanceMarker,
        boolean hasSpeiMovements,
        boolean structuredInput
) {
    public DocumentProfile {
        dateFormats = dateFormats == null ? Set.of() : Set.copyOf(dateFormats);
    }
}
