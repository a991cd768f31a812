package com.conciliator.engine.services.statements.normalization;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import com.conciliator.engine.services.statements.model.Transaction;

/**
 * Clean ledger plus the balances carried by the rows that were diverted out of it.
 */
public record NormalizationOutcome(
        List<Transaction> transactions,
        BigDecimal openingCarry,
        BigDecimal closingCarry,
        Map<String, Integer> rejections,
        int merged
) {
    public NormalizationOutcome {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        rejections = rejections == null ? Map.of() : Map.copyOf(rejections);
    }

    public int rejected() {
        return rejections.values().stream().mapToInt(Integer::intValue).sum();
    }
}
