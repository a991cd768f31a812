package com.conciliator.engine.services.statements.strategies;

import java.util.List;
import java.util.Map;

import com.conciliator.engine.services.statements.model.Transaction;

public record StrategyResult(
        String strategy,
        List<Transaction> transactions,
        Map<String, Object> metadata,
        String error
) {
    public StrategyResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static StrategyResult success(String strategy, List<Transaction> transactions, Map<String, Object> metadata) {
        return new StrategyResult(strategy, transactions, metadata, null);
    }

    public static StrategyResult failed(String strategy, String error, Map<String, Object> metadata) {
        return new StrategyResult(strategy, List.of(), metadata, error);
    }

    public boolean isFailed() {
        return error != null;
    }

    public int count() {
        return transactions.size();
    }
}
