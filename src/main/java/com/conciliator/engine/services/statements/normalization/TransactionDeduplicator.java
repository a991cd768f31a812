package com.conciliator.engine.services.statements.normalization;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.util.TextNormalizer;

/**
 * Collapses transactions sharing (date, normalized description, amount rounded to cents).
 * The first occurrence keeps its position; later ones contribute distinct description fragments
 * and their balance, if any.
 */
public final class TransactionDeduplicator {

    public record Key(String date, String description, BigDecimal amount) {
    }

    public record Result(List<Transaction> transactions, int merged) {
    }

    private TransactionDeduplicator() {
    }

    public static Key keyOf(Transaction tx) {
        String date = tx.getDate() == null ? "" : tx.getDate().toString();
        BigDecimal amount = tx.getAmount() == null ? BigDecimal.ZERO : tx.getAmount();
        return new Key(date,
                TextNormalizer.normalizeDescription(tx.getDescription()),
                amount.setScale(2, RoundingMode.HALF_UP));
    }

    public static Result deduplicate(List<Transaction> transactions) {
        Map<Key, Transaction> byKey = new LinkedHashMap<>();
        Map<Key, Set<String>> fragments = new LinkedHashMap<>();
        int merged = 0;

        for (Transaction tx : transactions) {
            Key key = keyOf(tx);
            Transaction existing = byKey.get(key);
            String fragment = tx.getDescription() == null ? "" : tx.getDescription().trim();

            if (existing == null) {
                byKey.put(key, tx);
                Set<String> seen = new LinkedHashSet<>();
                seen.add(fragment);
                fragments.put(key, seen);
                continue;
            }

            merged++;
            if (fragments.get(key).add(fragment)) {
                existing.appendDescription(fragment);
            }
            if (tx.getBalanceAfter() != null) {
                existing.setBalanceAfter(tx.getBalanceAfter());
            }
            if (existing.getReference() == null) {
                existing.setReference(tx.getReference());
            }
            existing.setConfidence(Math.max(existing.getConfidence(), tx.getConfidence()));
        }

        return new Result(new ArrayList<>(byKey.values()), merged);
    }
}
