package com.conciliator.engine.services.statements.normalization;

import java.math.BigDecimal;
import java.util.regex.Pattern;

import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.util.TextNormalizer;

/**
 * Decides CREDIT vs DEBIT. Order: direction already set by the strategy, explicit markers in the
 * line, keyword lists (credit before debit), running-balance delta, then the amount-versus-balance fallback.
 */
public final class DirectionClassifier {

    public enum Basis {
        PRESET,
        EXPLICIT_MARKER,
        KEYWORD,
        BALANCE_DELTA,
        FALLBACK
    }

    public record Decision(TransactionDirection direction, Basis basis) {
    }

    private static final Pattern CREDIT_MARKER = Pattern.compile("(?i)\\bABONO\\b|\\(\\+\\)|\\bCR\\b|\\d\\s?C$");
    private static final Pattern DEBIT_MARKER = Pattern.compile("(?i)\\bCARGO\\b|\\(-\\)|\\bDR\\b|\\d\\s?D$");
    private static final BigDecimal DELTA_TOLERANCE = new BigDecimal("0.01");

    private DirectionClassifier() {
    }

    public static Decision classify(Transaction tx, RuleSet rules, BigDecimal previousBalance) {
        if (tx.getDirection() != null) {
            return new Decision(tx.getDirection(), Basis.PRESET);
        }

        if (tx.getAmount() != null && tx.getAmount().signum() < 0) {
            return new Decision(TransactionDirection.DEBIT, Basis.EXPLICIT_MARKER);
        }
        String line = tx.getRawLine() != null ? tx.getRawLine() : tx.getDescription();
        if (line != null) {
            boolean credit = CREDIT_MARKER.matcher(line).find();
            boolean debit = DEBIT_MARKER.matcher(line).find();
            if (credit != debit) {
                return new Decision(credit ? TransactionDirection.CREDIT : TransactionDirection.DEBIT, Basis.EXPLICIT_MARKER);
            }
        }

        TransactionDirection byKeyword = keywordDirection(tx.getDescription(), rules);
        if (byKeyword != null) {
            return new Decision(byKeyword, Basis.KEYWORD);
        }

        BigDecimal amount = tx.absoluteAmount();
        BigDecimal balance = tx.getBalanceAfter();
        if (previousBalance != null && balance != null) {
            if (previousBalance.add(amount).subtract(balance).abs().compareTo(DELTA_TOLERANCE) <= 0) {
                return new Decision(TransactionDirection.CREDIT, Basis.BALANCE_DELTA);
            }
            if (previousBalance.subtract(amount).subtract(balance).abs().compareTo(DELTA_TOLERANCE) <= 0) {
                return new Decision(TransactionDirection.DEBIT, Basis.BALANCE_DELTA);
            }
        }

        if (balance != null && amount.compareTo(balance.abs()) >= 0) {
            return new Decision(TransactionDirection.CREDIT, Basis.FALLBACK);
        }
        return new Decision(TransactionDirection.DEBIT, Basis.FALLBACK);
    }

    /**
     * Direction implied by the rule keywords, null when none is present. A credit keyword
     * outranks any debit keyword ("PAGO SPEI RECIBIDO" is a credit).
     */
    public static TransactionDirection keywordDirection(String description, RuleSet rules) {
        if (description == null || description.isBlank()) return null;
        if (TextNormalizer.containsAny(description, rules.getCreditKeywords())) {
            return TransactionDirection.CREDIT;
        }
        if (TextNormalizer.containsAny(description, rules.getDebitKeywords())) {
            return TransactionDirection.DEBIT;
        }
        return null;
    }
}
