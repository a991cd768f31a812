package com.conciliator.engine.services.statements.msi;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.conciliator.engine.config.EngineTolerancesProperties;
import com.conciliator.engine.enums.AccountType;
import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.model.InvoiceCandidate;
import com.conciliator.engine.services.statements.model.MatchResult;
import com.conciliator.engine.services.statements.model.MsiEnrichment;
import com.conciliator.engine.services.statements.model.StatementPeriod;
import com.conciliator.engine.services.statements.model.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Links credit-card charges to card-paid invoices. A charge matches an invoice when the invoice
 * total, or one installment share (total / m), is within the amount tolerance of the charge.
 * One match gives 0.95 and an inferred plan; several matches give a low-confidence suggestion
 * that needs manual confirmation.
 */
@Slf4j
@Component
public class MsiMatcher {

    public static final String MODEL_TAG = "amount_index_v1";

    static final double UNIQUE_MATCH_CONFIDENCE = 0.95;
    static final double AMBIGUOUS_BASE_CONFIDENCE = 0.60;
    static final double AMBIGUOUS_STEP = 0.05;
    static final double AMBIGUOUS_FLOOR = 0.30;

    private static final MathContext MC = MathContext.DECIMAL64;

    private final EngineTolerancesProperties tolerances;

    public MsiMatcher(EngineTolerancesProperties tolerances) {
        this.tolerances = tolerances != null ? tolerances : EngineTolerancesProperties.defaults();
    }

    /**
     * Enriches matching debit transactions in place and returns one result per enriched transaction.
     */
    public List<MatchResult> match(List<Transaction> transactions,
                                   List<InvoiceCandidate> invoices,
                                   AccountType accountType,
                                   StatementPeriod periodOverride) {
        if (accountType != AccountType.CREDIT_CARD) {
            log.debug("[MsiMatcher] Skipped: account type {} has no installment plans", accountType);
            return List.of();
        }
        List<Transaction> debits = new ArrayList<>();
        if (transactions != null) {
            for (Transaction tx : transactions) {
                if (tx.getDirection() == TransactionDirection.DEBIT && tx.absoluteAmount().signum() > 0 && tx.getMsi() == null) {
                    debits.add(tx);
                }
            }
        }
        if (debits.isEmpty() || invoices == null || invoices.isEmpty()) {
            log.debug("[MsiMatcher] Skipped: {} debit transactions, {} invoice candidates",
                    debits.size(), invoices == null ? 0 : invoices.size());
            return List.of();
        }

        StatementPeriod window = periodOverride != null ? periodOverride : window(debits);
        NavigableMap<BigDecimal, List<InvoiceCandidate>> index = buildIndex(invoices, window);
        if (index.isEmpty()) {
            log.info("[MsiMatcher] No eligible invoices in window {}", window);
            return List.of();
        }

        List<MatchResult> results = new ArrayList<>();
        for (Transaction tx : debits) {
            List<InvoiceCandidate> matches = candidatesFor(tx.absoluteAmount(), index);
            if (matches.isEmpty()) continue;

            MatchResult result = matches.size() == 1
                    ? unique(tx, matches.get(0))
                    : ambiguous(tx, matches);
            results.add(result);
        }

        log.info("[MsiMatcher] {} of {} debit transactions matched ({} ambiguous)",
                results.size(), debits.size(), results.stream().filter(MatchResult::ambiguous).count());
        return results;
    }

    /** Invoices keyed by total rounded to cents; only card-paid, unconfirmed invoices inside the window. */
    NavigableMap<BigDecimal, List<InvoiceCandidate>> buildIndex(List<InvoiceCandidate> invoices, StatementPeriod window) {
        NavigableMap<BigDecimal, List<InvoiceCandidate>> index = new TreeMap<>();
        for (InvoiceCandidate invoice : invoices) {
            if (invoice == null || !invoice.paymentMethodIsCard() || invoice.isConfirmed()) continue;
            if (invoice.total() == null || invoice.total().signum() <= 0) continue;
            if (window != null && (invoice.date() == null || !window.contains(invoice.date()))) continue;
            index.computeIfAbsent(invoice.total().setScale(2, RoundingMode.HALF_UP), k -> new ArrayList<>()).add(invoice);
        }
        return index;
    }

    private List<InvoiceCandidate> candidatesFor(BigDecimal amount, NavigableMap<BigDecimal, List<InvoiceCandidate>> index) {
        BigDecimal tolerance = tolerances.msiAmountTolerance();
        Map<String, InvoiceCandidate> found = new LinkedHashMap<>();

        List<Integer> multipliers = new ArrayList<>();
        multipliers.add(1);
        multipliers.addAll(MsiPlanCatalog.VALID_MONTHS);

        for (int m : multipliers) {
            BigDecimal target = amount.multiply(BigDecimal.valueOf(m));
            // |amount - total/m| <= tol * amount  <=>  target * (1 - tol) <= total <= target * (1 + tol)
            BigDecimal low = target.multiply(BigDecimal.ONE.subtract(tolerance)).setScale(2, RoundingMode.FLOOR);
            BigDecimal high = target.multiply(BigDecimal.ONE.add(tolerance)).setScale(2, RoundingMode.CEILING);
            for (List<InvoiceCandidate> bucket : index.subMap(low, true, high, true).values()) {
                for (InvoiceCandidate invoice : bucket) {
                    if (relativeError(invoice.total(), target).compareTo(tolerance) <= 0) {
                        found.putIfAbsent(invoice.id(), invoice);
                    }
                }
            }
        }
        return new ArrayList<>(found.values());
    }

    private MatchResult unique(Transaction tx, InvoiceCandidate invoice) {
        Integer months = inferMonths(tx.absoluteAmount(), invoice.total());
        tx.setMsi(new MsiEnrichment(invoice.id(), months, UNIQUE_MATCH_CONFIDENCE, MODEL_TAG, false, List.of()));

        String reasoning = months != null
                ? String.format(Locale.ROOT, "single invoice match, %d installments of %s", months, invoice.total().divide(BigDecimal.valueOf(months), 2, RoundingMode.HALF_UP))
                : "single invoice match, one-time payment";
        log.debug("[MsiMatcher] {} -> {} ({})", tx.getRef(), invoice.id(), reasoning);
        return new MatchResult(tx.getRef(), invoice.id(), months, UNIQUE_MATCH_CONFIDENCE, false, reasoning, List.of());
    }

    private MatchResult ambiguous(Transaction tx, List<InvoiceCandidate> matches) {
        double confidence = ambiguousConfidence(matches.size());
        List<InvoiceCandidate> ordered = new ArrayList<>(matches);
        ordered.sort(Comparator.comparing(InvoiceCandidate::date, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder())).reversed());

        InvoiceCandidate primary = ordered.get(0);
        List<String> alternatives = ordered.subList(1, ordered.size()).stream().map(InvoiceCandidate::id).toList();
        tx.setMsi(new MsiEnrichment(primary.id(), null, confidence, MODEL_TAG, true, alternatives));

        String reasoning = String.format(Locale.ROOT, "%d invoices match; most recent suggested, needs confirmation", matches.size());
        log.debug("[MsiMatcher] {} ambiguous: {} (alternatives {})", tx.getRef(), primary.id(), alternatives);
        return new MatchResult(tx.getRef(), primary.id(), null, confidence, true, reasoning, alternatives);
    }

    /** Heuristic weighting, not a calibrated probability. */
    static double ambiguousConfidence(int matches) {
        return Math.max(AMBIGUOUS_FLOOR, AMBIGUOUS_BASE_CONFIDENCE - AMBIGUOUS_STEP * matches);
    }

    /** First plan whose monthly share is within the months tolerance of the charge, or null for a one-time payment. */
    Integer inferMonths(BigDecimal amount, BigDecimal total) {
        for (int m : MsiPlanCatalog.VALID_MONTHS) {
            BigDecimal share = total.divide(BigDecimal.valueOf(m), MC);
            if (relativeError(amount, share).compareTo(tolerances.msiMonthsTolerance()) <= 0) {
                return m;
            }
        }
        return null;
    }

    private StatementPeriod window(List<Transaction> debits) {
        LocalDate min = null;
        LocalDate max = null;
        for (Transaction tx : debits) {
            LocalDate d = tx.getDate();
            if (d == null) continue;
            if (min == null || d.isBefore(min)) min = d;
            if (max == null || d.isAfter(max)) max = d;
        }
        if (min == null) {
            return null;
        }
        return new StatementPeriod(min.minusDays(tolerances.msiLookbackDays()), max.plusDays(tolerances.msiLookaheadDays()));
    }

    private static BigDecimal relativeError(BigDecimal amount, BigDecimal reference) {
        return amount.subtract(reference).abs().divide(reference, MC);
    }
}
