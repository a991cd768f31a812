package com.conciliator.engine.services.statements.msi;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.conciliator.engine.services.statements.model.MsiEnrichment;
import com.conciliator.engine.services.statements.model.Transaction;

/**
 * Installment plans offered by card issuers and the manual confirmation of a plan.
 */
public final class MsiPlanCatalog {

    public static final List<Integer> VALID_MONTHS = List.of(3, 6, 9, 12, 18, 24);

    public static final String MANUAL_CONFIRMATION_TAG = "manual_confirmation";

    public record InstallmentOption(int months, BigDecimal monthlyPayment) {
    }

    private MsiPlanCatalog() {
    }

    public static boolean isValidMonths(Integer months) {
        return months != null && VALID_MONTHS.contains(months);
    }

    /** Monthly payment for every valid plan, rounded half-up to cents. */
    public static List<InstallmentOption> installmentOptions(BigDecimal total) {
        if (total == null || total.signum() <= 0) {
            throw new IllegalArgumentException("Invoice total must be positive: " + total);
        }
        List<InstallmentOption> options = new ArrayList<>();
        for (int months : VALID_MONTHS) {
            options.add(new InstallmentOption(months,
                    total.divide(BigDecimal.valueOf(months), 2, RoundingMode.HALF_UP)));
        }
        return options;
    }

    /**
     * Attaches a user-confirmed plan to a transaction, replacing any automatic suggestion.
     */
    public static MsiEnrichment confirm(Transaction tx, String invoiceId, int months) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction is required.");
        }
        if (invoiceId == null || invoiceId.isBlank()) {
            throw new IllegalArgumentException("Invoice id is required.");
        }
        if (!isValidMonths(months)) {
            throw new IllegalArgumentException("Unsupported installment plan: " + months + " months. Valid: " + VALID_MONTHS);
        }
        MsiEnrichment enrichment = new MsiEnrichment(invoiceId, months, 1.0, MANUAL_CONFIRMATION_TAG, false, List.of());
        tx.setMsi(enrichment);
        return enrichment;
    }
}
