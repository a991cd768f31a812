package com.conciliator.engine.services.statements.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Invoice supplied by the caller for installment matching. Read-only to the engine.
 *
 * @param confirmedMonths installment months already confirmed by a user; such invoices are not matched again
 */
public record InvoiceCandidate(
        String id,
        LocalDate date,
        BigDecimal total,
        boolean paymentMethodIsCard,
        Integer confirmedMonths
) {
    public InvoiceCandidate(String id, LocalDate date, BigDecimal total, boolean paymentMethodIsCard) {
        this(id, date, total, paymentMethodIsCard, null);
    }

    public boolean isConfirmed() {
        return confirmedMonths != null;
    }
}
