package com.conciliator.engine.services.statements.model;

import java.util.List;

/**
 * Installment ("meses sin intereses") link between a card charge and an invoice.
 * {@code months} is null when the plan could not be inferred or the match is ambiguous.
 */
public record MsiEnrichment(
        String candidateInvoiceId,
        Integer months,
        double matchConfidence,
        String modelTag,
        boolean ambiguous,
        List<String> alternativeInvoiceIds
) {
    public MsiEnrichment {
        alternativeInvoiceIds = alternativeInvoiceIds == null ? List.of() : List.copyOf(alternativeInvoiceIds);
    }
}
