package com.conciliator.engine.services.statements.model;

import java.util.List;

public record MatchResult(
        String transactionRef,
        String invoiceId,
        Integer months,
        double confidence,
        boolean ambiguous,
        String reasoning,
        List<String> alternativeInvoiceIds
) {
    public MatchResult {
        alternativeInvoiceIds = alternativeInvoiceIds == null ? List.of() : List.copyOf(alternativeInvoiceIds);
    }
}
