package com.conciliator.engine.services.statements.model;

import java.util.List;

import com.conciliator.engine.enums.AccountType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of one engine run. {@code text} is either the extracted statement text or a JSON array of
 * pre-structured rows (Excel/CSV extraction).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementRequest {

    private String text;
    private String bankHint;

    /** Account type already stored for the account, if any. */
    private AccountType accountType;

    private AccountMetadata accountMetadata;
    private List<InvoiceCandidate> invoiceCandidates;

    /** Restricts the invoices considered for MSI matching; defaults to the transaction window. */
    private StatementPeriod periodOverride;

    private AdvisoryClassification advisoryClassification;
}
