package com.conciliator.engine.services.statements.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.conciliator.engine.enums.ReconciliationStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatementSummary {

    private BigDecimal openingBalance;
    private BigDecimal closingBalance;
    private BigDecimal totalCredits;
    private BigDecimal totalDebits;
    private BigDecimal totalIncomes;
    private BigDecimal totalExpenses;
    private BigDecimal totalTransfers;
    private int transactionCount;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private ReconciliationStatus reconciliationStatus;

    /** opening + credits - debits - closing; null when not verifiable. */
    private BigDecimal reconciliationDifference;

    private String detectedBank;

    public String getDescription() {
        return String.format(
                "StatementSummary{bank=%s, tx=%d, opening=%s, closing=%s, credits=%s, debits=%s, status=%s}",
                detectedBank,
                transactionCount,
                openingBalance,
                closingBalance,
                totalCredits,
                totalDebits,
                reconciliationStatus);
    }
}
