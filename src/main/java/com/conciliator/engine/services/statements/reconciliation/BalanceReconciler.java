package com.conciliator.engine.services.statements.reconciliation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.conciliator.engine.config.EngineTolerancesProperties;
import com.conciliator.engine.enums.MovementKind;
import com.conciliator.engine.enums.ReconciliationStatus;
import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.model.StatementPeriod;
import com.conciliator.engine.services.statements.model.StatementSummary;
import com.conciliator.engine.services.statements.model.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Derives balances and totals for a normalized ledger and checks
 * |opening + credits - debits - closing| <= tolerance.
 */
@Slf4j
@Component
public class BalanceReconciler {

    private final EngineTolerancesProperties tolerances;

    public BalanceReconciler(EngineTolerancesProperties tolerances) {
        this.tolerances = tolerances != null ? tolerances : EngineTolerancesProperties.defaults();
    }

    /**
     * @param explicitOpening statement-level opening balance, used when the first transaction has no running balance
     * @param explicitClosing statement-level closing balance, used when the last transaction has no running balance
     * @param period printed statement period; when null the transaction date range is used
     */
    public StatementSummary reconcile(List<Transaction> transactions,
                                      BigDecimal explicitOpening,
                                      BigDecimal explicitClosing,
                                      StatementPeriod period,
                                      String detectedBank) {
        List<Transaction> txs = transactions == null ? List.of() : transactions;

        BigDecimal opening = explicitOpening;
        BigDecimal closing = explicitClosing;
        if (!txs.isEmpty()) {
            Transaction first = txs.get(0);
            Transaction last = txs.get(txs.size() - 1);
            if (first.getBalanceAfter() != null && first.getAmount() != null) {
                opening = first.getBalanceAfter().subtract(first.getAmount());
            }
            if (last.getBalanceAfter() != null) {
                closing = last.getBalanceAfter();
            }
        }

        BigDecimal credits = BigDecimal.ZERO;
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal incomes = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        BigDecimal transfers = BigDecimal.ZERO;
        LocalDate minDate = null;
        LocalDate maxDate = null;

        for (Transaction tx : txs) {
            BigDecimal abs = tx.absoluteAmount();
            if (tx.getDirection() == TransactionDirection.CREDIT) {
                credits = credits.add(abs);
            } else {
                debits = debits.add(abs);
            }
            if (tx.getMovementKind() == MovementKind.INCOME) {
                incomes = incomes.add(abs);
            } else if (tx.getMovementKind() == MovementKind.TRANSFER) {
                transfers = transfers.add(abs);
            } else {
                expenses = expenses.add(abs);
            }
            LocalDate d = tx.getDate();
            if (d != null) {
                if (minDate == null || d.isBefore(minDate)) minDate = d;
                if (maxDate == null || d.isAfter(maxDate)) maxDate = d;
            }
        }

        ReconciliationStatus status;
        BigDecimal difference = null;
        if (opening == null || closing == null) {
            status = ReconciliationStatus.UNVERIFIED;
            log.info("[BalanceReconciler] Balances not derivable (opening={}, closing={}), check skipped", opening, closing);
        } else {
            difference = opening.add(credits).subtract(debits).subtract(closing);
            if (difference.abs().compareTo(tolerances.reconciliationTolerance()) <= 0) {
                status = ReconciliationStatus.OK;
            } else {
                status = ReconciliationStatus.MISMATCH;
                log.warn("[BalanceReconciler] MISMATCH: opening={} + credits={} - debits={} != closing={} (diff={})",
                        opening, credits, debits, closing, difference);
            }
        }

        StatementSummary summary = StatementSummary.builder()
                .openingBalance(opening)
                .closingBalance(closing)
                .totalCredits(credits)
                .totalDebits(debits)
                .totalIncomes(incomes)
                .totalExpenses(expenses)
                .totalTransfers(transfers)
                .transactionCount(txs.size())
                .periodStart(period != null && period.start() != null ? period.start() : minDate)
                .periodEnd(period != null && period.end() != null ? period.end() : maxDate)
                .reconciliationStatus(status)
                .reconciliationDifference(difference)
                .detectedBank(Objects.requireNonNullElse(detectedBank, "unknown"))
                .build();

        log.info("[BalanceReconciler] {}", summary.getDescription());
        return summary;
    }
}
