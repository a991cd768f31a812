package com.conciliator.engine.services.statements.reconciliation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.conciliator.engine.config.EngineTolerancesProperties;
import com.conciliator.engine.enums.MovementKind;
import com.conciliator.engine.enums.ReconciliationStatus;
import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.model.StatementPeriod;
import com.conciliator.engine.services.statements.model.StatementSummary;
import com.conciliator.engine.services.statements.model.Transaction;

class BalanceReconcilerTest {

    private final BalanceReconciler reconciler = new BalanceReconciler(EngineTolerancesProperties.defaults());

    private static Transaction credit(int day, String amount, String balance, MovementKind kind) {
        return Transaction.builder()
                .date(LocalDate.of(2024, 12, day))
                .description("DEPOSITO")
                .amount(new BigDecimal(amount))
                .direction(TransactionDirection.CREDIT)
                .movementKind(kind)
                .balanceAfter(balance == null ? null : new BigDecimal(balance))
                .build();
    }

    private static Transaction debit(int day, String amount, String balance) {
        return Transaction.builder()
                .date(LocalDate.of(2024, 12, day))
                .description("COMPRA")
                .amount(new BigDecimal(amount).negate())
                .direction(TransactionDirection.DEBIT)
                .movementKind(MovementKind.EXPENSE)
                .balanceAfter(balance == null ? null : new BigDecimal(balance))
                .build();
    }

    @Test
    void balancesDerivedFromRunningBalanceReconcile() {
        List<Transaction> txs = List.of(
                credit(3, "500.00", "1500.00", MovementKind.INCOME),
                debit(8, "300.00", "1200.00"));

        StatementSummary summary = reconciler.reconcile(txs, null, null, null, "BBVA");

        assertEquals(0, new BigDecimal("1000.00").compareTo(summary.getOpeningBalance()));
        assertEquals(0, new BigDecimal("1200.00").compareTo(summary.getClosingBalance()));
        assertEquals(0, new BigDecimal("500.00").compareTo(summary.getTotalCredits()));
        assertEquals(0, new BigDecimal("300.00").compareTo(summary.getTotalDebits()));
        assertEquals(0, new BigDecimal("500.00").compareTo(summary.getTotalIncomes()));
        assertEquals(0, new BigDecimal("300.00").compareTo(summary.getTotalExpenses()));
        assertEquals(ReconciliationStatus.OK, summary.getReconciliationStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.getReconciliationDifference()));
        assertEquals(LocalDate.of(2024, 12, 3), summary.getPeriodStart());
        assertEquals(LocalDate.of(2024, 12, 8), summary.getPeriodEnd());
        assertEquals(2, summary.getTransactionCount());
    }

    @Test
    void explicitBalancesOutsideToleranceMismatch() {
        List<Transaction> txs = List.of(
                credit(3, "500.00", null, MovementKind.TRANSFER),
                debit(8, "300.00", null));

        StatementSummary summary = reconciler.reconcile(txs,
                new BigDecimal("1000.00"), new BigDecimal("1100.00"),
                new StatementPeriod(LocalDate.of(2024, 12, 1), LocalDate.of(2024, 12, 31)), "Santander");

        assertEquals(ReconciliationStatus.MISMATCH, summary.getReconciliationStatus());
        assertEquals(0, new BigDecimal("100.00").compareTo(summary.getReconciliationDifference()));
        assertEquals(0, new BigDecimal("500.00").compareTo(summary.getTotalTransfers()));
        assertEquals(LocalDate.of(2024, 12, 1), summary.getPeriodStart());
        assertEquals(LocalDate.of(2024, 12, 31), summary.getPeriodEnd());
    }

    @Test
    void differenceWithinToleranceIsOk() {
        StatementSummary summary = reconciler.reconcile(List.of(debit(8, "300.00", null)),
                new BigDecimal("1000.00"), new BigDecimal("700.40"), null, null);

        assertEquals(ReconciliationStatus.OK, summary.getReconciliationStatus());
        assertEquals("unknown", summary.getDetectedBank());
    }

    @Test
    void withoutBalancesTheCheckIsSkipped() {
        StatementSummary summary = reconciler.reconcile(List.of(debit(8, "300.00", null)), null, null, null, "BBVA");

        assertEquals(ReconciliationStatus.UNVERIFIED, summary.getReconciliationStatus());
        assertNull(summary.getReconciliationDifference());
        assertNull(summary.getOpeningBalance());
    }
}
