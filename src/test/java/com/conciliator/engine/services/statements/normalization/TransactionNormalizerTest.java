package com.conciliator.engine.services.statements.normalization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.conciliator.engine.config.EngineTolerancesProperties;
import com.conciliator.engine.enums.MovementKind;
import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.rules.RuleSet;

class TransactionNormalizerTest {

    private final TransactionNormalizer normalizer = new TransactionNormalizer(EngineTolerancesProperties.defaults());

    private static Transaction tx(int day, String description, String amount, String balance) {
        return Transaction.builder()
                .date(LocalDate.of(2024, 12, day))
                .description(description)
                .amount(amount == null ? null : new BigDecimal(amount))
                .balanceAfter(balance == null ? null : new BigDecimal(balance))
                .build();
    }

    @Test
    void carryRowsAreDivertedAndDirectionsResolved() {
        List<Transaction> candidates = new ArrayList<>(List.of(
                tx(1, "BALANCE INICIAL", "0", "1000.00"),
                tx(3, "DEPOSITO NOMINA", "500.00", "1500.00"),
                tx(4, "ACME SA DE CV", "200.00", "1300.00"),
                tx(5, "EMPRESA XYZ", "50.00", "1350.00"),
                tx(6, "TIENDA ABC", "80.00", null),
                tx(31, "SALDO FINAL", null, "1270.00")));

        NormalizationOutcome outcome = normalizer.normalize(candidates, RuleSet.base());

        assertEquals(new BigDecimal("1000.00"), outcome.openingCarry());
        assertEquals(new BigDecimal("1270.00"), outcome.closingCarry());
        assertEquals(4, outcome.transactions().size());

        Transaction nomina = outcome.transactions().get(0);
        assertEquals(TransactionDirection.CREDIT, nomina.getDirection());
        assertEquals(new BigDecimal("500.00"), nomina.getAmount());
        assertEquals(MovementKind.INCOME, nomina.getMovementKind());
        assertEquals("Nomina", nomina.getCategory());

        Transaction byDelta = outcome.transactions().get(1);
        assertEquals(TransactionDirection.DEBIT, byDelta.getDirection());
        assertEquals(new BigDecimal("-200.00"), byDelta.getAmount());

        assertEquals(TransactionDirection.CREDIT, outcome.transactions().get(2).getDirection());

        Transaction fallback = outcome.transactions().get(3);
        assertEquals(TransactionDirection.DEBIT, fallback.getDirection());
        assertEquals(new BigDecimal("-80.00"), fallback.getAmount());
    }

    @Test
    void creditKeywordOutranksDebitKeyword() {
        NormalizationOutcome outcome = normalizer.normalize(List.of(
                tx(2, "PAGO SPEI RECIBIDO CLIENTE ACME", "500.00", null),
                tx(3, "PAGO SERVICIO AGUA", "120.00", null)), RuleSet.base());

        Transaction incoming = outcome.transactions().get(0);
        assertEquals(TransactionDirection.CREDIT, incoming.getDirection());
        assertEquals(new BigDecimal("500.00"), incoming.getAmount());
        assertEquals(TransactionDirection.DEBIT, outcome.transactions().get(1).getDirection());
        assertEquals(TransactionDirection.CREDIT,
                DirectionClassifier.keywordDirection("compra con abono a cuenta", RuleSet.base()));
        assertNull(DirectionClassifier.keywordDirection("ACME SA DE CV", RuleSet.base()));
    }

    @Test
    void signAlwaysAgreesWithDirection() {
        List<Transaction> candidates = List.of(
                tx(2, "COMPRA OXXO", "-150.00", null),
                tx(2, "ABONO TRANSFERENCIA", "300.00", null),
                Transaction.builder().date(LocalDate.of(2024, 12, 3)).description("AJUSTE")
                        .amount(new BigDecimal("-25.00")).direction(TransactionDirection.CREDIT).build());

        NormalizationOutcome outcome = normalizer.normalize(candidates, RuleSet.base());

        for (Transaction t : outcome.transactions()) {
            assertTrue(t.getDirection().isConsistentWith(t.getAmount()), t.getDescription());
        }
        assertEquals(new BigDecimal("25.00"), outcome.transactions().get(2).getAmount());
        assertEquals(MovementKind.TRANSFER, outcome.transactions().get(1).getMovementKind());
    }

    @Test
    void noiseAndUnusableRowsAreCountedByReason() {
        List<Transaction> candidates = List.of(
                tx(1, "   ", "10.00", null),
                tx(1, "12/12/2024", "10.00", null),
                tx(1, "--", "10.00", null),
                tx(1, "TOTAL DE CARGOS", "500.00", null),
                tx(1, "TIENDA", null, null),
                tx(1, "TIENDA GRANDE", "2000000.00", null),
                tx(1, "TIENDA CHICA", "0.00", null),
                tx(1, "FARMACIA", "45.00", null));

        NormalizationOutcome outcome = normalizer.normalize(candidates, RuleSet.base());

        assertEquals(1, outcome.transactions().size());
        assertEquals(Integer.valueOf(1), outcome.rejections().get(TransactionNormalizer.REJECT_BLANK));
        assertEquals(Integer.valueOf(2), outcome.rejections().get(TransactionNormalizer.REJECT_NOISE));
        assertEquals(Integer.valueOf(1), outcome.rejections().get(TransactionNormalizer.REJECT_SKIP));
        assertEquals(Integer.valueOf(1), outcome.rejections().get(TransactionNormalizer.REJECT_NO_AMOUNT));
        assertEquals(Integer.valueOf(1), outcome.rejections().get(TransactionNormalizer.REJECT_UNREALISTIC));
        assertEquals(Integer.valueOf(1), outcome.rejections().get(TransactionNormalizer.REJECT_ZERO));
        assertEquals(7, outcome.rejected());
    }

    @Test
    void duplicatesCollapseKeepingFirstPosition() {
        Transaction first = tx(4, "COMPRA OXXO", "150.00", null);
        first.setReference(null);
        Transaction copy = tx(4, "Compra  OXXO", "150.00", "850.00");
        copy.setReference("998877");

        NormalizationOutcome outcome = normalizer.normalize(
                List.of(first, tx(5, "FARMACIA", "45.00", null), copy), RuleSet.base());

        assertEquals(2, outcome.transactions().size());
        assertEquals(1, outcome.merged());
        Transaction kept = outcome.transactions().get(0);
        assertEquals("998877", kept.getReference());
        assertEquals(new BigDecimal("850.00"), kept.getBalanceAfter());
    }

    @Test
    void normalizingTwiceChangesNothing() {
        List<Transaction> candidates = List.of(
                tx(1, "BALANCE INICIAL", "0", "1000.00"),
                tx(3, "DEPOSITO NOMINA", "500.00", "1500.00"),
                tx(4, "ACME SA DE CV", "200.00", "1300.00"),
                tx(6, "TIENDA ABC", "80.00", null));

        NormalizationOutcome once = normalizer.normalize(candidates, RuleSet.base());
        List<String> snapshot = once.transactions().stream()
                .map(t -> t.getDescription() + "|" + t.getAmount() + "|" + t.getDirection())
                .toList();

        NormalizationOutcome twice = normalizer.normalize(new ArrayList<>(once.transactions()), RuleSet.base());

        assertEquals(snapshot, twice.transactions().stream()
                .map(t -> t.getDescription() + "|" + t.getAmount() + "|" + t.getDirection())
                .toList());
        assertEquals(0, twice.rejected());
        assertEquals(0, twice.merged());
        assertNull(twice.openingCarry());
    }

    @Test
    void emptyInputGivesEmptyOutcome() {
        NormalizationOutcome outcome = normalizer.normalize(List.of(), RuleSet.base());

        assertTrue(outcome.transactions().isEmpty());
        assertEquals(0, outcome.rejected());
    }
}
