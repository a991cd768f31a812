package com.conciliator.engine.services.statements;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.conciliator.engine.config.EngineTolerancesProperties;
import com.conciliator.engine.config.QualityScoreConfig;
import com.conciliator.engine.enums.AccountType;
import com.conciliator.engine.enums.ReconciliationStatus;
import com.conciliator.engine.enums.StatementIssue;
import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.classification.AccountClassifier;
import com.conciliator.engine.services.statements.model.InvoiceCandidate;
import com.conciliator.engine.services.statements.model.MatchResult;
import com.conciliator.engine.services.statements.model.StatementRequest;
import com.conciliator.engine.services.statements.model.StatementResult;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.msi.MsiMatcher;
import com.conciliator.engine.services.statements.normalization.TransactionNormalizer;
import com.conciliator.engine.services.statements.quality.StrategyQualityScorer;
import com.conciliator.engine.services.statements.quality.StrategySelector;
import com.conciliator.engine.services.statements.reconciliation.BalanceReconciler;
import com.conciliator.engine.services.statements.rules.BankRuleProvider;
import com.conciliator.engine.services.statements.strategies.AdaptiveSynthesisStrategy;
import com.conciliator.engine.services.statements.strategies.BruteForceStrategy;
import com.conciliator.engine.services.statements.strategies.StandardPatternStrategy;
import com.conciliator.engine.services.statements.strategies.StructuredRecordStrategy;
import com.conciliator.engine.services.statements.strategies.UniversalFlexibleStrategy;
import com.fasterxml.jackson.databind.ObjectMapper;

class StatementEngineTest {

    private StatementEngine engine;

    @BeforeEach
    void setUp() {
        EngineTolerancesProperties tolerances = EngineTolerancesProperties.defaults();
        QualityScoreConfig config = new QualityScoreConfig();
        engine = new StatementEngine(
                new AccountClassifier(),
                new BankRuleProvider(List.of()),
                List.of(new StandardPatternStrategy(), new UniversalFlexibleStrategy(),
                        new AdaptiveSynthesisStrategy(), new BruteForceStrategy()),
                new StructuredRecordStrategy(new ObjectMapper()),
                new StrategySelector(new StrategyQualityScorer(), config, Runnable::run),
                new TransactionNormalizer(tolerances),
                new BalanceReconciler(tolerances),
                new MsiMatcher(tolerances),
                config);
    }

    @Test
    void checkingStatementReconciles() {
        String text = String.join("\n",
                "BBVA MEXICO",
                "ESTADO DE CUENTA",
                "PERIODO DEL 01/12/2024 AL 31/12/2024",
                "SALDO ANTERIOR 10,000.00",
                "SALDO FINAL 14,631.00",
                "DIC 01 BALANCE INICIAL 10,000.00",
                "DIC 03 1234567890 SPEI RECIBIDO NOMINA 5,000.00 15,000.00",
                "DIC 04 OXXO SUC 123 150.00 14,850.00",
                "DIC 05 NETFLIX 219.00 14,631.00");

        StatementResult result = engine.process(StatementRequest.builder().text(text).build());

        assertEquals("standard", result.getDiagnostics().getSelectedStrategy());
        assertEquals("BBVA", result.getAccount().bankName());
        assertEquals(AccountType.CHECKING, result.getAccount().accountType());

        List<Transaction> txs = result.getTransactions();
        assertEquals(3, txs.size());
        assertEquals("TX-0001", txs.get(0).getRef());
        assertEquals("TX-0003", txs.get(2).getRef());
        assertEquals(TransactionDirection.CREDIT, txs.get(0).getDirection());
        assertEquals(0, new BigDecimal("5000.00").compareTo(txs.get(0).getAmount()));
        assertEquals(0, new BigDecimal("-150.00").compareTo(txs.get(1).getAmount()));
        assertEquals(0, new BigDecimal("-219.00").compareTo(txs.get(2).getAmount()));

        assertEquals(ReconciliationStatus.OK, result.getSummary().getReconciliationStatus());
        assertEquals(0, new BigDecimal("10000.00").compareTo(result.getSummary().getOpeningBalance()));
        assertEquals(0, new BigDecimal("14631.00").compareTo(result.getSummary().getClosingBalance()));
        assertEquals(LocalDate.of(2024, 12, 1), result.getSummary().getPeriodStart());
        assertTrue(result.getMatches().isEmpty());
        assertFalse(result.getDiagnostics().hasIssue(StatementIssue.RECONCILIATION_MISMATCH));
        assertFalse(result.getProfileUpdate().isPresent());
    }

    @Test
    void creditCardChargesAreLinkedToInvoices() {
        String text = String.join("\n",
                "TARJETA DE CREDITO",
                "PERIODO DEL 01/12/2024 AL 31/12/2024",
                "DIC 02 LIVERPOOL MSI 3 DE 12 500.00",
                "DIC 06 AMAZON MX 2,000.00",
                "DIC 09 GASOLINERA PEMEX 650.00");
        List<InvoiceCandidate> invoices = List.of(
                new InvoiceCandidate("inv-1", LocalDate.of(2024, 11, 28), new BigDecimal("6000.00"), true),
                new InvoiceCandidate("inv-2", LocalDate.of(2024, 12, 1), new BigDecimal("2000.00"), true));

        StatementResult result = engine.process(StatementRequest.builder()
                .text(text)
                .accountType(AccountType.CREDIT_CARD)
                .invoiceCandidates(invoices)
                .build());

        List<MatchResult> matches = result.getMatches();
        assertEquals(2, matches.size());

        MatchResult liverpool = matches.get(0);
        assertEquals("TX-0001", liverpool.transactionRef());
        assertEquals("inv-1", liverpool.invoiceId());
        assertEquals(Integer.valueOf(12), liverpool.months());
        assertFalse(liverpool.ambiguous());

        MatchResult amazon = matches.get(1);
        assertEquals("TX-0002", amazon.transactionRef());
        assertTrue(amazon.ambiguous());
        assertEquals("inv-2", amazon.invoiceId());
        assertEquals(List.of("inv-1"), amazon.alternativeInvoiceIds());
        assertEquals(0.50, amazon.confidence(), 1e-9);

        assertNull(result.getTransactions().get(2).getMsi());
        assertTrue(result.getDiagnostics().hasIssue(StatementIssue.AMBIGUOUS_MSI_MATCH));
        assertTrue(result.getDiagnostics().hasIssue(StatementIssue.PARTIAL_QUALITY));
        assertEquals(ReconciliationStatus.UNVERIFIED, result.getSummary().getReconciliationStatus());
    }

    @Test
    void structuredRowsBypassLineStrategies() {
        String json = "["
                + "{\"Fecha\":\"05/12/2024\",\"Concepto\":\"NOMINA EMPRESA\",\"Cargo\":null,\"Abono\":\"15,000.00\",\"Saldo\":\"25,000.00\"},"
                + "{\"Fecha\":\"06/12/2024\",\"Concepto\":\"PAGO CFE\",\"Cargo\":\"850.50\",\"Abono\":\"\",\"Saldo\":\"24,149.50\"}"
                + "]";

        StatementResult result = engine.process(StatementRequest.builder().text(json).build());

        assertEquals(StructuredRecordStrategy.NAME, result.getDiagnostics().getSelectedStrategy());
        assertEquals(1, result.getDiagnostics().getStrategyScores().size());
        assertEquals(2, result.getTransactions().size());
        assertEquals(ReconciliationStatus.OK, result.getSummary().getReconciliationStatus());
    }

    @Test
    void blankTextIsRejected() {
        StatementParsingException e = assertThrows(StatementParsingException.class,
                () -> engine.process(StatementRequest.builder().text("   ").build()));

        assertEquals(StatementIssue.EXTRACTION_EMPTY, e.getIssue());
        assertTrue(e.getDiagnostics().hasIssue(StatementIssue.EXTRACTION_EMPTY));
    }

    @Test
    void textWithoutMovementsFailsEveryStrategy() {
        StatementParsingException e = assertThrows(StatementParsingException.class,
                () -> engine.process(StatementRequest.builder().text("hola mundo sin movimientos").build()));

        assertEquals(StatementIssue.ALL_STRATEGIES_FAILED, e.getIssue());
        assertEquals(4, e.getDiagnostics().getStrategyErrors().size());
    }
}
