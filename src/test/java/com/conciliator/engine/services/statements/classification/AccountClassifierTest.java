package com.conciliator.engine.services.statements.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.conciliator.engine.enums.AccountType;
import com.conciliator.engine.enums.ClassificationSource;
import com.conciliator.engine.services.statements.model.AccountMetadata;
import com.conciliator.engine.services.statements.model.AccountProfileUpdate;
import com.conciliator.engine.services.statements.model.AdvisoryClassification;

class AccountClassifierTest {

    private final AccountClassifier classifier = new AccountClassifier();

    private static final String CREDIT_CARD_TEXT = String.join("\n",
            "BBVA MEXICO",
            "TARJETA DE CREDITO PLATINUM",
            "FECHA DE CORTE 05/12/2024",
            "PAGO MINIMO 1,250.00");

    @Test
    void creditCardPhrasesClassifyAsCreditCard() {
        AccountClassifier.HeuristicClassification result = classifier.classifyAccountType(CREDIT_CARD_TEXT);

        assertEquals(AccountType.CREDIT_CARD, result.accountType());
        assertEquals(3, result.creditHits());
        assertEquals(0.8, result.confidence(), 1e-9);
    }

    @Test
    void debitPhrasesAndPlainTextFallBack() {
        AccountClassifier.HeuristicClassification debit = classifier.classifyAccountType("ESTADO DE CUENTA DE CHEQUES\nCUENTA DE CHEQUES 0123");
        AccountClassifier.HeuristicClassification plain = classifier.classifyAccountType("MOVIMIENTOS DEL PERIODO");

        assertEquals(AccountType.DEBIT_CARD, debit.accountType());
        assertEquals(0.6, debit.confidence(), 1e-9);
        assertEquals(AccountType.CHECKING, plain.accountType());
        assertEquals(0.5, plain.confidence(), 1e-9);
    }

    @Test
    void textDecidesWhenNothingIsKnown() {
        AccountResolution resolution = classifier.resolve(CREDIT_CARD_TEXT, null, null, null, null);

        assertEquals("bbva", resolution.bankId());
        assertEquals("BBVA", resolution.bankName());
        assertEquals(AccountType.CREDIT_CARD, resolution.accountType());
        assertEquals(ClassificationSource.HEURISTIC, resolution.source());
        assertTrue(resolution.msiEnabled());
        assertNull(resolution.profileUpdate());
    }

    @Test
    void confidentAdvisoryOverridesStoredProfileAndSuggestsUpdate() {
        AdvisoryClassification advisory = new AdvisoryClassification("BBVA México", AccountType.CREDIT_CARD, 0.92);

        AccountResolution resolution = classifier.resolve("MOVIMIENTOS", advisory, AccountType.CHECKING, "Santander",
                new AccountMetadata("acc-1", "company-1", "tenant-1"));

        assertEquals("bbva", resolution.bankId());
        assertEquals(AccountType.CREDIT_CARD, resolution.accountType());
        assertEquals(ClassificationSource.ADVISORY, resolution.source());

        AccountProfileUpdate update = resolution.profileUpdate();
        assertEquals("acc-1", update.accountId());
        assertEquals(AccountType.CHECKING, update.previousAccountType());
        assertEquals(AccountType.CREDIT_CARD, update.newAccountType());
        assertEquals("Santander", update.previousBankName());
        assertEquals("BBVA", update.newBankName());
    }

    @Test
    void weakAdvisoryKeepsStoredAccountType() {
        AdvisoryClassification advisory = new AdvisoryClassification("BBVA", AccountType.CREDIT_CARD, 0.6);

        AccountResolution resolution = classifier.resolve("MOVIMIENTOS", advisory, AccountType.CHECKING, "bbva", null);

        assertEquals(AccountType.CHECKING, resolution.accountType());
        assertEquals(ClassificationSource.KNOWN, resolution.source());
        assertEquals(1.0, resolution.confidence(), 1e-9);
        assertNull(resolution.profileUpdate());
    }

    @Test
    void advisoryFillsMissingAccountTypeWithoutChangingBank() {
        AdvisoryClassification advisory = new AdvisoryClassification(null, AccountType.SAVINGS, 0.85);

        AccountResolution resolution = classifier.resolve("MOVIMIENTOS", advisory, null, "Banorte", null);

        assertEquals("banorte", resolution.bankId());
        assertEquals(AccountType.SAVINGS, resolution.accountType());
        assertEquals(AccountType.SAVINGS, resolution.profileUpdate().newAccountType());
        assertNull(resolution.profileUpdate().newBankName());
    }
}
