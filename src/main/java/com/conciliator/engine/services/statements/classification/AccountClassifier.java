package com.conciliator.engine.services.statements.classification;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.conciliator.engine.enums.AccountType;
import com.conciliator.engine.enums.ClassificationSource;
import com.conciliator.engine.enums.KnownBank;
import com.conciliator.engine.services.statements.model.AccountMetadata;
import com.conciliator.engine.services.statements.model.AccountProfileUpdate;
import com.conciliator.engine.services.statements.model.AdvisoryClassification;
import com.conciliator.engine.services.statements.util.TextNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Resolves bank identity and account type. An injected advisory classification is preferred;
 * otherwise bank names and credit-card/debit phrases in the first pages decide.
 */
@Slf4j
@Component
public class AccountClassifier {

    static final double ACCOUNT_TYPE_UPDATE_CONFIDENCE = 0.80;
    static final double BANK_UPDATE_CONFIDENCE = 0.90;

    private static final int TEXT_WINDOW = 8000;

    static final List<String> CREDIT_CARD_PHRASES = List.of(
            "tarjeta de credito", "credit card", "limite de credito", "credit limit",
            "pago minimo", "minimum payment", "fecha de corte", "saldo para no generar intereses");

    static final List<String> DEBIT_PHRASES = List.of(
            "tarjeta de debito", "debit card", "cuenta de cheques", "checking account");

    public record HeuristicClassification(AccountType accountType, double confidence, int creditHits, int debitHits) {
    }

    private record BankIdentity(String id, String name, ClassificationSource source) {
    }

    public HeuristicClassification classifyAccountType(String text) {
        String window = text == null ? "" : text.substring(0, Math.min(TEXT_WINDOW, text.length()));
        int creditHits = countHits(window, CREDIT_CARD_PHRASES);
        int debitHits = countHits(window, DEBIT_PHRASES);

        if (creditHits >= 2) {
            return new HeuristicClassification(AccountType.CREDIT_CARD, Math.min(0.8, 0.5 + 0.1 * creditHits), creditHits, debitHits);
        }
        if (debitHits >= 1) {
            return new HeuristicClassification(AccountType.DEBIT_CARD, Math.min(0.7, 0.5 + 0.1 * debitHits), creditHits, debitHits);
        }
        return new HeuristicClassification(AccountType.CHECKING, 0.5, creditHits, debitHits);
    }

    public AccountResolution resolve(String text,
                                     AdvisoryClassification advisory,
                                     AccountType knownType,
                                     String bankHint,
                                     AccountMetadata metadata) {
        BankIdentity bank = resolveBank(text, advisory, bankHint);

        AccountType accountType;
        double confidence;
        ClassificationSource source;
        boolean advisoryType = advisory != null && advisory.accountType() != null;

        if (advisoryType && (knownType == null
                || (advisory.confidence() >= ACCOUNT_TYPE_UPDATE_CONFIDENCE && advisory.accountType() != knownType))) {
            accountType = advisory.accountType();
            confidence = advisory.confidence();
            source = ClassificationSource.ADVISORY;
        } else if (knownType != null) {
            accountType = knownType;
            confidence = 1.0;
            source = ClassificationSource.KNOWN;
        } else {
            HeuristicClassification heuristic = classifyAccountType(text);
            accountType = heuristic.accountType();
            confidence = heuristic.confidence();
            source = ClassificationSource.HEURISTIC;
            log.debug("[AccountClassifier] Heuristic {} (creditHits={}, debitHits={})",
                    accountType, heuristic.creditHits(), heuristic.debitHits());
        }

        AccountProfileUpdate update = profileUpdate(advisory, knownType, bankHint, bank, metadata);
        if (update != null) {
            log.info("[AccountClassifier] Profile update suggested for account {}: type {} -> {}, bank {} -> {} (confidence={})",
                    update.accountId(), update.previousAccountType(), update.newAccountType(),
                    update.previousBankName(), update.newBankName(), update.confidence());
        }

        log.info("[AccountClassifier] bank={} ({}), accountType={} ({}, confidence={})",
                bank.name(), bank.source(), accountType, source, confidence);
        return new AccountResolution(bank.id(), bank.name(), accountType, confidence, source, update);
    }

    private BankIdentity resolveBank(String text, AdvisoryClassification advisory, String bankHint) {
        if (advisory != null && advisory.bankName() != null && !advisory.bankName().isBlank()) {
            return identify(advisory.bankName(), ClassificationSource.ADVISORY);
        }
        if (bankHint != null && !bankHint.isBlank()) {
            return identify(bankHint, ClassificationSource.KNOWN);
        }
        Optional<KnownBank> detected = BankDetector.detect(text);
        if (detected.isPresent()) {
            return new BankIdentity(detected.get().getId(), detected.get().getDisplayName(), ClassificationSource.HEURISTIC);
        }
        return new BankIdentity(null, null, ClassificationSource.HEURISTIC);
    }

    private static BankIdentity identify(String name, ClassificationSource source) {
        return KnownBank.fromName(name)
                .map(b -> new BankIdentity(b.getId(), b.getDisplayName(), source))
                .orElseGet(() -> new BankIdentity(TextNormalizer.normalize(name), name.trim(), source));
    }

    private static AccountProfileUpdate profileUpdate(AdvisoryClassification advisory,
                                                      AccountType knownType,
                                                      String bankHint,
                                                      BankIdentity bank,
                                                      AccountMetadata metadata) {
        if (advisory == null) return null;

        AccountType newType = null;
        if (advisory.accountType() != null
                && advisory.confidence() >= ACCOUNT_TYPE_UPDATE_CONFIDENCE
                && advisory.accountType() != knownType) {
            newType = advisory.accountType();
        }

        String newBank = null;
        if (bank.source() == ClassificationSource.ADVISORY
                && advisory.confidence() >= BANK_UPDATE_CONFIDENCE
                && !sameBank(bank, bankHint)) {
            newBank = bank.name();
        }

        if (newType == null && newBank == null) return null;
        return new AccountProfileUpdate(
                metadata != null ? metadata.id() : null,
                knownType,
                newType,
                bankHint,
                newBank,
                advisory.confidence());
    }

    private static boolean sameBank(BankIdentity bank, String bankHint) {
        if (bankHint == null || bankHint.isBlank()) return false;
        BankIdentity hinted = identify(bankHint, ClassificationSource.KNOWN);
        return hinted.id() != null && hinted.id().equals(bank.id());
    }

    private static int countHits(String text, List<String> phrases) {
        int hits = 0;
        for (String phrase : phrases) {
            if (TextNormalizer.containsPhrase(text, phrase)) hits++;
        }
        return hits;
    }
}
