package com.conciliator.engine.services.statements.normalization;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.conciliator.engine.config.EngineTolerancesProperties;
import com.conciliator.engine.enums.TransactionDirection;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.util.CarryRows;
import com.conciliator.engine.services.statements.util.TextNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a strategy's raw candidates into the ledger: diverts balance carry rows, drops noise,
 * resolves direction and sign, labels movement kind and category, then deduplicates.
 * Running it again on its own output changes nothing.
 */
@Slf4j
@Component
public class TransactionNormalizer {

    static final String REJECT_BLANK = "blank_description";
    static final String REJECT_NOISE = "noise";
    static final String REJECT_SKIP = "skip_pattern";
    static final String REJECT_NO_AMOUNT = "no_amount";
    static final String REJECT_UNREALISTIC = "unrealistic_amount";
    static final String REJECT_ZERO = "zero_amount";

    private static final Pattern DIGITS_ONLY = Pattern.compile("^[\\d\\s.,/-]+$");
    private static final Set<String> SEPARATORS = Set.of("|", "-", "--", "_", "*");

    private final EngineTolerancesProperties tolerances;

    public TransactionNormalizer(EngineTolerancesProperties tolerances) {
        this.tolerances = tolerances != null ? tolerances : EngineTolerancesProperties.defaults();
    }

    public NormalizationOutcome normalize(List<Transaction> candidates, RuleSet rules) {
        if (candidates == null || candidates.isEmpty()) {
            return new NormalizationOutcome(List.of(), null, null, Map.of(), 0);
        }

        Map<String, Integer> rejections = new LinkedHashMap<>();
        List<Transaction> accepted = new ArrayList<>();
        BigDecimal openingCarry = null;
        BigDecimal closingCarry = null;
        BigDecimal previousBalance = null;

        for (Transaction tx : candidates) {
            if (tx == null) continue;
            String description = tx.getDescription() == null ? "" : tx.getDescription().trim();

            if (isCarry(tx, description)) {
                if (CarryRows.isClosing(description)) {
                    closingCarry = tx.getBalanceAfter();
                } else if (openingCarry == null) {
                    openingCarry = tx.getBalanceAfter();
                }
                if (tx.getBalanceAfter() != null) {
                    previousBalance = tx.getBalanceAfter();
                }
                continue;
            }

            String reason = rejectionReason(tx, description, rules);
            if (reason != null) {
                rejections.merge(reason, 1, Integer::sum);
                log.debug("[TransactionNormalizer] Dropped ({}): {}", reason, description);
                continue;
            }

            DirectionClassifier.Decision decision = DirectionClassifier.classify(tx, rules, previousBalance);
            TransactionDirection direction = decision.direction();
            BigDecimal magnitude = tx.getAmount().abs();
            tx.setDirection(direction);
            tx.setAmount(direction == TransactionDirection.CREDIT ? magnitude : magnitude.negate());
            tx.setMovementKind(MovementCategorizer.movementKind(description, direction));
            tx.setCategory(MovementCategorizer.categorize(description, direction));
            tx.setDescription(description);

            if (tx.getBalanceAfter() != null) {
                previousBalance = tx.getBalanceAfter();
            }
            accepted.add(tx);
        }

        TransactionDeduplicator.Result dedup = TransactionDeduplicator.deduplicate(accepted);
        NormalizationOutcome outcome = new NormalizationOutcome(
                dedup.transactions(), openingCarry, closingCarry, rejections, dedup.merged());

        log.info("[TransactionNormalizer] {} candidates -> {} transactions (rejected={}, merged={})",
                candidates.size(), outcome.transactions().size(), outcome.rejected(), outcome.merged());
        return outcome;
    }

    private static boolean isCarry(Transaction tx, String description) {
        if (tx.isCarryRow()) return true;
        boolean noAmount = tx.getAmount() == null || tx.getAmount().signum() == 0;
        return noAmount && CarryRows.isCarry(description);
    }

    private String rejectionReason(Transaction tx, String description, RuleSet rules) {
        if (description.isEmpty()) return REJECT_BLANK;
        if (SEPARATORS.contains(description) || DIGITS_ONLY.matcher(description).matches()) return REJECT_NOISE;
        if (TextNormalizer.containsAny(description, rules.getSkipKeywords())) return REJECT_SKIP;

        BigDecimal amount = tx.getAmount();
        if (amount == null) return REJECT_NO_AMOUNT;
        if (amount.abs().compareTo(tolerances.unrealisticAmountCeiling()) > 0) return REJECT_UNREALISTIC;
        if (amount.signum() == 0) return REJECT_ZERO;
        return null;
    }
}
