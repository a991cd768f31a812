package com.conciliator.engine.services.statements.quality;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.conciliator.engine.services.statements.model.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Scores a candidate transaction list in [0, 1].
 *
 * 0.30 * min(count / 50, 1)
 * + 0.20 * opening balance marker present
 * + 0.20 * min(distinct 20-char description prefixes / 20, 1)
 * + 0.15 * share of rows with a non-zero amount
 * + 0.15 * share of rows with a date
 */
@Slf4j
@Component
public class StrategyQualityScorer {

    static final double COUNT_WEIGHT = 0.30;
    static final double OPENING_WEIGHT = 0.20;
    static final double VARIETY_WEIGHT = 0.20;
    static final double AMOUNT_WEIGHT = 0.15;
    static final double DATE_WEIGHT = 0.15;

    private static final int COUNT_SATURATION = 50;
    private static final int VARIETY_SATURATION = 20;
    private static final int PREFIX_LENGTH = 20;

    public double score(List<Transaction> transactions, String rawText) {
        if (transactions == null || transactions.isEmpty()) {
            log.debug("[StrategyQualityScorer] No transactions, score=0");
            return 0.0;
        }

        int count = transactions.size();
        double score = 0.0;

        double countSignal = Math.min((double) count / COUNT_SATURATION, 1.0);
        score += COUNT_WEIGHT * countSignal;
        log.debug("[StrategyQualityScorer] count={} +{} (total: {})", count, COUNT_WEIGHT * countSignal, score);

        if (hasOpeningBalanceMarker(transactions)) {
            score += OPENING_WEIGHT;
            log.debug("[StrategyQualityScorer] ✓ Opening balance marker +{} (total: {})", OPENING_WEIGHT, score);
        } else {
            log.debug("[StrategyQualityScorer] ✗ Opening balance marker NOT found");
        }

        Set<String> prefixes = new HashSet<>();
        int validAmounts = 0;
        int validDates = 0;
        for (Transaction tx : transactions) {
            String description = tx.getDescription() == null ? "" : tx.getDescription().trim();
            prefixes.add(description.substring(0, Math.min(PREFIX_LENGTH, description.length())));
            if (tx.getAmount() != null && tx.getAmount().compareTo(BigDecimal.ZERO) != 0) validAmounts++;
            if (tx.getDate() != null) validDates++;
        }

        double variety = Math.min((double) prefixes.size() / VARIETY_SATURATION, 1.0);
        score += VARIETY_WEIGHT * variety;
        score += AMOUNT_WEIGHT * ((double) validAmounts / count);
        score += DATE_WEIGHT * ((double) validDates / count);
        log.debug("[StrategyQualityScorer] prefixes={}, validAmounts={}/{}, validDates={}/{} (total: {})",
                prefixes.size(), validAmounts, count, validDates, count, score);

        double bounded = Math.max(0.0, Math.min(1.0, score));
        log.debug("[StrategyQualityScorer] Final score {} over {} chars of text",
                String.format(Locale.ROOT, "%.3f", bounded), rawText == null ? 0 : rawText.length());
        return bounded;
    }

    private static boolean hasOpeningBalanceMarker(List<Transaction> transactions) {
        for (Transaction tx : transactions) {
            if (tx.isCarryRow()) return true;
            String d = tx.getDescription();
            if (d != null && d.toUpperCase(Locale.ROOT).contains("BALANCE")) return true;
        }
        return false;
    }
}
