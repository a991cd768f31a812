package com.conciliator.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Strategy selection thresholds.
 * Loaded from application.properties with prefix "conciliator.quality".
 *
 * Example:
 * conciliator.quality.early-exit-score=0.9
 * conciliator.quality.early-exit-min-transactions=10
 * conciliator.quality.completion-threshold=0.5
 * conciliator.quality.parallel-strategies=false
 */
@Data
@Component
@ConfigurationProperties(prefix = "conciliator.quality")
public class QualityScoreConfig {

    /**
     * Score at which the selector stops trying lower-priority strategies.
     */
    private double earlyExitScore = 0.9;

    /**
     * The early exit also requires strictly more transactions than this.
     */
    private int earlyExitMinTransactions = 10;

    /**
     * Winning scores below this value are reported as partial quality.
     */
    private double completionThreshold = 0.5;

    /**
     * Run every strategy on the strategy executor instead of one after the other.
     * Results are still evaluated in priority order.
     */
    private boolean parallelStrategies = false;

    public boolean isEarlyExit(double score, int transactionCount) {
        return score >= earlyExitScore && transactionCount > earlyExitMinTransactions;
    }

    public String getDescription() {
        return String.format(
                "QualityScoreConfig{earlyExit=%.2f, earlyExitMinTx=%d, completion=%.2f, parallel=%s}",
                earlyExitScore,
                earlyExitMinTransactions,
                completionThreshold,
                parallelStrategies);
    }
}
