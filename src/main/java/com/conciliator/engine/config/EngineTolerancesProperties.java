package com.conciliator.engine.config;

import java.math.BigDecimal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable thresholds for the normalizer, the reconciler and the MSI matcher.
 */
@ConfigurationProperties(prefix = "conciliator.tolerances")
public record EngineTolerancesProperties(
        BigDecimal unrealisticAmountCeiling,
        BigDecimal reconciliationTolerance,
        BigDecimal msiAmountTolerance,
        BigDecimal msiMonthsTolerance,
        Integer msiLookbackDays,
        Integer msiLookaheadDays
) {
    public EngineTolerancesProperties {
        if (unrealisticAmountCeiling == null) {
            unrealisticAmountCeiling = new BigDecimal("1000000");
        }
        if (reconciliationTolerance == null) {
            reconciliationTolerance = new BigDecimal("0.5");
        }
        if (msiAmountTolerance == null) {
            msiAmountTolerance = new BigDecimal("0.02");
        }
        if (msiMonthsTolerance == null) {
            msiMonthsTolerance = new BigDecimal("0.03");
        }
        if (msiLookbackDays == null) {
            msiLookbackDays = 30;
        }
        if (msiLookaheadDays == null) {
            msiLookaheadDays = 7;
        }
    }

    public static EngineTolerancesProperties defaults() {
        return new EngineTolerancesProperties(null, null, null, null, null, null);
    }
}
