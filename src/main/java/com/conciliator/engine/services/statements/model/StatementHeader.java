package com.conciliator.engine.services.statements.model;

import java.math.BigDecimal;

import com.conciliator.engine.services.statements.util.YearContext;

/**
 * Statement-level values printed outside the movement table.
 */
public record StatementHeader(
        StatementPeriod period,
        BigDecimal openingBalance,
        BigDecimal closingBalance,
        Integer yearHint
) {
    public static StatementHeader empty() {
        return new StatementHeader(null, null, null, null);
    }

    public YearContext yearContext() {
        if (period == null) {
            return YearContext.ofYear(yearHint);
        }
        return new YearContext(yearHint, period.start(), period.end());
    }
}
