package com.conciliator.engine.services.statements.strategies;

import java.math.BigDecimal;

import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.util.YearContext;

import lombok.Getter;
import lombok.Setter;

/**
 * Per-run state of a line scan. Never shared between runs.
 */
@Getter
public class LineContext {

    private final RuleSet rules;
    private final YearContext years;

    @Setter
    private BigDecimal previousBalance;

    public LineContext(RuleSet rules, YearContext years) {
        this.rules = rules;
        this.years = years;
    }
}
