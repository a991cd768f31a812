package com.conciliator.engine.services.statements.strategies;

import com.conciliator.engine.services.statements.rules.RuleSet;

/**
 * One way of turning statement text into candidate transactions.
 * Implementations are stateless and never throw for unparseable input: they return
 * {@link StrategyResult#failed} with the reason instead.
 */
public interface ExtractionStrategy {

    String name();

    StrategyResult run(String text, RuleSet rules);
}
