package com.conciliator.engine.services.statements.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.conciliator.engine.config.QualityScoreConfig;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.strategies.ExtractionStrategy;
import com.conciliator.engine.services.statements.strategies.StrategyResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs strategies in priority order, keeps the best-scoring result and stops as soon as one is
 * good enough. In parallel mode every strategy is started at once but results are still consumed
 * in priority order, so the winner never depends on which thread finished first.
 */
@Slf4j
@Component
public class StrategySelector {

    public record Candidate(
            String strategy,
            double score,
            List<Transaction> transactions,
            Map<String, Object> metadata,
            String error
    ) {
        public boolean failed() {
            return error != null;
        }

        public int count() {
            return transactions == null ? 0 : transactions.size();
        }
    }

    public record Selection(
            Candidate chosen,
            List<Candidate> evaluated,
            boolean earlyExit
    ) {
        public boolean allFailed() {
            return chosen == null;
        }
    }

    private final StrategyQualityScorer scorer;
    private final QualityScoreConfig config;
    private final Executor executor;

    public StrategySelector(StrategyQualityScorer scorer,
                            QualityScoreConfig config,
                            @Qualifier("strategyTaskExecutor") Executor executor) {
        this.scorer = scorer;
        this.config = config;
        this.executor = executor;
    }

    public Selection select(List<? extends ExtractionStrategy> strategies, String text, RuleSet rules) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("No extraction strategy configured.");
        }
        log.debug("[StrategySelector] Selecting among {} strategies with config: {}", strategies.size(), config.getDescription());
        if (config.isParallelStrategies() && executor != null && strategies.size() > 1) {
            return selectParallel(strategies, text, rules);
        }

        Candidate best = null;
        List<Candidate> evaluated = new ArrayList<>();
        for (ExtractionStrategy strategy : strategies) {
            Candidate candidate = evaluate(strategy, text, rules);
            evaluated.add(candidate);
            best = better(best, candidate);
            if (isEarlyExit(candidate)) {
                log.info("[StrategySelector] Early exit on {} (score={}, tx={})",
                        candidate.strategy(), format(candidate.score()), candidate.count());
                return new Selection(best, evaluated, true);
            }
        }
        return finish(best, evaluated);
    }

    private Selection selectParallel(List<? extends ExtractionStrategy> strategies, String text, RuleSet rules) {
        List<CompletableFuture<Candidate>> futures = new ArrayList<>();
        for (ExtractionStrategy strategy : strategies) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluate(strategy, text, rules), executor));
        }

        Candidate best = null;
        List<Candidate> evaluated = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            Candidate candidate = futures.get(i).join();
            evaluated.add(candidate);
            best = better(best, candidate);
            if (isEarlyExit(candidate)) {
                for (int j = i + 1; j < futures.size(); j++) {
                    futures.get(j).cancel(false);
                }
                log.info("[StrategySelector] Early exit on {} (score={}, tx={}), {} lower-priority results discarded",
                        candidate.strategy(), format(candidate.score()), candidate.count(), futures.size() - i - 1);
                return new Selection(best, evaluated, true);
            }
        }
        return finish(best, evaluated);
    }

    private Selection finish(Candidate best, List<Candidate> evaluated) {
        if (best == null) {
            log.warn("[StrategySelector] All {} strategies failed", evaluated.size());
            return new Selection(null, evaluated, false);
        }
        log.info("[StrategySelector] Selected {} (score={}, tx={}) after {} strategies",
                best.strategy(), format(best.score()), best.count(), evaluated.size());
        return new Selection(best, evaluated, false);
    }

    private Candidate evaluate(ExtractionStrategy strategy, String text, RuleSet rules) {
        StrategyResult result;
        try {
            result = strategy.run(text, rules);
        } catch (RuntimeException e) {
            log.warn("[StrategySelector] {} threw {}", strategy.name(), e.toString());
            return new Candidate(strategy.name(), 0.0, List.of(), Map.of(), "exception: " + e.getClass().getSimpleName());
        }
        if (result == null) {
            return new Candidate(strategy.name(), 0.0, List.of(), Map.of(), "null_result");
        }
        if (result.isFailed()) {
            log.debug("[StrategySelector] {} failed: {}", strategy.name(), result.error());
            return new Candidate(strategy.name(), 0.0, List.of(), result.metadata(), result.error());
        }

        double score = scorer.score(result.transactions(), text);
        log.debug("[StrategySelector] {} scored {} with {} transactions", strategy.name(), format(score), result.count());
        return new Candidate(strategy.name(), score, result.transactions(), result.metadata(), null);
    }

    /** Strictly higher score wins, so ties go to the higher-priority strategy. */
    private static Candidate better(Candidate best, Candidate candidate) {
        if (candidate.failed() || candidate.score() <= 0.0) {
            return best;
        }
        if (best == null || candidate.score() > best.score()) {
            return candidate;
        }
        return best;
    }

    private boolean isEarlyExit(Candidate candidate) {
        return !candidate.failed() && config.isEarlyExit(candidate.score(), candidate.count());
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.3f", score);
    }
}
