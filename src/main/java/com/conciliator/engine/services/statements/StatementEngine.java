package com.conciliator.engine.services.statements;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.conciliator.engine.config.QualityScoreConfig;
import com.conciliator.engine.enums.ReconciliationStatus;
import com.conciliator.engine.enums.StatementIssue;
import com.conciliator.engine.services.statements.classification.AccountClassifier;
import com.conciliator.engine.services.statements.classification.AccountResolution;
import com.conciliator.engine.services.statements.model.MatchResult;
import com.conciliator.engine.services.statements.model.ParseDiagnostics;
import com.conciliator.engine.services.statements.model.StatementHeader;
import com.conciliator.engine.services.statements.model.StatementRequest;
import com.conciliator.engine.services.statements.model.StatementResult;
import com.conciliator.engine.services.statements.model.StatementSummary;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.msi.MsiMatcher;
import com.conciliator.engine.services.statements.normalization.NormalizationOutcome;
import com.conciliator.engine.services.statements.normalization.TransactionNormalizer;
import com.conciliator.engine.services.statements.quality.DocumentAnalyzer;
import com.conciliator.engine.services.statements.quality.StrategySelector;
import com.conciliator.engine.services.statements.reconciliation.BalanceReconciler;
import com.conciliator.engine.services.statements.rules.BankRuleProvider;
import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.strategies.AbstractLineStrategy;
import com.conciliator.engine.services.statements.strategies.ExtractionStrategy;
import com.conciliator.engine.services.statements.strategies.StructuredRecordStrategy;
import com.conciliator.engine.services.statements.util.StatementHeaderExtractor;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point: extracted statement text in, reconciled ledger plus installment matches out.
 * <p>
 * Classification picks the bank rules, the selector runs the strategy chain, the normalizer cleans
 * the winner's candidates, the reconciler checks the balances and, for credit cards, the MSI matcher
 * links charges to invoices. The engine holds no per-statement state, so one instance serves
 * concurrent calls.
 */
@Slf4j
@Service
public class StatementEngine {

    private final AccountClassifier accountClassifier;
    private final BankRuleProvider ruleProvider;
    private final List<AbstractLineStrategy> lineStrategies;
    private final StructuredRecordStrategy structuredStrategy;
    private final StrategySelector selector;
    private final TransactionNormalizer normalizer;
    private final BalanceReconciler reconciler;
    private final MsiMatcher msiMatcher;
    private final QualityScoreConfig qualityConfig;

    /**
     * @param lineStrategies text strategies in priority order (Spring sorts them by {@code @Order})
     */
    public StatementEngine(AccountClassifier accountClassifier,
                           BankRuleProvider ruleProvider,
                           List<AbstractLineStrategy> lineStrategies,
                           StructuredRecordStrategy structuredStrategy,
                           StrategySelector selector,
                           TransactionNormalizer normalizer,
                           BalanceReconciler reconciler,
                           MsiMatcher msiMatcher,
                           QualityScoreConfig qualityConfig) {
        this.accountClassifier = accountClassifier;
        this.ruleProvider = ruleProvider;
        this.lineStrategies = List.copyOf(lineStrategies);
        this.structuredStrategy = structuredStrategy;
        this.selector = selector;
        this.normalizer = normalizer;
        this.reconciler = reconciler;
        this.msiMatcher = msiMatcher;
        this.qualityConfig = qualityConfig;
    }

    public StatementResult process(StatementRequest request) {
        ParseDiagnostics diagnostics = ParseDiagnostics.builder().build();
        String text = request == null ? null : request.getText();
        if (text == null || text.isBlank()) {
            diagnostics.addIssue(StatementIssue.EXTRACTION_EMPTY);
            log.warn("[StatementEngine] Empty statement text");
            throw new StatementParsingException(StatementIssue.EXTRACTION_EMPTY, "Statement text is empty.", diagnostics);
        }

        boolean structured = structuredStrategy.accepts(text);
        diagnostics.setDocumentProfile(DocumentAnalyzer.analyze(text, structured));

        AccountResolution account = accountClassifier.resolve(
                text,
                request.getAdvisoryClassification(),
                request.getAccountType(),
                request.getBankHint(),
                request.getAccountMetadata());

        RuleSet rules = ruleProvider.resolve(account.bankId());
        diagnostics.setBankId(account.bankId());
        diagnostics.setRulesSource(rules.isBase() ? "base" : rules.getBankId() + " v" + rules.getVersion());

        List<? extends ExtractionStrategy> chain = structured ? List.of(structuredStrategy) : lineStrategies;
        StrategySelector.Selection selection = selector.select(chain, text, rules);
        for (StrategySelector.Candidate candidate : selection.evaluated()) {
            diagnostics.getStrategyScores().put(candidate.strategy(), candidate.score());
            if (candidate.failed()) {
                diagnostics.getStrategyErrors().put(candidate.strategy(), candidate.error());
            }
        }
        diagnostics.setEarlyExit(selection.earlyExit());

        if (selection.allFailed()) {
            diagnostics.addIssue(StatementIssue.ALL_STRATEGIES_FAILED);
            log.warn("[StatementEngine] All strategies failed for bank={}: {}", account.bankId(), diagnostics.getStrategyErrors());
            throw new StatementParsingException(StatementIssue.ALL_STRATEGIES_FAILED,
                    "No extraction strategy produced transactions.", diagnostics);
        }

        StrategySelector.Candidate chosen = selection.chosen();
        diagnostics.setSelectedStrategy(chosen.strategy());
        diagnostics.setSelectedScore(chosen.score());
        if (chosen.score() < qualityConfig.getCompletionThreshold()) {
            diagnostics.addIssue(StatementIssue.PARTIAL_QUALITY);
            log.warn("[StatementEngine] Partial quality: {} scored {} (threshold {})",
                    chosen.strategy(), String.format(Locale.ROOT, "%.3f", chosen.score()), qualityConfig.getCompletionThreshold());
        }

        StatementHeader header = StatementHeaderExtractor.extract(text);
        NormalizationOutcome outcome = normalizer.normalize(chosen.transactions(), rules);
        diagnostics.setRejections(new LinkedHashMap<>(outcome.rejections()));
        diagnostics.setMergedDuplicates(outcome.merged());

        List<Transaction> ledger = new ArrayList<>(outcome.transactions());
        for (int i = 0; i < ledger.size(); i++) {
            ledger.get(i).setRef(String.format(Locale.ROOT, "TX-%04d", i + 1));
        }

        BigDecimal opening = header.openingBalance() != null ? header.openingBalance() : outcome.openingCarry();
        BigDecimal closing = header.closingBalance() != null ? header.closingBalance() : outcome.closingCarry();
        StatementSummary summary = reconciler.reconcile(ledger, opening, closing, header.period(), account.bankName());
        diagnostics.setReconciliationStatus(summary.getReconciliationStatus());
        if (summary.getReconciliationStatus() == ReconciliationStatus.MISMATCH) {
            diagnostics.addIssue(StatementIssue.RECONCILIATION_MISMATCH);
        }

        List<MatchResult> matches = List.of();
        if (account.msiEnabled()) {
            matches = msiMatcher.match(ledger, request.getInvoiceCandidates(), account.accountType(), request.getPeriodOverride());
            if (matches.stream().anyMatch(MatchResult::ambiguous)) {
                diagnostics.addIssue(StatementIssue.AMBIGUOUS_MSI_MATCH);
            }
        }

        log.info("[StatementEngine] bank={} strategy={} tx={} status={} msiMatches={} issues={}",
                account.bankName(), chosen.strategy(), ledger.size(), summary.getReconciliationStatus(),
                matches.size(), diagnostics.getIssues());

        return StatementResult.builder()
                .transactions(ledger)
                .summary(summary)
                .matches(matches)
                .diagnostics(diagnostics)
                .account(account)
                .build();
    }
}
