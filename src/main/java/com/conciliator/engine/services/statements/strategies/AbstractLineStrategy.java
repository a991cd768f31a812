package com.conciliator.engine.services.statements.strategies;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.conciliator.engine.services.statements.model.StatementHeader;
import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.rules.LinePattern;
import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.util.AmountParser;
import com.conciliator.engine.services.statements.util.CarryRows;
import com.conciliator.engine.services.statements.util.DateResolver;
import com.conciliator.engine.services.statements.util.DescriptionCleaner;
import com.conciliator.engine.services.statements.util.StatementHeaderExtractor;
import com.conciliator.engine.services.statements.util.StatementLines;
import com.conciliator.engine.services.statements.util.TextNormalizer;

import lombok.extern.slf4j.Slf4j;

/**
 * Line-by-line scan shared by the text strategies: skip lines, multiline concept merging and
 * transaction construction. Subclasses only decide how a single line is read.
 */
@Slf4j
public abstract class AbstractLineStrategy implements ExtractionStrategy {

    private static final Pattern HAS_LETTER = Pattern.compile("\\p{L}");
    private static final Pattern HAS_STRICT_AMOUNT = Pattern.compile(AmountParser.STRICT_AMOUNT);
    private static final int MAX_CONTINUATION_LENGTH = 120;

    @FunctionalInterface
    protected interface LineParser {
        Optional<Transaction> parse(String line, LineContext ctx);
    }

    /**
     * Builds the parser for this run. Returning null aborts the run; put the reason under "error" in metadata.
     */
    protected abstract LineParser prepare(List<String> lines, LineContext ctx, Map<String, Object> metadata);

    protected abstract double baseConfidence();

    protected int minLineLength() {
        return 10;
    }

    @Override
    public final StrategyResult run(String text, RuleSet rules) {
        if (text == null || text.isBlank()) {
            return StrategyResult.failed(name(), "empty_text", Map.of());
        }
        try {
            return scan(text, rules);
        } catch (RuntimeException e) {
            log.warn("[{}] Strategy failed: {}", name(), e.toString());
            return StrategyResult.failed(name(), "unexpected_error: " + e.getClass().getSimpleName(), Map.of());
        }
    }

    private StrategyResult scan(String text, RuleSet rules) {
        List<String> lines = StatementLines.splitSmart(text);
        StatementHeader header = StatementHeaderExtractor.extract(text);
        LineContext ctx = new LineContext(rules, header.yearContext());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("lines", lines.size());

        LineParser parser = prepare(lines, ctx, metadata);
        if (parser == null) {
            String error = String.valueOf(metadata.getOrDefault("error", "not_applicable"));
            return StrategyResult.failed(name(), error, metadata);
        }

        List<Transaction> out = new ArrayList<>();
        int skipped = 0;
        int merged = 0;
        int ignored = 0;
        boolean continuationOpen = false;

        for (String line : lines) {
            if (line.isEmpty()) continue;

            Optional<Transaction> parsed = line.length() >= minLineLength()
                    ? parser.parse(line, ctx)
                    : Optional.empty();

            if (parsed.isPresent()) {
                Transaction tx = parsed.get();
                tx.setRawLine(line);
                tx.setSourceStrategy(name());
                if (tx.getReference() == null) {
                    tx.setReference(DescriptionCleaner.extractReference(tx.getDescription()));
                }
                if (tx.getBalanceAfter() != null) {
                    ctx.setPreviousBalance(tx.getBalanceAfter());
                }
                out.add(tx);
                continuationOpen = !tx.isCarryRow();
            } else if (isSkipLine(line, rules)) {
                skipped++;
                continuationOpen = false;
            } else if (rules.isMergeMultilineConcepts() && continuationOpen && isContinuation(line, ctx)) {
                out.get(out.size() - 1).appendDescription(DescriptionCleaner.clean(line));
                merged++;
            } else {
                ignored++;
                continuationOpen = false;
            }
        }

        metadata.put("matchedLines", out.size());
        metadata.put("skippedLines", skipped);
        metadata.put("continuationLines", merged);
        metadata.put("ignoredLines", ignored);
        log.debug("[{}] matched={}, skipped={}, continuations={}, ignored={}",
                name(), out.size(), skipped, merged, ignored);

        if (out.isEmpty()) {
            return StrategyResult.failed(name(), "no_transactions", metadata);
        }
        return StrategyResult.success(name(), out, metadata);
    }

    protected boolean isSkipLine(String line, RuleSet rules) {
        return TextNormalizer.containsAny(line, rules.getSkipKeywords());
    }

    private boolean isContinuation(String line, LineContext ctx) {
        if (line.length() > MAX_CONTINUATION_LENGTH) return false;
        if (!HAS_LETTER.matcher(line).find()) return false;
        if (HAS_STRICT_AMOUNT.matcher(line).find()) return false;
        return DateResolver.findFirst(line, ctx.getYears())
                .map(m -> m.start() > 0)
                .orElse(true);
    }

    /**
     * Creates a transaction from already split tokens. Returns empty when the amount is unreadable.
     * Carry descriptions produce a zero-amount carry row holding the printed balance.
     */
    protected Optional<Transaction> build(LocalDate date,
                                          String rawDescription,
                                          String amountToken,
                                          String balanceToken,
                                          String reference,
                                          double confidence) {
        BigDecimal amount = AmountParser.parse(amountToken);
        BigDecimal balance = AmountParser.parse(balanceToken);
        if (amount == null) {
            return Optional.empty();
        }

        String description = DescriptionCleaner.clean(rawDescription);
        if (description.isEmpty()) {
            description = rawDescription == null ? "" : rawDescription.trim();
        }

        if (CarryRows.isCarry(description)) {
            return Optional.of(Transaction.builder()
                    .date(date)
                    .description(description)
                    .amount(BigDecimal.ZERO)
                    .balanceAfter(balance != null ? balance : amount)
                    .carryRow(true)
                    .confidence(confidence)
                    .build());
        }

        return Optional.of(Transaction.builder()
                .date(date)
                .description(description)
                .amount(amount)
                .balanceAfter(balance)
                .reference(reference)
                .confidence(confidence)
                .build());
    }

    /**
     * Reads a line through a named-group pattern (bank override or synthesized layout).
     */
    protected Optional<Transaction> fromLinePattern(LinePattern pattern, String line, LineContext ctx, double confidence) {
        Matcher m = pattern.pattern().matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        LocalDate date;
        String dateToken = pattern.group(m, "date");
        if (dateToken != null) {
            date = DateResolver.parse(dateToken, ctx.getYears());
        } else {
            date = DateResolver.fromMonthDay(pattern.group(m, "month"), pattern.group(m, "day"), ctx.getYears());
        }
        return build(date,
                pattern.group(m, "description"),
                pattern.group(m, "amount"),
                pattern.group(m, "balance"),
                pattern.group(m, "reference"),
                confidence);
    }
}
