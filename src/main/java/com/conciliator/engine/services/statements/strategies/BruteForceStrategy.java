package com.conciliator.engine.services.statements.strategies;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.rules.RuleSet;
import com.conciliator.engine.services.statements.util.AmountParser;
import com.conciliator.engine.services.statements.util.DateResolver;

/**
 * Last resort: permissive patterns (three-letter month + day + free text + amounts) searched
 * anywhere in the line, then a generic pass that pairs any date token with the rule set's amount patterns.
 */
@Component
@Order(4)
public class BruteForceStrategy extends AbstractLineStrategy {

    public static final String NAME = "brute_force";

    private static final String NUM = "([\\d,]+\\.?\\d*)";

    private static final Pattern MONTH_DAY_FOLIO_TWO = Pattern.compile(
            "([A-Z]{3})\\.?\\s+(\\d{1,2})\\s+(\\d{8,})\\s+(.+?)\\s+" + NUM + "\\s+" + NUM, Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY_TWO = Pattern.compile(
            "([A-Z]{3})\\.?\\s+(\\d{1,2})\\s+(.+?)\\s+" + NUM + "\\s+" + NUM + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_MONTH_ONE = Pattern.compile(
            "(\\d{1,2})\\s+([A-Z]{3})\\.?\\s+(.+?)\\s+" + NUM + "\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY_ONE = Pattern.compile(
            "([A-Z]{3})\\.?\\s+(\\d{1,2})\\s+(.+?)\\s+" + NUM + "\\s*$", Pattern.CASE_INSENSITIVE);

    private static final double PATTERN_CONFIDENCE = 0.5;
    private static final double GENERIC_CONFIDENCE = 0.4;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double baseConfidence() {
        return PATTERN_CONFIDENCE;
    }

    @Override
    protected int minLineLength() {
        return 20;
    }

    @Override
    protected LineParser prepare(List<String> lines, LineContext ctx, Map<String, Object> metadata) {
        metadata.put("amountPatterns", ctx.getRules().getAmountPatterns().size());
        return this::parseLine;
    }

    private Optional<Transaction> parseLine(String line, LineContext ctx) {
        Matcher m = MONTH_DAY_FOLIO_TWO.matcher(line);
        if (m.find() && DateResolver.monthNumber(m.group(1)) != null) {
            return build(DateResolver.fromMonthDay(m.group(1), m.group(2), ctx.getYears()),
                    m.group(4), m.group(5), m.group(6), m.group(3), PATTERN_CONFIDENCE);
        }

        m = MONTH_DAY_TWO.matcher(line);
        if (m.find() && DateResolver.monthNumber(m.group(1)) != null) {
            return build(DateResolver.fromMonthDay(m.group(1), m.group(2), ctx.getYears()),
                    m.group(3), m.group(4), m.group(5), null, PATTERN_CONFIDENCE);
        }

        m = DAY_MONTH_ONE.matcher(line);
        if (m.find() && DateResolver.monthNumber(m.group(2)) != null) {
            return build(DateResolver.fromMonthDay(m.group(2), m.group(1), ctx.getYears()),
                    m.group(3), m.group(4), null, null, PATTERN_CONFIDENCE);
        }

        m = MONTH_DAY_ONE.matcher(line);
        if (m.find() && DateResolver.monthNumber(m.group(1)) != null) {
            return build(DateResolver.fromMonthDay(m.group(1), m.group(2), ctx.getYears()),
                    m.group(3), m.group(4), null, null, PATTERN_CONFIDENCE);
        }

        return generic(line, ctx);
    }

    private record AmountSpan(int start, int end, String token) {
    }

    /**
     * Any date token plus the amounts found by the rule set. With a running-balance column the last
     * amount is the balance; the transaction amount is the first or the largest of the rest.
     */
    private Optional<Transaction> generic(String line, LineContext ctx) {
        Optional<DateResolver.DateMatch> dateMatch = DateResolver.findFirst(line, ctx.getYears());
        if (dateMatch.isEmpty()) {
            return Optional.empty();
        }
        RuleSet rules = ctx.getRules();
        List<AmountSpan> amounts = findAmounts(line, rules, dateMatch.get());
        if (amounts.isEmpty()) {
            return Optional.empty();
        }

        AmountSpan balance = null;
        List<AmountSpan> candidates = new ArrayList<>(amounts);
        if (candidates.size() >= 2 && rules.isHasRunningBalanceColumn()) {
            balance = candidates.remove(candidates.size() - 1);
        }

        AmountSpan chosen = rules.isPreferFirstAmount()
                ? candidates.get(0)
                : candidates.stream()
                        .max(Comparator.comparing((AmountSpan a) -> absOf(a.token())))
                        .orElse(candidates.get(0));

        StringBuilder description = new StringBuilder(line);
        List<int[]> cuts = new ArrayList<>();
        for (AmountSpan a : amounts) cuts.add(new int[] {a.start(), a.end()});
        cuts.add(new int[] {dateMatch.get().start(), dateMatch.get().end()});
        cuts.sort(Comparator.comparingInt((int[] c) -> c[0]).reversed());
        for (int[] cut : cuts) {
            description.replace(cut[0], cut[1], " ");
        }

        return build(dateMatch.get().date(), description.toString(), chosen.token(),
                balance != null ? balance.token() : null, null, GENERIC_CONFIDENCE);
    }

    private static List<AmountSpan> findAmounts(String line, RuleSet rules, DateResolver.DateMatch date) {
        TreeMap<Integer, AmountSpan> byStart = new TreeMap<>();
        for (Pattern pattern : rules.getAmountPatterns()) {
            Matcher m = pattern.matcher(line);
            while (m.find()) {
                if (m.start() < date.end() && m.end() > date.start()) continue;
                boolean overlaps = byStart.values().stream()
                        .anyMatch(a -> m.start() < a.end() && m.end() > a.start());
                if (!overlaps && AmountParser.parse(m.group()) != null) {
                    byStart.put(m.start(), new AmountSpan(m.start(), m.end(), m.group()));
                }
            }
        }
        return new ArrayList<>(byStart.values());
    }

    private static BigDecimal absOf(String token) {
        BigDecimal value = AmountParser.parse(token);
        return value == null ? BigDecimal.ZERO : value.abs();
    }
}
