package com.conciliator.engine.services.statements.strategies;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.conciliator.engine.services.statements.rules.LinePattern;
import com.conciliator.engine.services.statements.util.AmountParser;
import com.conciliator.engine.services.statements.util.DateResolver;

import lombok.extern.slf4j.Slf4j;

/**
 * Learns the layout of the document from a sample of probable movement lines (long lines with a
 * month token) and applies one synthesized pattern to every line.
 */
@Slf4j
@Component
@Order(3)
public class AdaptiveSynthesisStrategy extends AbstractLineStrategy {

    public static final String NAME = "adaptive";

    static final int MAX_SAMPLES = 50;
    static final int MIN_SAMPLES = 3;
    private static final int MIN_SAMPLE_LENGTH = 30;

    private static final String MONTHS = "(?:" + DateResolver.MONTH_ALTERNATION + ")";
    private static final String FLEX = "(?:" + AmountParser.FLEXIBLE_AMOUNT + ")";

    private static final Pattern AMOUNT_TOKEN = Pattern.compile("^" + FLEX + "$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DAY_TOKEN = Pattern.compile("^\\d{1,2}$");
    private static final Pattern FOLIO_TOKEN = Pattern.compile("^\\d{6,12}$");
    private static final Pattern NUMERIC_DATE_TOKEN = Pattern.compile("^\\d{1,2}[/\\-]\\d{1,2}(?:[/\\-]\\d{2,4})?$");
    private static final Pattern COMPACT_DATE_TOKEN = Pattern.compile("^\\d{1,2}[/\\-]?" + MONTHS + "[/\\-]?(?:\\d{2,4})?$", Pattern.CASE_INSENSITIVE);

    enum DateStyle {
        MONTH_DAY("(?<month>" + MONTHS + ")\\.?\\s+(?<day>\\d{1,2})"),
        DAY_MONTH("(?<day>\\d{1,2})\\s+(?<month>" + MONTHS + ")\\.?"),
        NUMERIC("(?<date>\\d{1,2}[/\\-]\\d{1,2}(?:[/\\-]\\d{2,4})?)"),
        COMPACT("(?<date>\\d{1,2}[/\\-]?" + MONTHS + "[/\\-]?(?:\\d{2,4})?)");

        private final String regex;

        DateStyle(String regex) {
            this.regex = regex;
        }
    }

    /** Shape of one movement line. */
    record Layout(DateStyle dateStyle, boolean folio, int amountColumns) {

        String toRegex() {
            StringBuilder sb = new StringBuilder("^").append(dateStyle.regex).append("\\s+");
            if (folio) {
                sb.append("(?<reference>\\d{6,12})\\s+");
            }
            sb.append("(?<description>.+?)\\s+(?<amount>").append(FLEX).append(")");
            if (amountColumns > 1) {
                sb.append("\\s+(?<balance>").append(FLEX).append(")");
            }
            return sb.append("\\s*$").toString();
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double baseConfidence() {
        return 0.7;
    }

    @Override
    protected LineParser prepare(List<String> lines, LineContext ctx, Map<String, Object> metadata) {
        List<String> samples = sample(lines);
        metadata.put("samples", samples.size());
        if (samples.size() < MIN_SAMPLES) {
            metadata.put("error", "insufficient_samples");
            return null;
        }

        Map<Layout, Integer> votes = new LinkedHashMap<>();
        for (String sample : samples) {
            Layout layout = detectLayout(sample);
            if (layout != null) {
                votes.merge(layout, 1, Integer::sum);
            }
        }
        if (votes.isEmpty()) {
            metadata.put("error", "no_layout_detected");
            return null;
        }

        Layout winner = null;
        int best = 0;
        for (Map.Entry<Layout, Integer> e : votes.entrySet()) {
            if (e.getValue() > best) {
                winner = e.getKey();
                best = e.getValue();
            }
        }

        LinePattern synthesized = LinePattern.compile(winner.toRegex());
        metadata.put("layout", winner.toString());
        metadata.put("layoutSupport", (double) best / samples.size());
        metadata.put("synthesizedPattern", synthesized.pattern().pattern());
        log.debug("[AdaptiveSynthesisStrategy] Layout {} supported by {}/{} samples", winner, best, samples.size());

        return (line, lineCtx) -> fromLinePattern(synthesized, line, lineCtx, baseConfidence());
    }

    static List<String> sample(List<String> lines) {
        List<String> samples = new ArrayList<>();
        for (String line : lines) {
            if (line.length() > MIN_SAMPLE_LENGTH && DateResolver.containsMonthToken(line)) {
                samples.add(line);
                if (samples.size() >= MAX_SAMPLES) break;
            }
        }
        return samples;
    }

    static Layout detectLayout(String line) {
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length < 3) return null;

        DateStyle style;
        int idx;
        if (DateResolver.monthNumber(tokens[0]) != null && DAY_TOKEN.matcher(tokens[1]).matches()) {
            style = DateStyle.MONTH_DAY;
            idx = 2;
        } else if (DAY_TOKEN.matcher(tokens[0]).matches() && DateResolver.monthNumber(tokens[1]) != null) {
            style = DateStyle.DAY_MONTH;
            idx = 2;
        } else if (NUMERIC_DATE_TOKEN.matcher(tokens[0]).matches()) {
            style = DateStyle.NUMERIC;
            idx = 1;
        } else if (COMPACT_DATE_TOKEN.matcher(tokens[0]).matches()) {
            style = DateStyle.COMPACT;
            idx = 1;
        } else {
            return null;
        }

        boolean folio = idx < tokens.length && FOLIO_TOKEN.matcher(tokens[idx]).matches();
        int descStart = folio ? idx + 1 : idx;

        int amounts = 0;
        for (int i = tokens.length - 1; i >= descStart && amounts < 2; i--) {
            if (!AMOUNT_TOKEN.matcher(tokens[i]).matches()) break;
            amounts++;
        }
        int descriptionTokens = tokens.length - descStart - amounts;
        if (amounts == 0 || descriptionTokens < 1) return null;

        return new Layout(style, folio, amounts);
    }
}
