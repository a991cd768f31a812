package com.conciliator.engine.services.statements.strategies;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.rules.LinePattern;
import com.conciliator.engine.services.statements.util.AmountParser;
import com.conciliator.engine.services.statements.util.DateResolver;

/**
 * Looser layout family: any supported date format at the start of the line, optional folio
 * (separate or glued to the day), description, one or two amounts in any common currency format.
 * Bank line patterns from the rule set are tried first.
 */
@Component
@Order(2)
public class UniversalFlexibleStrategy extends AbstractLineStrategy {

    public static final String NAME = "universal";

    private static final String MONTHS = "(?:" + DateResolver.MONTH_ALTERNATION + ")";
    private static final String FLEX = "(?:" + AmountParser.FLEXIBLE_AMOUNT + ")";

    // ENE 0512345678 ... (day glued to a folio)
    private static final Pattern GLUED_DAY_REFERENCE = Pattern.compile(
            "^(" + MONTHS + "\\.?\\s*\\d{2})(\\d{8,12})\\s+(.*)$", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> DATE_PREFIXES = List.of(
            Pattern.compile("^(\\d{4}[-/]\\d{1,2}[-/]\\d{1,2})\\s+(.*)$"),
            Pattern.compile("^(\\d{1,2}[/.\\-]\\d{1,2}(?:[/.\\-]\\d{2,4})?)\\s+(.*)$"),
            Pattern.compile("^(\\d{1,2}[\\s/\\-]?" + MONTHS + "\\.?(?:[\\s/\\-]?\\d{4}|[/\\-]\\d{2})?)\\s+(.*)$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(" + MONTHS + "\\.?\\s*\\d{1,2}(?:,?\\s+\\d{4})?)\\s+(.*)$", Pattern.CASE_INSENSITIVE));

    private static final Pattern TAIL = Pattern.compile(
            "^(?:(\\d{6,12})\\s+)?(.+?)\\s+(" + FLEX + ")(?:\\s+(" + FLEX + "))?\\s*(?:MXN|USD)?\\s*$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double baseConfidence() {
        return 0.8;
    }

    @Override
    protected LineParser prepare(List<String> lines, LineContext ctx, Map<String, Object> metadata) {
        metadata.put("customLinePatterns", ctx.getRules().getCustomLinePatterns().size());
        return this::parseLine;
    }

    private Optional<Transaction> parseLine(String line, LineContext ctx) {
        for (LinePattern custom : ctx.getRules().getCustomLinePatterns()) {
            Optional<Transaction> tx = fromLinePattern(custom, line, ctx, 0.85);
            if (tx.isPresent()) {
                return tx;
            }
        }

        Matcher glued = GLUED_DAY_REFERENCE.matcher(line);
        if (glued.find()) {
            Optional<Transaction> tx = fromTail(glued.group(1), glued.group(3), glued.group(2), ctx);
            if (tx.isPresent()) {
                return tx;
            }
        }

        for (Pattern prefix : DATE_PREFIXES) {
            Matcher m = prefix.matcher(line);
            if (m.find()) {
                Optional<Transaction> tx = fromTail(m.group(1), m.group(2), null, ctx);
                if (tx.isPresent()) {
                    return tx;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Transaction> fromTail(String dateToken, String rest, String gluedReference, LineContext ctx) {
        LocalDate date = DateResolver.parse(dateToken, ctx.getYears());
        if (date == null) {
            return Optional.empty();
        }
        Matcher tail = TAIL.matcher(rest);
        if (!tail.find()) {
            return Optional.empty();
        }
        String reference = gluedReference != null ? gluedReference : tail.group(1);
        return build(date, tail.group(2), tail.group(3), tail.group(4), reference, baseConfidence());
    }
}
