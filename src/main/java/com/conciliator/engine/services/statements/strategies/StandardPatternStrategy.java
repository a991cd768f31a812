package com.conciliator.engine.services.statements.strategies;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.conciliator.engine.services.statements.model.Transaction;
import com.conciliator.engine.services.statements.util.DateResolver;

/**
 * Fixed, ordered line shapes of the common Mexican layout. The first shape that matches a line wins.
 */
@Component
@Order(1)
public class StandardPatternStrategy extends AbstractLineStrategy {

    public static final String NAME = "standard";

    private static final String MON = "(" + DateResolver.SPANISH_MONTH_ABBREVIATIONS + ")";
    private static final String AMT = "(-?\\$?\\s?(?:\\d{1,3}(?:,\\d{3})+|\\d+)\\.\\d{2})";

    //  DIC 01 BALANCE INICIAL 10,000.00
    private static final Pattern OPENING_CARRY = Pattern.compile(
            "^" + MON + "\\.?\\s+(\\d{1,2})\\s+((?:BALANCE|SALDO)\\s+(?:INICIAL|ANTERIOR))\\s+" + AMT + "\\s*$",
            Pattern.CASE_INSENSITIVE);
    //  DIC 03 1234567890 SPEI RECIBIDO NOMINA 5,000.00 15,000.00
    private static final Pattern DATE_REF_TWO_AMOUNTS = Pattern.compile(
            "^" + MON + "\\.?\\s+(\\d{1,2})\\s+(\\d{8,12})\\s+(.+?)\\s+" + AMT + "\\s+" + AMT + "\\s*$",
            Pattern.CASE_INSENSITIVE);
    //  DIC 04 OXXO SUC 123 150.00 14,850.00
    private static final Pattern DATE_DESC_TWO_AMOUNTS = Pattern.compile(
            "^" + MON + "\\.?\\s+(\\d{1,2})\\s+([A-Za-z].*?)\\s+" + AMT + "\\s+" + AMT + "\\s*$",
            Pattern.CASE_INSENSITIVE);
    //  DIC 05 NETFLIX 219.00
    private static final Pattern DATE_DESC_ONE_AMOUNT = Pattern.compile(
            "^" + MON + "\\.?\\s+(\\d{1,2})\\s+(.+?)\\s+" + AMT + "\\s*$",
            Pattern.CASE_INSENSITIVE);
    //  05/12/2024 PAGO TARJETA -1,500.00 [saldo]
    private static final Pattern GENERIC_DMY = Pattern.compile(
            "^(\\d{1,2}/\\d{1,2}/\\d{4})\\s+(.+?)\\s+" + AMT + "(?:\\s+" + AMT + ")?\\s*$");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected double baseConfidence() {
        return 0.9;
    }

    @Override
    protected LineParser prepare(List<String> lines, LineContext ctx, Map<String, Object> metadata) {
        return this::parseLine;
    }

    private Optional<Transaction> parseLine(String line, LineContext ctx) {
        Matcher m = OPENING_CARRY.matcher(line);
        if (m.find()) {
            return build(DateResolver.fromMonthDay(m.group(1), m.group(2), ctx.getYears()),
                    m.group(3), m.group(4), m.group(4), null, baseConfidence());
        }

        m = DATE_REF_TWO_AMOUNTS.matcher(line);
        if (m.find()) {
            return build(DateResolver.fromMonthDay(m.group(1), m.group(2), ctx.getYears()),
                    m.group(4), m.group(5), m.group(6), m.group(3), baseConfidence());
        }

        m = DATE_DESC_TWO_AMOUNTS.matcher(line);
        if (m.find()) {
            return build(DateResolver.fromMonthDay(m.group(1), m.group(2), ctx.getYears()),
                    m.group(3), m.group(4), m.group(5), null, baseConfidence());
        }

        m = DATE_DESC_ONE_AMOUNT.matcher(line);
        if (m.find()) {
            return build(DateResolver.fromMonthDay(m.group(1), m.group(2), ctx.getYears()),
                    m.group(3), m.group(4), null, null, baseConfidence());
        }

        m = GENERIC_DMY.matcher(line);
        if (m.find()) {
            return build(DateResolver.parse(m.group(1), ctx.getYears()),
                    m.group(2), m.group(3), m.group(4), null, baseConfidence());
        }

        return Optional.empty();
    }
}
