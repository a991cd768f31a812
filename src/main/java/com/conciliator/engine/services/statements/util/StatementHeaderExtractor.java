package com.conciliator.engine.services.statements.util;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.conciliator.engine.services.statements.model.StatementHeader;
import com.conciliator.engine.services.statements.model.StatementPeriod;

/**
 * Reads the statement period and the printed opening/closing balances.
 */
public final class StatementHeaderExtractor {

    private static final Pattern PERIOD_LINE = Pattern.compile(
            "(?i)\\b(?:per[ií]odo|period|from|del)\\b[^\\n]*?(?:\\bal\\b|\\bto\\b|\\ba\\b|\\s-\\s)[^\\n]*");

    private static final String MONEY = "(-?\\$?\\s?\\d{1,3}(?:,\\d{3})*\\.\\d{2}|-?\\$?\\s?\\d+\\.\\d{2})";

    private static final Pattern OPENING = Pattern.compile(
            "(?i)\\b(?:saldo\\s+(?:inicial|anterior)|balance\\s+(?:inicial|anterior)|opening\\s+balance|previous\\s+balance)\\b[^0-9\\-$\\n]{0,20}" + MONEY);
    private static final Pattern CLOSING = Pattern.compile(
            "(?i)\\b(?:saldo\\s+(?:final|actual|al\\s+corte)|nuevo\\s+saldo|closing\\s+balance|new\\s+balance)\\b[^0-9\\-$\\n]{0,20}" + MONEY);
    private static final Pattern YEAR = Pattern.compile("\\b(20\\d{2}|19\\d{2})\\b");

    private StatementHeaderExtractor() {
    }

    public static StatementHeader extract(String text) {
        if (text == null || text.isBlank()) {
            return StatementHeader.empty();
        }

        Integer yearHint = null;
        Matcher y = YEAR.matcher(text);
        if (y.find()) {
            yearHint = Integer.parseInt(y.group(1));
        }

        StatementPeriod period = extractPeriod(text, YearContext.ofYear(yearHint));
        if (period != null && period.end() != null) {
            yearHint = period.end().getYear();
        }

        return new StatementHeader(
                period,
                firstMoney(OPENING, text),
                firstMoney(CLOSING, text),
                yearHint);
    }

    private static StatementPeriod extractPeriod(String text, YearContext years) {
        Matcher m = PERIOD_LINE.matcher(text);
        while (m.find()) {
            List<LocalDate> dates = DateResolver.findAll(m.group(), years);
            if (dates.size() >= 2) {
                LocalDate start = dates.get(0);
                LocalDate end = dates.get(1);
                if (end.isBefore(start)) {
                    // "DEL 15 DIC AL 14 ENE" without explicit years
                    end = end.plusYears(1);
                }
                return new StatementPeriod(start, end);
            }
        }
        return null;
    }

    private static BigDecimal firstMoney(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (m.find()) {
            return AmountParser.parse(m.group(1));
        }
        return null;
    }
}
