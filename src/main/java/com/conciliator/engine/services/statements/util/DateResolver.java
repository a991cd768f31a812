package com.conciliator.engine.services.statements.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Date tokens found on Mexican and US statements: numeric (dd/MM/yyyy, yyyy-MM-dd), Spanish and
 * English month names/abbreviations ("DIC. 05", "05 DIC", "05-DIC-2024", "5 de diciembre de 2024").
 */
public final class DateResolver {

    private static final Map<String, Integer> MONTHS = new LinkedHashMap<>();

    static {
        register(1, "ENE", "ENERO", "JAN", "JANUARY");
        register(2, "FEB", "FEBRERO", "FEBRUARY");
        register(3, "MAR", "MARZO", "MARCH");
        register(4, "ABR", "ABRIL", "APR", "APRIL");
        register(5, "MAY", "MAYO");
        register(6, "JUN", "JUNIO", "JUNE");
        register(7, "JUL", "JULIO", "JULY");
        register(8, "AGO", "AGOSTO", "AUG", "AUGUST");
        register(9, "SEP", "SEPT", "SEPTIEMBRE", "SETIEMBRE", "SEPTEMBER");
        register(10, "OCT", "OCTUBRE", "OCTOBER");
        register(11, "NOV", "NOVIEMBRE", "NOVEMBER");
        register(12, "DIC", "DICIEMBRE", "DEC", "DECEMBER");
    }

    /** Spanish three-letter abbreviations as printed by most Mexican banks. */
    public static final String SPANISH_MONTH_ABBREVIATIONS = "ENE|FEB|MAR|ABR|MAY|JUN|JUL|AGO|SEP|OCT|NOV|DIC";

    /** Every known month token, longest first so that "MARZO" wins over "MAR". */
    public static final String MONTH_ALTERNATION = MONTHS.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(Collectors.joining("|"));

    private static final Pattern ISO = Pattern.compile("\\b(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})\\b");
    private static final Pattern NUMERIC_DMY = Pattern.compile("\\b(\\d{1,2})[/.\\-](\\d{1,2})[/.\\-](\\d{4}|\\d{2})\\b");
    private static final Pattern LONG_SPANISH = Pattern.compile(
            "(?i)\\b(\\d{1,2})\\s+de\\s+(" + MONTH_ALTERNATION + ")\\b(?:\\s+(?:de\\s+|del\\s+)?(\\d{4})\\b)?");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "(?i)\\b(\\d{1,2})[\\s/\\-]?(" + MONTH_ALTERNATION + ")\\.?(?![A-Z])(?:[\\s/\\-]?(\\d{4}|\\d{2})(?!\\d))?");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "(?i)\\b(" + MONTH_ALTERNATION + ")\\.?\\s*(\\d{1,2})\\b(?:,?\\s+(\\d{4})\\b)?");
    private static final Pattern NUMERIC_DM = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})\\b(?![/\\d])");

    private static final Pattern MONTH_TOKEN = Pattern.compile("(?i)\\b(" + MONTH_ALTERNATION + ")\\b\\.?");

    private DateResolver() {
    }

    private static void register(int month, String... tokens) {
        for (String token : tokens) {
            MONTHS.put(token, month);
        }
    }

    /** A date found inside a line, with its character span. */
    public record DateMatch(LocalDate date, int start, int end) {
    }

    public static Integer monthNumber(String token) {
        if (token == null) return null;
        String key = TextNormalizer.normalize(token).replace(".", "").toUpperCase(Locale.ROOT);
        return MONTHS.get(key);
    }

    public static boolean containsMonthToken(String line) {
        return line != null && MONTH_TOKEN.matcher(line).find();
    }

    public static LocalDate fromMonthDay(String monthToken, String day, YearContext years) {
        Integer month = monthNumber(monthToken);
        Integer d = toInt(day);
        if (month == null || d == null) return null;
        YearContext ctx = years != null ? years : YearContext.none();
        return safeDate(ctx.yearFor(month), month, d);
    }

    public static LocalDate fromMonthDay(String monthToken, String day, String year, YearContext years) {
        Integer y = toYear(year);
        if (y == null) {
            return fromMonthDay(monthToken, day, years);
        }
        Integer month = monthNumber(monthToken);
        Integer d = toInt(day);
        if (month == null || d == null) return null;
        return safeDate(y, month, d);
    }

    /**
     * Parses a token that is expected to be a complete date ("05/12/2024", "DIC 05", "2024-12-05").
     */
    public static LocalDate parse(String token, YearContext years) {
        if (token == null || token.isBlank()) return null;
        return findFirst(token.trim(), years).map(DateMatch::date).orElse(null);
    }

    /**
     * Earliest date token in the line. On equal start positions the more specific form wins.
     */
    public static Optional<DateMatch> findFirst(String line, YearContext years) {
        if (line == null || line.isBlank()) return Optional.empty();
        List<DateMatch> found = new ArrayList<>();
        collectFirst(found, ISO.matcher(line), m -> safeDate(toInt(m.group(1)), toInt(m.group(2)), toInt(m.group(3))));
        collectFirst(found, NUMERIC_DMY.matcher(line), m -> safeDate(toYear(m.group(3)), toInt(m.group(2)), toInt(m.group(1))));
        collectFirst(found, LONG_SPANISH.matcher(line), m -> fromMonthDay(m.group(2), m.group(1), m.group(3), years));
        collectFirst(found, DAY_MONTH.matcher(line), m -> fromMonthDay(m.group(2), m.group(1), m.group(3), years));
        collectFirst(found, MONTH_DAY.matcher(line), m -> fromMonthDay(m.group(1), m.group(2), m.group(3), years));
        collectFirst(found, NUMERIC_DM.matcher(line), m -> {
            Integer month = toInt(m.group(2));
            if (month == null) return null;
            YearContext ctx = years != null ? years : YearContext.none();
            return safeDate(ctx.yearFor(month), month, toInt(m.group(1)));
        });
        return found.stream().min(Comparator.comparingInt(DateMatch::start));
    }

    public static List<LocalDate> findAll(String text, YearContext years) {
        List<LocalDate> out = new ArrayList<>();
        if (text == null) return out;
        String rest = text;
        int guard = 0;
        while (!rest.isEmpty() && guard++ < 64) {
            Optional<DateMatch> match = findFirst(rest, years);
            if (match.isEmpty()) break;
            out.add(match.get().date());
            rest = rest.substring(match.get().end());
        }
        return out;
    }

    private interface DateBuilder {
        LocalDate build(Matcher m);
    }

    private static void collectFirst(List<DateMatch> found, Matcher m, DateBuilder builder) {
        while (m.find()) {
            LocalDate date = builder.build(m);
            if (date != null) {
                found.add(new DateMatch(date, m.start(), m.end()));
                return;
            }
        }
    }

    private static LocalDate safeDate(Integer year, Integer month, Integer day) {
        if (year == null || month == null || day == null) return null;
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static Integer toYear(String raw) {
        Integer y = toInt(raw);
        if (y == null) return null;
        return y < 100 ? 2000 + y : y;
    }

    private static Integer toInt(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
