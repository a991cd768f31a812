package com.conciliator.engine.services.statements.quality;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import com.conciliator.engine.services.statements.util.CarryRows;
import com.conciliator.engine.services.statements.util.DateResolver;
import com.conciliator.engine.services.statements.util.StatementLines;

public final class DocumentAnalyzer {

    private static final Pattern SPANISH_ABBREVIATION = Pattern.compile(
            "(?i)\\b(" + DateResolver.SPANISH_MONTH_ABBREVIATIONS + ")\\b\\.?\\s*\\d{1,2}\\b");
    private static final Pattern ENGLISH_ABBREVIATION = Pattern.compile(
            "(?i)\\b(JAN|APR|AUG|DEC)\\b\\.?\\s*\\d{1,2}\\b");
    private static final Pattern FULL_MONTH = Pattern.compile(
            "(?i)\\b(ENERO|FEBRERO|MARZO|ABRIL|MAYO|JUNIO|JULIO|AGOSTO|SEPTIEMBRE|OCTUBRE|NOVIEMBRE|DICIEMBRE)\\b");
    private static final Pattern DMY = Pattern.compile("\\b\\d{1,2}/\\d{1,2}/\\d{4}\\b");
    private static final Pattern ISO = Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b");
    private static final Pattern DAY_MONTH_DASHED = Pattern.compile("(?i)\\b\\d{1,2}-[A-Z]{3}-\\d{2,4}\\b");
    private static final Pattern SPEI = Pattern.compile("(?i)\\bSPEI\\b");

    private DocumentAnalyzer() {
    }

    public static DocumentProfile analyze(String text, boolean structuredInput) {
        List<String> lines = StatementLines.split(text);
        int nonEmpty = 0;
        int candidates = 0;
        boolean spanish = false;
        boolean english = false;
        boolean full = false;
        boolean opening = false;
        boolean spei = false;
        Set<String> formats = new LinkedHashSet<>();

        for (String line : lines) {
            if (line.isEmpty()) continue;
            nonEmpty++;
            boolean monthDay = false;
            if (SPANISH_ABBREVIATION.matcher(line).find()) {
                spanish = true;
                monthDay = true;
                formats.add("MON DD");
            }
            if (ENGLISH_ABBREVIATION.matcher(line).find()) {
                english = true;
                monthDay = true;
                formats.add("MON DD");
            }
            if (FULL_MONTH.matcher(line).find()) full = true;
            boolean dmy = DMY.matcher(line).find();
            if (dmy) formats.add("DD/MM/YYYY");
            if (ISO.matcher(line).find()) formats.add("YYYY-MM-DD");
            if (DAY_MONTH_DASHED.matcher(line).find()) formats.add("DD-MON-YYYY");
            if (!opening && CarryRows.isOpening(line)) opening = true;
            if (!spei && SPEI.matcher(line).find()) spei = true;
            if ((monthDay || dmy) && line.length() > 20) candidates++;
        }

        String style = spanish ? "SPANISH_ABBREVIATION"
                : english ? "ENGLISH_ABBREVIATION"
                : full ? "FULL_NAME"
                : "NONE";

        double density = nonEmpty == 0 ? 0.0 : (double) candidates / nonEmpty;
        return new DocumentProfile(lines.size(), candidates, density, style, formats, opening, spei, structuredInput);
    }
}
