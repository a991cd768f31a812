package com.conciliator.engine.services.statements.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class StatementLines {

    // Require start-of-string or whitespace before the token so references like "D01/12" are not split.
    private static final Pattern ENTRY_DATE_TOKEN = Pattern.compile(
            "(?i)(?:(?<=^)|(?<=\\s))((?:" + DateResolver.SPANISH_MONTH_ABBREVIATIONS + ")\\.?\\s+\\d{1,2}\\s|\\d{2}/\\d{2}/\\d{4}\\s)");

    private StatementLines() {
    }

    public static List<String> split(String rawText) {
        if (rawText == null || rawText.isBlank()) return List.of();
        String t = rawText.replace('\u00A0', ' ');
        String[] arr = t.split("\\r?\\n|\\r");
        List<String> out = new ArrayList<>(arr.length);
        for (String s : arr) {
            out.add(s.replaceAll("[\\t ]+", " ").trim());
        }
        return out;
    }

    /**
     * Like {@link #split(String)}, but when extraction collapsed the document into one or two lines,
     * cuts entries at each leading date token.
     */
    public static List<String> splitSmart(String rawText) {
        List<String> base = split(rawText);

        int nonEmpty = 0;
        for (String s : base) {
            if (!s.isEmpty()) nonEmpty++;
        }
        if (nonEmpty > 2) {
            return base;
        }

        List<String> byDate = splitByEntryDateTokens(rawText);
        return byDate.size() > base.size() ? byDate : base;
    }

    private static List<String> splitByEntryDateTokens(String rawText) {
        String t = rawText.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
        if (t.isEmpty()) return List.of();

        Matcher m = ENTRY_DATE_TOKEN.matcher(t);
        List<Integer> starts = new ArrayList<>();
        while (m.find()) {
            starts.add(m.start(1));
        }
        if (starts.size() <= 1) {
            return split(rawText);
        }

        List<String> out = new ArrayList<>(starts.size() + 1);
        if (starts.get(0) > 0) {
            out.add(t.substring(0, starts.get(0)).trim());
        }
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = (i + 1 < starts.size()) ? starts.get(i + 1) : t.length();
            String chunk = t.substring(start, end).trim();
            if (!chunk.isEmpty()) {
                out.add(chunk);
            }
        }
        return out;
    }
}
