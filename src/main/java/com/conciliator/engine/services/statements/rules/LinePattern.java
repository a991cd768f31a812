package com.conciliator.engine.services.statements.rules;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A bank-specific transaction line regex. Recognized named groups: {@code date}, {@code month},
 * {@code day}, {@code description}, {@code amount}, {@code balance}, {@code reference}.
 */
public record LinePattern(Pattern pattern, Set<String> groups) {

    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    public LinePattern {
        groups = Set.copyOf(groups);
    }

    public static LinePattern compile(String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        Set<String> names = new LinkedHashSet<>();
        Matcher m = NAMED_GROUP.matcher(regex);
        while (m.find()) {
            names.add(m.group(1));
        }
        return new LinePattern(pattern, names);
    }

    public boolean isUsable() {
        return groups.contains("description") && groups.contains("amount")
                && (groups.contains("date") || (groups.contains("month") && groups.contains("day")));
    }

    public String group(Matcher matcher, String name) {
        if (!groups.contains(name)) return null;
        String value = matcher.group(name);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
