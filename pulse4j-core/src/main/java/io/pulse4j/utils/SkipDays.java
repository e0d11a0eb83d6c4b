package io.pulse4j.utils;

import io.pulse4j.core.exception.TimeParseException;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Day-of-week sets used to exclude weekdays from a recurrence.
 *
 * <p>Accepted tokens, comma or space separated: full names ("saturday"), three-letter
 * abbreviations ("sat"), numbers 0-7 (0 and 7 are Sunday), "weekend" and "weekdays".
 */
public final class SkipDays {
    private SkipDays() {
    }

    public static Set<DayOfWeek> parse(String spec) {
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (spec == null || spec.isBlank()) {
            return days;
        }
        for (String raw : spec.trim().toLowerCase(Locale.ROOT).split("[,\\s]+")) {
            if (raw.isEmpty()) {
                continue;
            }
            days.addAll(parseToken(raw, spec));
        }
        return days;
    }

    public static Set<DayOfWeek> parse(Collection<String> tokens) {
        EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (tokens == null) {
            return days;
        }
        for (String token : tokens) {
            days.addAll(parse(token));
        }
        return days;
    }

    /**
     * Canonical form: upper-case {@link DayOfWeek} names, Monday first.
     */
    public static String format(Set<DayOfWeek> days) {
        if (days == null || days.isEmpty()) {
            return null;
        }
        return EnumSet.copyOf(days).stream()
                .map(DayOfWeek::name)
                .collect(Collectors.joining(","));
    }

    private static Set<DayOfWeek> parseToken(String token, String spec) {
        switch (token) {
            case "weekend":
            case "weekends":
                return EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
            case "weekday":
            case "weekdays":
                return EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
            default:
                break;
        }
        if (token.matches("^\\d$")) {
            int n = Integer.parseInt(token);
            if (n > 7) {
                throw new TimeParseException("Invalid day number in skipDays: " + spec);
            }
            // 0 = Sunday
            return EnumSet.of(n == 0 || n == 7 ? DayOfWeek.SUNDAY : DayOfWeek.of(n));
        }
        for (DayOfWeek day : DayOfWeek.values()) {
            String name = day.name().toLowerCase(Locale.ROOT);
            if (name.equals(token) || name.substring(0, 3).equals(token)) {
                return EnumSet.of(day);
            }
        }
        throw new TimeParseException("Unknown day in skipDays: " + token);
    }
}
