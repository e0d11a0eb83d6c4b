package io.pulse4j.utils;

import io.pulse4j.core.exception.TimeParseException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.quartz.CronExpression;

/**
 * Parses repeat interval specs.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Human-readable intervals: "5 minutes", "2 hours", "1 day and 3 hours", "an hour", "90s", "1.5 hours"</li>
 *   <li>Plain numbers: seconds</li>
 *   <li>Cron expressions: 5-field POSIX ("*&#47;5 * * * *") or 6-field with seconds ("0 0 2 * * *")</li>
 * </ul>
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    private static final Pattern COMPACT = Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(ms|s|m|h|d|w)$");
    private static final Pattern NUMBER = Pattern.compile("^\\d+(?:\\.\\d+)?$");
    private static final Pattern DOW_NUMBER = Pattern.compile("\\d+");

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private static final Map<String, Long> UNIT_MILLIS = Map.ofEntries(
            Map.entry("ms", 1L),
            Map.entry("millisecond", 1L),
            Map.entry("sec", SECOND),
            Map.entry("second", SECOND),
            Map.entry("min", MINUTE),
            Map.entry("minute", MINUTE),
            Map.entry("hr", HOUR),
            Map.entry("hour", HOUR),
            Map.entry("day", DAY),
            Map.entry("week", 7 * DAY),
            Map.entry("month", 30 * DAY),
            Map.entry("year", 365 * DAY)
    );

    private static final Map<String, Integer> WORD_NUMBERS = Map.ofEntries(
            Map.entry("a", 1),
            Map.entry("an", 1),
            Map.entry("one", 1),
            Map.entry("two", 2),
            Map.entry("three", 3),
            Map.entry("four", 4),
            Map.entry("five", 5),
            Map.entry("six", 6),
            Map.entry("seven", 7),
            Map.entry("eight", 8),
            Map.entry("nine", 9),
            Map.entry("ten", 10),
            Map.entry("eleven", 11),
            Map.entry("twelve", 12)
    );

    /**
     * Resolve an IANA zone id; null means the system default.
     */
    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (Exception e) {
            throw new TimeParseException("Unknown time zone: " + timezone, e);
        }
    }

    /**
     * Returns true if the string can be parsed as a cron expression.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field cron (seconds first).
     * - Accepts 5-field cron by prepending seconds "0".
     * - Numeric day-of-week values use 0-7 with Sunday as 0 and 7; Quartz counts 1-7 from Sunday.
     * - Exactly one of day-of-month / day-of-week becomes "?" as Quartz requires.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = shiftDayOfWeek(dayOfWeek);

        boolean anyDom = "*".equals(dom) || "?".equals(dom);
        boolean anyDow = "*".equals(dow) || "?".equals(dow);
        if (anyDom && anyDow) {
            dom = "*";
            dow = "?";
        } else if (anyDow) {
            dow = "?";
        } else if (anyDom) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String shiftDayOfWeek(String field) {
        if ("*".equals(field) || "?".equals(field)) {
            return field;
        }
        StringBuilder out = new StringBuilder();
        for (String item : field.split(",", -1)) {
            if (out.length() > 0) {
                out.append(',');
            }
            // "/step" and "#nth" suffixes are not weekdays
            int suffixAt = indexOfAny(item, '/', '#');
            String range = suffixAt >= 0 ? item.substring(0, suffixAt) : item;
            String step = suffixAt >= 0 ? item.substring(suffixAt) : "";

            Matcher m = DOW_NUMBER.matcher(range);
            StringBuilder shifted = new StringBuilder();
            while (m.find()) {
                int day = Integer.parseInt(m.group());
                m.appendReplacement(shifted, String.valueOf((day % 7) + 1));
            }
            m.appendTail(shifted);
            out.append(shifted).append(step);
        }
        return out.toString();
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }

    /**
     * Next cron occurrence strictly after {@code after}, evaluated in {@code zone}.
     */
    public static Instant nextCronOccurrence(String spec, ZoneId zone, Instant after) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(after, "after must not be null");

        String cron = normalizeCron(spec);
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (Exception ex) {
            throw new TimeParseException("Invalid cron expression: " + spec, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(after));
        if (nextDate == null) {
            throw new TimeParseException("Cron expression produced no next execution time: " + spec);
        }
        return nextDate.toInstant();
    }

    /**
     * Parse a human-readable interval.
     *
     * @throws TimeParseException when the text is not an interval or is not positive
     */
    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new TimeParseException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new TimeParseException("Interval seconds out of range: " + input);
            }
            return positive(Duration.ofSeconds(seconds), input);
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            double n = Double.parseDouble(compact.group(1));
            long unit = switch (compact.group(2)) {
                case "ms" -> 1L;
                case "s" -> SECOND;
                case "m" -> MINUTE;
                case "h" -> HOUR;
                case "d" -> DAY;
                case "w" -> 7 * DAY;
                default -> throw new TimeParseException("Unsupported compact unit: " + compact.group(2));
            };
            return positive(Duration.ofMillis(Math.round(n * unit)), input);
        }

        String[] parts = s.replace(",", " ")
                .replaceAll("\\band\\b", " ")
                .trim()
                .split("\\s+");
        if (parts.length % 2 != 0) {
            throw new TimeParseException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        Set<String> seen = new HashSet<>();
        long totalMillis = 0;

        for (int i = 0; i < parts.length; i += 2) {
            double n = parseAmount(parts[i]);

            String unit = parts[i + 1];
            if (unit.endsWith("s") && !"ms".equals(unit)) {
                unit = unit.substring(0, unit.length() - 1);
            }
            Long unitMillis = UNIT_MILLIS.get(unit);
            if (unitMillis == null) {
                throw new TimeParseException("Unsupported interval unit: " + parts[i + 1]);
            }
            if (!seen.add(unit)) {
                throw new TimeParseException("Duplicate unit: " + unit);
            }
            totalMillis += Math.round(n * unitMillis);
        }

        return positive(Duration.ofMillis(totalMillis), input);
    }

    private static double parseAmount(String token) {
        Integer word = WORD_NUMBERS.get(token);
        if (word != null) {
            return word;
        }
        if (!NUMBER.matcher(token).matches()) {
            throw new TimeParseException("Invalid number in interval: " + token);
        }
        return Double.parseDouble(token);
    }

    private static Duration positive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new TimeParseException("Interval must be positive: " + input);
        }
        return d;
    }
}
