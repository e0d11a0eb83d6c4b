package io.pulse4j.utils;

import io.pulse4j.core.exception.TimeParseException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses times of day ("15:00", "3:30pm") and schedule expressions ("in 5 minutes",
 * "tomorrow at 9am", ISO-8601 date-times).
 */
public final class DateParser {
    private DateParser() {
    }

    private static final List<DateTimeFormatter> TIME_OF_DAY_FORMATS = List.of(
            new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendPattern("H:mm[:ss]").toFormatter(Locale.ENGLISH),
            new DateTimeFormatterBuilder().parseCaseInsensitive()
                    .appendPattern("h[:mm[:ss]][ ]a").toFormatter(Locale.ENGLISH)
    );

    private static final Pattern DAY_AT = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final Pattern IN_INTERVAL = Pattern.compile("^in\\s+(.+)$");
    private static final Pattern INTERVAL_FROM_NOW = Pattern.compile("^(.+)\\s+from\\s+now$");

    /**
     * Parse a time of day. Accepts 24-hour ("15:00", "7:05:30") and 12-hour ("3pm", "3:30 PM")
     * forms as well as "noon" and "midnight".
     */
    public static LocalTime parseTimeOfDay(String timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        String s = timeOfDay.trim();
        if ("noon".equalsIgnoreCase(s)) {
            return LocalTime.NOON;
        }
        if ("midnight".equalsIgnoreCase(s)) {
            return LocalTime.MIDNIGHT;
        }
        for (DateTimeFormatter f : TIME_OF_DAY_FORMATS) {
            try {
                return LocalTime.parse(s, f);
            } catch (DateTimeParseException ignored) {
                // try the next accepted form
            }
        }
        throw new TimeParseException("Invalid time of day. Expected HH:mm, HH:mm:ss or h[:mm]am/pm: " + timeOfDay);
    }

    /**
     * Resolve a relative or absolute schedule expression against {@code now}.
     * <ul>
     *   <li>"now"</li>
     *   <li>ISO instant or offset date-time ("2026-01-20T09:30:00Z")</li>
     *   <li>ISO local date-time or date, interpreted in {@code zone}</li>
     *   <li>"today at 15:00", "tomorrow at 9am", "tomorrow"</li>
     *   <li>"in 5 minutes", "2 hours from now", or a bare interval ("10 seconds")</li>
     * </ul>
     */
    public static Instant parseWhen(String expression, ZoneId zone, Instant now) {
        Objects.requireNonNull(zone, "zone must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (expression == null || expression.isBlank()) {
            throw new TimeParseException("Schedule expression must not be blank");
        }
        String s = expression.trim();
        String lower = s.toLowerCase(Locale.ROOT);

        if ("now".equals(lower)) {
            return now;
        }

        Instant absolute = parseAbsolute(s, zone);
        if (absolute != null) {
            return absolute;
        }

        Matcher dayAt = DAY_AT.matcher(lower);
        if (dayAt.matches()) {
            ZonedDateTime base = now.atZone(zone);
            if ("tomorrow".equals(dayAt.group(1))) {
                base = base.plusDays(1);
            }
            if (dayAt.group(2) == null) {
                return base.toInstant();
            }
            return base.with(parseTimeOfDay(dayAt.group(2))).toInstant();
        }

        String interval = lower;
        Matcher in = IN_INTERVAL.matcher(lower);
        Matcher fromNow = INTERVAL_FROM_NOW.matcher(lower);
        if (in.matches()) {
            interval = in.group(1);
        } else if (fromNow.matches()) {
            interval = fromNow.group(1);
        }

        try {
            return now.plus(IntervalParser.parseHumanDuration(interval));
        } catch (TimeParseException ex) {
            throw new TimeParseException("Unrecognized schedule expression: " + expression, ex);
        }
    }

    private static Instant parseAbsolute(String s, ZoneId zone) {
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time
        }
        try {
            return ZonedDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // not a zoned date-time
        }
        try {
            return LocalDateTime.parse(s).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return LocalDate.parse(s).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
