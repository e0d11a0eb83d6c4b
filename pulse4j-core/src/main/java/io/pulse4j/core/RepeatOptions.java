package io.pulse4j.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

/**
 * Options for repeat scheduling.
 * <ul>
 *   <li>timezone: IANA time zone id (e.g. "Asia/Taipei"); null means system default</li>
 *   <li>skipImmediate: if true, do not run immediately; schedule from the next computed run time</li>
 *   <li>startDate / endDate: bounds of the recurrence; null means unbounded</li>
 *   <li>skipDays: weekdays on which the job never fires</li>
 * </ul>
 */
public record RepeatOptions(
        String timezone,
        boolean skipImmediate,
        Instant startDate,
        Instant endDate,
        Set<DayOfWeek> skipDays
) {
    public RepeatOptions {
        skipDays = skipDays == null ? Set.of() : Set.copyOf(skipDays);
    }

    public static RepeatOptions defaults() {
        return new RepeatOptions(null, true, null, null, Set.of());
    }

    public static RepeatOptions inTimezone(String timezone) {
        return new RepeatOptions(timezone, true, null, null, Set.of());
    }

    public RepeatOptions withSkipImmediate(boolean skipImmediate) {
        return new RepeatOptions(timezone, skipImmediate, startDate, endDate, skipDays);
    }

    public RepeatOptions withBounds(Instant startDate, Instant endDate) {
        return new RepeatOptions(timezone, skipImmediate, startDate, endDate, skipDays);
    }

    public RepeatOptions withSkipDays(Set<DayOfWeek> skipDays) {
        return new RepeatOptions(timezone, skipImmediate, startDate, endDate, skipDays);
    }
}
