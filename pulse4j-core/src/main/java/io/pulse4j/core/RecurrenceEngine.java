package io.pulse4j.core;

import io.pulse4j.core.exception.TimeParseException;
import io.pulse4j.utils.DateParser;
import io.pulse4j.utils.IntervalParser;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the next eligible run time of a recurring job.
 *
 * <p>Order of evaluation:
 * <ol>
 *   <li>natural next occurrence: {@code repeatAt} (fixed time of day) wins over {@code repeatInterval}
 *       (cron or human interval)</li>
 *   <li>skipped weekdays are advanced by whole days, keeping the wall-clock time</li>
 *   <li>the result is moved up to {@code startDate} and retired at or after {@code endDate}</li>
 * </ol>
 */
public final class RecurrenceEngine {
    private RecurrenceEngine() {
    }

    private static final int MAX_SKIP_ADVANCES = 7;

    /**
     * Scheduling fields of a job, as read by the engine.
     */
    public record Recurrence(
            String repeatInterval,
            String repeatAt,
            String repeatTimezone,
            Instant lastRunAt,
            Instant startDate,
            Instant endDate,
            Set<DayOfWeek> skipDays
    ) {
        public Recurrence {
            skipDays = skipDays == null ? Set.of() : Set.copyOf(skipDays);
        }

        public boolean isRecurring() {
            return !isBlank(repeatInterval) || !isBlank(repeatAt);
        }
    }

    /**
     * @return the next run time, or {@code null} when the job has no further occurrence
     * (every weekday skipped, or past {@code endDate})
     * @throws TimeParseException when the interval, time of day or time zone is malformed
     */
    public static Instant nextRunAt(Recurrence r, Instant now) {
        Objects.requireNonNull(r, "recurrence must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (!r.isRecurring()) {
            throw new IllegalArgumentException("job has neither repeatInterval nor repeatAt");
        }

        ZoneId zone = IntervalParser.resolveZone(r.repeatTimezone());

        Instant candidate = applySkipDays(naturalNext(r, zone, now, false), r.skipDays(), zone);

        if (candidate != null && r.startDate() != null && candidate.isBefore(r.startDate())) {
            candidate = applySkipDays(naturalNext(r, zone, r.startDate(), true), r.skipDays(), zone);
        }

        if (candidate != null && r.endDate() != null && !candidate.isBefore(r.endDate())) {
            return null;
        }
        return candidate;
    }

    /**
     * @param reference "now", or the start date when clamping
     * @param inclusive whether {@code reference} itself is an acceptable occurrence
     */
    private static Instant naturalNext(Recurrence r, ZoneId zone, Instant reference, boolean inclusive) {
        if (!isBlank(r.repeatAt())) {
            LocalTime timeOfDay = DateParser.parseTimeOfDay(r.repeatAt());
            ZonedDateTime base = reference.atZone(zone);
            ZonedDateTime candidate = base.with(timeOfDay);
            boolean tooEarly = inclusive ? candidate.isBefore(base) : !candidate.isAfter(base);
            if (tooEarly) {
                candidate = base.plusDays(1).with(timeOfDay);
            }
            return candidate.toInstant();
        }

        String interval = r.repeatInterval().trim();
        if (IntervalParser.looksLikeCron(interval)) {
            if (inclusive) {
                return cronAtOrAfter(interval, zone, reference);
            }
            return IntervalParser.nextCronOccurrence(interval, zone, laterOf(reference, r.lastRunAt()));
        }

        Duration every = IntervalParser.parseHumanDuration(interval);
        if (inclusive) {
            return reference;
        }
        Instant lastRunAt = r.lastRunAt();
        if (lastRunAt == null) {
            return reference.plus(every);
        }
        Instant candidate = lastRunAt.plus(every);
        if (!candidate.isAfter(reference)) {
            // keep the cadence anchored on lastRunAt
            long periods = Duration.between(lastRunAt, reference).toMillis() / every.toMillis() + 1;
            candidate = lastRunAt.plus(every.multipliedBy(periods));
        }
        return candidate;
    }

    private static Instant cronAtOrAfter(String cron, ZoneId zone, Instant reference) {
        Instant next = IntervalParser.nextCronOccurrence(cron, zone, reference.minusSeconds(1));
        while (next.isBefore(reference)) {
            next = IntervalParser.nextCronOccurrence(cron, zone, next);
        }
        return next;
    }

    private static Instant applySkipDays(Instant candidate, Set<DayOfWeek> skipDays, ZoneId zone) {
        if (candidate == null || skipDays.isEmpty()) {
            return candidate;
        }
        ZonedDateTime z = candidate.atZone(zone);
        LocalTime wallClock = z.toLocalTime();
        int advances = 0;
        while (skipDays.contains(z.getDayOfWeek())) {
            if (advances == MAX_SKIP_ADVANCES) {
                return null;
            }
            z = z.toLocalDate().plusDays(1).atTime(wallClock).atZone(zone);
            advances++;
        }
        return z.toInstant();
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
