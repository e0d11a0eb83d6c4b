package io.pulse4j;

import io.pulse4j.core.CancelMode;
import io.pulse4j.core.CancelResult;
import io.pulse4j.core.JobQuery;
import io.pulse4j.core.PersistResult;
import io.pulse4j.core.RepeatOptions;
import io.pulse4j.core.SchedulerHandle;

import java.time.Instant;
import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Supports two scheduling styles:
 * <ul>
 *   <li>Absolute time scheduling (single run at a specific {@link Instant} or time expression)</li>
 *   <li>Recurring scheduling (human interval, cron string, numeric seconds or fixed time of day)</li>
 * </ul>
 */
public interface Pulse extends SchedulerHandle {
    void start();

    void stop();

    /**
     * Create an unsaved {@link io.pulse4j.core.JobType#NORMAL} job due now.
     */
    <T> Job<T> create(String name, T data);

    Job<Void> create(String name);

    /**
     * Create and persist a one-time job at an absolute time.
     */
    <T> Job<T> schedule(String name, Instant time, T data);

    /**
     * Create and persist a one-time job at a time expression ("in 10 minutes", "tomorrow at 9am").
     */
    <T> Job<T> schedule(String name, String when, T data);

    /**
     * Create or update the single recurring job of this name.
     * Supported intervals include human duration text and cron expressions.
     */
    <T> Job<T> every(String name, String interval, T data, RepeatOptions options);

    Job<Void> every(String name, String interval, RepeatOptions options);

    <T> Job<T> every(String name, Number seconds, T data, RepeatOptions options);

    /**
     * Create and persist a job that runs as soon as possible.
     */
    <T> Job<T> now(String name, T data);

    Job<Void> now(String name);

    /**
     * Load persisted jobs; payloads are left as stored (maps, lists and scalars).
     */
    List<Job<Object>> jobs(JobQuery query);

    <T> List<Job<T>> jobs(JobQuery query, Class<T> dataClass);

    CancelResult cancel(JobQuery query);

    CancelResult cancel(JobQuery query, CancelOptions options);

    record CancelOptions(CancelMode mode, int limit) {
        public static CancelOptions defaults() {
            return new CancelOptions(CancelMode.DISABLE, Integer.MAX_VALUE);
        }
    }
}
