package io.pulse4j;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pulse4j.core.Backoff;
import io.pulse4j.core.JobEvent;
import io.pulse4j.core.JobEventType;
import io.pulse4j.core.JobStatus;
import io.pulse4j.core.JobType;
import io.pulse4j.core.PersistResult;
import io.pulse4j.core.Priority;
import io.pulse4j.core.RecurrenceEngine;
import io.pulse4j.core.RepeatOptions;
import io.pulse4j.core.SchedulerHandle;
import io.pulse4j.core.UniqueOptions;
import io.pulse4j.core.exception.JobHandlerException;
import io.pulse4j.core.exception.TimeParseException;
import io.pulse4j.utils.DateParser;
import io.pulse4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A single unit of deferred or recurring work.
 *
 * <p>A job is created in memory (fresh, or hydrated from storage by the scheduler), configured
 * through its fluent operations and persisted with {@link #save()}:
 * <pre>{@code
 * pulse.create("send-digest", data)
 *      .repeatEvery("0 8 * * *", RepeatOptions.inTimezone("Europe/Berlin"))
 *      .unique(Map.of("data.userId", 42))
 *      .computeNextRunAt()
 *      .save();
 * }</pre>
 *
 * <p>Instances are not thread-safe. Each worker operates on its own hydrated copy; mutual
 * exclusion between workers comes from the store's atomic claim, not from this class.
 */
public class Job<T> {
    private static final Logger log = LoggerFactory.getLogger(Job.class);

    private static final ObjectMapper SNAPSHOT_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private final SchedulerHandle scheduler;

    private String id;
    private String name;
    private JobType type;
    private int priority = Priority.NORMAL.value();
    private boolean disabled;
    private Integer progress;

    private Instant nextRunAt;
    private Instant lockedAt;
    private Instant lastRunAt;
    private Instant lastFinishedAt;

    private int runCount;
    private int finishedCount;
    private int failCount;

    private String repeatInterval;
    private String repeatTimezone;
    private String repeatAt;
    private Instant startDate;
    private Instant endDate;
    private Set<DayOfWeek> skipDays = EnumSet.noneOf(DayOfWeek.class);

    private Map<String, Object> uniqueQuery;
    private UniqueOptions uniqueOpts;

    private Backoff backoff;
    private Integer attempts;
    private String failReason;
    private Instant failedAt;

    private boolean shouldSaveResult;
    private Object result;
    private T data;
    private String lastModifiedBy;

    /**
     * Creates a {@link JobType#ONCE} job due now.
     */
    public Job(SchedulerHandle scheduler, String name, T data) {
        this(scheduler, name, JobType.ONCE, data);
    }

    public Job(SchedulerHandle scheduler, String name, JobType type, T data) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.name = normalizeName(name);
        this.type = type == null ? JobType.ONCE : type;
        this.data = data;
        this.nextRunAt = now();
    }

    /* ================= recurrence ================= */

    /**
     * Recompute {@code nextRunAt} from the repeat fields and the current time.
     *
     * <p>Without {@code repeatInterval} and {@code repeatAt} the job is left as is. A malformed spec
     * is recorded in {@code failReason} and the previous {@code nextRunAt} is kept.
     */
    public Job<T> computeNextRunAt() {
        if (!isRecurring()) {
            return this;
        }
        try {
            Instant next = RecurrenceEngine.nextRunAt(recurrence(), now());
            if (next == null) {
                log.debug("pulse job retired, no further occurrence name={} id={} endDate={}", name, id, endDate);
            }
            this.nextRunAt = next;
        } catch (TimeParseException e) {
            String spec = isBlank(repeatAt) ? repeatInterval : repeatAt;
            String field = isBlank(repeatAt) ? "repeat interval" : "repeatAt";
            this.failReason = "failed to calculate nextRunAt due to invalid " + field + " (" + spec + "): " + e.getMessage();
            log.warn("pulse could not compute nextRunAt name={} id={} spec={} msg={}", name, id, spec, e.getMessage());
        }
        return this;
    }

    public boolean isRecurring() {
        return !isBlank(repeatInterval) || !isBlank(repeatAt);
    }

    private RecurrenceEngine.Recurrence recurrence() {
        return new RecurrenceEngine.Recurrence(
                repeatInterval,
                repeatAt,
                repeatTimezone,
                lastRunAt,
                startDate,
                endDate,
                skipDays
        );
    }

    /* ================= lock & liveness ================= */

    /**
     * A run has been claimed and has not completed yet.
     */
    public boolean isRunning() {
        if (lockedAt == null) {
            return false;
        }
        return lastFinishedAt == null || (lastRunAt != null && lastFinishedAt.isBefore(lastRunAt));
    }

    /**
     * The claim is older than {@code lockDeadline}, i.e. the worker holding it is presumed dead.
     */
    public boolean isExpired(Duration lockDeadline) {
        Objects.requireNonNull(lockDeadline, "lockDeadline must not be null");
        if (lockedAt == null) {
            return false;
        }
        return Duration.between(lockedAt, now()).compareTo(lockDeadline) > 0;
    }

    /**
     * Uses the scheduler's configured lock lifetime.
     */
    public boolean isExpired() {
        return isExpired(scheduler.lockLifetime());
    }

    /**
     * Refresh the claim from inside a long-running handler. No effect unless locked.
     */
    public Job<T> touch() {
        return touch(null);
    }

    /**
     * Refresh the claim and report progress (0-100) in the same write.
     */
    public Job<T> touch(Integer progress) {
        if (lockedAt == null) {
            return this;
        }
        if (progress != null) {
            setProgress(progress);
        }
        Instant now = now();
        if (now.isAfter(lockedAt)) {
            lockedAt = now;
        }
        if (id != null) {
            scheduler.store().touch(id, lockedAt, progress);
        }
        return this;
    }

    /* ================= lifecycle ================= */

    public Job<T> enable() {
        this.disabled = false;
        return this;
    }

    public Job<T> disable() {
        this.disabled = true;
        return this;
    }

    public Job<T> priority(int priority) {
        this.priority = Priority.normalize(priority);
        return this;
    }

    /**
     * Accepts a named level ("highest", "high", "normal", "low", "lowest") or a numeric string.
     */
    public Job<T> priority(String priority) {
        this.priority = Priority.parse(priority);
        return this;
    }

    public Job<T> priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    /**
     * Repeat every X amount of time.
     * Accepts human-interval strings (e.g. "5 minutes", "2 hours") or cron expressions.
     * Does not compute {@code nextRunAt}; call {@link #computeNextRunAt()} for that.
     */
    public Job<T> repeatEvery(String interval) {
        return repeatEvery(interval, null);
    }

    /**
     * Repeat by a string spec with options (timezone, date bounds, skipped days).
     *
     * @throws TimeParseException when the timezone is unknown
     */
    public Job<T> repeatEvery(String interval, RepeatOptions options) {
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isBlank()) {
            throw new IllegalArgumentException("interval must not be blank");
        }
        RepeatOptions o = options == null ? RepeatOptions.defaults() : options;
        if (o.timezone() != null) {
            IntervalParser.resolveZone(o.timezone());
            this.repeatTimezone = o.timezone();
        }
        if (o.startDate() != null) {
            this.startDate = o.startDate();
        }
        if (o.endDate() != null) {
            this.endDate = o.endDate();
        }
        if (!o.skipDays().isEmpty()) {
            this.skipDays = EnumSet.copyOf(o.skipDays());
        }
        this.repeatInterval = interval.trim();
        return this;
    }

    /**
     * Repeat every {@code seconds} seconds.
     */
    public Job<T> repeatEvery(Number seconds, RepeatOptions options) {
        Objects.requireNonNull(seconds, "seconds must not be null");
        double asDouble = seconds.doubleValue();
        if (asDouble <= 0) {
            throw new IllegalArgumentException("interval must be a positive number of seconds");
        }
        if (asDouble % 1 != 0) {
            throw new IllegalArgumentException("interval must be an integer number of seconds");
        }
        return repeatEvery(Long.toString(seconds.longValue()), options);
    }

    /**
     * Run every day at a fixed time of day ("15:00", "3:30pm") in the job's timezone.
     * Takes precedence over {@code repeatInterval} when both are set.
     */
    public Job<T> repeatAt(String timeOfDay) {
        this.repeatAt = timeOfDay == null || timeOfDay.isBlank() ? null : timeOfDay.trim();
        return this;
    }

    public Job<T> timezone(String timezone) {
        if (timezone != null) {
            IntervalParser.resolveZone(timezone);
        }
        this.repeatTimezone = timezone;
        return this;
    }

    public Job<T> startDate(Instant startDate) {
        this.startDate = startDate;
        return this;
    }

    public Job<T> endDate(Instant endDate) {
        this.endDate = endDate;
        return this;
    }

    public Job<T> skipDays(Set<DayOfWeek> days) {
        this.skipDays = (days == null || days.isEmpty()) ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(days);
        return this;
    }

    /**
     * Declare the natural key of this job. {@code query} maps document field paths
     * (e.g. "data.userId") to the values they must equal; the job name is always part of the key.
     */
    public Job<T> unique(Map<String, Object> query) {
        return unique(query, UniqueOptions.defaults());
    }

    public Job<T> unique(Map<String, Object> query, UniqueOptions options) {
        Objects.requireNonNull(query, "unique query must not be null");
        if (query.isEmpty()) {
            throw new IllegalArgumentException("unique query must not be empty");
        }
        for (var e : query.entrySet()) {
            String k = e.getKey();
            if (k == null || k.isBlank()) {
                throw new IllegalArgumentException("unique query contains blank key");
            }
            if (e.getValue() == null) {
                throw new IllegalArgumentException("unique query contains null value for key: " + k);
            }
        }
        this.uniqueQuery = Collections.unmodifiableMap(new LinkedHashMap<>(query));
        this.uniqueOpts = options == null ? UniqueOptions.defaults() : options;
        return this;
    }

    public Job<T> schedule(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.nextRunAt = time;
        return this;
    }

    /**
     * Schedule from an expression such as "in 10 minutes", "tomorrow at 9am" or an ISO-8601 date-time.
     *
     * @throws TimeParseException when the expression cannot be parsed
     */
    public Job<T> schedule(String when) {
        this.nextRunAt = DateParser.parseWhen(when, IntervalParser.resolveZone(repeatTimezone), now());
        return this;
    }

    public Job<T> backoff(Backoff backoff) {
        this.backoff = backoff;
        return this;
    }

    /**
     * Maximum number of failed runs for which a backoff retry is scheduled; null means unlimited.
     */
    public Job<T> attempts(Integer attempts) {
        if (attempts != null && attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive");
        }
        this.attempts = attempts;
        return this;
    }

    public Job<T> setShouldSaveResult(boolean shouldSaveResult) {
        this.shouldSaveResult = shouldSaveResult;
        return this;
    }

    /**
     * Persist this job (see {@link io.pulse4j.core.JobStore#save}). Adopts the stored identifier.
     *
     * @throws io.pulse4j.core.exception.PersistenceException when the store fails
     */
    public PersistResult save() {
        PersistResult result = scheduler.store().save(this);
        if (result.id() != null) {
            this.id = result.id();
        }
        return result;
    }

    /**
     * Delete the persisted job.
     *
     * @return deleted count; 0 when never saved or already gone
     */
    public long remove() {
        if (id == null) {
            return 0;
        }
        return scheduler.store().remove(id);
    }

    /**
     * Status as currently stored, falling back to this instance when it was never saved.
     * Does not modify the job.
     */
    public JobStatus fetchStatus() {
        if (id != null) {
            var stored = scheduler.store().findStatus(id);
            if (stored.isPresent()) {
                return stored.get();
            }
        }
        return status();
    }

    /**
     * Projection of this in-memory instance.
     */
    public JobStatus status() {
        return new JobStatus(
                id,
                name,
                disabled,
                isRunning(),
                progress,
                nextRunAt,
                lockedAt,
                lastRunAt,
                lastFinishedAt,
                runCount,
                finishedCount,
                failCount,
                failReason,
                failedAt
        );
    }

    /* ================= run / fail ================= */

    /**
     * Execute the handler registered under this job's name. The caller must already hold the claim;
     * a {@code lockedAt} set by that claim is kept.
     *
     * <p>A job that was never saved is inserted first. Afterwards only its run state is written
     * (see {@link io.pulse4j.core.JobStore#recordRun}), so a job disabled, redefined or removed
     * while the handler runs keeps that change.
     *
     * <p>Handler errors are recorded through {@link #fail(Throwable)} and never thrown; store
     * errors are.
     */
    public Job<T> run() {
        Instant startedAt = now();
        if (lockedAt == null) {
            this.lockedAt = startedAt;
        }
        this.lastRunAt = startedAt;
        this.runCount++;

        log.debug("pulse job started name={} id={} at={}", name, id, startedAt);
        emit(JobEventType.START, null);
        recordRun();

        try {
            Object value = resolveHandler().execute(this);
            succeed(value);
        } catch (Exception e) {
            log.error("pulse job failed name={} id={} msg={}", name, id, e.getMessage(), e);
            fail(e);
        }

        emit(JobEventType.COMPLETE, null);
        recordRun();
        return this;
    }

    private void recordRun() {
        if (id == null) {
            save();
        } else if (!scheduler.store().recordRun(this)) {
            log.debug("pulse job document is gone, run state not written name={} id={}", name, id);
        }
    }

    private void succeed(Object value) {
        Instant finishedAt = now();
        this.lastFinishedAt = finishedAt;
        this.finishedCount++;
        if (shouldSaveResult) {
            this.result = value;
        }
        this.lockedAt = null;
        scheduleNextRun();

        log.debug("pulse job succeeded name={} id={} at={} nextRunAt={}", name, id, finishedAt, nextRunAt);
        emit(JobEventType.SUCCESS, null);
    }

    /**
     * Record a failure. With a backoff (and attempts left) a retry is scheduled, otherwise the job
     * follows its normal recurrence or retires.
     */
    public Job<T> fail(Throwable error) {
        Instant now = now();
        this.failReason = JobHandlerException.describe(error);
        this.failedAt = now;
        this.failCount++;
        this.lockedAt = null;

        JobHandlerException wrapped = error instanceof JobHandlerException jhe
                ? jhe
                : new JobHandlerException(name, error);

        Duration retryDelay = retryDelay();
        if (retryDelay != null) {
            this.nextRunAt = now.plus(retryDelay);
            log.info("pulse job scheduled for retry name={} id={} failCount={} delay={}", name, id, failCount, retryDelay);
            emit(JobEventType.RETRY, wrapped);
        } else {
            if (backoff != null) {
                log.warn("pulse job reached max attempts name={} id={} failCount={} attempts={}", name, id, failCount, attempts);
            }
            scheduleNextRun();
        }

        emit(JobEventType.FAIL, wrapped);
        return this;
    }

    public Job<T> fail(String reason) {
        return fail(new IllegalStateException(reason));
    }

    private Duration retryDelay() {
        if (backoff == null) {
            return null;
        }
        if (attempts != null && failCount > attempts) {
            return null;
        }
        return backoff.retryDelay(failCount, scheduler.maxBackoffDelay());
    }

    private void scheduleNextRun() {
        if (!type.shouldReschedule() || !isRecurring()) {
            this.nextRunAt = null;
            return;
        }
        computeNextRunAt();
    }

    @SuppressWarnings("unchecked")
    private JobHandler<T> resolveHandler() {
        return (JobHandler<T>) scheduler.handlers().getRequired(name);
    }

    private void emit(JobEventType type, Throwable error) {
        try {
            scheduler.events().publish(new JobEvent(type, this, error));
        } catch (RuntimeException e) {
            log.warn("pulse event publishing failed type={} name={} msg={}", type, name, e.getMessage());
        }
    }

    /* ================= serialization ================= */

    /**
     * Plain snapshot of all attributes. Payloads are deep-copied, so later changes to the job
     * (or to the snapshot) do not leak into each other.
     */
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", id);
        json.put("name", name);
        json.put("type", type.name().toLowerCase(Locale.ROOT));
        json.put("priority", priority);
        json.put("disabled", disabled);
        json.put("progress", progress);
        json.put("nextRunAt", nextRunAt);
        json.put("lockedAt", lockedAt);
        json.put("lastRunAt", lastRunAt);
        json.put("lastFinishedAt", lastFinishedAt);
        json.put("runCount", runCount);
        json.put("finishedCount", finishedCount);
        json.put("failCount", failCount);
        json.put("repeatInterval", repeatInterval);
        json.put("repeatTimezone", repeatTimezone);
        json.put("repeatAt", repeatAt);
        json.put("startDate", startDate);
        json.put("endDate", endDate);
        json.put("skipDays", skipDays.stream().map(DayOfWeek::name).collect(Collectors.toList()));
        json.put("uniqueQuery", deepCopy(uniqueQuery));
        json.put("uniqueOpts", uniqueOpts == null ? null : new LinkedHashMap<>(Map.of("insertOnly", uniqueOpts.insertOnly())));
        json.put("backoff", backoff == null ? null : backoffJson(backoff));
        json.put("attempts", attempts);
        json.put("failReason", failReason);
        json.put("failedAt", failedAt);
        json.put("shouldSaveResult", shouldSaveResult);
        json.put("result", deepCopy(result));
        json.put("data", deepCopy(data));
        json.put("lastModifiedBy", lastModifiedBy);
        return json;
    }

    private static Map<String, Object> backoffJson(Backoff backoff) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", backoff.type().name().toLowerCase(Locale.ROOT));
        m.put("delay", backoff.delay());
        return m;
    }

    private static Object deepCopy(Object value) {
        if (value == null) {
            return null;
        }
        return SNAPSHOT_MAPPER.convertValue(value, Object.class);
    }

    /* ================= helpers ================= */

    private Instant now() {
        return scheduler.clock().instant();
    }

    private static String normalizeName(String name) {
        Objects.requireNonNull(name, "job name must not be null");
        String n = name.trim();
        if (n.isEmpty()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        return n;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /* ================= accessors (also used when hydrating from storage) ================= */

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public JobType getType() {
        return type;
    }

    public void setType(JobType type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public int getPriority() {
        return priority;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public Integer getProgress() {
        return progress;
    }

    /**
     * Advisory progress reported by the running handler.
     */
    public void setProgress(Integer progress) {
        if (progress != null && (progress < 0 || progress > 100)) {
            throw new IllegalArgumentException("progress must be between 0 and 100: " + progress);
        }
        this.progress = progress;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public void setLockedAt(Instant lockedAt) {
        this.lockedAt = lockedAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public Instant getLastFinishedAt() {
        return lastFinishedAt;
    }

    public void setLastFinishedAt(Instant lastFinishedAt) {
        this.lastFinishedAt = lastFinishedAt;
    }

    public int getRunCount() {
        return runCount;
    }

    public void setRunCount(int runCount) {
        this.runCount = nonNegative(runCount, "runCount");
    }

    public int getFinishedCount() {
        return finishedCount;
    }

    public void setFinishedCount(int finishedCount) {
        this.finishedCount = nonNegative(finishedCount, "finishedCount");
    }

    public int getFailCount() {
        return failCount;
    }

    public void setFailCount(int failCount) {
        this.failCount = nonNegative(failCount, "failCount");
    }

    public String getRepeatInterval() {
        return repeatInterval;
    }

    public void setRepeatInterval(String repeatInterval) {
        this.repeatInterval = repeatInterval;
    }

    public String getRepeatTimezone() {
        return repeatTimezone;
    }

    public void setRepeatTimezone(String repeatTimezone) {
        this.repeatTimezone = repeatTimezone;
    }

    public String getRepeatAt() {
        return repeatAt;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public Set<DayOfWeek> getSkipDays() {
        return Collections.unmodifiableSet(skipDays);
    }

    public Map<String, Object> getUniqueQuery() {
        return uniqueQuery;
    }

    public UniqueOptions getUniqueOpts() {
        return uniqueOpts;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public Integer getAttempts() {
        return attempts;
    }

    public String getFailReason() {
        return failReason;
    }

    public void setFailReason(String failReason) {
        this.failReason = failReason;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    public boolean isShouldSaveResult() {
        return shouldSaveResult;
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }

    public String getLastModifiedBy() {
        return lastModifiedBy;
    }

    public void setLastModifiedBy(String lastModifiedBy) {
        this.lastModifiedBy = lastModifiedBy;
    }

    public List<String> skipDayNames() {
        return skipDays.stream().map(DayOfWeek::name).collect(Collectors.toList());
    }

    private static int nonNegative(int value, String field) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
        return value;
    }

    @Override
    public String toString() {
        return "Job{name=" + name + ", id=" + id + ", type=" + type + ", nextRunAt=" + nextRunAt + "}";
    }
}
