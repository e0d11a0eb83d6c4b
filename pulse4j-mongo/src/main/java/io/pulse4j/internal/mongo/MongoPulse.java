package io.pulse4j.internal.mongo;

import io.pulse4j.Job;
import io.pulse4j.JobHandler;
import io.pulse4j.Pulse;
import io.pulse4j.config.PulseProperties;
import io.pulse4j.core.CancelResult;
import io.pulse4j.core.JobEventPublisher;
import io.pulse4j.core.JobHandlerRegistry;
import io.pulse4j.core.JobQuery;
import io.pulse4j.core.JobStore;
import io.pulse4j.core.JobType;
import io.pulse4j.core.RepeatOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pulse is a Mongo-backed job scheduler &amp; runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One-time jobs (run at a specific Instant or time expression)</li>
 *   <li>Recurring jobs (cron expression, human interval, fixed time of day)</li>
 *   <li>Distributed-safe execution via atomic claim/lock</li>
 *   <li>Per-job retry with fixed or exponential backoff</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * pulse.start();
 *
 * pulse.create("sub-to-channel", data)
 *      .unique(Map.of("data.sourceId", "xxx"))
 *      .schedule("2026-01-20T09:30:00.000Z")
 *      .save();
 *
 * pulse.now("sync-something", data);
 * pulse.stop();
 * }</pre>
 */
public class MongoPulse implements Pulse {
    private static final Logger log = LoggerFactory.getLogger(MongoPulse.class);
    private final PulseProperties props;
    private final MongoJobStore jobStore;
    private final JobHandlerRegistry jobRegistry;
    private final JobEventPublisher events;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;

    private Thread pollerThread;
    private Thread dispatcherThread;

    private final DelayQueue<DelayedJob> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, Boolean> enqueued = new ConcurrentHashMap<>();

    private final Semaphore refillSignal = new Semaphore(0);

    private final AtomicReference<Instant> windowCursor = new AtomicReference<>();

    private final Semaphore globalSem;
    private final ConcurrentHashMap<String, Semaphore> perNameSem = new ConcurrentHashMap<>();
    private int systemErrorCount = 0;

    private final String workerId;

    private final class DelayedJob implements Delayed {
        private final JobDocument doc;
        private final Instant runAt;

        private DelayedJob(JobDocument doc) {
            this.doc = doc;
            this.runAt = doc.getNextRunAt();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), runAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedJob o) {
                return this.runAt.compareTo(o.runAt);
            }
            long d1 = this.getDelay(TimeUnit.MILLISECONDS);
            long d2 = other.getDelay(TimeUnit.MILLISECONDS);
            return Long.compare(d1, d2);
        }
    }

    private Semaphore semForName(String name) {
        return perNameSem.computeIfAbsent(name, n -> new Semaphore(props.getDefaultConcurrency()));
    }

    public MongoPulse(PulseProperties props, MongoJobStore jobStore, JobHandlerRegistry jobRegistry,
                      JobEventPublisher events) {
        this(props, jobStore, jobRegistry, events, Clock.systemUTC());
    }

    public MongoPulse(PulseProperties props, MongoJobStore jobStore, JobHandlerRegistry jobRegistry,
                      JobEventPublisher events, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.events = events == null ? JobEventPublisher.noop() : events;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /* ================= SchedulerHandle ================= */

    @Override
    public JobStore store() {
        return jobStore;
    }

    @Override
    public JobHandlerRegistry handlers() {
        return jobRegistry;
    }

    @Override
    public JobEventPublisher events() {
        return events;
    }

    @Override
    public Duration lockLifetime() {
        return props.getDefaultLockLifetime();
    }

    @Override
    public Duration maxBackoffDelay() {
        return props.getMaxBackoffDelay();
    }

    @Override
    public Clock clock() {
        return clock;
    }

    public String workerId() {
        return workerId;
    }

    /* ================= lifecycle ================= */

    /**
     * Start polling and executing due jobs. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "pulse.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("pulse.processEvery must be a positive duration");
        }

        Duration lockLifetime = Objects.requireNonNull(props.getDefaultLockLifetime(), "pulse.defaultLockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("pulse.defaultLockLifetime must be a positive duration");
        }

        log.info("Pulse starting with processEvery={}, defaultLockLifetime={}, workerId={}, maxConcurrency={}, lockLimit={}, batchSize={}, handlers={}",
                props.getProcessEvery(),
                props.getDefaultLockLifetime(),
                workerId,
                props.getMaxConcurrency(),
                props.getLockLimit(),
                props.getBatchSize(),
                jobRegistry.names());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("pulse.workerPool");
                t.setDaemon(true);
                return t;
            });
        }

        windowCursor.compareAndSet(null, clock.instant());

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("pulse.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("pulse.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("Pulse started successfully.");
    }

    /**
     * Stop polling and executing. Should be idempotent.
     *
     * <p>Claimed jobs still waiting in the local queue keep their lock until it expires.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Pulse stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getDefaultLockLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        queue.clear();
        enqueued.clear();
        refillSignal.drainPermits();
        windowCursor.set(null);
        log.info("Pulse stopped successfully.");
    }

    /* ================= job factories ================= */

    /**
     * Create a job. This does not persist until save() is called.
     */
    @Override
    public <T> Job<T> create(String name, T data) {
        Job<T> job = new Job<>(this, name, JobType.NORMAL, data);
        job.setLastModifiedBy(workerId);
        return job;
    }

    /**
     * Create a job without data.
     */
    @Override
    public Job<Void> create(String name) {
        return create(name, null);
    }

    @Override
    public <T> Job<T> schedule(String name, Instant time, T data) {
        Job<T> job = create(name, data).schedule(time);
        job.save();
        return job;
    }

    @Override
    public <T> Job<T> schedule(String name, String when, T data) {
        Job<T> job = create(name, data).schedule(when);
        job.save();
        return job;
    }

    /**
     * Create or replace the single recurring job named {@code name}. Unless
     * {@link RepeatOptions#skipImmediate()} is false, the first run is the next occurrence
     * rather than now.
     */
    @Override
    public <T> Job<T> every(String name, String interval, T data, RepeatOptions options) {
        RepeatOptions o = options == null ? RepeatOptions.defaults() : options;
        Job<T> job = create(name, data);
        job.setType(JobType.SINGLE);
        job.repeatEvery(interval, o);
        return saveRecurring(job, o);
    }

    @Override
    public Job<Void> every(String name, String interval, RepeatOptions options) {
        return this.every(name, interval, null, options);
    }

    @Override
    public <T> Job<T> every(String name, Number seconds, T data, RepeatOptions options) {
        RepeatOptions o = options == null ? RepeatOptions.defaults() : options;
        Job<T> job = create(name, data);
        job.setType(JobType.SINGLE);
        job.repeatEvery(seconds, o);
        return saveRecurring(job, o);
    }

    private <T> Job<T> saveRecurring(Job<T> job, RepeatOptions options) {
        if (options.skipImmediate()) {
            job.computeNextRunAt();
        }
        job.save();
        return job;
    }

    /**
     * Create and persist a job that runs immediately (nextRunAt = now).
     * Callers do not need to call {@code save()}.
     */
    @Override
    public <T> Job<T> now(String name, T data) {
        Job<T> job = create(name, data).schedule(clock.instant());
        job.save();
        return job;
    }

    @Override
    public Job<Void> now(String name) {
        return now(name, null);
    }

    /* ================= queries ================= */

    @Override
    public List<Job<Object>> jobs(JobQuery query) {
        return jobs(query, Object.class);
    }

    @Override
    public <T> List<Job<T>> jobs(JobQuery query, Class<T> dataClass) {
        Objects.requireNonNull(query, "query must not be null");
        List<JobDocument> docs = jobStore.find(query, Integer.MAX_VALUE);
        List<Job<T>> jobs = new ArrayList<>(docs.size());
        for (JobDocument doc : docs) {
            jobs.add(jobStore.toJob(doc, dataClass, this));
        }
        return jobs;
    }

    @Override
    public CancelResult cancel(JobQuery query) {
        return cancel(query, CancelOptions.defaults());
    }

    @Override
    public CancelResult cancel(JobQuery query, CancelOptions options) {
        Objects.requireNonNull(query, "query must not be null");
        if (options == null) {
            options = CancelOptions.defaults();
        }
        if (options.limit() <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        if (options.mode() == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        if (query.isEmpty()) {
            throw new IllegalArgumentException("JobQuery must include at least an id, a name or a field");
        }

        return switch (options.mode()) {
            case DISABLE -> {
                long modified = jobStore.disableByQuery(query, options.limit());
                yield CancelResult.disabled(modified);
            }
            case DELETE -> {
                long deleted = jobStore.deleteByQuery(query, options.limit());
                yield CancelResult.deleted(deleted);
            }
        };
    }

    /* ================= polling & dispatch ================= */

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "pulse4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("pulse could not resolve host name, using default msg={}", e.getMessage());
        }

        String pid = "unknown";
        try {
            pid = ManagementFactory.getRuntimeMXBean().getName().split("@")[0];
        } catch (Exception e) {
            log.debug("pulse could not resolve process id msg={}", e.getMessage());
        }

        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("pulse pollOnce failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= 30) {
                    log.error("Pulse stopped due to repeated system failures...");
                    stop();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : pollBackoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            if (backlog) {
                try {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration pollBackoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private boolean pollOnce() {
        Instant now = clock.instant();
        Instant windowStart = windowCursor.get();
        // a cursor left behind (slow poll, long sleep) restarts at now
        if (windowStart == null || windowStart.isBefore(now)) {
            windowStart = now;
        }

        Instant windowEnd = windowStart.plus(props.getProcessEvery());

        int running = props.getMaxConcurrency() - globalSem.availablePermits();
        int inFlight = enqueued.size() + Math.max(0, running);

        int lockLimit = props.getLockLimit();
        int remaining;
        if (lockLimit <= 0) {
            remaining = Integer.MAX_VALUE;
        } else {
            remaining = Math.max(0, lockLimit - inFlight);
        }

        if (remaining == 0) {
            windowCursor.set(windowEnd);
            return true;
        }

        int batchSize = Math.max(1, props.getBatchSize());
        boolean backlog = false;

        while (remaining > 0) {
            int take = Math.min(batchSize, remaining);

            var docs = jobStore.claimDueJobs(
                    windowEnd,
                    take,
                    props.getDefaultLockLifetime(),
                    workerId
            );

            log.debug("Pulse polled jobs count={} windowEnd={} remaining={}", docs.size(), windowEnd, remaining);

            for (var doc : docs) {
                if (enqueued.putIfAbsent(doc.getId(), Boolean.TRUE) == null) {
                    queue.offer(new DelayedJob(doc));
                    remaining--;
                    if (remaining == 0) {
                        break;
                    }
                }
            }

            if (docs.size() < take) {
                break;
            }

            if (remaining == 0) {
                backlog = true;
                break;
            }
        }

        windowCursor.set(windowEnd);
        return backlog;
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DelayedJob dj = queue.take();
                JobDocument doc = dj.doc;

                enqueued.remove(doc.getId());
                submitToWorker(doc);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("pulse dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void submitToWorker(JobDocument doc) {
        final String name = doc.getName();

        final Semaphore nameSem = semForName(name);

        globalSem.acquireUninterruptibly();
        nameSem.acquireUninterruptibly();

        workerPool.submit(() -> {
            try {
                runClaimed(doc);
            } catch (Exception e) {
                // the lock stays in place and is reclaimed once it expires
                log.error("pulse job could not be persisted name={} id={} msg={}", name, doc.getId(), e.getMessage(), e);
            } finally {
                nameSem.release();
                globalSem.release();
                refillSignal.release();
            }
        });
    }

    /**
     * Hydrate a claimed document and run it. Handler failures are recorded on the job by
     * {@link Job#run()}; only store failures escape.
     */
    void runClaimed(JobDocument doc) {
        Class<?> dataClass = jobRegistry.find(doc.getName())
                .<Class<?>>map(JobHandler::dataClass)
                .orElse(null);
        Job<?> job = jobStore.toJob(doc, dataClass, this);
        job.setLastModifiedBy(workerId);

        int failsBefore = job.getFailCount();
        job.run();
        boolean failed = job.getFailCount() > failsBefore;

        if (!failed && job.getNextRunAt() == null && props.isCleanupFinishedJobs()) {
            jobStore.remove(job.getId());
            log.debug("Pulse removed finished job name={} id={}", job.getName(), job.getId());
        }
    }
}
