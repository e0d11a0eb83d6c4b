package io.pulse4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.pulse4j.Job;
import io.pulse4j.JobHandler;
import io.pulse4j.Pulse;
import io.pulse4j.config.PulseProperties;
import io.pulse4j.core.Backoff;
import io.pulse4j.core.CancelMode;
import io.pulse4j.core.JobEventType;
import io.pulse4j.core.JobHandlerRegistry;
import io.pulse4j.core.JobQuery;
import io.pulse4j.core.JobStatus;
import io.pulse4j.core.JobType;
import io.pulse4j.core.ListenerJobEventPublisher;
import io.pulse4j.core.PersistResult;
import io.pulse4j.core.RepeatOptions;
import io.pulse4j.core.UniqueOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoPulseIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "pulse4j_test");
        mongoTemplate.dropCollection(JobDocument.class);
        jobStore = new MongoJobStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
    }

    @Test
    void claimDueJobsShouldLockAndPreventDoubleClaim() {
        JobDocument due = newDoc("email-sync", Instant.now().minusSeconds(5));
        mongoTemplate.insert(due);

        List<JobDocument> claimed = jobStore.claimDueJobs(
                Instant.now().plusSeconds(2),
                1,
                Duration.ofSeconds(30),
                "worker-A"
        );

        assertEquals(1, claimed.size());
        JobDocument locked = claimed.get(0);
        assertEquals("worker-A", locked.getLockedBy());
        assertNotNull(locked.getLockedAt());

        List<JobDocument> secondClaim = jobStore.claimDueJobs(
                Instant.now().plusSeconds(2),
                1,
                Duration.ofSeconds(30),
                "worker-B"
        );

        assertTrue(secondClaim.isEmpty());
    }

    @Test
    void expiredLockShouldBeClaimedAgain() {
        JobDocument abandoned = newDoc("email-sync", Instant.now().minusSeconds(60));
        abandoned.setLockedAt(Instant.now().minus(Duration.ofMinutes(5)));
        abandoned.setLockedBy("crashed-worker");
        mongoTemplate.insert(abandoned);

        List<JobDocument> claimed = jobStore.claimDueJobs(
                Instant.now(),
                5,
                Duration.ofMinutes(1),
                "worker-B"
        );

        assertEquals(1, claimed.size());
        assertEquals("worker-B", claimed.get(0).getLockedBy());
    }

    @Test
    void disabledAndFutureJobsShouldNotBeClaimed() {
        JobDocument disabled = newDoc("disabled", Instant.now().minusSeconds(5));
        disabled.setDisabled(true);
        mongoTemplate.insert(disabled);
        mongoTemplate.insert(newDoc("later", Instant.now().plus(Duration.ofHours(1))));
        mongoTemplate.insert(newDoc("retired", null));

        List<JobDocument> claimed = jobStore.claimDueJobs(
                Instant.now().plusSeconds(2),
                10,
                Duration.ofSeconds(30),
                "worker-A"
        );

        assertTrue(claimed.isEmpty());
    }

    @Test
    void claimShouldPreferEarlierThenHigherPriority() {
        Instant at = Instant.now().minusSeconds(10);
        JobDocument low = newDoc("low", at);
        low.setPriority(-10);
        JobDocument high = newDoc("high", at);
        high.setPriority(10);
        mongoTemplate.insert(low);
        mongoTemplate.insert(high);
        mongoTemplate.insert(newDoc("earliest", at.minusSeconds(30)));

        List<JobDocument> claimed = jobStore.claimDueJobs(Instant.now(), 3, Duration.ofSeconds(30), "worker-A");

        assertEquals(List.of("earliest", "high", "low"), claimed.stream().map(JobDocument::getName).toList());
    }

    @Test
    void savedJobShouldHydrateWithItsState() {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of()));
        Instant start = Instant.parse("2030-01-01T00:00:00Z");

        Job<Map<String, Object>> job = pulse.create("digest", Map.<String, Object>of("userId", 42, "plan", "pro"))
                .repeatEvery("0 8 * * *", RepeatOptions.inTimezone("Europe/Berlin")
                        .withBounds(start, null)
                        .withSkipDays(EnumSet.of(DayOfWeek.SUNDAY)))
                .unique(Map.of("data.userId", 42))
                .priority("high")
                .backoff(Backoff.exponential(Duration.ofSeconds(2)))
                .attempts(4)
                .setShouldSaveResult(true)
                .computeNextRunAt();
        PersistResult saved = job.save();
        assertTrue(saved.created());

        List<Job<Object>> found = pulse.jobs(JobQuery.builder().where("data.userId", 42).build());

        assertEquals(1, found.size());
        Job<Object> loaded = found.get(0);
        assertEquals(saved.id(), loaded.getId());
        assertEquals("digest", loaded.getName());
        assertEquals(JobType.NORMAL, loaded.getType());
        assertEquals(10, loaded.getPriority());
        assertEquals("0 8 * * *", loaded.getRepeatInterval());
        assertEquals("Europe/Berlin", loaded.getRepeatTimezone());
        assertEquals(start, loaded.getStartDate());
        assertEquals(EnumSet.of(DayOfWeek.SUNDAY), loaded.getSkipDays());
        assertEquals(Map.of("data.userId", 42), loaded.getUniqueQuery());
        assertEquals(Backoff.exponential(Duration.ofSeconds(2)), loaded.getBackoff());
        assertEquals(4, loaded.getAttempts());
        assertTrue(loaded.isShouldSaveResult());
        assertEquals(job.getNextRunAt(), loaded.getNextRunAt());
        assertEquals(Map.of("userId", 42, "plan", "pro"), loaded.getData());
        assertEquals(pulse.workerId(), loaded.getLastModifiedBy());
    }

    @Test
    void uniqueSaveShouldUpdateOrKeepExistingDocument() {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of()));

        PersistResult first = pulse.create("report", Map.of("userId", 1, "v", 1))
                .unique(Map.of("data.userId", 1))
                .save();
        PersistResult updated = pulse.create("report", Map.of("userId", 1, "v", 2))
                .unique(Map.of("data.userId", 1))
                .save();
        PersistResult kept = pulse.create("report", Map.of("userId", 1, "v", 3))
                .unique(Map.of("data.userId", 1), new UniqueOptions(true))
                .save();

        assertTrue(first.created());
        assertTrue(updated.updated());
        assertEquals(first.id(), updated.id());
        assertFalse(kept.created());
        assertFalse(kept.updated());
        assertEquals(first.id(), kept.id());

        List<Job<Object>> all = pulse.jobs(JobQuery.byName("report"));
        assertEquals(1, all.size());
        assertEquals(Map.of("userId", 1, "v", 2), all.get(0).getData());
    }

    @Test
    void concurrentInsertOnlyUniqueSavesShouldCreateOneDocument() throws Exception {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of()));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<PersistResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<PersistResult> task = () -> {
                    Job<Map<String, Object>> job = pulse.create("welcome-mail", Map.<String, Object>of("userId", 7))
                            .unique(Map.of("data.userId", 7), new UniqueOptions(true));
                    go.await();
                    return job.save();
                };
                futures.add(pool.submit(task));
            }
            go.countDown();

            long created = 0;
            for (Future<PersistResult> f : futures) {
                if (f.get(10, TimeUnit.SECONDS).created()) {
                    created++;
                }
            }

            assertEquals(1, created);
            assertEquals(1, mongoTemplate.count(new Query(Criteria.where("name").is("welcome-mail")), JobDocument.class));
            assertTrue(mongoTemplate.indexOps(JobDocument.class).getIndexInfo().stream()
                    .anyMatch(info -> info.isUnique() && "ux_unique_welcome-mail_data.userId".equals(info.getName())));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void uniqueIndexShouldOnlyConstrainUniqueJobsOfThatName() {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of()));

        pulse.create("welcome-mail", Map.of("userId", 7)).unique(Map.of("data.userId", 7)).save();
        pulse.create("welcome-mail", Map.of("userId", 7)).save();
        pulse.create("welcome-mail", Map.of("userId", 7)).save();
        pulse.create("reminder-mail", Map.of("userId", 7)).unique(Map.of("data.userId", 7)).save();

        assertEquals(3, mongoTemplate.count(new Query(Criteria.where("name").is("welcome-mail")), JobDocument.class));
        assertEquals(1, mongoTemplate.count(new Query(Criteria.where("name").is("reminder-mail")), JobDocument.class));
    }

    @Test
    void everyShouldKeepOneSingleDocumentPerName() {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of()));

        Job<Void> first = pulse.every("nightly-report", "1 hour", RepeatOptions.defaults());
        Job<Void> second = pulse.every("nightly-report", "2 hours", RepeatOptions.defaults());

        assertEquals(first.getId(), second.getId());
        List<JobDocument> docs = mongoTemplate.find(
                new Query(Criteria.where("name").is("nightly-report")), JobDocument.class);
        assertEquals(1, docs.size());
        assertEquals(JobType.SINGLE, docs.get(0).getType());
        assertEquals("2 hours", docs.get(0).getRepeatInterval());
        assertNotNull(docs.get(0).getNextRunAt());
        assertTrue(docs.get(0).getNextRunAt().isAfter(Instant.now().plus(Duration.ofMinutes(30))));
    }

    @Test
    void cancelShouldSupportDisableAndDelete() {
        Pulse pulse = newPulse(new JobHandlerRegistry(List.of()));

        JobDocument disableCandidate = newDoc("cleanup", Instant.now().plusSeconds(30));
        mongoTemplate.insert(disableCandidate);

        var disableResult = pulse.cancel(
                JobQuery.builder().name("cleanup").build(),
                new Pulse.CancelOptions(CancelMode.DISABLE, 10)
        );

        assertEquals(1, disableResult.modified());
        JobDocument disabled = mongoTemplate.findById(disableCandidate.getId(), JobDocument.class);
        assertNotNull(disabled);
        assertTrue(disabled.isDisabled());
        assertNotNull(disabled.getNextRunAt());

        JobDocument deleteCandidate = newDoc("cleanup-delete", Instant.now().plusSeconds(30));
        mongoTemplate.insert(deleteCandidate);

        var deleteResult = pulse.cancel(
                JobQuery.builder().name("cleanup-delete").build(),
                new Pulse.CancelOptions(CancelMode.DELETE, 10)
        );

        assertEquals(1, deleteResult.deleted());
        JobDocument deleted = mongoTemplate.findById(deleteCandidate.getId(), JobDocument.class);
        assertNull(deleted);
    }

    @Test
    void removeAndFetchStatusShouldUseStoredDocument() {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of()));
        Job<Void> job = pulse.create("report");
        job.save();

        JobStatus status = job.fetchStatus();
        assertEquals(job.getId(), status.id());
        assertFalse(status.running());

        assertEquals(1, job.remove());
        assertEquals(0, job.remove());
        assertEquals(job.getNextRunAt().truncatedTo(ChronoUnit.MILLIS), job.fetchStatus().nextRunAt().truncatedTo(ChronoUnit.MILLIS));
    }

    @Test
    void touchShouldRefreshLockOfClaimedJob() {
        mongoTemplate.insert(newDoc("long-import", Instant.now().minusSeconds(1)));
        JobDocument claimed = jobStore.claimDueJobs(Instant.now(), 1, Duration.ofSeconds(30), "worker-A").get(0);

        Instant later = claimed.getLockedAt().plusSeconds(20);
        assertTrue(jobStore.touch(claimed.getId(), later, 55));

        JobDocument stored = mongoTemplate.findById(claimed.getId(), JobDocument.class);
        assertNotNull(stored);
        assertEquals(later.truncatedTo(ChronoUnit.MILLIS), stored.getLockedAt());
        assertEquals(55, stored.getProgress());
        assertEquals("worker-A", stored.getLockedBy());

        JobDocument unlocked = newDoc("idle", Instant.now());
        mongoTemplate.insert(unlocked);
        assertFalse(jobStore.touch(unlocked.getId(), later, null));
    }

    @Test
    void runClaimedShouldRecordFailureAndScheduleRetry() {
        List<JobEventType> seen = new CopyOnWriteArrayList<>();
        ListenerJobEventPublisher events = new ListenerJobEventPublisher();
        events.addListener(e -> seen.add(e.type()));
        MongoPulse pulse = new MongoPulse(defaultProps(), jobStore,
                new JobHandlerRegistry(List.of(failingHandler())), events);

        pulse.create("failing-job", Map.of("id", "A1"))
                .backoff(Backoff.fixed(Duration.ofMinutes(5)))
                .save();
        JobDocument claimed = jobStore.claimDueJobs(Instant.now(), 1, Duration.ofSeconds(30), "test-worker").get(0);

        pulse.runClaimed(claimed);

        JobDocument updated = mongoTemplate.findById(claimed.getId(), JobDocument.class);
        assertNotNull(updated);
        assertEquals(1, updated.getFailCount());
        assertEquals(1, updated.getRunCount());
        assertEquals("simulated failure", updated.getFailReason());
        assertNull(updated.getLockedAt());
        assertNull(updated.getLockedBy());
        assertTrue(updated.getNextRunAt().isAfter(Instant.now().plus(Duration.ofMinutes(4))));
        assertEquals(List.of(JobEventType.START, JobEventType.RETRY, JobEventType.FAIL, JobEventType.COMPLETE), seen);
    }

    @Test
    void runWithoutRegisteredHandlerShouldKeepPayload() {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of()));
        Job<Map<String, Object>> job = pulse.now("mail", Map.of("userId", 42));
        JobDocument claimed = jobStore.claimDueJobs(Instant.now(), 1, Duration.ofSeconds(30), "test-worker").get(0);

        pulse.runClaimed(claimed);

        JobDocument updated = mongoTemplate.findById(job.getId(), JobDocument.class);
        assertNotNull(updated);
        assertEquals(1, updated.getFailCount());
        assertTrue(updated.getFailReason().contains("No JobHandler registered"));
        assertNull(updated.getLockedAt());
        assertEquals(Map.of("userId", 42), pulse.jobs(JobQuery.builder().id(job.getId()).build()).get(0).getData());
    }

    @Test
    void jobDisabledWhileRunningShouldStayDisabled() {
        AtomicReference<MongoPulse> ref = new AtomicReference<>();
        JobHandler<Map<String, Object>> cancelling = mapHandler("sync", job -> {
            ref.get().cancel(JobQuery.builder().id(job.getId()).build(), new Pulse.CancelOptions(CancelMode.DISABLE, 1));
            return null;
        });
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of(cancelling)));
        ref.set(pulse);

        Job<Map<String, Object>> job = pulse.create("sync", Map.<String, Object>of("id", "C3"))
                .repeatEvery("1 minute");
        job.save();
        JobDocument claimed = jobStore.claimDueJobs(Instant.now(), 1, Duration.ofSeconds(30), "test-worker").get(0);

        pulse.runClaimed(claimed);

        JobDocument updated = mongoTemplate.findById(job.getId(), JobDocument.class);
        assertNotNull(updated);
        assertTrue(updated.isDisabled());
        assertEquals(1, updated.getFinishedCount());
        assertNotNull(updated.getNextRunAt());
        assertTrue(jobStore.claimDueJobs(Instant.now().plus(Duration.ofHours(1)), 5, Duration.ofSeconds(30), "test-worker").isEmpty());
    }

    @Test
    void redefinitionWhileRunningShouldSurviveTheRun() {
        AtomicReference<MongoPulse> ref = new AtomicReference<>();
        JobHandler<Map<String, Object>> redefining = mapHandler("nightly-report", job -> {
            ref.get().every("nightly-report", "2 hours", RepeatOptions.defaults());
            return null;
        });
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of(redefining)));
        ref.set(pulse);

        Job<Void> job = pulse.every("nightly-report", "1 hour", RepeatOptions.defaults().withSkipImmediate(false));
        JobDocument claimed = jobStore.claimDueJobs(Instant.now(), 1, Duration.ofSeconds(30), "test-worker").get(0);

        pulse.runClaimed(claimed);

        JobDocument updated = mongoTemplate.findById(job.getId(), JobDocument.class);
        assertNotNull(updated);
        assertEquals("2 hours", updated.getRepeatInterval());
        assertEquals(1, updated.getRunCount());
        assertNull(updated.getLockedAt());
    }

    @Test
    void runClaimedShouldRemoveFinishedOneShotJobWhenCleanupIsOn() {
        PulseProperties props = defaultProps();
        props.setCleanupFinishedJobs(true);
        List<String> handled = new CopyOnWriteArrayList<>();
        MongoPulse pulse = new MongoPulse(props, jobStore,
                new JobHandlerRegistry(List.of(recordingHandler("one-shot", handled))), null);

        Job<Map<String, Object>> job = pulse.now("one-shot", Map.of("id", "B2"));
        JobDocument claimed = jobStore.claimDueJobs(Instant.now(), 1, Duration.ofSeconds(30), "test-worker").get(0);

        pulse.runClaimed(claimed);

        assertEquals(List.of("B2"), handled);
        assertNull(mongoTemplate.findById(job.getId(), JobDocument.class));
    }

    @Test
    void failedHandlerShouldIncreaseFailCountAndReschedule() throws Exception {
        MongoPulse pulse = newPulse(new JobHandlerRegistry(List.of(failingHandler())));

        pulse.create("failing-job", Map.of("id", "A1"))
                .backoff(Backoff.fixed(Duration.ofSeconds(30)))
                .save();
        pulse.start();

        boolean reached = waitUntil(8, TimeUnit.SECONDS, () -> {
            JobDocument doc = mongoTemplate.findOne(
                    new Query(Criteria.where("name").is("failing-job")),
                    JobDocument.class
            );
            return doc != null && doc.getFailCount() >= 1 && doc.getLockedAt() == null;
        });

        pulse.stop();

        assertTrue(reached);
        JobDocument updated = mongoTemplate.findOne(
                new Query(Criteria.where("name").is("failing-job")),
                JobDocument.class
        );
        assertNotNull(updated);
        assertTrue(updated.getFailCount() >= 1);
        assertNotNull(updated.getNextRunAt());
        assertFalse(updated.getNextRunAt().isBefore(Instant.now().plusSeconds(20)));
    }

    private MongoPulse newPulse(JobHandlerRegistry registry) {
        return new MongoPulse(defaultProps(), jobStore, registry, new ListenerJobEventPublisher());
    }

    private static JobHandler<Map<String, Object>> failingHandler() {
        return new JobHandler<>() {
            @Override
            public String name() {
                return "failing-job";
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> dataClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public Object execute(Job<Map<String, Object>> job) {
                throw new IllegalStateException("simulated failure");
            }
        };
    }

    private static JobHandler<Map<String, Object>> recordingHandler(String name, List<String> handled) {
        return new JobHandler<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> dataClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public Object execute(Job<Map<String, Object>> job) {
                handled.add(String.valueOf(job.getData().get("id")));
                return null;
            }
        };
    }

    private static JobHandler<Map<String, Object>> mapHandler(String name, Function<Job<Map<String, Object>>, Object> body) {
        return new JobHandler<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> dataClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public Object execute(Job<Map<String, Object>> job) {
                return body.apply(job);
            }
        };
    }

    private static JobDocument newDoc(String name, Instant nextRunAt) {
        JobDocument doc = new JobDocument();
        doc.setName(name);
        doc.setType(JobType.NORMAL);
        doc.setPriority(0);
        doc.setNextRunAt(nextRunAt);
        doc.setData(Map.of("k", "v"));
        return doc;
    }

    private static PulseProperties defaultProps() {
        PulseProperties props = new PulseProperties();
        props.setProcessEvery(Duration.ofMillis(200));
        props.setDefaultLockLifetime(Duration.ofSeconds(2));
        props.setMaxConcurrency(1);
        props.setDefaultConcurrency(1);
        props.setLockLimit(10);
        props.setBatchSize(1);
        props.setCleanupFinishedJobs(false);
        props.setWorkerId("test-worker");
        return props;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
