package io.pulse4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.pulse4j.Job;
import io.pulse4j.core.Backoff;
import io.pulse4j.core.JobQuery;
import io.pulse4j.core.JobStatus;
import io.pulse4j.core.JobStore;
import io.pulse4j.core.JobType;
import io.pulse4j.core.PersistResult;
import io.pulse4j.core.SchedulerHandle;
import io.pulse4j.core.UniqueOptions;
import io.pulse4j.core.exception.PersistenceException;
import io.pulse4j.utils.SkipDays;
import org.bson.BsonValue;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexField;
import org.springframework.data.mongodb.core.index.IndexInfo;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Save semantics:
 * <ul>
 *   <li>identifier present: upsert by {@code _id}</li>
 *   <li>unique query present: upsert by {name, query}; insert-only jobs only write on insert</li>
 *   <li>type=SINGLE: name-only singleton (upsert by {name,type}); the run state of an existing
 *       document is kept</li>
 *   <li>otherwise: insert</li>
 * </ul>
 *
 * <p>Unique queries are backed by a unique partial index on {name, query paths}, created on the
 * first save of each name and path set. A running job only writes its run state
 * ({@link #recordRun(Job)}).
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private static final List<String> FIELDS = List.of(
            "name", "type", "priority", "disabled", "progress",
            "nextRunAt", "lockedAt", "lockedBy", "lastRunAt", "lastFinishedAt",
            "runCount", "finishedCount", "failCount",
            "repeatInterval", "repeatTimezone", "repeatAt", "startDate", "endDate", "skipDays",
            "uniqueQuery", "uniqueInsertOnly", "backoffType", "backoffDelay", "attempts",
            "failReason", "failedAt", "shouldSaveResult", "result", "data", "lastModifiedBy"
    );

    // Owned by the run state machine; redefining a SINGLE job keeps the stored values.
    private static final Set<String> RUN_STATE_FIELDS = Set.of(
            "progress", "lockedAt", "lockedBy", "lastRunAt", "lastFinishedAt",
            "runCount", "finishedCount", "failCount", "failReason", "failedAt", "result"
    );

    // Written by a running job; everything else belongs to the job definition.
    private static final List<String> RUN_FIELDS = List.of(
            "progress", "nextRunAt", "lockedAt", "lockedBy", "lastRunAt", "lastFinishedAt",
            "runCount", "finishedCount", "failCount", "failReason", "failedAt", "result", "lastModifiedBy"
    );

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Set<String> uniqueIndexesEnsured = ConcurrentHashMap.newKeySet();

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /* ================= JobStore ================= */

    @Override
    public PersistResult save(Job<?> job) {
        Objects.requireNonNull(job, "job must not be null");
        return translate("save name=" + job.getName(), () -> {
            if (job.getId() != null) {
                return saveById(job);
            }
            if (job.getUniqueQuery() != null) {
                return saveUnique(job);
            }
            if (job.getType() == JobType.SINGLE) {
                return saveSingle(job);
            }
            JobDocument doc = toDocument(job);
            mongoTemplate.insert(doc);
            return PersistResult.createdResult(doc.getId());
        });
    }

    @Override
    public boolean recordRun(Job<?> job) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.getId(), "job id must not be null");
        return translate("recordRun id=" + job.getId(), () -> {
            Document written = write(toDocument(job));
            Update u = new Update();
            for (String field : RUN_FIELDS) {
                applySet(u, field, written.get(field), written);
            }
            return mongoTemplate.updateFirst(byId(job.getId()), u, JobDocument.class).getMatchedCount() > 0;
        });
    }

    @Override
    public long remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return translate("remove id=" + id, () ->
                mongoTemplate.remove(byId(id), JobDocument.class).getDeletedCount());
    }

    @Override
    public Optional<JobStatus> findStatus(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return translate("findStatus id=" + id, () ->
                Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class))
                        .map(MongoJobStore::toStatus));
    }

    @Override
    public boolean touch(String id, Instant lockedAt, Integer progress) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(lockedAt, "lockedAt must not be null");
        return translate("touch id=" + id, () -> {
            Query q = new Query(Criteria.where("_id").is(id).and("lockedAt").ne(null));
            Update u = new Update().set("lockedAt", lockedAt);
            if (progress != null) {
                u.set("progress", progress);
            }
            return mongoTemplate.updateFirst(q, u, JobDocument.class).getMatchedCount() > 0;
        });
    }

    private PersistResult saveById(Job<?> job) {
        UpdateResult r = mongoTemplate.upsert(byId(job.getId()), setAll(toDocument(job)), JobDocument.class);
        return r.getUpsertedId() != null
                ? PersistResult.createdResult(job.getId())
                : PersistResult.updatedResult(job.getId());
    }

    private PersistResult saveUnique(Job<?> job) {
        ensureUniqueIndex(job.getName(), job.getUniqueQuery().keySet());
        Criteria c = Criteria.where("name").is(job.getName());
        for (var e : job.getUniqueQuery().entrySet()) {
            if (!"name".equals(e.getKey())) {
                c = c.and(e.getKey()).is(e.getValue());
            }
        }
        Query q = new Query(c);
        boolean insertOnly = job.getUniqueOpts() != null && job.getUniqueOpts().insertOnly();
        Document written = write(toDocument(job));

        Update u = new Update();
        for (String field : FIELDS) {
            Object v = written.get(field);
            if (insertOnly) {
                if (v != null) {
                    u.setOnInsert(field, v);
                }
            } else {
                applySet(u, field, v, written);
            }
        }

        UpdateResult r = upsertRetryingOnce(q, u, job.getName());
        if (r.getUpsertedId() != null) {
            return PersistResult.createdResult(idOf(r.getUpsertedId()));
        }
        String id = findId(q);
        return insertOnly ? PersistResult.noop(id) : PersistResult.updatedResult(id);
    }

    private PersistResult saveSingle(Job<?> job) {
        Query q = new Query(Criteria.where("name").is(job.getName()).and("type").is(JobType.SINGLE));
        Document written = write(toDocument(job));
        Instant now = clock.instant();

        Update u = new Update();
        for (String field : FIELDS) {
            Object v = written.get(field);
            boolean keepStored = RUN_STATE_FIELDS.contains(field)
                    || ("nextRunAt".equals(field) && job.getNextRunAt() != null && !job.getNextRunAt().isAfter(now));
            if (keepStored) {
                if (v != null) {
                    u.setOnInsert(field, v);
                }
            } else {
                applySet(u, field, v, written);
            }
        }

        UpdateResult r = upsertRetryingOnce(q, u, job.getName());
        if (r.getUpsertedId() != null) {
            return PersistResult.createdResult(idOf(r.getUpsertedId()));
        }
        return PersistResult.updatedResult(findId(q));
    }

    /**
     * Unique partial index behind a unique query: keys {name, paths...}, limited to documents of
     * this name that were saved with a unique query and carry every path.
     */
    static Index uniqueQueryIndex(String name, Collection<String> paths) {
        List<String> keys = uniquePaths(paths);
        Document filter = new Document("name", name)
                .append("uniqueQuery", new Document("$exists", true));
        Index idx = new Index().on("name", Sort.Direction.ASC);
        for (String path : keys) {
            idx = idx.on(path, Sort.Direction.ASC);
            filter.append(path, new Document("$exists", true));
        }
        return idx.unique()
                .partial(PartialIndexFilter.of(filter))
                .named(uniqueIndexName(name, keys));
    }

    private void ensureUniqueIndex(String name, Collection<String> paths) {
        List<String> keys = uniquePaths(paths);
        String cacheKey = name + "|" + String.join(",", keys);
        if (uniqueIndexesEnsured.contains(cacheKey)) {
            return;
        }

        IndexOperations ops = mongoTemplate.indexOps(JobDocument.class);
        String indexName = uniqueIndexName(name, keys);
        Set<String> expectedKeys = new HashSet<>(keys);
        expectedKeys.add("name");
        boolean covered = ops.getIndexInfo().stream().anyMatch(info -> info.isUnique()
                && expectedKeys.equals(indexKeys(info))
                && (info.getPartialFilterExpression() == null || indexName.equals(info.getName())));
        if (!covered) {
            ops.ensureIndex(uniqueQueryIndex(name, keys));
            log.info("pulse created unique index index={} name={} paths={}", indexName, name, keys);
        }
        uniqueIndexesEnsured.add(cacheKey);
    }

    private static List<String> uniquePaths(Collection<String> paths) {
        return paths.stream()
                .filter(p -> !"name".equals(p))
                .sorted()
                .toList();
    }

    private static String uniqueIndexName(String name, List<String> keys) {
        return "ux_unique_" + name + (keys.isEmpty() ? "" : "_" + String.join("_", keys));
    }

    private static Set<String> indexKeys(IndexInfo info) {
        Set<String> keys = new HashSet<>();
        for (IndexField field : info.getIndexFields()) {
            keys.add(field.getKey());
        }
        return keys;
    }

    private UpdateResult upsertRetryingOnce(Query q, Update u, String name) {
        try {
            return mongoTemplate.upsert(q, u, JobDocument.class);
        } catch (DuplicateKeyException e) {
            // a concurrent writer inserted the same key first; the retry matches its document
            log.debug("pulse unique upsert raced, retrying name={}", name);
            return mongoTemplate.upsert(q, u, JobDocument.class);
        }
    }

    private Update setAll(JobDocument doc) {
        Document written = write(doc);
        Update u = new Update();
        for (String field : FIELDS) {
            applySet(u, field, written.get(field), written);
        }
        return u;
    }

    private static void applySet(Update u, String field, Object value, Document written) {
        // the claim owns lockedBy while the lock is held
        if ("lockedBy".equals(field) && written.get("lockedAt") != null) {
            return;
        }
        if (value == null) {
            u.unset(field);
        } else {
            u.set(field, value);
        }
    }

    private Document write(JobDocument doc) {
        Document out = new Document();
        mongoTemplate.getConverter().write(doc, out);
        return out;
    }

    private String findId(Query q) {
        q.fields().include("_id");
        JobDocument doc = mongoTemplate.findOne(q, JobDocument.class);
        return doc == null ? null : doc.getId();
    }

    private static String idOf(BsonValue upsertedId) {
        if (upsertedId.isObjectId()) {
            return upsertedId.asObjectId().getValue().toHexString();
        }
        return upsertedId.asString().getValue();
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static <R> R translate(String operation, Supplier<R> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new PersistenceException("pulse store " + operation + " failed: " + e.getMessage(), e);
        }
    }

    /* ================= mapping ================= */

    /**
     * Map a job to its document. {@code data} and {@code result} are converted into plain maps,
     * lists and scalars with the configured {@link ObjectMapper}.
     */
    public JobDocument toDocument(Job<?> job) {
        JobDocument doc = new JobDocument();
        doc.setId(job.getId());
        doc.setName(job.getName());
        doc.setType(job.getType());
        doc.setPriority(job.getPriority());
        doc.setDisabled(job.isDisabled());
        doc.setProgress(job.getProgress());
        doc.setNextRunAt(job.getNextRunAt());
        doc.setLockedAt(job.getLockedAt());
        doc.setLastRunAt(job.getLastRunAt());
        doc.setLastFinishedAt(job.getLastFinishedAt());
        doc.setRunCount(job.getRunCount());
        doc.setFinishedCount(job.getFinishedCount());
        doc.setFailCount(job.getFailCount());
        doc.setRepeatInterval(job.getRepeatInterval());
        doc.setRepeatTimezone(job.getRepeatTimezone());
        doc.setRepeatAt(job.getRepeatAt());
        doc.setStartDate(job.getStartDate());
        doc.setEndDate(job.getEndDate());
        doc.setSkipDays(job.getSkipDays().isEmpty() ? null : job.skipDayNames());

        if (job.getUniqueQuery() != null) {
            List<JobDocument.UniqueField> unique = new ArrayList<>();
            job.getUniqueQuery().forEach((path, value) -> unique.add(new JobDocument.UniqueField(path, value)));
            doc.setUniqueQuery(unique);
            doc.setUniqueInsertOnly(job.getUniqueOpts() != null && job.getUniqueOpts().insertOnly());
        }

        Backoff backoff = job.getBackoff();
        if (backoff != null) {
            doc.setBackoffType(backoff.type());
            doc.setBackoffDelay(backoff.delay());
        }
        doc.setAttempts(job.getAttempts());
        doc.setFailReason(job.getFailReason());
        doc.setFailedAt(job.getFailedAt());
        doc.setShouldSaveResult(job.isShouldSaveResult());
        doc.setResult(plain(job.getResult()));
        doc.setData(plain(job.getData()));
        doc.setLastModifiedBy(job.getLastModifiedBy());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Job)}.
     *
     * <p>Hydrates a persisted {@link JobDocument} into a {@link Job} bound to {@code scheduler}.
     * The stored {@code data} is converted into {@code dataClass}.
     *
     * @param dataClass target payload type; null leaves the payload as plain maps and lists
     */
    public <T> Job<T> toJob(JobDocument doc, Class<T> dataClass, SchedulerHandle scheduler) {
        Objects.requireNonNull(doc, "doc must not be null");

        Job<T> job = new Job<>(scheduler, doc.getName(), doc.getType() == null ? JobType.NORMAL : doc.getType(),
                convertData(doc.getData(), dataClass));
        job.setId(doc.getId());
        job.priority(doc.getPriority());
        if (doc.isDisabled()) {
            job.disable();
        }
        job.setProgress(doc.getProgress());
        job.setNextRunAt(doc.getNextRunAt());
        job.setLockedAt(doc.getLockedAt());
        job.setLastRunAt(doc.getLastRunAt());
        job.setLastFinishedAt(doc.getLastFinishedAt());
        job.setRunCount(doc.getRunCount());
        job.setFinishedCount(doc.getFinishedCount());
        job.setFailCount(doc.getFailCount());
        job.setRepeatInterval(doc.getRepeatInterval());
        job.setRepeatTimezone(doc.getRepeatTimezone());
        job.repeatAt(doc.getRepeatAt());
        job.startDate(doc.getStartDate());
        job.endDate(doc.getEndDate());
        job.skipDays(SkipDays.parse(doc.getSkipDays()));

        if (doc.getUniqueQuery() != null && !doc.getUniqueQuery().isEmpty()) {
            Map<String, Object> unique = new LinkedHashMap<>();
            for (JobDocument.UniqueField f : doc.getUniqueQuery()) {
                unique.put(f.getPath(), f.getValue());
            }
            job.unique(unique, new UniqueOptions(Boolean.TRUE.equals(doc.getUniqueInsertOnly())));
        }
        if (doc.getBackoffType() != null && doc.getBackoffDelay() != null) {
            job.backoff(new Backoff(doc.getBackoffType(), doc.getBackoffDelay()));
        }
        job.attempts(doc.getAttempts());
        job.setFailReason(doc.getFailReason());
        job.setFailedAt(doc.getFailedAt());
        job.setShouldSaveResult(doc.isShouldSaveResult());
        job.setResult(plain(doc.getResult()));
        job.setLastModifiedBy(doc.getLastModifiedBy());
        return job;
    }

    /**
     * Without a target type the payload stays as plain maps, lists and scalars.
     */
    @SuppressWarnings("unchecked")
    private <T> T convertData(Object raw, Class<T> dataClass) {
        if (raw == null || dataClass == Void.class) {
            return null;
        }
        if (dataClass == null) {
            return (T) plain(raw);
        }
        return objectMapper.convertValue(raw, dataClass);
    }

    private Object plain(Object value) {
        if (value == null) {
            return null;
        }
        return objectMapper.convertValue(value, Object.class);
    }

    private static JobStatus toStatus(JobDocument d) {
        boolean running = d.getLockedAt() != null
                && (d.getLastFinishedAt() == null
                || (d.getLastRunAt() != null && d.getLastFinishedAt().isBefore(d.getLastRunAt())));
        return new JobStatus(
                d.getId(),
                d.getName(),
                d.isDisabled(),
                running,
                d.getProgress(),
                d.getNextRunAt(),
                d.getLockedAt(),
                d.getLastRunAt(),
                d.getLastFinishedAt(),
                d.getRunCount(),
                d.getFinishedCount(),
                d.getFailCount(),
                d.getFailReason(),
                d.getFailedAt()
        );
    }

    /* ================= scheduler operations ================= */

    /**
     * Atomically claims (locks) at most {@code batchSize} due jobs.
     *
     * <p>A job is considered due when:
     * <ul>
     *   <li>{@code nextRunAt <= windowEnd} and it is not disabled</li>
     *   <li>and it is not locked, or its lock has expired: {@code lockedAt == null || lockedAt <= now - lockLifetime}</li>
     * </ul>
     *
     * <p>This method is safe under MultiServer concurrency because each claim is performed via
     * MongoDB {@code findAndModify} (read + update atomically).
     */
    public List<JobDocument> claimDueJobs(Instant windowEnd, int batchSize, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Instant now = clock.instant();

        Query baseQuery = new Query(new Criteria().andOperator(
                Criteria.where("nextRunAt").ne(null).lte(windowEnd),
                Criteria.where("disabled").ne(true),
                new Criteria().orOperator(
                        Criteria.where("lockedAt").is(null),
                        Criteria.where("lockedAt").lte(now.minus(lockLifetime))
                )
        ));
        baseQuery.with(Sort.by(Sort.Order.asc("nextRunAt"), Sort.Order.desc("priority")));

        Update lockUpdate = new Update()
                .set("lockedAt", now)
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        return translate("claim workerId=" + workerId, () -> {
            List<JobDocument> claimed = new ArrayList<>(Math.min(batchSize, 64));
            for (int i = 0; i < batchSize; i++) {
                JobDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, JobDocument.class);
                if (doc == null) {
                    break;
                }
                claimed.add(doc);
            }
            return claimed;
        });
    }

    /**
     * Find jobs matching {@code query}, earliest {@code nextRunAt} first, then higher priority.
     */
    public List<JobDocument> find(JobQuery query, int limit) {
        Criteria c = buildCriteria(query);
        Query q = new Query(c).with(Sort.by(Sort.Order.asc("nextRunAt"), Sort.Order.desc("priority")));
        if (limit != Integer.MAX_VALUE) {
            q.limit(limit);
        }
        return translate("find", () -> mongoTemplate.find(q, JobDocument.class));
    }

    /**
     * Disable (cancel) jobs by a flexible {@link JobQuery}.
     *
     * <p>Disable means: keep documents and their schedule but flag them so they are never claimed,
     * and release any lock.
     *
     * @param limit max number of jobs to affect; use {@code Integer.MAX_VALUE} for no limit
     * @return modified count
     */
    public long disableByQuery(JobQuery query, int limit) {
        List<String> ids = selectIdsForQuery(query, limit);
        if (ids.isEmpty()) {
            return 0;
        }

        Query q = new Query(Criteria.where("_id").in(ids));
        Update u = new Update()
                .set("disabled", true)
                .unset("lockedAt")
                .unset("lockedBy");

        return translate("disable", () -> mongoTemplate.updateMulti(q, u, JobDocument.class).getModifiedCount());
    }

    /**
     * Hard delete jobs by a flexible {@link JobQuery}.
     *
     * @param limit max number of jobs to delete; use {@code Integer.MAX_VALUE} for no limit
     * @return deleted count
     */
    public long deleteByQuery(JobQuery query, int limit) {
        List<String> ids = selectIdsForQuery(query, limit);
        if (ids.isEmpty()) {
            return 0;
        }

        Query q = new Query(Criteria.where("_id").in(ids));
        return translate("delete", () -> mongoTemplate.remove(q, JobDocument.class).getDeletedCount());
    }

    private List<String> selectIdsForQuery(JobQuery query, int limit) {
        Objects.requireNonNull(query, "query must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }

        Query q = new Query(buildCriteria(query));
        q.with(Sort.by(Sort.Order.asc("nextRunAt"), Sort.Order.desc("priority")));
        if (limit != Integer.MAX_VALUE) {
            q.limit(limit);
        }
        q.fields().include("_id");

        List<JobDocument> docs = translate("select", () -> mongoTemplate.find(q, JobDocument.class));
        List<String> ids = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            if (d != null && d.getId() != null) {
                ids.add(d.getId());
            }
        }
        return ids;
    }

    private static Criteria buildCriteria(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        List<Criteria> parts = new ArrayList<>(8);

        if (!isBlank(query.id())) {
            parts.add(Criteria.where("_id").is(query.id()));
        }
        if (!isBlank(query.name())) {
            parts.add(Criteria.where("name").is(query.name()));
        }

        Map<String, Object> fields = query.fields();
        if (fields != null) {
            for (var e : fields.entrySet()) {
                if (isBlank(e.getKey()) || e.getValue() == null) {
                    continue;
                }
                parts.add(Criteria.where(e.getKey()).is(e.getValue()));
            }
        }

        if (parts.isEmpty()) {
            throw new IllegalArgumentException("JobQuery must include at least one selector");
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Criteria().andOperator(parts.toArray(new Criteria[0]));
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
