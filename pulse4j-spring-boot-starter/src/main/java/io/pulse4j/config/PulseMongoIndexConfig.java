package io.pulse4j.config;

import io.pulse4j.internal.mongo.JobDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

import java.util.Collection;
import java.util.Objects;

/**
 * MongoDB index definitions for the Pulse collection.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code pulse.ensure-indexes-on-startup=true};
 * in production they usually come from migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code pulse_jobs})</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { nextRunAt: 1, priority: -1, lockedAt: 1, disabled: 1 }
 *       <br/>Used by claiming due jobs ordered by time, then priority.</li>
 *   <li><b>idx_name</b>: { name: 1 }
 *       <br/>Used by lookup and cancel by name.</li>
 *   <li><b>ux_single_name</b> (unique + partial): { name: 1 } with partialFilterExpression { type: "SINGLE" }
 *       <br/>At most one SINGLE job per name.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.pulse_jobs.createIndex({ nextRunAt: 1, priority: -1, lockedAt: 1, disabled: 1 }, { name: "idx_due_claim" });
 * db.pulse_jobs.createIndex({ name: 1 }, { name: "idx_name" });
 * db.pulse_jobs.createIndex(
 *   { name: 1 },
 *   { name: "ux_single_name", unique: true, partialFilterExpression: { type: "SINGLE" } }
 * );
 * </pre>
 *
 * <p>Indexes behind {@code unique(...)} queries are created by the store on first use, one per
 * job name and path set. {@link #uniqueIndex(String, Collection, Document)} builds them for
 * migrations that create them up front.
 */
public class PulseMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_NAME = "idx_name";
    public static final String UX_SINGLE_NAME = "ux_single_name";

    private final MongoTemplate mongoTemplate;

    public PulseMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(JobDocument.class);
        ops.ensureIndex(dueClaimIndex());
        ops.ensureIndex(nameIndex());
        ops.ensureIndex(singleNameUniqueIndex());
    }

    public static Index dueClaimIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .on("lockedAt", Sort.Direction.ASC)
                .on("disabled", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    public static Index nameIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .named(IDX_NAME);
    }

    public static Index singleNameUniqueIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("type", "SINGLE")))
                .named(UX_SINGLE_NAME);
    }

    /**
     * Build a unique index for jobs saved with {@code unique(query)}: the job name plus the
     * query paths, in the same form the query uses.
     *
     * <pre>
     *   uniqueIndex("ux_welcome_user", List.of("data.userId"), null)
     *   // { name: 1, "data.userId": 1 }
     * </pre>
     *
     * <p>Index keys are fixed, so each combination of paths in use needs its own index. Pass a
     * partial filter such as {@code { name: "welcome-mail" }} to scope it to one job name.
     *
     * @param indexName     index name
     * @param paths         document paths used by the unique query (e.g. "data.userId")
     * @param partialFilter optional partial filter (pass null for none)
     */
    public static Index uniqueIndex(String indexName, Collection<String> paths, Document partialFilter) {
        Objects.requireNonNull(indexName, "indexName must not be null");
        Objects.requireNonNull(paths, "paths must not be null");
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("paths must not be empty");
        }

        Index idx = new Index().on("name", Sort.Direction.ASC);
        for (String path : paths) {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("paths must not contain blank values");
            }
            if (!"name".equals(path)) {
                idx = idx.on(path, Sort.Direction.ASC);
            }
        }

        idx = idx.unique().named(indexName);
        if (partialFilter != null) {
            idx = idx.partial(PartialIndexFilter.of(partialFilter));
        }
        return idx;
    }
}
