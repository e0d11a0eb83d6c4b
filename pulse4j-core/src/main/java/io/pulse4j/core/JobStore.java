package io.pulse4j.core;

import io.pulse4j.Job;

import java.time.Instant;
import java.util.Optional;

/**
 * Persistence boundary used by {@link Job}. Implementations translate storage failures
 * into {@link io.pulse4j.core.exception.PersistenceException}.
 */
public interface JobStore {

    /**
     * Persist a job.
     * <ul>
     *   <li>identifier set: upsert by identifier</li>
     *   <li>unique query set: atomic find-or-create keyed by name + query; an existing match is
     *       updated unless the job is insert-only</li>
     *   <li>type SINGLE: upsert by {name, type}</li>
     *   <li>otherwise: insert</li>
     * </ul>
     * At most one document satisfying a unique query may ever exist, also under concurrent callers.
     */
    PersistResult save(Job<?> job);

    /**
     * Write the run state of a persisted job: counters, run timestamps, lock, progress, failure,
     * result, {@code nextRunAt} and {@code lastModifiedBy}. The definition and {@code disabled}
     * stay as stored, so changes made while the job ran survive. A document that no longer
     * exists is not recreated.
     *
     * @return true if a document was updated
     */
    boolean recordRun(Job<?> job);

    /**
     * Delete by identifier.
     *
     * @return deleted count; 0 when the document is already absent
     */
    long remove(String id);

    Optional<JobStatus> findStatus(String id);

    /**
     * Refresh the lock timestamp of a locked job (last write wins).
     *
     * @param progress new progress value, or null to leave it unchanged
     * @return true if a locked document was updated
     */
    boolean touch(String id, Instant lockedAt, Integer progress);
}
