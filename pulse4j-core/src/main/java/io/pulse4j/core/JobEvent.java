package io.pulse4j.core;

import io.pulse4j.Job;

/**
 * State transition of a job.
 *
 * @param error the handler failure for {@link JobEventType#FAIL} and {@link JobEventType#RETRY}, otherwise null
 */
public record JobEvent(JobEventType type, Job<?> job, Throwable error) {

    public static JobEvent of(JobEventType type, Job<?> job) {
        return new JobEvent(type, job, null);
    }

    public String jobName() {
        return job.getName();
    }
}
