package io.pulse4j.core;

import java.time.Instant;

/**
 * Read-only projection of a job's counters and timestamps.
 */
public record JobStatus(
        String id,
        String name,
        boolean disabled,
        boolean running,
        Integer progress,
        Instant nextRunAt,
        Instant lockedAt,
        Instant lastRunAt,
        Instant lastFinishedAt,
        int runCount,
        int finishedCount,
        int failCount,
        String failReason,
        Instant failedAt
) {
    public boolean retired() {
        return nextRunAt == null;
    }
}
