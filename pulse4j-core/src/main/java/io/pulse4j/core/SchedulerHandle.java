package io.pulse4j.core;

import java.time.Clock;
import java.time.Duration;

/**
 * What a {@link io.pulse4j.Job} needs from the scheduler that created or loaded it.
 * A job only borrows this reference; it never owns or stops the scheduler.
 */
public interface SchedulerHandle {

    JobStore store();

    JobHandlerRegistry handlers();

    JobEventPublisher events();

    /**
     * Maximum lifetime of an execution claim before it counts as abandoned.
     */
    Duration lockLifetime();

    /**
     * Upper bound of exponential retry delays.
     */
    Duration maxBackoffDelay();

    Clock clock();
}
