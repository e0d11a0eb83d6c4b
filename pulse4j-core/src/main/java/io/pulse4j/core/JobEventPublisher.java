package io.pulse4j.core;

/**
 * Event sink notified on job state transitions. Publishing is best-effort: implementations
 * must not throw back into the job.
 */
public interface JobEventPublisher {

    void publish(JobEvent event);

    static JobEventPublisher noop() {
        return event -> {
        };
    }
}
