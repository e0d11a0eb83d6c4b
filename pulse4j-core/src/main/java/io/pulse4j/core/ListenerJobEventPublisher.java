package io.pulse4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process publisher that fans events out to registered listeners.
 */
public class ListenerJobEventPublisher implements JobEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(ListenerJobEventPublisher.class);

    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(JobEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(JobEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void publish(JobEvent event) {
        for (JobEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("pulse event listener failed type={} name={} msg={}",
                        event.type(), event.jobName(), e.getMessage(), e);
            }
        }
    }
}
