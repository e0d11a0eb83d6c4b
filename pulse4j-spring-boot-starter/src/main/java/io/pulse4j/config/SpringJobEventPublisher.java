package io.pulse4j.config;

import io.pulse4j.core.JobEvent;
import io.pulse4j.core.JobEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Publishes job events as Spring application events, so they can be consumed with
 * {@code @EventListener void on(JobEvent event)}.
 */
public class SpringJobEventPublisher implements JobEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(SpringJobEventPublisher.class);

    private final ApplicationEventPublisher delegate;

    public SpringJobEventPublisher(ApplicationEventPublisher delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void publish(JobEvent event) {
        try {
            delegate.publishEvent(event);
        } catch (RuntimeException e) {
            log.warn("Pulse event listener failed type={} job={} msg={}", event.type(), event.jobName(), e.getMessage(), e);
        }
    }
}
