package io.pulse4j.core;

import io.pulse4j.Job;
import io.pulse4j.support.TestScheduler;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ListenerJobEventPublisherTest {

    @Test
    void failingListenerShouldNotStopOthers() {
        ListenerJobEventPublisher publisher = new ListenerJobEventPublisher();
        List<JobEventType> seen = new ArrayList<>();
        publisher.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        publisher.addListener(event -> seen.add(event.type()));

        Job<Void> job = new Job<>(new TestScheduler(Instant.now()), "report", null);
        publisher.publish(JobEvent.of(JobEventType.START, job));

        assertThat(seen).containsExactly(JobEventType.START);
    }
}
