package io.pulse4j.core;

@FunctionalInterface
public interface JobEventListener {
    void onEvent(JobEvent event);
}
