package io.pulse4j.core;

import io.pulse4j.JobHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handlers by job name. A job runs the handler registered under its own name.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler<?>> handlersByName;

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        Map<String, JobHandler<?>> byName = new LinkedHashMap<>();
        for (JobHandler<?> handler : handlers) {
            String name = handler.name();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("JobHandler name must not be blank: " + handler.getClass().getName());
            }
            if (byName.putIfAbsent(name.trim(), handler) != null) {
                throw new IllegalStateException("Duplicate JobHandler name: " + name);
            }
        }
        this.handlersByName = Map.copyOf(byName);
    }

    public Optional<JobHandler<?>> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(handlersByName.get(name));
    }

    /**
     * @throws IllegalStateException when nothing is registered under {@code name}; inside
     *                               {@code Job.run()} this is recorded as a job failure
     */
    public JobHandler<?> getRequired(String name) {
        return find(name).orElseThrow(() ->
                new IllegalStateException("No JobHandler registered for name: " + name));
    }

    public Set<String> names() {
        return handlersByName.keySet();
    }
}
