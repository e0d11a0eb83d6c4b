package io.pulse4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * JobQuery describes how to match persisted jobs (for listing or canceling).
 *
 * <p>This is an API-layer object (NOT a MongoDB query). The store layer translates it
 * into an actual database query.
 */
public final class JobQuery {

    private final String id;
    private final String name;
    private final Map<String, Object> fields;

    private JobQuery(String id, String name, Map<String, Object> fields) {
        this.id = (id == null || id.isBlank()) ? null : id;
        this.name = (name == null || name.isBlank()) ? null : name;
        this.fields = (fields == null || fields.isEmpty())
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String id() {
        return id;
    }

    /**
     * Job handler name (e.g. "send-digest").
     */
    public String name() {
        return name;
    }

    /**
     * Document field paths and the values they must equal, in the same shape as a
     * job's unique query (e.g. {@code data.userId -> 42}).
     */
    public Map<String, Object> fields() {
        return fields;
    }

    /**
     * Returns true if this query has no selector.
     */
    public boolean isEmpty() {
        return id == null
                && name == null
                && (fields == null || fields.isEmpty());
    }

    public static JobQuery byName(String name) {
        return builder().name(name).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder fields(Map<String, Object> fields) {
            this.fields.clear();
            if (fields != null) {
                this.fields.putAll(fields);
            }
            return this;
        }

        /**
         * Add a single field condition (e.g. path="data.userId", value=42).
         */
        public Builder where(String path, Object value) {
            Objects.requireNonNull(path, "path must not be null");
            if (path.isBlank()) {
                throw new IllegalArgumentException("path must not be blank");
            }
            if (value == null) {
                return this;
            }
            this.fields.put(path, value);
            return this;
        }

        public JobQuery build() {
            boolean hasId = id != null && !id.isBlank();
            boolean hasName = name != null && !name.isBlank();

            if (!hasId && !hasName && fields.isEmpty()) {
                throw new IllegalStateException(
                        "JobQuery must contain at least one condition: id, name, or a field"
                );
            }
            return new JobQuery(id, name, fields);
        }
    }
}
