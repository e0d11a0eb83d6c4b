package io.pulse4j.core;

public enum CancelMode {
    /**
     * Keep the documents but mark them disabled and release their locks.
     */
    DISABLE,
    DELETE
}
