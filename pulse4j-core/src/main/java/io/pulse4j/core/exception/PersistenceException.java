package io.pulse4j.core.exception;

/**
 * Failure of the storage boundary during save, remove, touch or lookup.
 */
public class PersistenceException extends PulseException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
