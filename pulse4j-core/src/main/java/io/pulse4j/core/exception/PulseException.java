package io.pulse4j.core.exception;

/**
 * Base type of all scheduler-specific failures.
 */
public class PulseException extends RuntimeException {

    public PulseException(String message) {
        super(message);
    }

    public PulseException(String message, Throwable cause) {
        super(message, cause);
    }
}
