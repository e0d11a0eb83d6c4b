package io.pulse4j.core.exception;

public class InvalidPriorityException extends PulseException {

    public InvalidPriorityException(String message) {
        super(message);
    }
}
