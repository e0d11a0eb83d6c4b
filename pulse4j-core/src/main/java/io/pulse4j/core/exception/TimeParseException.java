package io.pulse4j.core.exception;

/**
 * A malformed interval, cron expression, time of day, schedule expression or time zone.
 */
public class TimeParseException extends PulseException {

    public TimeParseException(String message) {
        super(message);
    }

    public TimeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
