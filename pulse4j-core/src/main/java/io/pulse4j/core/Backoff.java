package io.pulse4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry delay policy applied after a failed run.
 *
 * @param type  fixed or exponential growth
 * @param delay base delay in milliseconds
 */
public record Backoff(BackoffType type, long delay) {

    private static final int MAX_EXPONENT = 30;

    public Backoff {
        Objects.requireNonNull(type, "type must not be null");
        if (delay <= 0) {
            throw new IllegalArgumentException("backoff delay must be a positive number of milliseconds");
        }
    }

    public static Backoff fixed(Duration delay) {
        return new Backoff(BackoffType.FIXED, delay.toMillis());
    }

    public static Backoff exponential(Duration delay) {
        return new Backoff(BackoffType.EXPONENTIAL, delay.toMillis());
    }

    /**
     * Delay before the next attempt.
     *
     * @param failCount failures so far, including the one just recorded (starts at 1)
     * @param cap       upper bound of the delay; null means uncapped
     */
    public Duration retryDelay(int failCount, Duration cap) {
        long ms;
        if (type == BackoffType.FIXED) {
            ms = delay;
        } else {
            int exp = Math.min(Math.max(0, failCount - 1), MAX_EXPONENT);
            long factor = 1L << exp;
            ms = delay > Long.MAX_VALUE / factor ? Long.MAX_VALUE : delay * factor;
        }
        if (cap != null && ms > cap.toMillis()) {
            ms = cap.toMillis();
        }
        return Duration.ofMillis(ms);
    }
}
