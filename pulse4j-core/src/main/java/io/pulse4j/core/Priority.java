package io.pulse4j.core;

import io.pulse4j.core.exception.InvalidPriorityException;

import java.util.Locale;

public enum Priority {

    HIGHEST(20),
    HIGH(10),
    NORMAL(0),
    LOW(-10),
    LOWEST(-20);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Normalizes a raw priority value. Accepted range is [{@link #LOWEST}, {@link #HIGHEST}].
     */
    public static int normalize(int priority) {
        if (priority < LOWEST.value || priority > HIGHEST.value) {
            throw new InvalidPriorityException("Priority out of range [" + LOWEST.value + ", "
                    + HIGHEST.value + "]: " + priority);
        }
        return priority;
    }

    /**
     * Normalizes a named level ("high", "LOWEST") or a numeric string ("-10").
     */
    public static int parse(String priority) {
        if (priority == null || priority.isBlank()) {
            throw new InvalidPriorityException("Priority must not be blank");
        }
        String s = priority.trim();
        if (s.matches("^[+-]?\\d+$")) {
            try {
                return normalize(Integer.parseInt(s));
            } catch (NumberFormatException ex) {
                throw new InvalidPriorityException("Priority out of range: " + priority);
            }
        }
        try {
            return Priority.valueOf(s.toUpperCase(Locale.ROOT)).value;
        } catch (IllegalArgumentException ex) {
            throw new InvalidPriorityException("Unknown priority: " + priority);
        }
    }
}
