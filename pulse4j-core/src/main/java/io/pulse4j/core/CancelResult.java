package io.pulse4j.core;

/**
 * Outcome of {@code Pulse.cancel}.
 *
 * @param matched  jobs selected by the query (bounded by the cancel limit)
 * @param modified jobs switched to disabled
 * @param deleted  jobs removed
 */
public record CancelResult(
        long matched,
        long modified,
        long deleted
) {

    public static CancelResult disabled(long count) {
        return new CancelResult(count, count, 0);
    }

    public static CancelResult deleted(long count) {
        return new CancelResult(count, 0, count);
    }
}
