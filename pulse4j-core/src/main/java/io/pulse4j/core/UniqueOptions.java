package io.pulse4j.core;

/**
 * @param insertOnly when true an existing job matching the unique query is left untouched
 */
public record UniqueOptions(boolean insertOnly) {
    public static UniqueOptions defaults() {
        return new UniqueOptions(false);
    }
}
