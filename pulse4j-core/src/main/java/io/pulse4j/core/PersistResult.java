package io.pulse4j.core;

/**
 * Outcome of {@link JobStore#save}.
 *
 * @param id      identifier of the stored document (the pre-existing one when matched)
 * @param created a new document was inserted
 * @param updated an existing document was modified
 */
public record PersistResult(
        String id,
        boolean created,
        boolean updated
) {
    public static PersistResult createdResult(String id) {
        return new PersistResult(id, true, false);
    }

    public static PersistResult updatedResult(String id) {
        return new PersistResult(id, false, true);
    }

    /**
     * Matched an existing document and left it untouched (insert-only unique jobs).
     */
    public static PersistResult noop(String id) {
        return new PersistResult(id, false, false);
    }
}
