package com.quackhouse.exception;

/**
 * Raised when a single catalog entry cannot be bound into the engine namespace.
 *
 * <p>Never escapes a synchronization pass; the synchronizer records it in the
 * report and continues with the remaining entries.
 */
public class SyncEntryFailedException extends QuackhouseException {

    private final String tableName;

    public SyncEntryFailedException(String tableName, String message) {
        super(message);
        this.tableName = tableName;
    }

    public SyncEntryFailedException(String tableName, String message, Throwable cause) {
        super(message, cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
