package com.quackhouse.exception;

/**
 * Thrown when the durable table registry cannot serve a read or write.
 */
public class RegistryException extends QuackhouseException {

    private final boolean conflict;

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
        this.conflict = false;
    }

    private RegistryException(String message, boolean conflict) {
        super(message);
        this.conflict = conflict;
    }

    /**
     * Creates an exception for a write that collides with an existing
     * {@code (name, database)} entry.
     */
    public static RegistryException conflict(String name, String database) {
        return new RegistryException(
            String.format("Table '%s' already exists in database '%s'", name, database), true);
    }

    /** True when the write failed because the entry already exists. */
    public boolean isConflict() {
        return conflict;
    }
}
