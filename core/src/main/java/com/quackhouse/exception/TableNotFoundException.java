package com.quackhouse.exception;

/**
 * Thrown when a catalog entry does not exist, or exists but must not be
 * revealed to the caller.
 */
public class TableNotFoundException extends QuackhouseException {

    public TableNotFoundException(String message) {
        super(message);
    }

    public static TableNotFoundException forId(long id) {
        return new TableNotFoundException("Table not found: " + id);
    }
}
