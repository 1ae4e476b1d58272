package com.quackhouse.runtime;

import org.duckdb.DuckDBConnection;

import java.util.Objects;

/**
 * Loan of a pooled engine connection; closing it returns the connection.
 *
 * <pre>
 *   try (PooledConnection pooled = manager.borrowConnection()) {
 *       Statement stmt = pooled.get().createStatement();
 *       ...
 *   }
 * </pre>
 *
 * @see DuckDBConnectionManager
 */
public class PooledConnection implements AutoCloseable {

    private final DuckDBConnection connection;
    private final DuckDBConnectionManager manager;
    private boolean released = false;

    PooledConnection(DuckDBConnection connection, DuckDBConnectionManager manager) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
    }

    /**
     * @return the underlying connection, valid until this loan is closed
     * @throws IllegalStateException if the connection was already returned
     */
    public DuckDBConnection get() {
        if (released) {
            throw new IllegalStateException("Connection already released to pool");
        }
        return connection;
    }

    public boolean isReleased() {
        return released;
    }

    /** Returns the connection to the pool. Idempotent. */
    @Override
    public void close() {
        if (!released) {
            released = true;
            manager.releaseConnection(connection);
        }
    }
}
