package com.quackhouse.runtime;

import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A constructed query engine: the runtime, its connection pool, and the set of
 * views bound into its namespace by catalog synchronization.
 *
 * <p>Handles are created by an {@link EngineFactory} and owned by the
 * {@link EngineSession}; they are shared by all concurrent executions.
 */
public class EngineHandle implements AutoCloseable {

    private final DuckDBRuntime runtime;
    private final DuckDBConnectionManager connections;
    // lowercased view name -> name as bound
    private final Map<String, String> managedViews = new ConcurrentHashMap<>();

    public EngineHandle(DuckDBRuntime runtime, DuckDBConnectionManager connections) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
    }

    /**
     * Borrows a pooled connection to the engine database.
     *
     * @throws SQLException if the engine is closed or no connection becomes free
     */
    public PooledConnection borrowConnection() throws SQLException {
        return connections.borrowConnection();
    }

    public DuckDBRuntime runtime() {
        return runtime;
    }

    public DuckDBConnectionManager connections() {
        return connections;
    }

    /**
     * Views created by synchronization, keyed by lowercased name. DuckDB
     * resolves identifiers case-insensitively, so the key is the identity of
     * a view.
     */
    public Map<String, String> managedViews() {
        return managedViews;
    }

    public boolean isClosed() {
        return runtime.isClosed();
    }

    @Override
    public void close() {
        connections.close();
        runtime.close();
    }
}
