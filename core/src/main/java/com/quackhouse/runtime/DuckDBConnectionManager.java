package com.quackhouse.runtime;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size pool of worker connections to one engine database.
 *
 * <p>Every pooled connection is a duplicate of the runtime's primary
 * connection, so queries running concurrently on different pooled
 * connections share one catalog. Broken connections are replaced on release.
 *
 * <p>Example usage:
 * <pre>
 *   DuckDBConnectionManager manager = new DuckDBConnectionManager(runtime, 4);
 *   try (PooledConnection pooled = manager.borrowConnection()) {
 *       // Execute queries...
 *   }
 *   manager.close();
 * </pre>
 *
 * @see DuckDBRuntime
 * @see PooledConnection
 */
public class DuckDBConnectionManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBConnectionManager.class);

    private static final long ACQUIRE_TIMEOUT_SECONDS = 30;

    private final DuckDBRuntime runtime;
    private final BlockingQueue<DuckDBConnection> connectionPool;
    private final int poolSize;
    private volatile boolean closed = false;

    /**
     * Creates the pool and opens all of its connections.
     *
     * @param runtime the runtime whose database the pool serves
     * @param poolSize number of connections, at least 1
     * @throws SQLException if a connection cannot be opened
     */
    public DuckDBConnectionManager(DuckDBRuntime runtime, int poolSize) throws SQLException {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
        }
        this.poolSize = poolSize;
        this.connectionPool = new ArrayBlockingQueue<>(poolSize);

        try {
            for (int i = 0; i < poolSize; i++) {
                connectionPool.offer(runtime.duplicate());
            }
        } catch (SQLException e) {
            close();
            throw e;
        }
        logger.debug("Connection pool ready with {} connections", poolSize);
    }

    /**
     * Borrows a connection, waiting up to 30 seconds for one to become free.
     *
     * @return a loan to be closed by the caller
     * @throws SQLException if the pool is closed or exhausted
     */
    public PooledConnection borrowConnection() throws SQLException {
        if (closed) {
            throw new SQLException("Connection manager is closed");
        }

        try {
            DuckDBConnection conn = connectionPool.poll(ACQUIRE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (conn == null) {
                throw new SQLException(
                    "Connection pool exhausted - timeout after " + ACQUIRE_TIMEOUT_SECONDS + " seconds");
            }
            if (conn.isClosed()) {
                conn = runtime.duplicate();
            }
            return new PooledConnection(conn, this);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    /**
     * Returns a connection to the pool, replacing it when it is no longer usable.
     */
    void releaseConnection(DuckDBConnection conn) {
        if (conn == null) {
            return;
        }
        if (closed) {
            closeConnection(conn);
            return;
        }

        DuckDBConnection pooled = conn;
        if (!isConnectionValid(conn)) {
            logger.warn("Invalid connection detected, replacing it");
            closeConnection(conn);
            try {
                pooled = runtime.duplicate();
            } catch (SQLException e) {
                logger.warn("Failed to create replacement connection: {}", e.getMessage());
                return;
            }
        }

        if (!connectionPool.offer(pooled)) {
            logger.warn("Connection pool full, closing extra connection");
            closeConnection(pooled);
        }
    }

    private boolean isConnectionValid(DuckDBConnection conn) {
        try {
            return !conn.isClosed() && conn.isValid(5);
        } catch (SQLException e) {
            return false;
        }
    }

    private void closeConnection(DuckDBConnection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.warn("Failed to close connection: {}", e.getMessage());
        }
    }

    public int getPoolSize() {
        return poolSize;
    }

    /** Number of connections currently idle in the pool. */
    public int available() {
        return connectionPool.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the idle connections. Connections on loan are closed when returned.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        DuckDBConnection conn;
        while ((conn = connectionPool.poll()) != null) {
            closeConnection(conn);
        }
    }
}
