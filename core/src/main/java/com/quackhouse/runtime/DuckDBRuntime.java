package com.quackhouse.runtime;

import com.quackhouse.generator.SQLQuoting;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * DuckDB runtime - owns the primary connection of the engine database.
 *
 * <p>The primary connection opens the database and carries its global settings
 * (memory limit, threads, object store secret). Worker connections are
 * {@linkplain DuckDBConnection#duplicate() duplicates} of it and therefore see
 * the same catalog: views bound through one are visible to all.
 *
 * <p>Typical usage:
 * <pre>{@code
 * try (DuckDBRuntime runtime = DuckDBRuntime.create(config, HardwareProfile.detect())) {
 *     DuckDBConnection worker = runtime.duplicate();
 *     // ... execute queries ...
 * }
 * }</pre>
 *
 * <p>An in-memory engine uses the anonymous {@code jdbc:duckdb:} URL, so every
 * runtime gets a private database.
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    /** JDBC URL of a private in-memory database */
    public static final String IN_MEMORY_JDBC_URL = "jdbc:duckdb:";

    /** Name of the secret holding object store credentials */
    static final String OBJECT_STORE_SECRET = "quackhouse_object_store";

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private final String memoryLimit;
    private final int threads;
    private volatile boolean closed = false;

    private DuckDBRuntime(String jdbcUrl, EngineConfig config, HardwareProfile hardware) throws SQLException {
        this.jdbcUrl = jdbcUrl;
        this.memoryLimit = config.memoryLimit() != null ? config.memoryLimit() : hardware.recommendedMemoryLimit();
        this.threads = config.threads() > 0 ? config.threads() : hardware.recommendedThreadCount();

        logger.info("Creating DuckDB runtime with URL: {}", jdbcUrl);

        Connection rawConn = DriverManager.getConnection(jdbcUrl);
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        try {
            configureConnection();
            if (config.objectStore() != null) {
                configureObjectStore(config.objectStore());
            }
        } catch (SQLException e) {
            closeQuietly();
            throw e;
        }

        logger.info("DuckDB runtime initialized: memory={}, threads={}, {}", memoryLimit, threads, hardware);
    }

    /**
     * Creates a runtime for the database named by the configuration.
     *
     * @param config the engine configuration
     * @param hardware the host profile used when the configuration leaves sizing open
     * @return the runtime
     * @throws SQLException if the database cannot be opened or configured
     */
    public static DuckDBRuntime create(EngineConfig config, HardwareProfile hardware) throws SQLException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(hardware, "hardware must not be null");
        String url = config.duckDbPath() != null ? "jdbc:duckdb:" + config.duckDbPath() : IN_MEMORY_JDBC_URL;
        return new DuckDBRuntime(url, config, hardware);
    }

    private void configureConnection() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(String.format("SET memory_limit='%s'", memoryLimit));
            stmt.execute(String.format("SET threads=%d", threads));

            // Non-interactive service
            stmt.execute("SET enable_progress_bar=false");

            // Row order of scans must be stable for result truncation
            stmt.execute("SET preserve_insertion_order=true");
        }
    }

    /**
     * Loads httpfs and registers an S3 secret for the configured endpoint.
     */
    private void configureObjectStore(EngineConfig.ObjectStore store) throws SQLException {
        StringBuilder secret = new StringBuilder()
            .append("CREATE OR REPLACE SECRET ").append(OBJECT_STORE_SECRET).append(" (TYPE S3")
            .append(", ENDPOINT ").append(SQLQuoting.quoteLiteral(store.endpoint()))
            .append(", REGION ").append(SQLQuoting.quoteLiteral(store.region()))
            .append(", URL_STYLE 'path'")
            .append(", USE_SSL ").append(store.useSsl());
        if (store.accessKey() != null) {
            secret.append(", KEY_ID ").append(SQLQuoting.quoteLiteral(store.accessKey()));
        }
        if (store.secretKey() != null) {
            secret.append(", SECRET ").append(SQLQuoting.quoteLiteral(store.secretKey()));
        }
        secret.append(")");

        try (Statement stmt = connection.createStatement()) {
            stmt.execute("INSTALL httpfs");
            stmt.execute("LOAD httpfs");
            stmt.execute(secret.toString());
        }
        logger.info("Object store configured: {}", store);
    }

    /**
     * Returns the primary connection. Callers must not close it.
     *
     * @throws IllegalStateException if the runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    /**
     * Opens a new connection to the same database.
     *
     * @return a connection the caller owns and must close
     * @throws SQLException if the runtime is closed or the connection cannot be opened
     */
    public DuckDBConnection duplicate() throws SQLException {
        if (closed) {
            throw new SQLException("DuckDB runtime is closed");
        }
        return (DuckDBConnection) connection.duplicate();
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getMemoryLimit() {
        return memoryLimit;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes the primary connection. The database is released once every
     * duplicate has been closed as well.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeQuietly();
        logger.info("DuckDB runtime closed: {}", jdbcUrl);
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException e) {
            logger.warn("Error closing DuckDB connection: {}", e.getMessage());
        }
    }
}
