package com.quackhouse.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quackhouse.exception.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Table registry backed by a relational store.
 *
 * <p>Entries live in a {@code data_tables} table. The DDL and statements stick
 * to syntax shared by PostgreSQL and DuckDB, so the same class serves the
 * production store and file-backed test databases.
 *
 * <p>The declared schema is stored as a JSON document. Closing the registry
 * closes the data source when it is closeable (a connection pool).
 */
public class JdbcTableRegistry implements TableRegistry, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTableRegistry.class);

    private static final TypeReference<List<SchemaField>> SCHEMA_TYPE = new TypeReference<>() {};

    private static final String COLUMNS =
        "id, name, \"database\", format, location, owner_id, is_public, schema_definition, created_at, updated_at";

    private static final String INSERT_SQL =
        "INSERT INTO data_tables (name, \"database\", format, location, owner_id, is_public, "
            + "schema_definition, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING id";

    private final DataSource dataSource;
    private final String defaultBucket;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcTableRegistry(DataSource dataSource, String defaultBucket) {
        this(dataSource, defaultBucket, new ObjectMapper(), Clock.systemUTC());
    }

    public JdbcTableRegistry(DataSource dataSource, String defaultBucket, ObjectMapper mapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.defaultBucket = Objects.requireNonNull(defaultBucket, "defaultBucket must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates the registry table and its id sequence if they do not exist.
     *
     * @throws RegistryException if the DDL fails
     */
    public void initializeSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE SEQUENCE IF NOT EXISTS data_tables_id_seq");
            stmt.execute(
                "CREATE TABLE IF NOT EXISTS data_tables ("
                    + "id BIGINT PRIMARY KEY DEFAULT nextval('data_tables_id_seq'), "
                    + "name VARCHAR(255) NOT NULL, "
                    + "\"database\" VARCHAR(255) NOT NULL DEFAULT 'default', "
                    + "format VARCHAR(32) NOT NULL DEFAULT 'delta', "
                    + "location TEXT NOT NULL, "
                    + "owner_id BIGINT, "
                    + "is_public BOOLEAN NOT NULL DEFAULT FALSE, "
                    + "schema_definition TEXT, "
                    + "created_at TIMESTAMP NOT NULL, "
                    + "updated_at TIMESTAMP NOT NULL, "
                    + "UNIQUE (name, \"database\"))");
            logger.info("Table registry schema ready");
        } catch (SQLException e) {
            throw new RegistryException("Failed to initialize table registry schema", e);
        }
    }

    @Override
    public TableEntry create(NewTable table, Long ownerId) {
        Objects.requireNonNull(table, "table must not be null");

        // Stores keep microsecond precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        String location = table.locationOrDefault(defaultBucket);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, table.name());
            ps.setString(2, table.database());
            ps.setString(3, table.format().wireName());
            ps.setString(4, location);
            if (ownerId != null) {
                ps.setLong(5, ownerId);
            } else {
                ps.setNull(5, Types.BIGINT);
            }
            ps.setBoolean(6, table.visibility() == Visibility.PUBLIC);
            if (table.schema().isEmpty()) {
                ps.setNull(7, Types.VARCHAR);
            } else {
                ps.setString(7, writeSchema(table.schema()));
            }
            ps.setTimestamp(8, Timestamp.from(now));
            ps.setTimestamp(9, Timestamp.from(now));

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new RegistryException("Insert returned no id for " + table.name(), null);
                }
                long id = rs.getLong(1);
                logger.info("Registered table {}.{} with id {}", table.database(), table.name(), id);
                return new TableEntry(id, table.name(), table.database(), table.format(), location,
                    ownerId, table.visibility(), table.schema(), now, now);
            }
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw RegistryException.conflict(table.name(), table.database());
            }
            throw new RegistryException("Failed to register table " + table.name(), e);
        }
    }

    @Override
    public Optional<TableEntry> findById(long id) {
        String sql = "SELECT " + COLUMNS + " FROM data_tables WHERE id = ?";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readEntry(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RegistryException("Failed to read table " + id, e);
        }
    }

    @Override
    public List<TableEntry> list(String database) {
        if (database == null) {
            return query("SELECT " + COLUMNS + " FROM data_tables ORDER BY created_at DESC, id DESC", null);
        }
        return query("SELECT " + COLUMNS + " FROM data_tables WHERE \"database\" = ? ORDER BY name", database);
    }

    @Override
    public List<TableEntry> snapshot() {
        return query("SELECT " + COLUMNS + " FROM data_tables ORDER BY id", null);
    }

    @Override
    public boolean delete(long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM data_tables WHERE id = ?")) {
            ps.setLong(1, id);
            int removed = ps.executeUpdate();
            if (removed > 0) {
                logger.info("Removed table {} from registry", id);
            }
            return removed > 0;
        } catch (SQLException e) {
            throw new RegistryException("Failed to delete table " + id, e);
        }
    }

    private List<TableEntry> query(String sql, String parameter) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            if (parameter != null) {
                ps.setString(1, parameter);
            }
            try (ResultSet rs = ps.executeQuery()) {
                List<TableEntry> entries = new ArrayList<>();
                while (rs.next()) {
                    entries.add(readEntry(rs));
                }
                return entries;
            }
        } catch (SQLException e) {
            throw new RegistryException("Failed to list tables", e);
        }
    }

    private TableEntry readEntry(ResultSet rs) throws SQLException {
        long ownerRaw = rs.getLong("owner_id");
        Long ownerId = rs.wasNull() ? null : ownerRaw;
        String name = rs.getString("name");

        return new TableEntry(
            rs.getLong("id"),
            name,
            rs.getString("database"),
            readFormat(name, rs.getString("format")),
            rs.getString("location"),
            ownerId,
            rs.getBoolean("is_public") ? Visibility.PUBLIC : Visibility.PRIVATE,
            readSchema(rs.getString("schema_definition")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")));
    }

    private String writeSchema(List<SchemaField> schema) {
        try {
            return mapper.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new RegistryException("Failed to serialize schema definition", e);
        }
    }

    private static TableFormat readFormat(String tableName, String stored) {
        try {
            return TableFormat.parse(stored);
        } catch (IllegalArgumentException e) {
            // Rows written by other services may carry formats we cannot scan
            logger.warn("Table '{}' has unsupported format '{}'", tableName, stored);
            return TableFormat.UNKNOWN;
        }
    }

    private List<SchemaField> readSchema(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, SCHEMA_TYPE);
        } catch (JsonProcessingException e) {
            // A malformed legacy document must not hide the entry itself
            logger.warn("Ignoring unreadable schema definition: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    private static boolean isUniqueViolation(SQLException e) {
        if ("23505".equals(e.getSQLState())) {
            return true;
        }
        String message = e.getMessage();
        return message != null
            && (message.contains("Duplicate key") || message.contains("violates unique constraint"));
    }

    @Override
    public void close() throws Exception {
        if (dataSource instanceof AutoCloseable closeable) {
            closeable.close();
        }
    }
}
