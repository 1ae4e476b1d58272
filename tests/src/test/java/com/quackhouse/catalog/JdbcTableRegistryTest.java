package com.quackhouse.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quackhouse.exception.RegistryException;
import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the registry against an in-memory DuckDB database, which accepts the
 * same DDL and statements as PostgreSQL.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("JDBC Table Registry")
public class JdbcTableRegistryTest extends TestBase {

    private Connection connection;
    private JdbcTableRegistry registry;

    @BeforeEach
    void setup() throws SQLException {
        connection = DriverManager.getConnection("jdbc:duckdb:");
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(connection, true);
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00.123456789Z"), ZoneOffset.UTC);
        registry = new JdbcTableRegistry(dataSource, "lake", new ObjectMapper(), clock);
        registry.initializeSchema();
    }

    @AfterEach
    void teardown() throws SQLException {
        connection.close();
    }

    @Test
    @DisplayName("Created entry reads back identically")
    void createAndRead() {
        NewTable table = new NewTable("events", "web", TableFormat.PARQUET, null, Visibility.PUBLIC,
            List.of(new SchemaField("id", "BIGINT", false), new SchemaField("url", "VARCHAR", true)));

        TableEntry created = registry.create(table, 7L);

        assertThat(created.location()).isEqualTo("s3a://lake/tables/web/events");
        assertThat(created.createdAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00.123456Z"));
        assertThat(registry.findById(created.id())).contains(created);
    }

    @Test
    @DisplayName("Schema initialization is repeatable")
    void initializeTwice() {
        registry.create(NewTable.of("events", null), 1L);

        registry.initializeSchema();

        assertThat(registry.snapshot()).hasSize(1);
    }

    @Test
    @DisplayName("Duplicate name in the same database is a conflict")
    void conflict() {
        registry.create(NewTable.of("events", "web"), 1L);

        assertThatThrownBy(() -> registry.create(NewTable.of("events", "web"), 2L))
            .isInstanceOfSatisfying(RegistryException.class, e -> assertThat(e.isConflict()).isTrue());
        assertThat(registry.create(NewTable.of("events", "mobile"), 2L).id()).isPositive();
    }

    @Test
    @DisplayName("Entries without owner or schema round-trip as null and empty")
    void nullableColumns() {
        TableEntry created = registry.create(NewTable.of("legacy", null), null);

        TableEntry read = registry.findById(created.id()).orElseThrow();

        assertThat(read.ownerId()).isNull();
        assertThat(read.schema()).isEmpty();
    }

    @Test
    @DisplayName("Listing filters by database and snapshot is ordered by id")
    void listing() {
        registry.create(NewTable.of("zeta", "a"), 1L);
        registry.create(NewTable.of("alpha", "a"), 1L);
        registry.create(NewTable.of("other", "b"), 1L);

        assertThat(registry.list("a")).extracting(TableEntry::name).containsExactly("alpha", "zeta");
        assertThat(registry.list(null)).hasSize(3);
        assertThat(registry.snapshot()).extracting(TableEntry::name).containsExactly("zeta", "alpha", "other");
    }

    @Test
    @DisplayName("Delete reports whether a row was removed")
    void delete() {
        TableEntry entry = registry.create(NewTable.of("events", null), 1L);

        assertThat(registry.delete(entry.id())).isTrue();
        assertThat(registry.delete(entry.id())).isFalse();
        assertThat(registry.findById(entry.id())).isEmpty();
    }

    @Test
    @DisplayName("Unreadable stored schema does not hide the entry")
    void unreadableSchema() throws SQLException {
        TableEntry entry = registry.create(NewTable.of("events", null), 1L);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("UPDATE data_tables SET schema_definition = '{not json' WHERE id = " + entry.id());
        }

        assertThat(registry.findById(entry.id())).hasValueSatisfying(e -> assertThat(e.schema()).isEmpty());
    }

    @Test
    @DisplayName("Unknown stored format reads back as UNKNOWN")
    void unknownFormat() throws SQLException {
        TableEntry entry = registry.create(NewTable.of("events", null), 1L);
        registry.create(NewTable.of("orders", null), 1L);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("UPDATE data_tables SET format = 'iceberg' WHERE id = " + entry.id());
        }

        assertThat(registry.snapshot())
            .extracting(TableEntry::name, TableEntry::format)
            .containsExactly(tuple("events", TableFormat.UNKNOWN), tuple("orders", TableFormat.DELTA));
    }
}
