package com.quackhouse.exec;

import com.quackhouse.auth.AuthorizationPolicy;
import com.quackhouse.auth.Principal;
import com.quackhouse.catalog.InMemoryTableRegistry;
import com.quackhouse.catalog.NewTable;
import com.quackhouse.catalog.SchemaField;
import com.quackhouse.catalog.TableFormat;
import com.quackhouse.catalog.Visibility;
import com.quackhouse.exception.TableNotFoundException;
import com.quackhouse.runtime.EngineSession;
import com.quackhouse.support.Fixtures;
import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import com.quackhouse.support.TestEngines;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("Engine Introspector")
public class EngineIntrospectorTest extends TestBase {

    @TempDir
    Path dir;

    private EngineSession session;
    private EngineIntrospector introspector;

    @BeforeEach
    void setup() throws SQLException {
        Fixtures.parquet(dir.resolve("orders.parquet"), "SELECT range AS id, 'sku' AS sku FROM range(3)");
        Fixtures.csv(dir.resolve("secret.csv"), "SELECT 1 AS amount");

        InMemoryTableRegistry registry = new InMemoryTableRegistry("lake");
        registry.create(new NewTable("orders", "shop", TableFormat.PARQUET,
            dir.resolve("orders.parquet").toString(), Visibility.PUBLIC, null), 1L);
        registry.create(new NewTable("secret", "shop", TableFormat.CSV,
            dir.resolve("secret.csv").toString(), Visibility.PRIVATE, null), 1L);

        session = TestEngines.session(TestEngines.config().build(), registry);
        introspector = new EngineIntrospector(session, new AuthorizationPolicy());
    }

    @AfterEach
    void teardown() {
        session.shutdown();
    }

    @Test
    @DisplayName("Lists the bound views, building the engine on demand")
    void listTables() {
        assertThat(introspector.listTables(Principal.admin(2)))
            .extracting(EngineTable::name, EngineTable::type)
            .containsExactly(tuple("orders", "VIEW"), tuple("secret", "VIEW"));
        assertThat(session.isInitialized()).isTrue();
    }

    @Test
    @DisplayName("Listing hides private tables of other users")
    void listTablesHidden() {
        assertThat(introspector.listTables(Principal.user(9)))
            .extracting(EngineTable::name)
            .containsExactly("orders");
        assertThat(introspector.listTables(Principal.anonymous()))
            .extracting(EngineTable::name)
            .containsExactly("orders");
        assertThat(introspector.listTables(Principal.user(1)))
            .extracting(EngineTable::name)
            .containsExactly("orders", "secret");
    }

    @Test
    @DisplayName("Describes the columns of a readable table")
    void describe() {
        assertThat(introspector.describe(Principal.user(9), "ORDERS"))
            .extracting(SchemaField::name, SchemaField::type)
            .containsExactly(tuple("id", "BIGINT"), tuple("sku", "VARCHAR"));
    }

    @Test
    @DisplayName("Private table of another user looks missing")
    void describeHidden() {
        assertThatThrownBy(() -> introspector.describe(Principal.user(9), "secret"))
            .isInstanceOf(TableNotFoundException.class)
            .hasMessage("Table not found: secret");

        assertThat(introspector.describe(Principal.user(1), "secret")).hasSize(1);
        assertThat(introspector.describe(Principal.admin(2), "secret")).hasSize(1);
    }

    @Test
    @DisplayName("Unknown table is not found, even for admins")
    void describeMissing() {
        assertThatThrownBy(() -> introspector.describe(Principal.admin(2), "ghost"))
            .isInstanceOf(TableNotFoundException.class);
    }
}
