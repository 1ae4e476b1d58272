package com.quackhouse.runtime;

import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import org.junit.jupiter.api.*;
import static org.assertj.core.api.Assertions.*;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tests for the engine connection pool.
 *
 * <p>These tests verify that:
 * <ul>
 *   <li>Connections are released back to the pool by try-with-resources</li>
 *   <li>Pooled connections share the catalog of the primary connection</li>
 *   <li>Closed connections are replaced</li>
 * </ul>
 */
@TestCategories.Tier2
@TestCategories.Integration
@TestCategories.Concurrency
@DisplayName("Engine Connection Pool")
public class DuckDBConnectionManagerTest extends TestBase {

    private DuckDBRuntime runtime;
    private DuckDBConnectionManager manager;

    @BeforeEach
    void setup() throws SQLException {
        EngineConfig config = EngineConfig.builder().memoryLimit("256MB").threads(1).build();
        runtime = DuckDBRuntime.create(config, new HardwareProfile(2, 2L * 1024 * 1024 * 1024));
        manager = new DuckDBConnectionManager(runtime, 3);
    }

    @AfterEach
    void teardown() {
        manager.close();
        runtime.close();
    }

    @Nested
    @DisplayName("Auto-Release")
    class AutoRelease {

        @Test
        @DisplayName("Connection returns to the pool after try-with-resources")
        void autoRelease() throws SQLException {
            // Given: a pool of 3
            assertThat(manager.available()).isEqualTo(3);

            // When: borrowing inside try-with-resources
            try (PooledConnection conn = manager.borrowConnection()) {
                assertThat(conn.get().isClosed()).isFalse();
                assertThat(manager.available()).isEqualTo(2);
            }

            // Then: the connection is back
            assertThat(manager.available()).isEqualTo(3);
        }

        @Test
        @DisplayName("Closing twice releases once")
        void closeTwice() throws SQLException {
            PooledConnection conn = manager.borrowConnection();

            conn.close();
            conn.close();

            assertThat(conn.isReleased()).isTrue();
            assertThat(manager.available()).isEqualTo(3);
        }

        @Test
        @DisplayName("Released connection cannot be used")
        void useAfterRelease() throws SQLException {
            PooledConnection conn = manager.borrowConnection();
            conn.close();

            assertThatThrownBy(conn::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already released");
        }

        @Test
        @DisplayName("Connection is released when the block throws")
        void releaseOnException() {
            assertThatThrownBy(() -> {
                try (PooledConnection conn = manager.borrowConnection();
                     Statement stmt = conn.get().createStatement()) {
                    stmt.execute("SELECT * FROM no_such_table");
                }
            }).isInstanceOf(SQLException.class);

            assertThat(manager.available()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Shared catalog")
    class SharedCatalog {

        @Test
        @DisplayName("View created on one connection is visible on another")
        void viewVisibleAcrossConnections() throws SQLException {
            try (PooledConnection first = manager.borrowConnection();
                 PooledConnection second = manager.borrowConnection()) {

                try (Statement stmt = first.get().createStatement()) {
                    stmt.execute("CREATE VIEW shared_numbers AS SELECT * FROM range(5) t(n)");
                }

                try (Statement stmt = second.get().createStatement();
                     ResultSet rs = stmt.executeQuery("SELECT count(*) FROM shared_numbers")) {
                    assertThat(rs.next()).isTrue();
                    assertThat(rs.getLong(1)).isEqualTo(5);
                }
            }
        }

        @Test
        @DisplayName("Runtime settings apply to pooled connections")
        void settingsShared() throws SQLException {
            try (PooledConnection conn = manager.borrowConnection();
                 Statement stmt = conn.get().createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT current_setting('threads')")) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getLong(1)).isEqualTo(1);
            }
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Closed connection is replaced on release")
        void replaceClosedConnection() throws SQLException {
            PooledConnection conn = manager.borrowConnection();
            conn.get().close();
            conn.close();

            List<PooledConnection> all = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                all.add(manager.borrowConnection());
            }
            for (PooledConnection borrowed : all) {
                assertThat(borrowed.get().isClosed()).isFalse();
                borrowed.close();
            }
        }

        @Test
        @DisplayName("Borrowing from a closed pool fails")
        void closedPool() {
            manager.close();

            assertThat(manager.isClosed()).isTrue();
            assertThatThrownBy(() -> manager.borrowConnection())
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("closed");
        }

        @Test
        @DisplayName("Pool size must be positive")
        void invalidSize() {
            assertThatThrownBy(() -> new DuckDBConnectionManager(runtime, 0))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent borrowers all complete and the pool refills")
        void concurrentBorrow() throws Exception {
            int threads = 8;
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger successes = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                final int n = i;
                new Thread(() -> {
                    try (PooledConnection conn = manager.borrowConnection();
                         Statement stmt = conn.get().createStatement();
                         ResultSet rs = stmt.executeQuery("SELECT " + n)) {
                        if (rs.next() && rs.getInt(1) == n) {
                            successes.incrementAndGet();
                        }
                    } catch (SQLException e) {
                        // counted as a failure
                    } finally {
                        done.countDown();
                    }
                }).start();
            }

            assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
            assertThat(successes.get()).isEqualTo(threads);
            assertThat(manager.available()).isEqualTo(3);
        }
    }
}
