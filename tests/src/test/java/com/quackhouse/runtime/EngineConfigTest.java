package com.quackhouse.runtime;

import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Engine Configuration")
public class EngineConfigTest extends TestBase {

    private static EngineConfig read(Map<String, String> env) {
        return EngineConfig.fromEnvironment(env, new Properties());
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Empty environment yields defaults")
        void emptyEnvironment() {
            EngineConfig config = read(Map.of());

            assertThat(config.rowLimit()).isEqualTo(1000);
            assertThat(config.queryTimeoutMs()).isEqualTo(300_000L);
            assertThat(config.duckDbPath()).isNull();
            assertThat(config.memoryLimit()).isNull();
            assertThat(config.threads()).isZero();
            assertThat(config.poolSize()).isZero();
            assertThat(config.objectStore()).isNull();
            assertThat(config.defaultBucket()).isEqualTo("quackhouse-data");
            assertThat(config.registryUrl()).isNull();
            assertThat(config.pruneStaleViews()).isTrue();
            assertThat(config.warmup()).isTrue();
        }

        @Test
        @DisplayName("Blank values count as unset")
        void blankValues() {
            EngineConfig config = read(Map.of("QUERY_ROW_LIMIT", "  ", "DUCKDB_PATH", ""));

            assertThat(config.rowLimit()).isEqualTo(EngineConfig.DEFAULT_ROW_LIMIT);
            assertThat(config.duckDbPath()).isNull();
        }
    }

    @Nested
    @DisplayName("Environment")
    class Environment {

        @Test
        @DisplayName("Reads engine and registry settings")
        void readsSettings() {
            EngineConfig config = read(Map.of(
                "QUERY_ROW_LIMIT", "250",
                "QUERY_TIMEOUT_MS", "0",
                "ENGINE_MEMORY_LIMIT", "2GB",
                "ENGINE_THREADS", "3",
                "DATABASE_URL", "jdbc:postgresql://db/catalog",
                "DATABASE_USER", "catalog",
                "SYNC_PRUNE_STALE_VIEWS", "no"));

            assertThat(config.rowLimit()).isEqualTo(250);
            assertThat(config.queryTimeoutMs()).isZero();
            assertThat(config.memoryLimit()).isEqualTo("2GB");
            assertThat(config.threads()).isEqualTo(3);
            assertThat(config.registryUrl()).isEqualTo("jdbc:postgresql://db/catalog");
            assertThat(config.registryUser()).isEqualTo("catalog");
            assertThat(config.registryPassword()).isNull();
            assertThat(config.pruneStaleViews()).isFalse();
        }

        @Test
        @DisplayName("Object store requires an endpoint and defaults its region")
        void objectStore() {
            EngineConfig config = read(Map.of(
                "S3_ENDPOINT", "minio:9000",
                "S3_ACCESS_KEY", "key",
                "S3_SECRET_KEY", "secret"));

            assertThat(config.objectStore()).isEqualTo(
                new EngineConfig.ObjectStore("minio:9000", "key", "secret", "us-east-1", false));
            assertThat(config.objectStore().toString()).doesNotContain("secret");

            assertThat(read(Map.of("S3_ACCESS_KEY", "key")).objectStore()).isNull();
        }

        @Test
        @DisplayName("System properties override the environment")
        void propertyOverride() {
            Properties overrides = new Properties();
            overrides.setProperty("quackhouse.query.row.limit", "10");

            EngineConfig config = EngineConfig.fromEnvironment(Map.of("QUERY_ROW_LIMIT", "500"), overrides);

            assertThat(config.rowLimit()).isEqualTo(10);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Malformed numbers name the variable")
        void malformedNumber() {
            assertThatThrownBy(() -> read(Map.of("QUERY_ROW_LIMIT", "lots")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("QUERY_ROW_LIMIT must be an integer: 'lots'");
        }

        @Test
        @DisplayName("Malformed booleans are rejected")
        void malformedBoolean() {
            assertThatThrownBy(() -> read(Map.of("ENGINE_WARMUP", "maybe")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ENGINE_WARMUP");
        }

        @Test
        @DisplayName("Row limit must be positive and timeout non-negative")
        void ranges() {
            assertThatThrownBy(() -> EngineConfig.builder().rowLimit(0).build())
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> EngineConfig.builder().queryTimeoutMs(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
