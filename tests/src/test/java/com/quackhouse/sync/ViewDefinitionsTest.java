package com.quackhouse.sync;

import com.quackhouse.catalog.TableEntry;
import com.quackhouse.catalog.TableFormat;
import com.quackhouse.catalog.Visibility;
import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("View Definitions")
public class ViewDefinitionsTest extends TestBase {

    private static TableEntry entry(String name, TableFormat format, String location) {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        return new TableEntry(1, name, "default", format, location, 1L, Visibility.PRIVATE, List.of(), now, now);
    }

    @Nested
    @DisplayName("Location resolution")
    class Locations {

        @ParameterizedTest(name = "{0} {1} -> {2}")
        @CsvSource({
            "DELTA,   s3a://data/tables/web/events,      s3://data/tables/web/events",
            "DELTA,   s3n://data/events/,                s3://data/events/",
            "PARQUET, s3a://data/events,                 s3://data/events/**/*.parquet",
            "PARQUET, s3://data/events/,                 s3://data/events/**/*.parquet",
            "PARQUET, s3://data/events/part-0.parquet,   s3://data/events/part-0.parquet",
            "CSV,     s3://data/raw/*.csv,               s3://data/raw/*.csv",
            "JSON,    file:///var/data/logs,             /var/data/logs/**/*.json",
            "CSV,     /var/data/trips.csv,               /var/data/trips.csv",
            "PARQUET, https://host/files/a.parquet,      https://host/files/a.parquet",
            "PARQUET, gs://bucket/dir,                   gs://bucket/dir/**/*.parquet"
        })
        void resolves(TableFormat format, String location, String expected) {
            assertThat(ViewDefinitions.resolveLocation(format, location)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Blank location is rejected")
        void blank() {
            assertThatThrownBy(() -> ViewDefinitions.resolveLocation(TableFormat.DELTA, "  "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Location is empty");
        }

        @Test
        @DisplayName("Schemes the engine cannot read are rejected")
        void unsupportedScheme() {
            assertThatThrownBy(() -> ViewDefinitions.resolveLocation(TableFormat.PARQUET, "hdfs://nn/data"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported location scheme 'hdfs'");
        }

        @Test
        @DisplayName("Scheme without a path is rejected")
        void schemeOnly() {
            assertThatThrownBy(() -> ViewDefinitions.resolveLocation(TableFormat.PARQUET, "s3://"))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("View scans the location with the format's reader")
        void createView() {
            String sql = ViewDefinitions.createView(entry("events", TableFormat.PARQUET, "s3a://data/events"));

            assertThat(sql).isEqualTo(
                "CREATE OR REPLACE VIEW \"events\" AS SELECT * FROM read_parquet('s3://data/events/**/*.parquet')");
        }

        @Test
        @DisplayName("Delta entries use delta_scan")
        void deltaView() {
            assertThat(ViewDefinitions.createView(entry("orders", TableFormat.DELTA, "s3a://data/orders")))
                .endsWith("delta_scan('s3://data/orders')");
        }

        @Test
        @DisplayName("Names and paths are quoted")
        void quoting() {
            String sql = ViewDefinitions.createView(entry("odd\"name", TableFormat.CSV, "/tmp/it's.csv"));

            assertThat(sql).contains("\"odd\"\"name\"").contains("'/tmp/it''s.csv'");
        }

        @Test
        @DisplayName("Paths carrying statement separators are rejected")
        void injection() {
            assertThatThrownBy(() -> ViewDefinitions.createView(
                entry("x", TableFormat.CSV, "/tmp/a.csv'); DROP TABLE t; --")))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Entries with an unknown stored format have no view")
        void unknownFormat() {
            assertThatThrownBy(() -> ViewDefinitions.createView(entry("x", TableFormat.UNKNOWN, "s3://data/x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported table format");
        }

        @Test
        @DisplayName("Drop is conditional")
        void dropView() {
            assertThat(ViewDefinitions.dropView("events")).isEqualTo("DROP VIEW IF EXISTS \"events\"");
        }
    }
}
