package com.quackhouse.catalog;

import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Catalog JSON mapping")
public class CatalogJsonTest extends TestBase {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    @DisplayName("Registration request applies defaults")
    void newTableDefaults() throws Exception {
        NewTable table = mapper.readValue("{\"name\": \"events\"}", NewTable.class);

        assertThat(table.database()).isEqualTo("default");
        assertThat(table.format()).isEqualTo(TableFormat.DELTA);
        assertThat(table.visibility()).isEqualTo(Visibility.PRIVATE);
        assertThat(table.location()).isNull();
        assertThat(table.schema()).isEmpty();
    }

    @Test
    @DisplayName("Registration request reads wire names")
    void newTableWireNames() throws Exception {
        NewTable table = mapper.readValue("""
            {"name": "trips", "database": "nyc", "format": "CSV", "visibility": "public",
             "location": "s3a://b/trips/",
             "schema_definition": [{"name": "id", "type": "BIGINT", "nullable": false}]}
            """, NewTable.class);

        assertThat(table.format()).isEqualTo(TableFormat.CSV);
        assertThat(table.visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(table.schema()).containsExactly(new SchemaField("id", "BIGINT", false));
    }

    @Test
    @DisplayName("Unknown format and missing name are rejected")
    void invalidRequests() {
        assertThatThrownBy(() -> mapper.readValue("{\"name\": \"t\", \"format\": \"orc\"}", NewTable.class))
            .hasRootCauseInstanceOf(IllegalArgumentException.class)
            .hasRootCauseMessage("Unsupported table format: 'orc'. Valid values: delta, parquet, csv, json");
        assertThatThrownBy(() -> mapper.readValue("{\"database\": \"x\"}", NewTable.class))
            .isInstanceOf(ValueInstantiationException.class)
            .hasRootCauseMessage("Table name is required");
    }

    @Test
    @DisplayName("Entry serializes with snake_case wire fields")
    void entryJson() {
        Instant created = Instant.parse("2024-05-01T10:00:00Z");
        TableEntry entry = new TableEntry(3, "events", "web", TableFormat.PARQUET, "s3a://b/events", 7L,
            Visibility.PUBLIC, List.of(), created, created);

        JsonNode json = mapper.valueToTree(entry);

        assertThat(json.get("owner_id").asLong()).isEqualTo(7);
        assertThat(json.get("format").asText()).isEqualTo("parquet");
        assertThat(json.get("visibility").asText()).isEqualTo("public");
        assertThat(json.has("created_at")).isTrue();
        assertThat(json.has("public")).isFalse();
    }
}
