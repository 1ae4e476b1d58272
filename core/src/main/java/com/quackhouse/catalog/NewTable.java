package com.quackhouse.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Request to register a table.
 *
 * <p>{@code database}, {@code format} and {@code visibility} fall back to
 * {@code default}, delta and private. A null location is assigned by the
 * registry under the default bucket.
 */
public record NewTable(
        String name,
        String database,
        TableFormat format,
        String location,
        Visibility visibility,
        @JsonProperty("schema_definition") List<SchemaField> schema) {

    public static final String DEFAULT_DATABASE = "default";

    public NewTable {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name is required");
        }
        name = name.trim();
        database = database == null || database.isBlank() ? DEFAULT_DATABASE : database.trim();
        format = Objects.requireNonNullElse(format, TableFormat.DELTA);
        if (format == TableFormat.UNKNOWN) {
            throw new IllegalArgumentException("Unsupported table format: 'unknown'. Valid values: delta, parquet, csv, json");
        }
        location = location == null || location.isBlank() ? null : location.trim();
        visibility = Objects.requireNonNullElse(visibility, Visibility.PRIVATE);
        schema = schema == null ? List.of() : List.copyOf(schema);
    }

    /**
     * Returns the requested location, or the conventional location under
     * {@code bucket} when none was given.
     */
    public String locationOrDefault(String bucket) {
        if (location != null) {
            return location;
        }
        return "s3a://" + bucket + "/tables/" + database + "/" + name;
    }

    /** Creates a private delta table request with an assigned location. */
    public static NewTable of(String name, String database) {
        return new NewTable(name, database, null, null, null, null);
    }
}
