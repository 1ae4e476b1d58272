package com.quackhouse.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Storage formats a catalog entry may declare.
 *
 * <p>Each format maps to the DuckDB table function that scans it. Formats
 * stored as loose files also carry the file extension used to expand a
 * directory location into a glob.
 */
public enum TableFormat {
    DELTA("delta", "delta_scan", null),
    PARQUET("parquet", "read_parquet", "parquet"),
    CSV("csv", "read_csv_auto", "csv"),
    JSON("json", "read_json_auto", "json"),
    /** A stored format this service cannot scan; never accepted on registration. */
    UNKNOWN("unknown", null, null);

    private final String wireName;
    private final String scanFunction;
    private final String fileExtension;

    TableFormat(String wireName, String scanFunction, String fileExtension) {
        this.wireName = wireName;
        this.scanFunction = scanFunction;
        this.fileExtension = fileExtension;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Returns the DuckDB table function, or null for {@link #UNKNOWN}. */
    public String scanFunction() {
        return scanFunction;
    }

    /**
     * Returns the data file extension, or null for formats whose location is
     * always a table root (Delta).
     */
    public String fileExtension() {
        return fileExtension;
    }

    /**
     * Parse a format name (case-insensitive).
     *
     * @param value "delta", "parquet", "csv" or "json"; null means delta
     * @return the parsed format
     * @throws IllegalArgumentException if value is not recognized
     */
    @JsonCreator
    public static TableFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return DELTA;
        }
        return switch (value.trim().toLowerCase()) {
            case "delta" -> DELTA;
            case "parquet" -> PARQUET;
            case "csv" -> CSV;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException(
                "Unsupported table format: '%s'. Valid values: delta, parquet, csv, json".formatted(value));
        };
    }
}
