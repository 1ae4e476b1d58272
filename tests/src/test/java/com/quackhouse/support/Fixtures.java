package com.quackhouse.support;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Writes data files with a throwaway DuckDB database.
 */
public final class Fixtures {

    private Fixtures() {}

    /** Writes the rows of {@code select} as a Parquet file. */
    public static Path parquet(Path file, String select) throws SQLException {
        return copy(file, select, "FORMAT PARQUET");
    }

    /** Writes the rows of {@code select} as a CSV file with a header line. */
    public static Path csv(Path file, String select) throws SQLException {
        return copy(file, select, "FORMAT CSV, HEADER");
    }

    /** Writes the rows of {@code select} as newline-delimited JSON. */
    public static Path json(Path file, String select) throws SQLException {
        return copy(file, select, "FORMAT JSON");
    }

    private static Path copy(Path file, String select, String options) throws SQLException {
        try (Connection conn = DriverManager.getConnection("jdbc:duckdb:");
             Statement stmt = conn.createStatement()) {
            stmt.execute("COPY (" + select + ") TO '" + file.toAbsolutePath().toString().replace("'", "''")
                + "' (" + options + ")");
        }
        return file;
    }
}
