package com.quackhouse.exec;

import org.duckdb.DuckDBStruct;

import java.sql.Array;
import java.sql.Date;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts values read from DuckDB result sets into plain Java values that
 * serialize cleanly to JSON.
 */
final class JdbcValues {

    private JdbcValues() {}

    static Object toPlain(Object value) throws SQLException {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof byte[]) {
            return value;
        }
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (value instanceof Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Time time) {
            return time.toLocalTime();
        }
        if (value instanceof Array array) {
            Object[] elements = (Object[]) array.getArray();
            List<Object> list = new ArrayList<>(elements.length);
            for (Object element : elements) {
                list.add(toPlain(element));
            }
            return list;
        }
        if (value instanceof DuckDBStruct struct) {
            return toPlainMap(struct.getMap());
        }
        if (value instanceof Map<?, ?> map) {
            return toPlainMap(map);
        }
        if (value instanceof Temporal || value instanceof UUID) {
            return value;
        }
        // Intervals, JSON and other engine-specific types
        return value.toString();
    }

    private static Map<String, Object> toPlainMap(Map<?, ?> map) throws SQLException {
        Map<String, Object> plain = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            plain.put(String.valueOf(entry.getKey()), toPlain(entry.getValue()));
        }
        return plain;
    }
}
