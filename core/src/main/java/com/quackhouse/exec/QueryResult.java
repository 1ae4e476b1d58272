package com.quackhouse.exec;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a query execution.
 *
 * <p>On success {@code data} holds at most the configured row limit, one map
 * per row keyed by column name in column order; {@code truncated} tells whether
 * the engine produced more. On failure the row fields are empty and
 * {@code error} carries the message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(
        boolean success,
        List<String> columns,
        List<Map<String, Object>> data,
        @JsonProperty("row_count") int rowCount,
        boolean truncated,
        @JsonProperty("execution_time_ms") long executionTimeMs,
        String error,
        @JsonIgnore QueryErrorKind errorKind) {

    public QueryResult {
        columns = columns == null ? List.of() : List.copyOf(columns);
        data = data == null ? List.of() : List.copyOf(data);
    }

    public static QueryResult success(List<String> columns, List<Map<String, Object>> data,
                                      boolean truncated, long executionTimeMs) {
        return new QueryResult(true, columns, data, data.size(), truncated, executionTimeMs, null, null);
    }

    public static QueryResult failure(QueryErrorKind kind, String error, long executionTimeMs) {
        return new QueryResult(false, List.of(), List.of(), 0, false, executionTimeMs, error, kind);
    }
}
