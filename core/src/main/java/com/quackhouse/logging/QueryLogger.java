package com.quackhouse.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for query executions.
 *
 * <p>{@link #startQuery(String, Object, String)} puts the query id into the MDC so every log
 * line written on the executing thread carries it; {@link #clearContext()}
 * must be called in a {@code finally} block when the execution ends.
 */
public final class QueryLogger {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    public static final String QUERY_ID = "queryId";
    public static final String PRINCIPAL = "principal";

    private static final int MAX_LOGGED_SQL = 500;

    private QueryLogger() {}

    /** Generates a short id such as {@code q_1a2b3c4d}. */
    public static String newQueryId() {
        return "q_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public static void startQuery(String queryId, Object principal, String sql) {
        MDC.put(QUERY_ID, queryId);
        MDC.put(PRINCIPAL, String.valueOf(principal));
        logger.info("Query started: {}", abbreviate(sql));
    }

    public static void logExecution(long executionTimeMs, long rowCount, boolean truncated) {
        logger.debug("Query executed in {} ms, {} row(s) returned{}",
            executionTimeMs, rowCount, truncated ? " (truncated)" : "");
    }

    public static void completeQuery(long totalTimeMs) {
        logger.info("Query completed in {} ms", totalTimeMs);
    }

    public static void logRejected(Object principal, String reason) {
        logger.info("Query rejected for {}: {}", principal, reason);
    }

    public static void logError(Throwable error) {
        logger.warn("Query failed: {}", error.getMessage());
        logger.debug("Query failure detail", error);
    }

    public static String currentQueryId() {
        return MDC.get(QUERY_ID);
    }

    public static void clearContext() {
        MDC.remove(QUERY_ID);
        MDC.remove(PRINCIPAL);
    }

    static String abbreviate(String sql) {
        if (sql == null) {
            return "";
        }
        String singleLine = sql.strip().replaceAll("\\s+", " ");
        return singleLine.length() <= MAX_LOGGED_SQL
            ? singleLine
            : singleLine.substring(0, MAX_LOGGED_SQL) + "...";
    }
}
