package com.quackhouse.exception;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exception thrown when the engine rejects or fails to run a statement.
 *
 * <p>Wraps the underlying {@link java.sql.SQLException} with the failed SQL
 * and translates common DuckDB error messages into something a catalog user
 * can act on.
 *
 * <p>Common causes:
 * <ul>
 *   <li>Table or view not bound in the namespace</li>
 *   <li>Column not found</li>
 *   <li>Invalid SQL syntax</li>
 *   <li>Unreadable storage location</li>
 *   <li>Memory limit exceeded</li>
 * </ul>
 *
 * @see com.quackhouse.exec.QueryExecutor
 */
public class QueryExecutionException extends QuackhouseException {

    private static final Pattern MISSING_COLUMN = Pattern.compile("column \"([^\"]+)\" not found");
    private static final Pattern CANDIDATES = Pattern.compile("Candidate bindings: (.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MISSING_TABLE = Pattern.compile("Table with name ([^ ]+) does not exist");
    private static final Pattern SYNTAX_TOKEN = Pattern.compile("syntax error at or near \"([^\"]+)\"");

    private final String failedSQL;

    /**
     * Creates a query execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, String sql) {
        super(message);
        this.failedSQL = sql;
    }

    /**
     * Creates a query execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public QueryExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Detects the DuckDB error class prefix ("Catalog Error", "Binder Error",
     * ...) and rewrites the message. Unknown errors are passed through.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();

        if (message == null) {
            return "Query execution failed. Check SQL syntax and table names.";
        }

        if (message.contains("Catalog Error")) {
            return translateCatalogError(message);
        }

        if (message.contains("Binder Error") && message.contains("not found")) {
            return translateColumnNotFound(message);
        }

        if (message.contains("Parser Error") || message.contains("Syntax Error")) {
            return translateSyntaxError(message);
        }

        if (message.contains("Out of Memory Error")) {
            return "Query requires more memory than available. "
                + "Try adding filters or a LIMIT clause.";
        }

        if (message.contains("IO Error") || message.contains("HTTP Error")) {
            return "Could not read table data from storage: " + message;
        }

        return message;
    }

    private String translateCatalogError(String message) {
        Matcher matcher = MISSING_TABLE.matcher(message);
        if (matcher.find()) {
            return "Table " + matcher.group(1) + " is not available. "
                + "Check the table is registered and the catalog has been synchronized.";
        }
        return message;
    }

    private String translateColumnNotFound(String message) {
        Matcher matcher = MISSING_COLUMN.matcher(message);
        if (!matcher.find()) {
            return message;
        }
        String missingColumn = matcher.group(1);

        Matcher candidates = CANDIDATES.matcher(message);
        if (candidates.find()) {
            return "Column '" + missingColumn + "' not found. Available columns: " + candidates.group(1);
        }
        return "Column '" + missingColumn + "' not found. Check column name spelling.";
    }

    private String translateSyntaxError(String message) {
        Matcher matcher = SYNTAX_TOKEN.matcher(message);
        if (matcher.find()) {
            return "SQL syntax error near '" + matcher.group(1) + "'.";
        }
        return message;
    }
}
