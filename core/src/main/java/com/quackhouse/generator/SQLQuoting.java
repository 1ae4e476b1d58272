package com.quackhouse.generator;

/**
 * Quoting of identifiers, literals and file locations embedded in generated SQL.
 *
 * <p>Registry fields are user-supplied; everything the service splices into
 * engine statements passes through here.
 *
 * <pre>
 *   SQLQuoting.quoteIdentifier("sales \"eu\"");   // "sales ""eu"""
 *   SQLQuoting.quoteLiteral("O'Reilly");          // 'O''Reilly'
 *   SQLQuoting.quoteFilePath("s3://b/t/*.csv");   // 's3://b/t/*.csv'
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (view or column name) with double quotes.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Quotes a string literal, or returns {@code NULL} for null.
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Quotes a file location for a scan function.
     *
     * <p>Glob characters are kept. Locations containing statement separators
     * or control characters are rejected rather than escaped.
     *
     * @param path the location to quote
     * @return quoted location
     * @throws IllegalArgumentException if path is null, empty, or contains
     *         a statement separator or control character
     */
    public static String quoteFilePath(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("File path cannot be null or empty");
        }
        if (path.contains(";") || path.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException("Invalid characters in file path: " + path);
        }
        return "'" + path.replace("'", "''") + "'";
    }
}
