package com.quackhouse.sync;

import com.quackhouse.catalog.TableEntry;
import com.quackhouse.catalog.TableFormat;
import com.quackhouse.generator.SQLQuoting;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the engine statements that bind registry entries as views.
 *
 * <p>A view is {@code SELECT *} over the scan function of the entry format:
 * <pre>
 *   CREATE OR REPLACE VIEW "events" AS SELECT * FROM read_parquet('s3://data/events/**&#47;*.parquet')
 * </pre>
 *
 * <p>Location handling:
 * <ul>
 *   <li>{@code s3a://} and {@code s3n://} are rewritten to {@code s3://}</li>
 *   <li>{@code file://} is stripped to a local path</li>
 *   <li>other schemes must be readable by the engine, otherwise the entry is rejected</li>
 *   <li>for file formats, a location without a file extension or glob is a
 *       directory and gets {@code /**&#47;*.<ext>} appended</li>
 * </ul>
 */
public final class ViewDefinitions {

    private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*)://(.*)$");

    private static final Set<String> ENGINE_SCHEMES =
        Set.of("s3", "gs", "gcs", "r2", "http", "https", "az", "azure", "abfss");

    private ViewDefinitions() {}

    /**
     * @return {@code CREATE OR REPLACE VIEW} statement binding the entry
     * @throws IllegalArgumentException if the format or location is unsupported
     */
    public static String createView(TableEntry entry) {
        TableFormat format = entry.format();
        if (format.scanFunction() == null) {
            throw new IllegalArgumentException("Unsupported table format");
        }
        String source = resolveLocation(format, entry.location());
        return "CREATE OR REPLACE VIEW " + SQLQuoting.quoteIdentifier(entry.name())
            + " AS SELECT * FROM " + format.scanFunction() + "(" + SQLQuoting.quoteFilePath(source) + ")";
    }

    public static String dropView(String name) {
        return "DROP VIEW IF EXISTS " + SQLQuoting.quoteIdentifier(name);
    }

    /**
     * Translates a registry location into the path handed to the scan function.
     *
     * @throws IllegalArgumentException if the location is blank or uses an unsupported scheme
     */
    public static String resolveLocation(TableFormat format, String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Location is empty");
        }
        String path = location.strip();

        Matcher matcher = SCHEME.matcher(path);
        if (matcher.matches()) {
            String scheme = matcher.group(1).toLowerCase(Locale.ROOT);
            String rest = matcher.group(2);
            if (rest.isEmpty()) {
                throw new IllegalArgumentException("Location has no path: " + location);
            }
            path = switch (scheme) {
                case "s3a", "s3n" -> "s3://" + rest;
                case "file" -> rest;
                default -> {
                    if (!ENGINE_SCHEMES.contains(scheme)) {
                        throw new IllegalArgumentException("Unsupported location scheme '" + scheme + "'");
                    }
                    yield scheme + "://" + rest;
                }
            };
        }

        if (format.fileExtension() != null && isDirectory(path)) {
            path = stripTrailingSlashes(path) + "/**/*." + format.fileExtension();
        }
        return path;
    }

    private static boolean isDirectory(String path) {
        if (path.indexOf('*') >= 0 || path.indexOf('?') >= 0 || path.indexOf('[') >= 0) {
            return false;
        }
        String trimmed = stripTrailingSlashes(path);
        String lastSegment = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        return lastSegment.lastIndexOf('.') <= 0 || path.endsWith("/");
    }

    private static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 1 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }
}
