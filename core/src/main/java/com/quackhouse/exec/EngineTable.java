package com.quackhouse.exec;

/**
 * An object visible in the engine namespace.
 *
 * @param database engine catalog name
 * @param schema engine schema name
 * @param name object name
 * @param type {@code VIEW}, {@code BASE TABLE}, ...
 */
public record EngineTable(String database, String schema, String name, String type) {
}
