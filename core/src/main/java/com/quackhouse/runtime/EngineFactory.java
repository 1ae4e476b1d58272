package com.quackhouse.runtime;

import java.sql.SQLException;

/**
 * Builds the query engine for an {@link EngineSession}.
 */
@FunctionalInterface
public interface EngineFactory {

    /**
     * Constructs a ready-to-use engine.
     *
     * @param config the engine configuration
     * @return the engine; ownership passes to the caller
     * @throws SQLException if the engine cannot be opened or configured
     */
    EngineHandle create(EngineConfig config) throws SQLException;
}
