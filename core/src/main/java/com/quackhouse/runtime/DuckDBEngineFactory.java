package com.quackhouse.runtime;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Default engine factory: a DuckDB runtime sized from the host hardware, plus a
 * pool of duplicate connections.
 */
public class DuckDBEngineFactory implements EngineFactory {

    private final HardwareProfile hardware;

    public DuckDBEngineFactory() {
        this(HardwareProfile.detect());
    }

    public DuckDBEngineFactory(HardwareProfile hardware) {
        this.hardware = Objects.requireNonNull(hardware, "hardware must not be null");
    }

    @Override
    public EngineHandle create(EngineConfig config) throws SQLException {
        DuckDBRuntime runtime = DuckDBRuntime.create(config, hardware);
        int poolSize = config.poolSize() > 0 ? config.poolSize() : hardware.recommendedPoolSize();
        try {
            return new EngineHandle(runtime, new DuckDBConnectionManager(runtime, poolSize));
        } catch (SQLException | RuntimeException e) {
            runtime.close();
            throw e;
        }
    }
}
