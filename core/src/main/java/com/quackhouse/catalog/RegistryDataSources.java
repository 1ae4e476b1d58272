package com.quackhouse.catalog;

import com.quackhouse.runtime.EngineConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.Objects;

/**
 * Connection pools for the registry store.
 */
public final class RegistryDataSources {

    private static final int MAX_POOL_SIZE = 10;

    private RegistryDataSources() {}

    /**
     * Creates a pool for the registry database named by the configuration.
     *
     * @param config configuration with a registry URL
     * @return the pool; the caller closes it
     * @throws IllegalArgumentException if no registry URL is configured
     */
    public static HikariDataSource create(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        if (config.registryUrl() == null) {
            throw new IllegalArgumentException("No registry database configured (DATABASE_URL)");
        }
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("quackhouse-registry");
        hc.setJdbcUrl(config.registryUrl());
        hc.setUsername(config.registryUser());
        hc.setPassword(config.registryPassword());
        hc.setMaximumPoolSize(MAX_POOL_SIZE);
        return new HikariDataSource(hc);
    }
}
