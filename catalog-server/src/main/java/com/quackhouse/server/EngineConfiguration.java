package com.quackhouse.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quackhouse.auth.AuthorizationPolicy;
import com.quackhouse.catalog.CatalogService;
import com.quackhouse.catalog.InMemoryTableRegistry;
import com.quackhouse.catalog.JdbcTableRegistry;
import com.quackhouse.catalog.RegistryDataSources;
import com.quackhouse.catalog.TableRegistry;
import com.quackhouse.exception.EngineUnavailableException;
import com.quackhouse.exec.EngineIntrospector;
import com.quackhouse.exec.QueryExecutor;
import com.quackhouse.runtime.DuckDBEngineFactory;
import com.quackhouse.runtime.EngineConfig;
import com.quackhouse.runtime.EngineSession;
import com.quackhouse.sync.CatalogSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the core components from the environment-sourced {@link EngineConfig}.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public EngineConfig engineConfig() {
        EngineConfig config = EngineConfig.fromEnvironment();
        logger.info("Starting with {}", config);
        return config;
    }

    @Bean
    public TableRegistry tableRegistry(EngineConfig config, ObjectMapper mapper) {
        if (config.registryUrl() == null) {
            logger.warn("DATABASE_URL not set; using an in-memory table registry, entries are lost on restart");
            return new InMemoryTableRegistry(config.defaultBucket());
        }
        JdbcTableRegistry registry = new JdbcTableRegistry(
            RegistryDataSources.create(config), config.defaultBucket(), mapper, Clock.systemUTC());
        registry.initializeSchema();
        return registry;
    }

    @Bean
    public AuthorizationPolicy authorizationPolicy() {
        return new AuthorizationPolicy();
    }

    @Bean
    public CatalogSynchronizer catalogSynchronizer(EngineConfig config) {
        return new CatalogSynchronizer(config.pruneStaleViews());
    }

    @Bean(destroyMethod = "shutdown")
    public EngineSession engineSession(EngineConfig config, TableRegistry registry,
                                       CatalogSynchronizer synchronizer) {
        return new EngineSession(config, new DuckDBEngineFactory(), registry, synchronizer);
    }

    @Bean(destroyMethod = "close")
    public QueryExecutor queryExecutor(EngineSession session, AuthorizationPolicy policy) {
        return new QueryExecutor(session, policy);
    }

    @Bean
    public CatalogService catalogService(TableRegistry registry, AuthorizationPolicy policy) {
        return new CatalogService(registry, policy);
    }

    @Bean
    public EngineIntrospector engineIntrospector(EngineSession session, AuthorizationPolicy policy) {
        return new EngineIntrospector(session, policy);
    }

    /**
     * Builds the engine at startup so the first query does not pay for it.
     * A failure leaves the server up; the next query retries construction.
     */
    @Bean
    public ApplicationRunner engineWarmup(EngineConfig config, EngineSession session) {
        return args -> {
            if (!config.warmup()) {
                return;
            }
            try {
                session.acquire();
            } catch (EngineUnavailableException e) {
                logger.warn("Startup degraded: query engine warm-up failed, will retry on first use: {}",
                    e.getMessage());
            }
        };
    }
}
