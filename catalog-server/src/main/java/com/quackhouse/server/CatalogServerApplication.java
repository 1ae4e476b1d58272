package com.quackhouse.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * Entry point of the catalog and query server.
 *
 * <p>The registry pool is built from {@code DATABASE_URL} by
 * {@link EngineConfiguration}, so Spring's own data source setup is disabled.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class CatalogServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogServerApplication.class, args);
    }
}
