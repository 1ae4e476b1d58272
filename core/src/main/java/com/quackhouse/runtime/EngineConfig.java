package com.quackhouse.runtime;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Startup configuration of the catalog and query engine.
 *
 * <p>Values come from environment variables, each overridable by a system
 * property named {@code quackhouse.<lowercased variable with dots>}; for
 * example {@code QUERY_ROW_LIMIT} is overridden by
 * {@code -Dquackhouse.query.row.limit=500}. The configuration is read once and
 * handed to the engine at construction; later changes have no effect on a
 * running engine.
 */
public final class EngineConfig {

    public static final int DEFAULT_ROW_LIMIT = 1000;
    public static final long DEFAULT_QUERY_TIMEOUT_MS = 300_000L;
    public static final long DEFAULT_SHUTDOWN_DRAIN_TIMEOUT_MS = 10_000L;
    public static final String DEFAULT_BUCKET = "quackhouse-data";

    private final int rowLimit;
    private final long queryTimeoutMs;
    private final String duckDbPath;
    private final String memoryLimit;
    private final int threads;
    private final int poolSize;
    private final ObjectStore objectStore;
    private final String defaultBucket;
    private final String registryUrl;
    private final String registryUser;
    private final String registryPassword;
    private final boolean pruneStaleViews;
    private final long shutdownDrainTimeoutMs;
    private final boolean warmup;

    private EngineConfig(Builder builder) {
        if (builder.rowLimit <= 0) {
            throw new IllegalArgumentException("rowLimit must be positive: " + builder.rowLimit);
        }
        if (builder.queryTimeoutMs < 0) {
            throw new IllegalArgumentException("queryTimeoutMs must be non-negative: " + builder.queryTimeoutMs);
        }
        if (builder.threads < 0 || builder.poolSize < 0) {
            throw new IllegalArgumentException("threads and poolSize must be non-negative");
        }
        this.rowLimit = builder.rowLimit;
        this.queryTimeoutMs = builder.queryTimeoutMs;
        this.duckDbPath = builder.duckDbPath;
        this.memoryLimit = builder.memoryLimit;
        this.threads = builder.threads;
        this.poolSize = builder.poolSize;
        this.objectStore = builder.objectStore;
        this.defaultBucket = Objects.requireNonNull(builder.defaultBucket, "defaultBucket must not be null");
        this.registryUrl = builder.registryUrl;
        this.registryUser = builder.registryUser;
        this.registryPassword = builder.registryPassword;
        this.pruneStaleViews = builder.pruneStaleViews;
        this.shutdownDrainTimeoutMs = builder.shutdownDrainTimeoutMs;
        this.warmup = builder.warmup;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Configuration with every option at its default. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the configuration from the process environment and system properties.
     */
    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System.getenv(), System.getProperties());
    }

    /**
     * Reads the configuration from the given sources.
     *
     * @param env environment variables
     * @param overrides system properties taking precedence over {@code env}
     * @return the configuration
     * @throws IllegalArgumentException if a numeric or boolean value is malformed
     */
    public static EngineConfig fromEnvironment(Map<String, String> env, Properties overrides) {
        Source source = new Source(env, overrides);
        Builder builder = builder()
            .rowLimit(source.intValue("QUERY_ROW_LIMIT", DEFAULT_ROW_LIMIT))
            .queryTimeoutMs(source.longValue("QUERY_TIMEOUT_MS", DEFAULT_QUERY_TIMEOUT_MS))
            .duckDbPath(source.get("DUCKDB_PATH"))
            .memoryLimit(source.get("ENGINE_MEMORY_LIMIT"))
            .threads(source.intValue("ENGINE_THREADS", 0))
            .poolSize(source.intValue("ENGINE_POOL_SIZE", 0))
            .defaultBucket(source.getOrDefault("DEFAULT_BUCKET", DEFAULT_BUCKET))
            .registry(source.get("DATABASE_URL"), source.get("DATABASE_USER"), source.get("DATABASE_PASSWORD"))
            .pruneStaleViews(source.booleanValue("SYNC_PRUNE_STALE_VIEWS", true))
            .shutdownDrainTimeoutMs(source.longValue("SHUTDOWN_DRAIN_TIMEOUT_MS", DEFAULT_SHUTDOWN_DRAIN_TIMEOUT_MS))
            .warmup(source.booleanValue("ENGINE_WARMUP", true));

        String endpoint = source.get("S3_ENDPOINT");
        if (endpoint != null) {
            builder.objectStore(new ObjectStore(
                endpoint,
                source.get("S3_ACCESS_KEY"),
                source.get("S3_SECRET_KEY"),
                source.getOrDefault("S3_REGION", "us-east-1"),
                source.booleanValue("S3_USE_SSL", false)));
        }
        return builder.build();
    }

    public int rowLimit() {
        return rowLimit;
    }

    /** Execution timeout in milliseconds; 0 disables the timeout. */
    public long queryTimeoutMs() {
        return queryTimeoutMs;
    }

    /** DuckDB database file, or null for an in-memory engine. */
    public String duckDbPath() {
        return duckDbPath;
    }

    /** Explicit DuckDB memory limit (e.g. "4GB"), or null for the hardware-derived value. */
    public String memoryLimit() {
        return memoryLimit;
    }

    /** Explicit DuckDB thread count, or 0 for the hardware-derived value. */
    public int threads() {
        return threads;
    }

    /** Pooled engine connections, or 0 for min(cores, 8). */
    public int poolSize() {
        return poolSize;
    }

    /** Object store settings, or null when no object store is configured. */
    public ObjectStore objectStore() {
        return objectStore;
    }

    public String defaultBucket() {
        return defaultBucket;
    }

    /** JDBC URL of the registry store, or null for the in-memory registry. */
    public String registryUrl() {
        return registryUrl;
    }

    public String registryUser() {
        return registryUser;
    }

    public String registryPassword() {
        return registryPassword;
    }

    public boolean pruneStaleViews() {
        return pruneStaleViews;
    }

    public long shutdownDrainTimeoutMs() {
        return shutdownDrainTimeoutMs;
    }

    public boolean warmup() {
        return warmup;
    }

    @Override
    public String toString() {
        return String.format(
            "EngineConfig(rowLimit=%d, queryTimeoutMs=%d, duckDb=%s, memoryLimit=%s, threads=%s, poolSize=%s, "
                + "objectStore=%s, registry=%s, pruneStaleViews=%s)",
            rowLimit, queryTimeoutMs,
            duckDbPath != null ? duckDbPath : "in-memory",
            memoryLimit != null ? memoryLimit : "auto",
            threads > 0 ? threads : "auto",
            poolSize > 0 ? poolSize : "auto",
            objectStore != null ? objectStore.endpoint() : "none",
            registryUrl != null ? "jdbc" : "in-memory",
            pruneStaleViews);
    }

    /**
     * S3-compatible object store the engine reads table data from.
     *
     * @param endpoint host[:port] of the store
     * @param accessKey access key id
     * @param secretKey secret access key
     * @param region signing region
     * @param useSsl whether to use https
     */
    public record ObjectStore(String endpoint, String accessKey, String secretKey, String region, boolean useSsl) {

        public ObjectStore {
            Objects.requireNonNull(endpoint, "endpoint must not be null");
            Objects.requireNonNull(region, "region must not be null");
        }

        @Override
        public String toString() {
            return "ObjectStore(endpoint=" + endpoint + ", region=" + region + ", ssl=" + useSsl + ")";
        }
    }

    /**
     * Builder for {@link EngineConfig}.
     */
    public static final class Builder {
        private int rowLimit = DEFAULT_ROW_LIMIT;
        private long queryTimeoutMs = DEFAULT_QUERY_TIMEOUT_MS;
        private String duckDbPath;
        private String memoryLimit;
        private int threads;
        private int poolSize;
        private ObjectStore objectStore;
        private String defaultBucket = DEFAULT_BUCKET;
        private String registryUrl;
        private String registryUser;
        private String registryPassword;
        private boolean pruneStaleViews = true;
        private long shutdownDrainTimeoutMs = DEFAULT_SHUTDOWN_DRAIN_TIMEOUT_MS;
        private boolean warmup = true;

        private Builder() {}

        public Builder rowLimit(int rowLimit) {
            this.rowLimit = rowLimit;
            return this;
        }

        public Builder queryTimeoutMs(long queryTimeoutMs) {
            this.queryTimeoutMs = queryTimeoutMs;
            return this;
        }

        public Builder duckDbPath(String duckDbPath) {
            this.duckDbPath = duckDbPath;
            return this;
        }

        public Builder memoryLimit(String memoryLimit) {
            this.memoryLimit = memoryLimit;
            return this;
        }

        public Builder threads(int threads) {
            this.threads = threads;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public Builder objectStore(ObjectStore objectStore) {
            this.objectStore = objectStore;
            return this;
        }

        public Builder defaultBucket(String defaultBucket) {
            this.defaultBucket = defaultBucket;
            return this;
        }

        public Builder registry(String url, String user, String password) {
            this.registryUrl = url;
            this.registryUser = user;
            this.registryPassword = password;
            return this;
        }

        public Builder pruneStaleViews(boolean pruneStaleViews) {
            this.pruneStaleViews = pruneStaleViews;
            return this;
        }

        public Builder shutdownDrainTimeoutMs(long shutdownDrainTimeoutMs) {
            this.shutdownDrainTimeoutMs = shutdownDrainTimeoutMs;
            return this;
        }

        public Builder warmup(boolean warmup) {
            this.warmup = warmup;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    private static final class Source {
        private final Map<String, String> env;
        private final Properties overrides;

        Source(Map<String, String> env, Properties overrides) {
            this.env = Objects.requireNonNull(env, "env must not be null");
            this.overrides = Objects.requireNonNull(overrides, "overrides must not be null");
        }

        String get(String name) {
            String property = "quackhouse." + name.toLowerCase(Locale.ROOT).replace('_', '.');
            String value = overrides.getProperty(property);
            if (value == null) {
                value = env.get(name);
            }
            return value == null || value.isBlank() ? null : value.trim();
        }

        String getOrDefault(String name, String fallback) {
            String value = get(name);
            return value != null ? value : fallback;
        }

        int intValue(String name, int fallback) {
            String value = get(name);
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer: '" + value + "'", e);
            }
        }

        long longValue(String name, long fallback) {
            String value = get(name);
            if (value == null) {
                return fallback;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " must be an integer: '" + value + "'", e);
            }
        }

        boolean booleanValue(String name, boolean fallback) {
            String value = get(name);
            if (value == null) {
                return fallback;
            }
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "true", "1", "yes" -> true;
                case "false", "0", "no" -> false;
                default -> throw new IllegalArgumentException(name + " must be true or false: '" + value + "'");
            };
        }
    }
}
