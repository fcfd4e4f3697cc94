package objectsdb.config;

import java.time.Duration;

/**
 * Connection and task-queue settings.
 * All settings have sensible defaults.
 */
public final class DatabaseConfig {

    // Connection settings
    private String databaseUrl = null; // explicit JDBC URL, overrides host/port/dbname
    private String host = "localhost";
    private int port = 5432;
    private String user = null;
    private String password = null;
    private String databaseName = "household_objects";

    // Pool settings
    private int poolSize = 10;
    private Duration connectionTimeout = Duration.ofSeconds(5);

    // Schema
    private boolean initSchema = false;

    // Task claim settings
    private int claimBatchSize = 8;
    private Duration claimTimeout = null; // none: bounded only by the store's lock timeout

    private DatabaseConfig() {
    }

    public static DatabaseConfig defaults() {
        return new DatabaseConfig();
    }

    public static DatabaseConfig fromEnv() {
        DatabaseConfig config = new DatabaseConfig();

        String url = System.getenv("OBJECTSDB_DB_URL");
        if (url != null && !url.isBlank()) {
            config.databaseUrl = url;
        }

        String host = System.getenv("OBJECTSDB_DB_HOST");
        if (host != null && !host.isBlank()) {
            config.host = host;
        }

        String port = System.getenv("OBJECTSDB_DB_PORT");
        if (port != null && !port.isBlank()) {
            config.port = Integer.parseInt(port);
        }

        String user = System.getenv("OBJECTSDB_DB_USER");
        if (user != null && !user.isBlank()) {
            config.user = user;
        }

        String password = System.getenv("OBJECTSDB_DB_PASSWORD");
        if (password != null) {
            config.password = password;
        }

        String name = System.getenv("OBJECTSDB_DB_NAME");
        if (name != null && !name.isBlank()) {
            config.databaseName = name;
        }

        String poolSize = System.getenv("OBJECTSDB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.poolSize = Integer.parseInt(poolSize);
        }

        String claimTimeout = System.getenv("OBJECTSDB_CLAIM_TIMEOUT_MS");
        if (claimTimeout != null && !claimTimeout.isBlank()) {
            config.claimTimeout = Duration.ofMillis(Long.parseLong(claimTimeout));
        }

        return config;
    }

    /**
     * The explicit URL if one is set, otherwise a PostgreSQL URL built from host, port and database name.
     */
    public String jdbcUrl() {
        if (databaseUrl != null && !databaseUrl.isBlank()) {
            return databaseUrl;
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + databaseName;
    }

    // Getters
    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String user() {
        return user;
    }

    public String password() {
        return password;
    }

    public String databaseName() {
        return databaseName;
    }

    public int poolSize() {
        return poolSize;
    }

    public Duration connectionTimeout() {
        return connectionTimeout;
    }

    public boolean initSchema() {
        return initSchema;
    }

    public int claimBatchSize() {
        return claimBatchSize;
    }

    public Duration claimTimeout() {
        return claimTimeout;
    }

    // Fluent setters for testing/customization
    public DatabaseConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public DatabaseConfig withHost(String host) {
        this.host = host;
        return this;
    }

    public DatabaseConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public DatabaseConfig withCredentials(String user, String password) {
        this.user = user;
        this.password = password;
        return this;
    }

    public DatabaseConfig withDatabaseName(String name) {
        this.databaseName = name;
        return this;
    }

    public DatabaseConfig withPoolSize(int poolSize) {
        this.poolSize = poolSize;
        return this;
    }

    public DatabaseConfig withInitSchema(boolean initSchema) {
        this.initSchema = initSchema;
        return this;
    }

    public DatabaseConfig withClaimBatchSize(int claimBatchSize) {
        if (claimBatchSize <= 0) {
            throw new IllegalArgumentException("claimBatchSize must be positive");
        }
        this.claimBatchSize = claimBatchSize;
        return this;
    }

    public DatabaseConfig withClaimTimeout(Duration claimTimeout) {
        this.claimTimeout = claimTimeout;
        return this;
    }

    @Override
    public String toString() {
        return "DatabaseConfig{" +
                "url='" + jdbcUrl() + '\'' +
                ", user='" + user + '\'' +
                ", poolSize=" + poolSize +
                ", claimBatchSize=" + claimBatchSize +
                ", passwordSet=" + (password != null) +
                '}';
    }
}
