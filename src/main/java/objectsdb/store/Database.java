package objectsdb.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import objectsdb.config.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool.
 * Uses HikariCP; every component receives this pool at construction.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final HikariDataSource dataSource;

    public Database(DatabaseConfig config) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(config.jdbcUrl());
        if (config.user() != null) {
            hikariConfig.setUsername(config.user());
            hikariConfig.setPassword(config.password());
        }
        hikariConfig.setMaximumPoolSize(config.poolSize());
        hikariConfig.setMinimumIdle(Math.min(2, config.poolSize()));
        hikariConfig.setConnectionTimeout(config.connectionTimeout().toMillis());
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("objectsdb-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", config.jdbcUrl());

        if (config.initSchema()) {
            runScript(SCHEMA_RESOURCE);
        }
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Retire a borrowed connection instead of returning it to the pool, for
     * connections left in a state other borrowers must not inherit.
     */
    public void evict(Connection conn) {
        dataSource.evictConnection(conn);
    }

    /**
     * Get the underlying DataSource (for frameworks that need it).
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Execute a classpath SQL script, statements separated by {@code ;}.
     * Lines starting with {@code --} are comments.
     */
    public void runScript(String resource) {
        String script = readResource(resource);

        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            for (String statement : script.split(";")) {
                String sql = stripComments(statement);
                if (!sql.isBlank()) {
                    st.addBatch(sql);
                }
            }

            st.executeBatch();
            conn.commit();

            log.info("Database script {} executed", resource);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to execute database script " + resource, e);
        }
    }

    private static String readResource(String resource) {
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static String stripComments(String statement) {
        StringBuilder sb = new StringBuilder();
        for (String line : statement.split("\n")) {
            if (!line.trim().startsWith("--")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString().trim();
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
