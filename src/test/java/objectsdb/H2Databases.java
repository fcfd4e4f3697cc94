package objectsdb;

import objectsdb.config.DatabaseConfig;

/**
 * Isolated in-memory H2 databases in PostgreSQL mode, schema created on open.
 */
public final class H2Databases {

    private H2Databases() {
    }

    public static DatabaseConfig config(String name) {
        return config(name, 10_000);
    }

    public static DatabaseConfig config(String name, int lockTimeoutMs) {
        return DatabaseConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:" + name + "-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=" + lockTimeoutMs)
                .withInitSchema(true);
    }
}
