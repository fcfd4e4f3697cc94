package objectsdb.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

/**
 * Bounds how long statements on one connection wait for row locks.
 *
 * <p>{@code Statement.setQueryTimeout} does not interrupt a lock wait on every
 * engine, so a caller's timeout is also pushed down as the store's own lock timeout:
 * <ul>
 *   <li>PostgreSQL: {@code set_config('lock_timeout', ..., true)}, scoped to the
 *       current transaction and reset by its commit or rollback.</li>
 *   <li>H2: {@code SET LOCK_TIMEOUT}, a session setting. The previous value is
 *       restored on {@link #close()} since pooled connections outlive the claim.</li>
 * </ul>
 * Other engines keep their configured lock timeout.
 */
final class SessionLockTimeout implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SessionLockTimeout.class);

    private static final SessionLockTimeout NONE = new SessionLockTimeout(null, null, -1);

    private final Database db;
    private final Connection conn;
    private final long restoreMillis;

    private SessionLockTimeout(Database db, Connection conn, long restoreMillis) {
        this.db = db;
        this.conn = conn;
        this.restoreMillis = restoreMillis;
    }

    /**
     * Apply {@code timeout} to {@code conn}, borrowed from {@code db}. A null timeout changes nothing.
     */
    static SessionLockTimeout apply(Database db, Connection conn, Duration timeout) throws SQLException {
        if (timeout == null) {
            return NONE;
        }
        long millis = Math.max(1, timeout.toMillis());
        String product = conn.getMetaData().getDatabaseProductName();

        if ("PostgreSQL".equalsIgnoreCase(product)) {
            try (PreparedStatement ps = conn.prepareStatement("SELECT set_config('lock_timeout', ?, true)")) {
                ps.setString(1, millis + "ms");
                ps.execute();
            }
            return NONE;
        }

        if ("H2".equalsIgnoreCase(product)) {
            long previous;
            try (Statement st = conn.createStatement()) {
                try (ResultSet rs = st.executeQuery("SELECT LOCK_TIMEOUT()")) {
                    rs.next();
                    previous = rs.getLong(1);
                }
                st.execute("SET LOCK_TIMEOUT " + millis);
            }
            log.debug("H2 lock timeout {} ms (was {} ms)", millis, previous);
            return new SessionLockTimeout(db, conn, previous);
        }

        log.debug("No lock timeout support for {}, relying on the statement timeout", product);
        return NONE;
    }

    /**
     * Restore the H2 session's lock timeout. A connection that cannot be restored
     * is evicted from the pool; the claim's own outcome is already settled.
     */
    @Override
    public void close() {
        if (conn == null) {
            return;
        }
        try (Statement st = conn.createStatement()) {
            st.execute("SET LOCK_TIMEOUT " + restoreMillis);
        } catch (SQLException e) {
            log.warn("Failed to restore lock timeout to {} ms, evicting connection: {}", restoreMillis, e.getMessage());
            db.evict(conn);
        }
    }
}
