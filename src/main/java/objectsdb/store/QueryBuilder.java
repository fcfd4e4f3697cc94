package objectsdb.store;

import objectsdb.NotFoundException;
import objectsdb.QueryException;
import objectsdb.SchemaException;
import objectsdb.query.Predicate;
import objectsdb.query.SqlFragment;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;
import objectsdb.schema.FieldBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Generic example-object queries.
 *
 * <p>An example {@link EntityDescriptor} says which columns to read or write;
 * a {@link Predicate} says which rows. Each public operation borrows one pooled
 * connection. The {@code Connection}-taking variants run inside a caller's
 * transaction and leave commit/rollback to the caller.
 */
public class QueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);

    private static final int NO_LIMIT = 0;

    private final Database db;

    public QueryBuilder(Database db) {
        this.db = db;
    }

    /**
     * All rows of the example's table matching {@code where}, ordered by key when
     * the shape has one. Empty list when nothing matches.
     */
    public List<EntityRow> list(EntityDescriptor example, Predicate where) {
        try (Connection conn = db.getConnection()) {
            return list(conn, example, where, NO_LIMIT, null);
        } catch (SQLException e) {
            throw new QueryException("Failed to list " + example.table() + " " + where, e);
        }
    }

    /**
     * Same as {@link #list(EntityDescriptor, Predicate)} on the caller's connection.
     *
     * @param limit   maximum rows, 0 for all
     * @param timeout statement timeout, null for none
     */
    public List<EntityRow> list(Connection conn, EntityDescriptor example, Predicate where, int limit,
            Duration timeout) throws SQLException {
        SqlFragment filter = where.compile();
        StringBuilder sql = new StringBuilder(selectSql(example, filter));
        if (example.hasPrimaryKey()) {
            sql.append(" ORDER BY ").append(example.primaryKey().column());
        }
        if (limit > 0) {
            sql.append(" LIMIT ").append(limit);
        }

        log.debug("list: {} {}", sql, filter.params());
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            setQueryTimeout(ps, timeout);
            bindAll(ps, 1, filter.params());
            List<EntityRow> rows = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs, example));
                }
            }
            return rows;
        }
    }

    /**
     * Number of rows matching {@code where}.
     */
    public int count(EntityDescriptor example, Predicate where) {
        SqlFragment filter = where.compile();
        String sql = "SELECT COUNT(*) FROM " + example.table() + whereClause(filter);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            bindAll(ps, 1, filter.params());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new QueryException("Failed to count " + example.table() + " " + where, e);
        }
    }

    /**
     * The row with primary key {@code key}, with every readable column of the example filled.
     *
     * @throws NotFoundException if no row has that key
     */
    public EntityRow loadByKey(EntityDescriptor example, Object key) {
        try (Connection conn = db.getConnection()) {
            return loadByKey(conn, example, key, null);
        } catch (SQLException e) {
            throw new QueryException("Failed to load " + example.table() + " " + key, e);
        }
    }

    /**
     * Fill the readable columns of {@code keyed}, whose key must be set. Returns a new row.
     */
    public EntityRow loadByKey(EntityRow keyed) {
        return loadByKey(keyed.descriptor(), keyed.key());
    }

    public EntityRow loadByKey(Connection conn, EntityDescriptor example, Object key, Duration timeout)
            throws SQLException {
        FieldBinding pk = example.primaryKey();
        if (key == null || !pk.type().accepts(key)) {
            throw new SchemaException("Invalid key " + key + " for " + example.table() + "." + pk.column());
        }
        String sql = selectSql(example, new SqlFragment(pk.column() + " = ?", List.of()));

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            setQueryTimeout(ps, timeout);
            pk.type().bind(conn, ps, 1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new NotFoundException(example.table(), key);
                }
                return mapRow(rs, example);
            }
        }
    }

    /**
     * Insert the writable columns of {@code row}, plus its key when set.
     *
     * @return the row's key, database-generated when the row had none
     */
    public Object insert(EntityRow row) {
        EntityDescriptor shape = row.descriptor();
        FieldBinding pk = shape.hasPrimaryKey() ? shape.primaryKey() : null;

        List<FieldBinding> columns = new ArrayList<>();
        for (FieldBinding binding : shape.bindings()) {
            boolean suppliedKey = binding.isPrimaryKey() && row.get(binding.column()) != null;
            if (binding.isWritable() || suppliedKey) {
                columns.add(binding);
            }
        }
        boolean generatedKey = pk != null && !columns.contains(pk);

        StringBuilder sql = new StringBuilder("INSERT INTO ").append(shape.table()).append(" (");
        StringBuilder values = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            sql.append(i == 0 ? "" : ", ").append(columns.get(i).column());
            values.append(i == 0 ? "?" : ", ?");
        }
        sql.append(") VALUES (").append(values).append(')');

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = generatedKey
                    ? conn.prepareStatement(sql.toString(), new String[] { pk.column() })
                    : conn.prepareStatement(sql.toString())) {

                for (int i = 0; i < columns.size(); i++) {
                    FieldBinding binding = columns.get(i);
                    binding.type().bind(conn, ps, i + 1, row.get(binding.column()));
                }
                ps.executeUpdate();

                Object key = pk == null ? null : row.get(pk.column());
                if (generatedKey) {
                    try (ResultSet keys = ps.getGeneratedKeys()) {
                        if (keys.next()) {
                            key = toKey(pk.type(), keys.getObject(1));
                        }
                    }
                }
                conn.commit();
                log.debug("Inserted {} {}", shape.table(), key);
                return key;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new QueryException("Failed to insert into " + shape.table(), e);
        }
    }

    /**
     * Write the writable columns of {@code row} to the row with the same key.
     *
     * @return number of rows changed, 0 if the key does not exist
     */
    public int update(EntityRow row) {
        EntityDescriptor shape = row.descriptor();
        Object key = row.key();
        if (key == null) {
            throw new SchemaException("Cannot update " + shape.table() + " without a key");
        }

        EntityRow changes = shape.newRow();
        for (FieldBinding binding : shape.bindings()) {
            if (binding.isWritable() && !binding.isPrimaryKey()) {
                changes.set(binding.column(), row.get(binding.column()));
            }
        }
        return updateWhere(changes, Predicate.eq(shape.primaryKey().column(), key));
    }

    /**
     * Set every column present in {@code changes} on the rows matching {@code where}.
     *
     * @return number of rows changed
     */
    public int updateWhere(EntityRow changes, Predicate where) {
        try (Connection conn = db.getConnection()) {
            try {
                int updated = updateWhere(conn, changes, where, null);
                conn.commit();
                return updated;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new QueryException("Failed to update " + changes.descriptor().table() + " " + where, e);
        }
    }

    public int updateWhere(Connection conn, EntityRow changes, Predicate where, Duration timeout)
            throws SQLException {
        EntityDescriptor shape = changes.descriptor();
        List<FieldBinding> columns = new ArrayList<>();
        for (FieldBinding binding : shape.bindings()) {
            if (changes.has(binding.column()) && !binding.isPrimaryKey()) {
                columns.add(binding);
            }
        }
        if (columns.isEmpty()) {
            return 0;
        }

        SqlFragment filter = where.compile();
        StringBuilder sql = new StringBuilder("UPDATE ").append(shape.table()).append(" SET ");
        for (int i = 0; i < columns.size(); i++) {
            sql.append(i == 0 ? "" : ", ").append(columns.get(i).column()).append(" = ?");
        }
        sql.append(whereClause(filter));

        log.debug("update: {} {}", sql, filter.params());
        try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            setQueryTimeout(ps, timeout);
            for (int i = 0; i < columns.size(); i++) {
                FieldBinding binding = columns.get(i);
                binding.type().bind(conn, ps, i + 1, changes.get(binding.column()));
            }
            bindAll(ps, columns.size() + 1, filter.params());
            return ps.executeUpdate();
        }
    }

    // Helper methods

    private static String selectSql(EntityDescriptor example, SqlFragment filter) {
        List<String> columns = example.readableColumns();
        if (columns.isEmpty()) {
            throw new SchemaException("Nothing to read from " + example.table());
        }
        return "SELECT " + String.join(", ", columns) + " FROM " + example.table() + whereClause(filter);
    }

    private static String whereClause(SqlFragment filter) {
        return filter.isEmpty() ? "" : " WHERE " + filter.text();
    }

    private static EntityRow mapRow(ResultSet rs, EntityDescriptor example) throws SQLException {
        EntityRow row = example.newRow();
        for (FieldBinding binding : example.bindings()) {
            if (binding.isReadable()) {
                row.set(binding.column(), binding.type().read(rs, binding.column()));
            }
        }
        return row;
    }

    private static void bindAll(PreparedStatement ps, int first, List<Object> params) throws SQLException {
        int index = first;
        for (Object param : params) {
            if (param instanceof Instant instant) {
                ps.setObject(index++, ColumnType.utc(instant));
            } else {
                ps.setObject(index++, param);
            }
        }
    }

    private static Object toKey(ColumnType type, Object generated) {
        if (generated instanceof Number n) {
            return switch (type) {
                case INTEGER -> n.intValue();
                case BIGINT -> n.longValue();
                default -> generated;
            };
        }
        return generated;
    }

    private static void setQueryTimeout(Statement st, Duration timeout) throws SQLException {
        if (timeout != null) {
            long seconds = Math.max(1, (timeout.toMillis() + 999) / 1000);
            st.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
        }
    }
}
