package objectsdb.schema;

import objectsdb.SchemaException;

import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JDBC mapping of one column's value slot.
 * Array columns are exposed as unmodifiable lists.
 */
public enum ColumnType {

    INTEGER(Integer.class) {
        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setInt(index, (Integer) value);
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            int value = rs.getInt(column);
            return rs.wasNull() ? null : value;
        }
    },

    BIGINT(Long.class) {
        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setLong(index, (Long) value);
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            long value = rs.getLong(column);
            return rs.wasNull() ? null : value;
        }
    },

    DOUBLE(Double.class) {
        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setDouble(index, (Double) value);
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            double value = rs.getDouble(column);
            return rs.wasNull() ? null : value;
        }
    },

    TEXT(String.class) {
        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setString(index, (String) value);
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            return rs.getString(column);
        }
    },

    BOOLEAN(Boolean.class) {
        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setBoolean(index, (Boolean) value);
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            boolean value = rs.getBoolean(column);
            return rs.wasNull() ? null : value;
        }
    },

    /**
     * Stored as {@code TIMESTAMP WITH TIME ZONE} and always written in UTC, so the
     * JVM's default zone never shifts the stored instant.
     */
    TIMESTAMP(Instant.class) {
        @Override
        void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
            ps.setObject(index, utc((Instant) value));
        }

        @Override
        public Object read(ResultSet rs, String column) throws SQLException {
            OffsetDateTime ts = rs.getObject(column, OffsetDateTime.class);
            return ts != null ? ts.toInstant() : null;
        }
    },

    INTEGER_ARRAY(List.class, "integer") {
        @Override
        Object element(Object raw) {
            return ((Number) raw).intValue();
        }
    },

    DOUBLE_ARRAY(List.class, "float8") {
        @Override
        Object element(Object raw) {
            return ((Number) raw).doubleValue();
        }
    },

    TEXT_ARRAY(List.class, "varchar") {
        @Override
        Object element(Object raw) {
            return raw.toString();
        }
    };

    private final Class<?> javaType;
    private final String elementTypeName;

    ColumnType(Class<?> javaType) {
        this(javaType, null);
    }

    ColumnType(Class<?> javaType, String elementTypeName) {
        this.javaType = javaType;
        this.elementTypeName = elementTypeName;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public boolean isArray() {
        return elementTypeName != null;
    }

    /**
     * Whether {@code value} can be stored in a column of this type. Null always fits.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        if (!javaType.isInstance(value)) {
            return false;
        }
        if (isArray()) {
            for (Object e : (List<?>) value) {
                if (e == null) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Bind {@code value} (possibly null) to parameter {@code index}.
     */
    public void bind(Connection conn, PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType());
        } else if (isArray()) {
            Array array = conn.createArrayOf(elementTypeName, ((List<?>) value).toArray());
            ps.setArray(index, array);
        } else {
            bindValue(ps, index, value);
        }
    }

    /**
     * Read this column's value from the current row, null for SQL NULL.
     */
    public Object read(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return null;
        }
        try {
            Object[] raw = (Object[]) array.getArray();
            List<Object> values = new ArrayList<>(raw.length);
            for (Object e : raw) {
                if (e == null) {
                    throw new SchemaException("Array column " + column + " holds a NULL element");
                }
                values.add(element(e));
            }
            return Collections.unmodifiableList(values);
        } finally {
            array.free();
        }
    }

    /**
     * UTC form of an instant, the way timestamps are handed to the driver.
     */
    public static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        throw new UnsupportedOperationException(name() + " is bound as an array");
    }

    Object element(Object raw) {
        throw new UnsupportedOperationException(name() + " has no elements");
    }

    private int sqlType() {
        return switch (this) {
            case INTEGER -> Types.INTEGER;
            case BIGINT -> Types.BIGINT;
            case DOUBLE -> Types.DOUBLE;
            case TEXT -> Types.VARCHAR;
            case BOOLEAN -> Types.BOOLEAN;
            case TIMESTAMP -> Types.TIMESTAMP_WITH_TIMEZONE;
            case INTEGER_ARRAY, DOUBLE_ARRAY, TEXT_ARRAY -> Types.ARRAY;
        };
    }
}
