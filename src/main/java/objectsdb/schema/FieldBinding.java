package objectsdb.schema;

import objectsdb.SchemaException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Mapping between one value slot and one database column.
 * Immutable: the mark/with methods return a new binding.
 */
public final class FieldBinding {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String column;
    private final ColumnType type;
    private final boolean readable;
    private final boolean writable;
    private final boolean primaryKey;

    private FieldBinding(String column, ColumnType type, boolean readable, boolean writable, boolean primaryKey) {
        this.column = requireIdentifier(column);
        this.type = Objects.requireNonNull(type, "type is required");
        this.readable = readable || primaryKey;
        this.writable = writable;
        this.primaryKey = primaryKey;
    }

    /** A plain column, read and written. */
    public static FieldBinding of(String column, ColumnType type) {
        return new FieldBinding(column, type, true, true, false);
    }

    /** A database-assigned key: readable, not written. */
    public static FieldBinding key(String column, ColumnType type) {
        return new FieldBinding(column, type, true, false, true);
    }

    public String column() {
        return column;
    }

    public ColumnType type() {
        return type;
    }

    public boolean isReadable() {
        return readable;
    }

    public boolean isWritable() {
        return writable;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    public FieldBinding markReadable() {
        return withReadable(true);
    }

    public FieldBinding markWritable() {
        return withWritable(true);
    }

    public FieldBinding markPrimaryKey() {
        return new FieldBinding(column, type, true, writable, true);
    }

    /**
     * Keys stay readable whatever is requested here.
     */
    public FieldBinding withReadable(boolean readable) {
        return new FieldBinding(column, type, readable, writable, primaryKey);
    }

    public FieldBinding withWritable(boolean writable) {
        return new FieldBinding(column, type, readable, writable, primaryKey);
    }

    static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new SchemaException("Not a valid SQL identifier: " + name);
        }
        return name;
    }

    /**
     * Check a caller-supplied table or column name before it is placed in SQL text.
     */
    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FieldBinding that))
            return false;
        return readable == that.readable && writable == that.writable && primaryKey == that.primaryKey
                && column.equals(that.column) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, type, readable, writable, primaryKey);
    }

    @Override
    public String toString() {
        return "FieldBinding{" + column + " " + type
                + (primaryKey ? " key" : "")
                + (readable ? " r" : "")
                + (writable ? " w" : "") + "}";
    }
}
