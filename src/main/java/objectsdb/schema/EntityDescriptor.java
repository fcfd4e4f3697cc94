package objectsdb.schema;

import objectsdb.SchemaException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Row shape of one table: an ordered set of field bindings.
 *
 * <p>Descriptors are immutable projection specs. A query "example" is derived
 * with {@link #select(String...)} or {@link #writing(String...)} instead of
 * flipping flags on a shared instance, so concurrent queries never see each
 * other's shape.
 */
public final class EntityDescriptor {

    private final String table;
    private final Map<String, FieldBinding> bindings;

    private EntityDescriptor(String table, List<FieldBinding> bindings) {
        this.table = FieldBinding.requireIdentifier(table);
        Map<String, FieldBinding> byColumn = new LinkedHashMap<>();
        for (FieldBinding binding : bindings) {
            if (byColumn.put(binding.column(), binding) != null) {
                throw new SchemaException("Duplicate column " + binding.column() + " in " + table);
            }
        }
        this.bindings = Collections.unmodifiableMap(byColumn);
    }

    public static Builder builder(String table) {
        return new Builder(table);
    }

    public static EntityDescriptor of(String table, List<FieldBinding> bindings) {
        return new EntityDescriptor(table, bindings);
    }

    public String table() {
        return table;
    }

    public List<FieldBinding> bindings() {
        return List.copyOf(bindings.values());
    }

    public Optional<FieldBinding> binding(String column) {
        return Optional.ofNullable(bindings.get(column));
    }

    /**
     * @throws SchemaException if the column is not part of this shape
     */
    public FieldBinding requireBinding(String column) {
        FieldBinding binding = bindings.get(column);
        if (binding == null) {
            throw new SchemaException("Unknown column " + column + " in " + table);
        }
        return binding;
    }

    public List<String> readableColumns() {
        List<String> columns = new ArrayList<>();
        for (FieldBinding binding : bindings.values()) {
            if (binding.isReadable()) {
                columns.add(binding.column());
            }
        }
        return columns;
    }

    public List<String> writableColumns() {
        List<String> columns = new ArrayList<>();
        for (FieldBinding binding : bindings.values()) {
            if (binding.isWritable()) {
                columns.add(binding.column());
            }
        }
        return columns;
    }

    public boolean hasPrimaryKey() {
        return bindings.values().stream().filter(FieldBinding::isPrimaryKey).count() == 1;
    }

    /**
     * The single primary-key binding.
     *
     * @throws SchemaException if zero or several bindings are marked as key
     */
    public FieldBinding primaryKey() {
        FieldBinding key = null;
        for (FieldBinding binding : bindings.values()) {
            if (binding.isPrimaryKey()) {
                if (key != null) {
                    throw new SchemaException("Several primary keys in " + table + ": "
                            + key.column() + ", " + binding.column());
                }
                key = binding;
            }
        }
        if (key == null) {
            throw new SchemaException("No primary key in " + table);
        }
        return key;
    }

    /**
     * Example that reads only {@code columns} (the key is always read).
     * Writability is left as it is.
     */
    public EntityDescriptor select(String... columns) {
        Set<String> wanted = requireColumns(columns);
        List<FieldBinding> projected = new ArrayList<>();
        for (FieldBinding binding : bindings.values()) {
            projected.add(binding.withReadable(wanted.contains(binding.column())));
        }
        return new EntityDescriptor(table, projected);
    }

    /**
     * Example that writes only {@code columns}.
     */
    public EntityDescriptor writing(String... columns) {
        Set<String> wanted = requireColumns(columns);
        List<FieldBinding> projected = new ArrayList<>();
        for (FieldBinding binding : bindings.values()) {
            projected.add(binding.withWritable(wanted.contains(binding.column())));
        }
        return new EntityDescriptor(table, projected);
    }

    public EntityRow newRow() {
        return new EntityRow(this);
    }

    private Set<String> requireColumns(String... columns) {
        Set<String> wanted = new LinkedHashSet<>(Arrays.asList(columns));
        for (String column : wanted) {
            requireBinding(column);
        }
        return wanted;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityDescriptor that))
            return false;
        return table.equals(that.table) && bindings().equals(that.bindings());
    }

    @Override
    public int hashCode() {
        return table.hashCode() * 31 + bindings().hashCode();
    }

    @Override
    public String toString() {
        return "EntityDescriptor{" + table + " " + bindings.values() + "}";
    }

    public static final class Builder {
        private final String table;
        private final List<FieldBinding> bindings = new ArrayList<>();

        private Builder(String table) {
            this.table = table;
        }

        /** Database-assigned primary key. */
        public Builder key(String column, ColumnType type) {
            bindings.add(FieldBinding.key(column, type));
            return this;
        }

        /** Primary key supplied by the caller on insert. */
        public Builder naturalKey(String column, ColumnType type) {
            bindings.add(FieldBinding.key(column, type).markWritable());
            return this;
        }

        public Builder column(String column, ColumnType type) {
            bindings.add(FieldBinding.of(column, type));
            return this;
        }

        public Builder binding(FieldBinding binding) {
            bindings.add(binding);
            return this;
        }

        public EntityDescriptor build() {
            return new EntityDescriptor(table, bindings);
        }
    }
}
