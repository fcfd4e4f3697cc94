package objectsdb.schema;

import objectsdb.SchemaException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Values of one row, shaped by an {@link EntityDescriptor}.
 * Not thread-safe; a row belongs to the call that produced it.
 */
public final class EntityRow {

    private final EntityDescriptor descriptor;
    private final Map<String, Object> values = new LinkedHashMap<>();

    EntityRow(EntityDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    public EntityDescriptor descriptor() {
        return descriptor;
    }

    /**
     * @throws SchemaException on an unknown column or a value of the wrong type
     */
    public EntityRow set(String column, Object value) {
        FieldBinding binding = descriptor.requireBinding(column);
        if (!binding.type().accepts(value)) {
            throw new SchemaException("Column " + descriptor.table() + "." + column + " of type "
                    + binding.type() + " cannot hold " + value.getClass().getSimpleName());
        }
        if (value instanceof List<?> list) {
            value = List.copyOf(list);
        }
        values.put(column, value);
        return this;
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        descriptor.requireBinding(column);
        return values.get(column);
    }

    public Object key() {
        return values.get(descriptor.primaryKey().column());
    }

    public EntityRow key(Object key) {
        return set(descriptor.primaryKey().column(), key);
    }

    public Integer getInt(String column) {
        return (Integer) get(column);
    }

    public Long getLong(String column) {
        return (Long) get(column);
    }

    public Double getDouble(String column) {
        return (Double) get(column);
    }

    public String getString(String column) {
        return (String) get(column);
    }

    public Boolean getBoolean(String column) {
        return (Boolean) get(column);
    }

    public Instant getInstant(String column) {
        return (Instant) get(column);
    }

    @SuppressWarnings("unchecked")
    public <E> List<E> getList(String column) {
        List<E> list = (List<E>) get(column);
        return list != null ? list : List.of();
    }

    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityRow that))
            return false;
        return descriptor.table().equals(that.descriptor.table()) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptor.table(), values);
    }

    @Override
    public String toString() {
        return descriptor.table() + values;
    }
}
