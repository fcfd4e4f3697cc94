package objectsdb.store.mapping;

import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;

/**
 * Converts between a domain type and the rows of its table.
 */
public interface EntityMapper<T> {

    /** Full row shape of the table. */
    EntityDescriptor descriptor();

    T fromRow(EntityRow row);

    EntityRow toRow(T entity);
}
