package objectsdb;

/**
 * A load by primary key matched no row.
 */
public class NotFoundException extends ObjectsDatabaseException {

    private final String table;
    private final Object key;

    public NotFoundException(String table, Object key) {
        super("No row in " + table + " with key " + key);
        this.table = table;
        this.key = key;
    }

    public String table() {
        return table;
    }

    public Object key() {
        return key;
    }
}
