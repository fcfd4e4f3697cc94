package objectsdb;

/**
 * Malformed entity descriptor or a value that does not fit its column.
 * Always a programming error, never retried.
 */
public class SchemaException extends ObjectsDatabaseException {

    public SchemaException(String message) {
        super(message);
    }
}
