package objectsdb;

/**
 * Store-side failure while reading or writing rows: lost connection,
 * malformed predicate fragment, execution error. Idempotent reads may be retried.
 */
public class QueryException extends ObjectsDatabaseException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
