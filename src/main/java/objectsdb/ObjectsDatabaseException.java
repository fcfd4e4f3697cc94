package objectsdb;

/**
 * Base class of every failure raised by the objects database layer.
 */
public class ObjectsDatabaseException extends RuntimeException {

    public ObjectsDatabaseException(String message) {
        super(message);
    }

    public ObjectsDatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
