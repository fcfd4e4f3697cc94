package objectsdb;

/**
 * Store-side failure during the atomic task claim. The claim transaction has
 * been rolled back, so the call is safe to retry.
 */
public class ClaimException extends ObjectsDatabaseException {

    public ClaimException(String message, Throwable cause) {
        super(message, cause);
    }
}
