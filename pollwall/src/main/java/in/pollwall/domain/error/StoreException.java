package in.pollwall.domain.error;

/**
 * Non-retryable store failure.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
