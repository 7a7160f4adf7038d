package in.pollwall.domain.error;

/**
 * Retryable store failure: serialization conflict, deadlock, lock timeout or a lost
 * connection. Raised only after the transaction has been rolled back.
 */
public class TransientStoreException extends RuntimeException {

    private final String sqlState;

    public TransientStoreException(String message, String sqlState, Throwable cause) {
        super(String.format("%s (SQLState %s)", message, sqlState), cause);
        this.sqlState = sqlState;
    }

    public String getSqlState() {
        return sqlState;
    }
}
