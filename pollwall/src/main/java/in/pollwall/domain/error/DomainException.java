package in.pollwall.domain.error;

/**
 * Base for expected rejections of a request. These leave no state change behind and
 * map to a 4xx response.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    /**
     * HTTP status the transport layer answers with.
     */
    public abstract int httpStatus();
}
