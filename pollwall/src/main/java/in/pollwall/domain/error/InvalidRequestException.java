package in.pollwall.domain.error;

/**
 * Malformed or semantically invalid request input.
 */
public class InvalidRequestException extends DomainException {

    public InvalidRequestException(String message) {
        super(message);
    }

    @Override
    public int httpStatus() {
        return 422;
    }
}
