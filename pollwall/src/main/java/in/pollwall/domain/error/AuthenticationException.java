package in.pollwall.domain.error;

/**
 * Missing, invalid or expired credentials.
 */
public class AuthenticationException extends DomainException {

    public AuthenticationException(String message) {
        super(message);
    }

    @Override
    public int httpStatus() {
        return 401;
    }
}
