package in.pollwall.domain.error;

/**
 * Authenticated, but the operation is reserved for admins.
 */
public class AdminRequiredException extends DomainException {

    private final String userId;

    public AdminRequiredException(String userId) {
        super("The user doesn't have enough privileges");
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public int httpStatus() {
        return 403;
    }
}
