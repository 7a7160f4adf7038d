package in.pollwall.domain.error;

/**
 * The caller is authenticated but not allowed to act on the poll.
 */
public class ForbiddenOperationException extends DomainException {

    private final String userId;
    private final String pollId;

    public ForbiddenOperationException(String userId, String pollId, String operation) {
        super(String.format("User %s is not allowed to %s poll %s", userId, operation, pollId));
        this.userId = userId;
        this.pollId = pollId;
    }

    public String getUserId() {
        return userId;
    }

    public String getPollId() {
        return pollId;
    }

    @Override
    public int httpStatus() {
        return 403;
    }
}
