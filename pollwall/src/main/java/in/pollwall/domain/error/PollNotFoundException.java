package in.pollwall.domain.error;

/**
 * Thrown when a poll id does not resolve to a row.
 */
public class PollNotFoundException extends DomainException {

    private final String pollId;

    public PollNotFoundException(String pollId) {
        super(String.format("Poll not found: %s", pollId));
        this.pollId = pollId;
    }

    public String getPollId() {
        return pollId;
    }

    @Override
    public int httpStatus() {
        return 404;
    }
}
