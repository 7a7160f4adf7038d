package in.pollwall.domain.error;

/**
 * Thrown when a vote names an option that does not exist or belongs to another poll.
 */
public class VoteValidationException extends DomainException {

    private final String pollId;
    private final String optionId;

    public VoteValidationException(String pollId, String optionId) {
        super(String.format("Option %s does not belong to poll %s", optionId, pollId));
        this.pollId = pollId;
        this.optionId = optionId;
    }

    public String getPollId() {
        return pollId;
    }

    public String getOptionId() {
        return optionId;
    }

    @Override
    public int httpStatus() {
        return 400;
    }
}
