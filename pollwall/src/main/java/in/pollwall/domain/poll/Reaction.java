package in.pollwall.domain.poll;

/**
 * Like state a user can hold on a poll. The two values are mutually exclusive.
 */
public enum Reaction {
    LIKE,
    DISLIKE;

    public Reaction opposite() {
        return this == LIKE ? DISLIKE : LIKE;
    }
}
