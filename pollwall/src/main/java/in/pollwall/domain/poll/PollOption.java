package in.pollwall.domain.poll;

/**
 * One answer of a poll. {@code votes} is derived from the vote rows that reference it.
 */
public record PollOption(String id, String text, int votes) {}
