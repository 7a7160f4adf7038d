package in.pollwall.domain.poll;

import java.time.Instant;

/**
 * Vote fact row. At most one exists per (user, poll); revoting reassigns the option in place.
 */
public record Vote(
    String id,
    String userId,
    String pollId,
    String optionId,
    Instant createdAt
) {
    public Vote withOption(String newOptionId) {
        return new Vote(id, userId, pollId, newOptionId, createdAt);
    }
}
