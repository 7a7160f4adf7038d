package in.pollwall.domain.poll;

import com.fasterxml.jackson.annotation.JsonView;
import in.pollwall.domain.user.User;
import in.pollwall.util.Json;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read snapshot of a poll aggregate.
 *
 * Counters are recomputed from relation rows under the poll row lock, so a snapshot
 * taken inside the mutating transaction reflects exactly the committed state.
 * {@code myVoteOptionId} is viewer-specific: responses always carry it (null when the
 * viewer has not voted), the event stream never does.
 */
public record Poll(
    String id,
    String title,
    String description,
    Instant pollExpiresAt,
    int likes,
    int dislikes,
    Instant createdAt,
    Instant updatedAt,
    String createdBy,
    User creator,
    List<PollOption> options,
    List<User> likedBy,
    List<User> dislikedBy,
    @JsonView(Json.Views.Viewer.class) String myVoteOptionId
) {
    public Poll {
        options = options == null ? List.of() : List.copyOf(options);
        likedBy = likedBy == null ? List.of() : List.copyOf(likedBy);
        dislikedBy = dislikedBy == null ? List.of() : List.copyOf(dislikedBy);
    }

    public Poll withViewerVote(String optionId) {
        return new Poll(id, title, description, pollExpiresAt, likes, dislikes, createdAt, updatedAt,
            createdBy, creator, options, likedBy, dislikedBy, optionId);
    }

    public Optional<PollOption> option(String optionId) {
        return options.stream().filter(o -> o.id().equals(optionId)).findFirst();
    }

    public boolean isOwnedBy(String userId) {
        return createdBy != null && createdBy.equals(userId);
    }
}
