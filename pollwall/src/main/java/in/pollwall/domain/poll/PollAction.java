package in.pollwall.domain.poll;

import java.util.Locale;
import java.util.Objects;

/**
 * A counter-affecting mutation on an existing poll.
 */
public record PollAction(Kind kind, String optionId) {

    public enum Kind { LIKE, DISLIKE, VOTE }

    public PollAction {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.VOTE && optionId == null) {
            throw new IllegalArgumentException("vote action requires an option id");
        }
    }

    public static PollAction like() {
        return new PollAction(Kind.LIKE, null);
    }

    public static PollAction dislike() {
        return new PollAction(Kind.DISLIKE, null);
    }

    public static PollAction vote(String optionId) {
        return new PollAction(Kind.VOTE, optionId);
    }

    public String label() {
        return kind.name().toLowerCase(Locale.ROOT);
    }
}
