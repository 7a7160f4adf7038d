package in.pollwall.domain.event;

import in.pollwall.domain.poll.Poll;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable poll lifecycle notification.
 *
 * Payload shape:
 * <pre>
 * poll_created / poll_updated : {"poll": {...snapshot...}}
 * poll_deleted                : {"poll_id": "P..."}
 * </pre>
 */
public record PollEvent(PollEventType type, Map<String, Object> payload, Instant ts) {

    public PollEvent {
        Objects.requireNonNull(type, "type");
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        if (ts == null) ts = Instant.now();
    }

    public static PollEvent created(Poll poll) {
        return new PollEvent(PollEventType.POLL_CREATED, Map.of("poll", broadcastView(poll)), Instant.now());
    }

    public static PollEvent updated(Poll poll) {
        return new PollEvent(PollEventType.POLL_UPDATED, Map.of("poll", broadcastView(poll)), Instant.now());
    }

    public static PollEvent deleted(String pollId) {
        return new PollEvent(PollEventType.POLL_DELETED, Map.of("poll_id", pollId), Instant.now());
    }

    /**
     * Poll id this event refers to, whatever the payload shape.
     */
    public String pollId() {
        Object poll = payload.get("poll");
        if (poll instanceof Poll) {
            return ((Poll) poll).id();
        }
        Object id = payload.get("poll_id");
        return id != null ? id.toString() : null;
    }

    // Viewer-specific fields never go out on the broadcast channel
    private static Poll broadcastView(Poll poll) {
        Objects.requireNonNull(poll, "poll");
        return poll.myVoteOptionId() == null ? poll : poll.withViewerVote(null);
    }
}
