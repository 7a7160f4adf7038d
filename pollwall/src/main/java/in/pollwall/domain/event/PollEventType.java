package in.pollwall.domain.event;

/**
 * Poll lifecycle event types. The wire name is the SSE {@code event:} field.
 */
public enum PollEventType {
    POLL_CREATED("poll_created"),
    POLL_UPDATED("poll_updated"),
    POLL_DELETED("poll_deleted");

    private final String wireName;

    PollEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
