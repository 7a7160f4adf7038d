package in.pollwall.domain.poll;

import in.pollwall.domain.error.InvalidRequestException;

/**
 * Ordering for poll listings. Both orders are descending.
 */
public enum PollSort {
    CREATED_AT("created_at"),
    LIKES("likes");

    private final String wireName;

    PollSort(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static PollSort fromWire(String value) {
        if (value == null || value.isBlank()) {
            return CREATED_AT;
        }
        for (PollSort sort : values()) {
            if (sort.wireName.equalsIgnoreCase(value)) {
                return sort;
            }
        }
        throw new InvalidRequestException("sort_by must be one of created_at, likes");
    }
}
