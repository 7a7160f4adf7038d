package in.pollwall.domain.poll;

import in.pollwall.domain.error.InvalidRequestException;

/**
 * Sorted window over poll listings.
 */
public record PageRequest(PollSort sort, int limit, int offset) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public PageRequest {
        if (sort == null) sort = PollSort.CREATED_AT;
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new InvalidRequestException("offset must not be negative");
        }
    }

    public static PageRequest firstPage() {
        return new PageRequest(PollSort.CREATED_AT, DEFAULT_LIMIT, 0);
    }
}
