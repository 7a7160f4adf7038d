package in.pollwall.auth;

import in.pollwall.domain.error.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding-window limiter for login attempts, keyed by client address.
 * In memory only; counts reset on restart.
 */
public final class LoginRateLimiter {

    private final int maxAttempts;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> attempts = new ConcurrentHashMap<>();

    public LoginRateLimiter(int maxAttempts, Duration window) {
        this(maxAttempts, window, Clock.systemUTC());
    }

    public LoginRateLimiter(int maxAttempts, Duration window, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Count one attempt for {@code key}.
     *
     * @throws RateLimitExceededException if the key already used up the window
     */
    public void acquire(String key) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        // compute() holds the key's bin, so eviction cannot detach the deque mid-update
        attempts.compute(key, (k, history) -> {
            Deque<Instant> live = history != null ? history : new ArrayDeque<>();
            prune(live, cutoff);
            if (live.size() >= maxAttempts) {
                long retryAfter = Math.max(1, Duration.between(cutoff, live.peekFirst()).toSeconds());
                throw new RateLimitExceededException(key, retryAfter);
            }
            live.addLast(now);
            return live;
        });
    }

    /**
     * Drop keys with no attempt inside the current window.
     */
    public void evictIdle() {
        Instant cutoff = clock.instant().minus(window);
        for (String key : attempts.keySet()) {
            attempts.computeIfPresent(key, (k, history) -> {
                prune(history, cutoff);
                return history.isEmpty() ? null : history;
            });
        }
    }

    int trackedKeys() {
        return attempts.size();
    }

    private static void prune(Deque<Instant> history, Instant cutoff) {
        while (!history.isEmpty() && !history.peekFirst().isAfter(cutoff)) {
            history.pollFirst();
        }
    }
}
