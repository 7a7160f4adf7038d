package in.pollwall.infrastructure.metrics;

import java.time.Duration;

/**
 * Poll service metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Events published per type and events dropped by slow subscribers
 * - Active stream subscribers
 * - Mutation outcomes and latency (lock wait included)
 * - Transaction retries on transient store failures
 */
public interface PollMetrics {

    /**
     * Record one event handed to the bus.
     *
     * @param eventType wire name, e.g. poll_updated
     * @param deliveredTo number of subscriber queues it was enqueued on
     */
    void recordEventPublished(String eventType, int deliveredTo);

    /**
     * Record an event evicted from a full subscriber queue.
     */
    void recordEventDropped();

    void setActiveSubscribers(int count);

    /**
     * Record a counter-affecting mutation.
     *
     * @param action like, dislike, vote, create or delete
     * @param outcome success, not_found, invalid, transient or error
     * @param latency end-to-end time including row lock wait
     */
    void recordMutation(String action, String outcome, Duration latency);

    void recordTransactionRetry(String transaction, String sqlState);

    void recordRateLimited(String endpoint);
}
