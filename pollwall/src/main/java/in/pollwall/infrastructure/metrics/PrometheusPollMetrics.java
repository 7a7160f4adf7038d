package in.pollwall.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of PollMetrics.
 *
 * Metrics:
 * - pollwall_events_published_total{type}
 * - pollwall_event_deliveries_total{type}
 * - pollwall_events_dropped_total
 * - pollwall_stream_subscribers
 * - pollwall_mutations_total{action, outcome}
 * - pollwall_mutation_latency_seconds{action}
 * - pollwall_tx_retries_total{transaction, sql_state}
 * - pollwall_rate_limited_total{endpoint}
 */
public class PrometheusPollMetrics implements PollMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusPollMetrics.class);

    private final CollectorRegistry registry;

    private final Counter eventsPublished;
    private final Counter eventDeliveries;
    private final Counter eventsDropped;
    private final Gauge subscribers;
    private final Counter mutations;
    private final Histogram mutationLatency;
    private final Counter txRetries;
    private final Counter rateLimited;

    public PrometheusPollMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusPollMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.eventsPublished = Counter.build()
            .name("pollwall_events_published_total")
            .help("Poll events handed to the event bus")
            .labelNames("type")
            .register(registry);

        this.eventDeliveries = Counter.build()
            .name("pollwall_event_deliveries_total")
            .help("Poll events enqueued on subscriber queues")
            .labelNames("type")
            .register(registry);

        this.eventsDropped = Counter.build()
            .name("pollwall_events_dropped_total")
            .help("Events evicted from full subscriber queues")
            .register(registry);

        this.subscribers = Gauge.build()
            .name("pollwall_stream_subscribers")
            .help("Currently registered stream subscribers")
            .register(registry);

        this.mutations = Counter.build()
            .name("pollwall_mutations_total")
            .help("Poll mutations by action and outcome")
            .labelNames("action", "outcome")
            .register(registry);

        this.mutationLatency = Histogram.build()
            .name("pollwall_mutation_latency_seconds")
            .help("Poll mutation latency in seconds, row lock wait included")
            .labelNames("action")
            .buckets(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0)
            .register(registry);

        this.txRetries = Counter.build()
            .name("pollwall_tx_retries_total")
            .help("Transactions retried after a transient store failure")
            .labelNames("transaction", "sql_state")
            .register(registry);

        this.rateLimited = Counter.build()
            .name("pollwall_rate_limited_total")
            .help("Requests rejected by a rate limiter")
            .labelNames("endpoint")
            .register(registry);

        log.info("[PrometheusPollMetrics] Registered poll metrics");
    }

    @Override
    public void recordEventPublished(String eventType, int deliveredTo) {
        eventsPublished.labels(eventType).inc();
        if (deliveredTo > 0) {
            eventDeliveries.labels(eventType).inc(deliveredTo);
        }
    }

    @Override
    public void recordEventDropped() {
        eventsDropped.inc();
    }

    @Override
    public void setActiveSubscribers(int count) {
        subscribers.set(count);
    }

    @Override
    public void recordMutation(String action, String outcome, Duration latency) {
        mutations.labels(action, outcome).inc();
        mutationLatency.labels(action).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordTransactionRetry(String transaction, String sqlState) {
        txRetries.labels(transaction, sqlState == null ? "unknown" : sqlState).inc();
    }

    @Override
    public void recordRateLimited(String endpoint) {
        rateLimited.labels(endpoint).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
