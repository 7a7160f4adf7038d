package in.pollwall.service.event;

import in.pollwall.domain.event.PollEvent;
import in.pollwall.domain.event.PollEventType;
import in.pollwall.infrastructure.metrics.PollMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process broadcast hub for poll lifecycle events.
 *
 * Every subscriber owns a bounded queue. {@link #publish} never blocks: when a queue is
 * full its oldest event is evicted to make room, so a stalled reader only ever holds
 * the newest {@code maxQueueSize} events. The membership lock is held just long enough
 * to copy the subscriber set; fan-out runs without it.
 *
 * Nothing is persisted. Subscribers see only events published while they are registered.
 */
public final class PollEventBus {
    private static final Logger log = LoggerFactory.getLogger(PollEventBus.class);

    public static final int DEFAULT_MAX_QUEUE_SIZE = 100;

    // Queued by Subscription.close() to wake a blocked reader; never handed out
    private static final PollEvent CLOSED =
        new PollEvent(PollEventType.POLL_DELETED, Map.of(), Instant.EPOCH);

    private final int maxQueueSize;
    private final PollMetrics metrics;
    private final AtomicLong subscriptionSeq = new AtomicLong(0);

    private final ReentrantLock membershipLock = new ReentrantLock();
    // guarded by membershipLock
    private final Set<Subscription> subscribers = new LinkedHashSet<>();

    public PollEventBus(int maxQueueSize, PollMetrics metrics) {
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("maxQueueSize must be positive: " + maxQueueSize);
        }
        this.maxQueueSize = maxQueueSize;
        this.metrics = metrics;
    }

    /**
     * Register a new subscriber. The returned handle must be closed to deregister.
     */
    public Subscription subscribe() {
        Subscription subscription = new Subscription(subscriptionSeq.incrementAndGet(), maxQueueSize);
        int count;
        membershipLock.lock();
        try {
            subscribers.add(subscription);
            count = subscribers.size();
            metrics.setActiveSubscribers(count);
        } finally {
            membershipLock.unlock();
        }
        log.debug("[EventBus] Subscriber #{} registered ({} active)", subscription.id(), count);
        return subscription;
    }

    /**
     * Fan the event out to every currently registered subscriber.
     */
    public void publish(PollEvent event) {
        List<Subscription> snapshot;
        membershipLock.lock();
        try {
            snapshot = new ArrayList<>(subscribers);
        } finally {
            membershipLock.unlock();
        }

        int delivered = 0;
        for (Subscription subscription : snapshot) {
            if (subscription.offer(event)) {
                delivered++;
            }
        }
        metrics.recordEventPublished(event.type().wireName(), delivered);
        log.debug("[EventBus] {} for {} delivered to {} subscribers",
            event.type().wireName(), event.pollId(), delivered);
    }

    public int subscriberCount() {
        membershipLock.lock();
        try {
            return subscribers.size();
        } finally {
            membershipLock.unlock();
        }
    }

    public int maxQueueSize() {
        return maxQueueSize;
    }

    private void unregister(Subscription subscription) {
        int count;
        membershipLock.lock();
        try {
            subscribers.remove(subscription);
            count = subscribers.size();
            metrics.setActiveSubscribers(count);
        } finally {
            membershipLock.unlock();
        }
        log.debug("[EventBus] Subscriber #{} closed ({} active, {} dropped)",
            subscription.id(), count, subscription.droppedCount());
    }

    /**
     * One subscriber's view of the bus: a bounded FIFO of events published since
     * registration. Not restartable; once closed it receives nothing further.
     */
    public final class Subscription implements AutoCloseable {
        private final long id;
        private final ArrayBlockingQueue<PollEvent> queue;
        private final AtomicLong dropped = new AtomicLong(0);
        private volatile boolean closed;

        private Subscription(long id, int capacity) {
            this.id = id;
            this.queue = new ArrayBlockingQueue<>(capacity);
        }

        public long id() {
            return id;
        }

        /**
         * Next event, waiting up to {@code timeout}.
         *
         * @return the event, or null on timeout or when closed; a reader blocked
         *         here returns as soon as the subscription is closed
         */
        public PollEvent poll(Duration timeout) throws InterruptedException {
            if (closed) {
                return null;
            }
            PollEvent event = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (event == CLOSED) {
                // pass the wake-up on to any other blocked reader
                queue.offer(CLOSED);
                return null;
            }
            return closed ? null : event;
        }

        public int pending() {
            return closed ? 0 : queue.size();
        }

        public long droppedCount() {
            return dropped.get();
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            unregister(this);
            queue.clear();
            while (!queue.offer(CLOSED)) {
                queue.poll();
            }
        }

        // Drop-oldest enqueue. A null poll means a reader emptied the queue in between.
        private boolean offer(PollEvent event) {
            if (closed) {
                return false;
            }
            while (!queue.offer(event)) {
                PollEvent evicted = queue.poll();
                if (evicted != null && evicted != CLOSED) {
                    dropped.incrementAndGet();
                    metrics.recordEventDropped();
                }
            }
            return true;
        }
    }
}
