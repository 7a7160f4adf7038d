package in.pollwall.service.event;

import in.pollwall.domain.event.PollEvent;
import in.pollwall.domain.event.PollEventType;
import in.pollwall.domain.poll.Poll;
import in.pollwall.domain.poll.PollOption;
import in.pollwall.infrastructure.metrics.PrometheusPollMetrics;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PollEventBusTest {

    private static final Duration WAIT = Duration.ofMillis(200);

    private CollectorRegistry registry;
    private PollEventBus bus;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        bus = new PollEventBus(3, new PrometheusPollMetrics(registry));
    }

    @Test
    void publishWithoutSubscribersIsNoOp() {
        assertDoesNotThrow(() -> bus.publish(PollEvent.deleted("P1")));
        assertEquals(0, bus.subscriberCount());
        assertEquals(1.0, registry.getSampleValue("pollwall_events_published_total",
            new String[]{"type"}, new String[]{"poll_deleted"}));
    }

    @Test
    void slowSubscriberKeepsNewestEventsInOrder() throws Exception {
        PollEventBus.Subscription subscription = bus.subscribe();

        for (int i = 1; i <= 10; i++) {
            bus.publish(PollEvent.deleted("P" + i));
        }

        assertEquals(3, subscription.pending(), "Queue should stay at capacity");
        assertEquals(7, subscription.droppedCount(), "Oldest events should have been evicted");
        assertEquals("P8", subscription.poll(WAIT).pollId());
        assertEquals("P9", subscription.poll(WAIT).pollId());
        assertEquals("P10", subscription.poll(WAIT).pollId());
        assertNull(subscription.poll(Duration.ofMillis(20)));
        assertEquals(7.0, registry.getSampleValue("pollwall_events_dropped_total"));
    }

    @Test
    void everySubscriberReceivesEveryEvent() throws Exception {
        PollEventBus.Subscription first = bus.subscribe();
        PollEventBus.Subscription second = bus.subscribe();

        bus.publish(PollEvent.deleted("P1"));
        bus.publish(PollEvent.deleted("P2"));

        for (PollEventBus.Subscription s : List.of(first, second)) {
            assertEquals("P1", s.poll(WAIT).pollId());
            assertEquals("P2", s.poll(WAIT).pollId());
        }
        assertEquals(4.0, registry.getSampleValue("pollwall_event_deliveries_total",
            new String[]{"type"}, new String[]{"poll_deleted"}));
    }

    @Test
    void subscriberSeesOnlyEventsPublishedAfterJoining() throws Exception {
        bus.publish(PollEvent.deleted("before"));
        PollEventBus.Subscription subscription = bus.subscribe();
        bus.publish(PollEvent.deleted("after"));

        assertEquals("after", subscription.poll(WAIT).pollId());
        assertNull(subscription.poll(Duration.ofMillis(20)));
    }

    @Test
    void closeDeregistersAndStopsDelivery() throws Exception {
        PollEventBus.Subscription subscription = bus.subscribe();
        assertEquals(1, bus.subscriberCount());
        assertEquals(1.0, registry.getSampleValue("pollwall_stream_subscribers"));

        subscription.close();
        subscription.close();

        assertTrue(subscription.isClosed());
        assertEquals(0, bus.subscriberCount());
        assertEquals(0.0, registry.getSampleValue("pollwall_stream_subscribers"));

        bus.publish(PollEvent.deleted("P1"));
        assertNull(subscription.poll(Duration.ofMillis(20)));
        assertEquals(0, subscription.pending());
    }

    @Test
    void closeWakesBlockedReader() throws Exception {
        PollEventBus.Subscription subscription = bus.subscribe();
        ExecutorService reader = Executors.newSingleThreadExecutor();
        CountDownLatch waiting = new CountDownLatch(1);
        Future<Long> elapsed = reader.submit(() -> {
            long start = System.nanoTime();
            waiting.countDown();
            PollEvent event = subscription.poll(Duration.ofSeconds(5));
            assertNull(event, "Closed subscription yields no event");
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        });

        assertTrue(waiting.await(1, TimeUnit.SECONDS));
        Thread.sleep(200);
        subscription.close();

        long millis = elapsed.get(2, TimeUnit.SECONDS);
        reader.shutdown();
        assertTrue(millis < 1000, "Reader should return on close, took " + millis + " ms");
        assertNull(subscription.poll(Duration.ofMillis(20)));
        assertEquals(0, subscription.pending());
    }

    @Test
    void subscriberGaugeSettlesOnFinalCount() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) {
                    bus.subscribe().close();
                }
                return null;
            }));
        }
        PollEventBus.Subscription kept = bus.subscribe();
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(1, bus.subscriberCount());
        assertEquals(1.0, registry.getSampleValue("pollwall_stream_subscribers"),
            "Gauge must match the registered subscriber count");
        kept.close();
    }

    @Test
    void createdEventCarriesPollSnapshot() throws Exception {
        PollEventBus.Subscription subscription = bus.subscribe();
        Poll poll = samplePoll("P42");

        bus.publish(PollEvent.created(poll));

        PollEvent received = subscription.poll(WAIT);
        assertNotNull(received);
        assertEquals(PollEventType.POLL_CREATED, received.type());
        assertEquals("P42", ((Poll) received.payload().get("poll")).id());
    }

    @Test
    void concurrentPublishersNeverBlockAndRespectCapacity() throws Exception {
        PollEventBus.Subscription stalled = bus.subscribe();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    bus.publish(PollEvent.deleted("T" + thread + "-" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(3, stalled.pending());
        assertEquals(2000 - 3, stalled.droppedCount());
    }

    @Test
    void rejectsNonPositiveQueueSize() {
        assertThrows(IllegalArgumentException.class,
            () -> new PollEventBus(0, new PrometheusPollMetrics(new CollectorRegistry())));
    }

    static Poll samplePoll(String id) {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        return new Poll(id, "Lunch?", null, null, 0, 0, now, now, "U1", null,
            List.of(new PollOption("OA", "Pizza", 0), new PollOption("OB", "Sushi", 0)),
            List.of(), List.of(), null);
    }
}
