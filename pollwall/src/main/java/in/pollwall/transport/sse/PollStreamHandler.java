package in.pollwall.transport.sse;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.pollwall.domain.event.PollEvent;
import in.pollwall.service.event.PollEventBus;
import in.pollwall.util.Json;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.sse.ServerSentEventConnection;
import io.undertow.server.handlers.sse.ServerSentEventConnectionCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Server-Sent Events endpoint for poll lifecycle events (GET /api/polls/stream).
 *
 * Each connection gets its own bus subscription and one pump thread that drains it.
 * The pump waits for every frame to be written before taking the next event, so a
 * slow client backs up into its bounded bus queue, where the oldest events are
 * dropped, instead of into unbounded socket buffers.
 *
 * Frame format:
 * <pre>
 * event: poll_updated
 * id: 7
 * data: {"poll":{...}}
 * </pre>
 */
public final class PollStreamHandler implements ServerSentEventConnectionCallback {
    private static final Logger log = LoggerFactory.getLogger(PollStreamHandler.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);
    private static final long SEND_TIMEOUT_SECONDS = 30;

    private final PollEventBus eventBus;
    private final Duration keepAlive;
    private final AtomicInteger pumpSeq = new AtomicInteger(0);
    private final ExecutorService pumps = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "sse-pump-" + pumpSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public PollStreamHandler(PollEventBus eventBus, Duration keepAlive) {
        this.eventBus = eventBus;
        this.keepAlive = keepAlive;
    }

    public HttpHandler handler() {
        return Handlers.serverSentEvents(this);
    }

    @Override
    public void connected(ServerSentEventConnection connection, String lastEventId) {
        if (keepAlive != null && !keepAlive.isZero()) {
            connection.setKeepAliveTime(keepAlive.toMillis());
        }
        PollEventBus.Subscription subscription = eventBus.subscribe();
        connection.addCloseTask(c -> subscription.close());
        log.info("[SSE] Client connected (subscription #{}, {} active)",
            subscription.id(), eventBus.subscriberCount());
        pumps.execute(() -> pump(connection, subscription));
    }

    private void pump(ServerSentEventConnection connection, PollEventBus.Subscription subscription) {
        long sequence = 0;
        try {
            while (connection.isOpen() && !subscription.isClosed()) {
                PollEvent event = subscription.poll(POLL_INTERVAL);
                if (event == null) {
                    continue;
                }
                String data;
                try {
                    data = Json.BROADCAST.writeValueAsString(event.payload());
                } catch (JsonProcessingException e) {
                    log.error("[SSE] Cannot serialize {} for {}: {}", event.type().wireName(), event.pollId(), e.getMessage());
                    continue;
                }
                sendAndWait(connection, data, event.type().wireName(), Long.toString(++sequence));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException | TimeoutException e) {
            log.debug("[SSE] Subscription #{} write failed: {}", subscription.id(), e.getMessage());
        } finally {
            subscription.close();
            closeQuietly(connection);
            log.info("[SSE] Subscription #{} ended after {} events ({} dropped)",
                subscription.id(), sequence, subscription.droppedCount());
        }
    }

    private void sendAndWait(ServerSentEventConnection connection, String data, String event, String id)
            throws InterruptedException, IOException, TimeoutException {
        CompletableFuture<Void> written = new CompletableFuture<>();
        connection.send(data, event, id, new ServerSentEventConnection.EventCallback() {
            @Override
            public void done(ServerSentEventConnection c, String d, String e, String i) {
                written.complete(null);
            }

            @Override
            public void failed(ServerSentEventConnection c, String d, String e, String i, IOException ex) {
                written.completeExceptionally(ex);
            }
        });
        try {
            written.get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw e.getCause() instanceof IOException
                ? (IOException) e.getCause()
                : new IOException("SSE send failed", e.getCause());
        }
    }

    private void closeQuietly(ServerSentEventConnection connection) {
        if (!connection.isOpen()) {
            return;
        }
        try {
            connection.close();
        } catch (IOException e) {
            log.debug("[SSE] Close failed: {}", e.getMessage());
        }
    }

    public void shutdown() {
        pumps.shutdownNow();
    }
}
