package in.warroom.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.warroom.transport.stream.BroadcastHub;
import in.warroom.transport.stream.StreamEvent;
import in.warroom.transport.stream.Subscriber;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * GET /stream - Server-Sent Events feed of the war room.
 *
 * Each connection is moved off the IO thread onto its own stream thread, registers a
 * hub subscriber and writes one {@code data: <json>} frame per event until the client
 * goes away or the hub closes. Idle connections get {@code {"type":"ping"}}.
 */
public final class StreamHandler implements HttpHandler, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StreamHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String PING_JSON = "{\"type\":\"ping\"}";

    private final BroadcastHub hub;
    private final AtomicLong threadSeq = new AtomicLong(0);
    private final ExecutorService streamThreads = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "stream-" + threadSeq.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public StreamHandler(BroadcastHub hub) {
        this.hub = hub;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(streamThreads, this);
            return;
        }

        Subscriber subscriber;
        try {
            subscriber = hub.subscribe();
        } catch (IllegalStateException e) {
            exchange.setStatusCode(StatusCodes.SERVICE_UNAVAILABLE);
            exchange.getResponseSender().send("{\"error\":\"shutting down\"}", StandardCharsets.UTF_8);
            return;
        }

        exchange.startBlocking();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders()
            .put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8")
            .put(Headers.CACHE_CONTROL, "no-cache")
            .put(HttpString.tryFromString("X-Accel-Buffering"), "no");

        log.info("[STREAM] {} attached from {} (keepalive {}s)",
            subscriber.getHandle(), exchange.getSourceAddress(), hub.getKeepaliveInterval().toSeconds());
        try (OutputStream out = exchange.getOutputStream()) {
            // SSE comment: commits headers so the client knows it is subscribed
            write(out, ": connected " + subscriber.getHandle() + "\n\n");

            while (true) {
                StreamEvent event = subscriber.next();
                if (event.isEnd()) {
                    break;
                }
                write(out, frame(event));
            }
        } catch (IOException e) {
            log.debug("[STREAM] {} client went away: {}", subscriber.getHandle(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            hub.unsubscribe(subscriber);
            log.info("[STREAM] {} detached after {}s",
                subscriber.getHandle(), Duration.between(subscriber.getConnectedAt(), Instant.now()).toSeconds());
        }
    }

    static String frame(StreamEvent event) throws JsonProcessingException {
        String json = event.isKeepalive() ? PING_JSON : MAPPER.writeValueAsString(event.message());
        return "data: " + json + "\n\n";
    }

    private static void write(OutputStream out, String chunk) throws IOException {
        out.write(chunk.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Override
    public void close() {
        streamThreads.shutdownNow();
        try {
            streamThreads.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
