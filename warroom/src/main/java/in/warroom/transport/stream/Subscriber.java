package in.warroom.transport.stream;

import in.warroom.domain.model.Message;
import in.warroom.infrastructure.metrics.WarRoomMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live stream connection registered with the {@link BroadcastHub}.
 *
 * Owns a bounded queue fed by the hub's fan-out and drained by exactly one reader
 * (the connection's stream thread). When the queue is full the oldest unread message
 * of this subscriber is dropped; other subscribers are never affected.
 */
public final class Subscriber {
    private static final Logger log = LoggerFactory.getLogger(Subscriber.class);

    private final String handle;
    private final BlockingDeque<StreamEvent> queue;
    private final Duration keepaliveInterval;
    private final WarRoomMetrics metrics;
    private final Instant connectedAt;
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean open = true;

    Subscriber(String handle, int capacity, Duration keepaliveInterval, WarRoomMetrics metrics) {
        this.handle = handle;
        this.queue = new LinkedBlockingDeque<>(capacity);
        this.keepaliveInterval = keepaliveInterval;
        this.metrics = metrics;
        this.connectedAt = Instant.now();
    }

    public String getHandle() {
        return handle;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Messages queued for this subscriber so far (including ones later dropped).
     */
    public long getDelivered() {
        return delivered.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public int getBacklog() {
        return queue.size();
    }

    /**
     * Queue a message. Called by the hub only, under its fan-out lock.
     *
     * @return false if the subscriber is already closed
     */
    boolean offer(Message message) {
        if (!open) {
            return false;
        }
        StreamEvent event = StreamEvent.of(message);
        while (!queue.offerLast(event)) {
            // Backlog overrun: drop this subscriber's oldest unread message
            if (queue.pollFirst() != null) {
                long n = dropped.incrementAndGet();
                metrics.recordDropped();
                if (n == 1 || n % 100 == 0) {
                    log.warn("[HUB] Subscriber {} backlog full, dropped {} message(s) so far", handle, n);
                }
            }
        }
        delivered.incrementAndGet();
        return true;
    }

    /**
     * Block until the next event is available.
     *
     * Returns {@link StreamEvent.Kind#KEEPALIVE} when nothing arrived within the
     * keepalive interval, and {@link StreamEvent.Kind#END} once the subscriber has
     * been closed. Closing discards any unread backlog.
     */
    public StreamEvent next() throws InterruptedException {
        if (!open && queue.isEmpty()) {
            return StreamEvent.END;
        }
        StreamEvent event = queue.pollFirst(keepaliveInterval.toNanos(), TimeUnit.NANOSECONDS);
        if (event != null) {
            return event;
        }
        if (!open) {
            return StreamEvent.END;
        }
        metrics.recordKeepalive();
        return StreamEvent.KEEPALIVE;
    }

    /**
     * Stop accepting messages and wake the reader.
     */
    void close() {
        if (!open) {
            return;
        }
        open = false;
        queue.clear();
        queue.offerLast(StreamEvent.END);
    }

    @Override
    public String toString() {
        return "Subscriber[" + handle + "]";
    }
}
