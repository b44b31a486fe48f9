package in.warroom.transport.stream;

import in.warroom.domain.model.Message;
import in.warroom.infrastructure.metrics.WarRoomMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out hub for war room messages.
 *
 * - Every subscriber has its own bounded queue; a stalled reader only loses its own oldest messages
 * - Late joiners see only messages published after they subscribed (no replay)
 * - subscribe/unsubscribe/publish share one fan-out lock, so each publish sees a consistent
 *   set of recipients and every recipient gets messages in publish order
 * - Idle subscribers receive a keepalive once the keepalive interval passes without a message
 *
 * The fan-out itself only enqueues, so holding the lock never waits on a reader.
 */
public final class BroadcastHub implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    // Handle -> Subscriber
    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Object fanOutLock = new Object();
    private final AtomicLong handleSeq = new AtomicLong(0);

    private final int queueCapacity;
    private final Duration keepaliveInterval;
    private final WarRoomMetrics metrics;
    private volatile boolean closed = false;

    public BroadcastHub(int queueCapacity, Duration keepaliveInterval, WarRoomMetrics metrics) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        if (keepaliveInterval.isNegative() || keepaliveInterval.isZero()) {
            throw new IllegalArgumentException("keepaliveInterval must be positive: " + keepaliveInterval);
        }
        this.queueCapacity = queueCapacity;
        this.keepaliveInterval = keepaliveInterval;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Register a new delivery channel. It receives every message published from now on.
     *
     * @throws IllegalStateException if the hub has been closed
     */
    public Subscriber subscribe() {
        Subscriber subscriber;
        synchronized (fanOutLock) {
            if (closed) {
                throw new IllegalStateException("Broadcast hub is closed");
            }
            String handle = "sub-" + handleSeq.incrementAndGet();
            subscriber = new Subscriber(handle, queueCapacity, keepaliveInterval, metrics);
            subscribers.put(handle, subscriber);
            metrics.recordSubscriberCount(subscribers.size());
        }
        log.info("[HUB] Subscriber {} joined (total: {})", subscriber.getHandle(), subscribers.size());
        return subscriber;
    }

    /**
     * Deregister a subscriber. Safe to call more than once and concurrently with publish.
     */
    public void unsubscribe(Subscriber subscriber) {
        if (subscriber == null) {
            return;
        }
        boolean removed;
        synchronized (fanOutLock) {
            removed = subscribers.remove(subscriber.getHandle(), subscriber);
            subscriber.close();
            metrics.recordSubscriberCount(subscribers.size());
        }
        if (removed) {
            log.info("[HUB] Subscriber {} left (delivered={}, dropped={}, total={})",
                subscriber.getHandle(), subscriber.getDelivered(), subscriber.getDropped(), subscribers.size());
        }
    }

    /**
     * Deliver a message to every currently registered subscriber.
     *
     * @return number of subscribers the message was queued for
     */
    public int publish(Message message) {
        Objects.requireNonNull(message, "message");
        int recipients = 0;
        synchronized (fanOutLock) {
            for (Subscriber subscriber : subscribers.values()) {
                if (subscriber.offer(message)) {
                    recipients++;
                }
            }
        }
        metrics.recordPublished(message.type(), recipients);
        log.debug("[HUB] Published {} from {} to {} subscriber(s)", message.type(), message.agent(), recipients);
        return recipients;
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public Duration getKeepaliveInterval() {
        return keepaliveInterval;
    }

    /**
     * Close the hub: every subscriber is deregistered and its stream ends.
     */
    @Override
    public void close() {
        List<Subscriber> snapshot;
        synchronized (fanOutLock) {
            if (closed) {
                return;
            }
            closed = true;
            snapshot = new ArrayList<>(subscribers.values());
            subscribers.clear();
            snapshot.forEach(Subscriber::close);
            metrics.recordSubscriberCount(0);
        }
        log.info("[HUB] Closed ({} subscriber(s) disconnected)", snapshot.size());
    }
}
