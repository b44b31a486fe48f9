package in.warroom.infrastructure.metrics;

import in.warroom.domain.approval.GateState;
import in.warroom.domain.model.MessageType;

import java.time.Duration;

/**
 * War room metrics interface for monitoring.
 *
 * Implementations can publish to Prometheus or anything else. All methods default to
 * no-ops so components can be constructed with {@link #NOOP} in tests.
 */
public interface WarRoomMetrics {

    WarRoomMetrics NOOP = new WarRoomMetrics() {};

    /**
     * Record a message fanned out by the hub.
     *
     * @param type Message kind
     * @param recipients Number of subscribers it was queued for
     */
    default void recordPublished(MessageType type, int recipients) {}

    /**
     * Record the current number of registered subscribers.
     */
    default void recordSubscriberCount(int count) {}

    /**
     * Record an unread message dropped from a full subscriber queue.
     */
    default void recordDropped() {}

    /**
     * Record a keepalive emitted on an idle subscriber.
     */
    default void recordKeepalive() {}

    /**
     * Record the terminal state an approval gate settled in.
     */
    default void recordApproval(GateState outcome) {}

    /**
     * Record the end of a triage run.
     *
     * @param result completed | rejected | failed
     * @param duration Wall time of the run
     */
    default void recordRun(String result, Duration duration) {}
}
