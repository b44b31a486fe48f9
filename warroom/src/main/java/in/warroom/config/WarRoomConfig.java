package in.warroom.config;

import in.warroom.domain.approval.ApprovalDecision;
import in.warroom.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * War room runtime configuration.
 *
 * Every knob is read from the environment (or a -D system property) with a default.
 */
public record WarRoomConfig(
    int port,
    String bindHost,
    Duration approvalTimeout,          // how long the gate waits for a human
    ApprovalDecision approvalDefault,  // decision applied when the gate times out
    String approverName,
    Duration keepaliveInterval,        // idle time before a ping on a stream
    int subscriberQueueCapacity,
    double stepDelayScale,             // multiplier on scripted pauses (0 = no pacing)
    Duration maxStepDelay,             // cap on a single pause
    String incidentCatalog             // blank = bundled catalog
) {
    private static final Logger log = LoggerFactory.getLogger(WarRoomConfig.class);

    private static final Duration KEEPALIVE_MIN = Duration.ofSeconds(30);
    private static final Duration KEEPALIVE_MAX = Duration.ofSeconds(60);

    public static WarRoomConfig defaults() {
        return new WarRoomConfig(
            5050,
            "0.0.0.0",
            Duration.ofSeconds(15),
            ApprovalDecision.GRANTED,
            "Nitin",
            Duration.ofSeconds(60),
            256,
            1.0,
            Duration.ofMillis(1500),
            ""
        );
    }

    public static WarRoomConfig fromEnv() {
        WarRoomConfig d = defaults();
        return new WarRoomConfig(
            Env.getInt("PORT", d.port()),
            Env.get("BIND_HOST", d.bindHost()),
            Duration.ofSeconds(Env.getLong("APPROVAL_TIMEOUT_SECONDS", d.approvalTimeout().toSeconds())),
            parseDecision(Env.get("APPROVAL_DEFAULT", d.approvalDefault().name())),
            Env.get("APPROVER_NAME", d.approverName()),
            Duration.ofSeconds(Env.getLong("KEEPALIVE_SECONDS", d.keepaliveInterval().toSeconds())),
            Env.getInt("SUBSCRIBER_QUEUE_CAPACITY", d.subscriberQueueCapacity()),
            Env.getDouble("STEP_DELAY_SCALE", d.stepDelayScale()),
            Duration.ofMillis(Env.getLong("MAX_STEP_DELAY_MS", d.maxStepDelay().toMillis())),
            Env.get("INCIDENT_CATALOG", d.incidentCatalog())
        );
    }

    static ApprovalDecision parseDecision(String value) {
        try {
            return ApprovalDecision.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                "INVALID CONFIG: APPROVAL_DEFAULT must be GRANTED or REJECTED, got '" + value + "'");
        }
    }

    /**
     * Validate values at startup.
     *
     * @throws IllegalStateException if any value is unusable
     */
    public WarRoomConfig validate() {
        if (port < 1 || port > 65535) {
            throw new IllegalStateException("INVALID CONFIG: PORT out of range: " + port);
        }
        if (approvalTimeout.isNegative() || approvalTimeout.isZero()) {
            throw new IllegalStateException("INVALID CONFIG: APPROVAL_TIMEOUT_SECONDS must be positive");
        }
        if (keepaliveInterval.isNegative() || keepaliveInterval.isZero()) {
            throw new IllegalStateException("INVALID CONFIG: KEEPALIVE_SECONDS must be positive");
        }
        if (subscriberQueueCapacity < 1) {
            throw new IllegalStateException("INVALID CONFIG: SUBSCRIBER_QUEUE_CAPACITY must be positive");
        }
        if (stepDelayScale < 0) {
            throw new IllegalStateException("INVALID CONFIG: STEP_DELAY_SCALE must not be negative");
        }
        if (maxStepDelay.isNegative()) {
            throw new IllegalStateException("INVALID CONFIG: MAX_STEP_DELAY_MS must not be negative");
        }
        if (approverName == null || approverName.isBlank()) {
            throw new IllegalStateException("INVALID CONFIG: APPROVER_NAME must not be blank");
        }
        if (keepaliveInterval.compareTo(KEEPALIVE_MIN) < 0 || keepaliveInterval.compareTo(KEEPALIVE_MAX) > 0) {
            log.warn("⚠️ KEEPALIVE_SECONDS={} is outside 30-60s, proxies may reclaim idle streams",
                keepaliveInterval.toSeconds());
        }
        return this;
    }
}
