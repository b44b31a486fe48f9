package in.warroom.service.approval;

import in.warroom.domain.approval.ApprovalDecision;
import in.warroom.domain.approval.ApprovalOutcome;
import in.warroom.domain.approval.GateState;
import in.warroom.domain.approval.ResolveResult;
import in.warroom.infrastructure.metrics.WarRoomMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-slot human approval gate.
 *
 * Two triggers race to settle a pending gate: an explicit {@link #resolve} and the
 * deadline set by {@link #open}. Both transitions happen under one lock and only from
 * PENDING, so exactly one of them wins and the loser sees a terminal state.
 *
 * Expiry is checked against the monotonic deadline on every access: a resolve that
 * arrives after the deadline loses even if the waiting thread has not woken up yet.
 *
 * Usage:
 * <pre>
 * gate.open(Duration.ofSeconds(15));
 * ApprovalOutcome outcome = gate.awaitOutcome();   // blocks at most ~15s
 *
 * // from an HTTP handler
 * gate.resolve(ApprovalDecision.GRANTED, "Nitin");
 * </pre>
 */
public final class ApprovalGate {
    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition settled = lock.newCondition();

    private final ApprovalDecision timeoutDefault;
    private final WarRoomMetrics metrics;

    // Guarded by lock
    private GateState state = GateState.IDLE;
    private ApprovalDecision decision;
    private String decidedBy;
    private long deadlineNanos;
    private Instant deadline;

    public ApprovalGate(ApprovalDecision timeoutDefault, WarRoomMetrics metrics) {
        this.timeoutDefault = Objects.requireNonNull(timeoutDefault, "timeoutDefault");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ApprovalDecision getTimeoutDefault() {
        return timeoutDefault;
    }

    /**
     * IDLE (or a consumed terminal state) -> PENDING with an absolute deadline.
     *
     * @throws GateMisuseException if the gate is already pending
     */
    public void open(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative: " + timeout);
        }
        lock.lock();
        try {
            expireIfDue();
            if (state == GateState.PENDING) {
                throw new GateMisuseException("Approval gate is already pending (deadline " + deadline + ")");
            }
            state = GateState.PENDING;
            decision = null;
            decidedBy = null;
            deadlineNanos = System.nanoTime() + timeout.toNanos();
            deadline = Instant.now().plus(timeout);
            log.info("[GATE] Opened, awaiting decision until {} (default on timeout: {})", deadline, timeoutDefault);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settle a pending gate with an explicit decision.
     *
     * Exactly-once: if the gate is not pending (already settled, expired, or idle)
     * nothing changes and the returned result reports {@code applied=false}.
     */
    public ResolveResult resolve(ApprovalDecision requested, String actor) {
        Objects.requireNonNull(requested, "requested");
        lock.lock();
        try {
            expireIfDue();
            if (state != GateState.PENDING) {
                log.info("[GATE] {} by {} ignored, gate is {}", requested, actor, state);
                return new ResolveResult(false, snapshot());
            }
            settle(requested == ApprovalDecision.GRANTED ? GateState.GRANTED : GateState.REJECTED, requested, actor);
            log.info("[GATE] Settled {} by {}", state, actor);
            return new ResolveResult(true, snapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until the gate leaves PENDING, at most until its deadline.
     *
     * If the deadline passes first the gate settles to TIMED_OUT with the configured
     * default decision, which is what this call returns.
     *
     * @throws GateMisuseException if the gate was never opened
     * @throws InterruptedException if the waiting thread is interrupted; the gate stays pending
     */
    public ApprovalOutcome awaitOutcome() throws InterruptedException {
        lock.lock();
        try {
            if (state == GateState.IDLE) {
                throw new GateMisuseException("Approval gate awaited before being opened");
            }
            while (state == GateState.PENDING) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0) {
                    expireIfDue();
                    break;
                }
                settled.awaitNanos(remaining);
            }
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return a settled gate to IDLE before the next run.
     *
     * @throws GateMisuseException if the gate is still pending
     */
    public void reset() {
        lock.lock();
        try {
            expireIfDue();
            if (state == GateState.PENDING) {
                throw new GateMisuseException("Cannot reset a pending approval gate");
            }
            state = GateState.IDLE;
            decision = null;
            decidedBy = null;
            deadline = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current snapshot. Settles an expired gate as a side effect.
     */
    public ApprovalOutcome status() {
        lock.lock();
        try {
            expireIfDue();
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private void expireIfDue() {
        if (state == GateState.PENDING && System.nanoTime() - deadlineNanos >= 0) {
            settle(GateState.TIMED_OUT, timeoutDefault, null);
            log.info("[GATE] Deadline passed with no decision, settled to {}", timeoutDefault);
        }
    }

    // Caller holds lock, state is PENDING
    private void settle(GateState terminal, ApprovalDecision outcome, String actor) {
        state = terminal;
        decision = outcome;
        decidedBy = actor;
        settled.signalAll();
        metrics.recordApproval(terminal);
    }

    private ApprovalOutcome snapshot() {
        return new ApprovalOutcome(state, decision, decidedBy, deadline);
    }
}
