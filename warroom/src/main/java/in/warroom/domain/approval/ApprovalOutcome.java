package in.warroom.domain.approval;

import java.time.Instant;

/**
 * Snapshot of an approval gate.
 *
 * decision is null while the gate is IDLE or PENDING. For TIMED_OUT it carries the
 * configured default. decidedBy is the actor of an explicit resolution, null otherwise.
 * deadline is null while IDLE.
 */
public record ApprovalOutcome(
    GateState state,
    ApprovalDecision decision,
    String decidedBy,
    Instant deadline
) {
    public boolean isPending() {
        return state == GateState.PENDING;
    }

    public boolean isGranted() {
        return decision == ApprovalDecision.GRANTED;
    }

    public boolean isTimedOut() {
        return state == GateState.TIMED_OUT;
    }
}
