package in.warroom.domain.approval;

/**
 * Approval gate lifecycle.
 *
 * IDLE -> PENDING -> one of GRANTED | REJECTED | TIMED_OUT.
 * Terminal states only return to IDLE through an explicit reset between runs.
 */
public enum GateState {
    IDLE,
    PENDING,
    GRANTED,
    REJECTED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == GRANTED || this == REJECTED || this == TIMED_OUT;
    }
}
