package in.warroom.domain.approval;

/**
 * Result of an explicit approve/reject call.
 *
 * @param applied true if this call settled the gate; false if it was already
 *                terminal (or idle) and nothing changed
 * @param outcome gate snapshot after the call
 */
public record ResolveResult(boolean applied, ApprovalOutcome outcome) {
}
