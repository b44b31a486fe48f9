package in.warroom.domain.approval;

/**
 * Human decision on a deployment.
 */
public enum ApprovalDecision {
    GRANTED,
    REJECTED
}
