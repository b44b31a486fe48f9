package in.warroom.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Incident under triage.
 *
 * Opaque to the orchestration engine apart from the fields it formats into messages.
 * The patch is optional: an incident without one runs the script without the
 * diff/build/approval/deploy segment.
 */
public record Incident(
    String service,                // e.g. "billing"
    String errorCode,              // e.g. "BILLING_400"
    String errorMessage,
    List<String> symptoms,
    String rootCause,
    String fixDescription,
    String filePath,               // affected file, relative to the service repo
    String agentOwner,             // agent that owns the service, e.g. "BillingAgent"
    FixPatch patch                 // null when no fix is available
) {
    public Incident {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(errorCode, "errorCode");
        Objects.requireNonNull(errorMessage, "errorMessage");
        Objects.requireNonNull(rootCause, "rootCause");
        Objects.requireNonNull(fixDescription, "fixDescription");
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(agentOwner, "agentOwner");
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
    }

    public boolean hasFix() {
        return patch != null;
    }

    public Optional<FixPatch> fix() {
        return Optional.ofNullable(patch);
    }

    /**
     * Stable identifier shown by the status endpoint, e.g. "billing_BILLING_400".
     */
    public String id() {
        return service + "_" + errorCode;
    }
}
