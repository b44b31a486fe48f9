package in.warroom.domain.model;

import java.util.List;

/**
 * A seat at the triage call.
 */
public record Participant(String name, String role, String avatar) {

    /**
     * The fixed roster: the human approver followed by the six agents.
     */
    public static List<Participant> roster(String approverName) {
        return List.of(
            new Participant(approverName, "Engineering Lead", "👨‍💻"),
            new Participant("ChairAgent", "Triage Chair (AI)", "🤖"),
            new Participant("MainAgent", "Incident Coordinator (AI)", "🎯"),
            new Participant("SREAgent", "SRE (AI)", "🔧"),
            new Participant("BillingAgent", "Billing Expert (AI)", "💳"),
            new Participant("OrderingAgent", "Orders Expert (AI)", "📦"),
            new Participant("FrontendAgent", "Frontend Expert (AI)", "🖥️")
        );
    }
}
