package in.warroom.service.triage;

import in.warroom.domain.approval.ApprovalDecision;
import in.warroom.domain.approval.ApprovalOutcome;
import in.warroom.domain.approval.GateState;
import in.warroom.domain.model.Incident;
import in.warroom.domain.model.Message;
import in.warroom.domain.model.MessageType;
import in.warroom.domain.model.TestIncidents;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TriageScriptTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-08T09:15:30Z"), ZoneOffset.UTC);

    private static TriageScript script(Incident incident, long seed) {
        return new TriageScript(incident, "Nitin", CLOCK, new Random(seed));
    }

    @Test
    void testTicketIdFormat() {
        for (long seed = 0; seed < 50; seed++) {
            String ticketId = script(TestIncidents.billingWithFix(), seed).ticketId();
            assertTrue(ticketId.matches("INC-2026-[1-9]\\d{2}"), "Unexpected ticket id " + ticketId);
        }
    }

    @Test
    void testSecondAnalystIsNeverTheOwner() {
        for (long seed = 0; seed < 50; seed++) {
            TriageScript s = script(TestIncidents.billingWithFix(), seed);
            assertNotEquals("BillingAgent", s.secondAnalyst());
            assertEquals(s.secondAnalyst(), s.domainConfirm().agent());
        }
    }

    @Test
    void testDeployTargetByService() {
        assertEquals("Vercel", script(TestIncidents.billingWithFix(), 1).deployTarget());
        assertEquals("Kubernetes", script(TestIncidents.databaseWithoutFix(), 1).deployTarget());
    }

    @Test
    void testOpeningNamesServiceAndError() {
        Message open = script(TestIncidents.billingWithFix(), 7).open();

        assertEquals("ChairAgent", open.agent());
        assertEquals(MessageType.SPEECH, open.type());
        assertEquals("09:15:30", open.timestamp());
        assertTrue(open.text().contains("BILLING_400"));
        assertTrue(open.text().contains("SEV-2"));
    }

    @Test
    void testApprovalMessages() {
        TriageScript s = script(TestIncidents.billingWithFix(), 3);

        Message request = s.approvalRequest();
        assertEquals(MessageType.APPROVAL_REQUEST, request.type());
        assertTrue(request.text().contains("@Nitin"));

        Message waiting = s.waiting(Duration.ofSeconds(15), ApprovalDecision.GRANTED);
        assertEquals("System", waiting.agent());
        assertEquals("Waiting for Nitin's approval... (auto-approves in 15s)", waiting.text());

        ApprovalOutcome timedOut = new ApprovalOutcome(GateState.TIMED_OUT, ApprovalDecision.GRANTED, null, null);
        Message approved = s.approved(timedOut);
        assertEquals(MessageType.HUMAN, approved.type());
        assertEquals("Nitin", approved.agent());
        assertTrue(approved.text().startsWith("✅ **Auto-approved**"));

        ApprovalOutcome rejected = new ApprovalOutcome(GateState.REJECTED, ApprovalDecision.REJECTED, "Nitin", null);
        assertEquals("❌ **Deployment rejected by Nitin.**\nTriage paused. Manual intervention required.",
            s.rejected(rejected).text());
    }

    @Test
    void testReportWithoutFixMentionsManualRemediation() {
        Message report = script(TestIncidents.databaseWithoutFix(), 5).report();

        assertEquals(MessageType.RCA, report.type());
        assertTrue(report.text().contains("manual remediation pending"));
    }
}
