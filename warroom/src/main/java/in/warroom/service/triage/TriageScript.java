package in.warroom.service.triage;

import in.warroom.domain.approval.ApprovalDecision;
import in.warroom.domain.approval.ApprovalOutcome;
import in.warroom.domain.model.Incident;
import in.warroom.domain.model.Message;
import in.warroom.domain.model.MessageType;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.Year;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders the lines of one triage run from its incident.
 *
 * Pure formatting: every call returns a fresh {@link Message} stamped with the clock.
 * Per-run choices (ticket id, deploy version, second analyst) are fixed at construction.
 */
public final class TriageScript {

    static final String CHAIR = "ChairAgent";
    static final String MAIN = "MainAgent";
    static final String SRE = "SREAgent";
    static final String SYSTEM = "System";

    private static final List<String> DOMAIN_AGENTS = List.of("BillingAgent", "OrderingAgent", SRE);

    private static final Set<String> CLUSTER_SERVICES =
        Set.of("database", "kubernetes", "cache", "gateway", "auth", "queue");

    private static final Map<String, String> IMPACT = Map.of(
        "billing", "Payment processing failures. ~50 failed transactions.",
        "ordering", "Order creation failures. ~30 duplicate/lost orders.",
        "database", "Database connection failures affecting all services.",
        "auth", "Authentication failures. Users logged out unexpectedly.",
        "cache", "Cache failures causing database overload.",
        "kubernetes", "Pod restarts causing intermittent service unavailability.",
        "queue", "Message processing failures. Events lost.",
        "gateway", "API gateway failures blocking requests.",
        "frontend", "UI failures preventing user interactions."
    );

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final Incident incident;
    private final String approver;
    private final Clock clock;
    private final String ticketId;
    private final String backendVersion;
    private final String secondAnalyst;

    public TriageScript(Incident incident, String approver, Clock clock, Random random) {
        this.incident = incident;
        this.approver = approver;
        this.clock = clock;
        this.ticketId = "INC-" + Year.now(clock).getValue() + "-" + (100 + random.nextInt(900));
        this.backendVersion = "v1." + (1 + random.nextInt(9)) + "." + random.nextInt(10);
        List<String> others = DOMAIN_AGENTS.stream()
            .filter(a -> !a.equals(incident.agentOwner()))
            .collect(Collectors.toList());
        this.secondAnalyst = others.get(random.nextInt(others.size()));
    }

    public String ticketId() {
        return ticketId;
    }

    public String secondAnalyst() {
        return secondAnalyst;
    }

    public String deployTarget() {
        return CLUSTER_SERVICES.contains(incident.service()) ? "Kubernetes" : "Vercel";
    }

    // ═══════════════════════════════════════════════════════════════
    // CALL OPENING & ASSESSMENT
    // ═══════════════════════════════════════════════════════════════

    public Message open() {
        String symptoms = incident.symptoms().stream().limit(2).collect(Collectors.joining(", "));
        return speech(CHAIR,
            "🚨 **Opening triage for " + ticketId + "**\n"
            + "**Severity:** SEV-2\n"
            + "**Service:** " + service() + "\n"
            + "**Error:** `" + incident.errorCode() + "` - " + incident.errorMessage() + "\n"
            + "**Symptoms:** " + symptoms);
    }

    public Message requestAssessment() {
        return speech(CHAIR, "📋 " + MAIN + ", please provide your initial assessment.");
    }

    public Message assessment() {
        return speech(MAIN,
            "**Initial Assessment:**\n"
            + "- Error pattern: `" + incident.errorCode() + "`\n"
            + "- Affected service: **" + service() + "**\n"
            + "- Responsible team: **" + incident.agentOwner() + "**\n"
            + "- Hypothesis: " + incident.rootCause() + "\n\n"
            + "Recommend routing to **" + incident.agentOwner() + "** for deep dive.");
    }

    public Message requestDeploys() {
        return speech(CHAIR, "🔍 " + SRE + ", check recent deployments and similar incidents.");
    }

    public Message deploys() {
        return speech(SRE,
            "**Recent Deployments:**\n"
            + "- `backend/" + incident.service() + "` " + backendVersion
            + " (" + LocalTime.now(clock).format(HH_MM) + ") - Added validation\n"
            + "- `frontend` v2.8.0 (earlier) - Checkout refactor\n\n"
            + "**⚠️ Backend deployed AFTER frontend - possible contract mismatch**");
    }

    public Message pastIncidents() {
        return speech(SRE,
            "**Similar Past Incidents:**\n"
            + "- INC-2026-015: API contract mismatch after deploy\n"
            + "- INC-2026-008: Frontend/backend version skew");
    }

    public Message route() {
        return speech(CHAIR, "📌 Routing to **" + incident.agentOwner() + "** for detailed analysis.");
    }

    public Message domainAnalysis() {
        return speech(incident.agentOwner(),
            "**" + service() + " Analysis:**\n"
            + "- Found errors matching `" + incident.errorCode() + "`\n"
            + "- File: `" + incident.filePath() + "`\n"
            + "- Root cause: " + incident.rootCause() + "\n\n"
            + "**Recommendation:** Code fix required.");
    }

    public Message domainConfirm() {
        return speech(secondAnalyst,
            "**" + secondAnalyst.replace("Agent", "") + " Status:**\n"
            + "- No issues detected in our domain\n"
            + "- Confirming " + incident.agentOwner() + " has the lead");
    }

    public Message requestFix() {
        return speech(CHAIR, "🔧 " + incident.agentOwner() + ", please inspect the code and propose a fix.");
    }

    public Message inspect() {
        String next = incident.hasFix()
            ? "Preparing patch..."
            : "No safe automated patch available. Handing over for manual remediation.";
        return speech(incident.agentOwner(),
            "**Code Inspection - `" + incident.filePath() + "`:**\n"
            + "❌ **Bug Found:** " + incident.fixDescription() + "\n\n"
            + "**Error:** `" + incident.errorCode() + "` - " + incident.errorMessage() + "\n\n"
            + next);
    }

    // ═══════════════════════════════════════════════════════════════
    // FIX, BUILD & APPROVAL
    // ═══════════════════════════════════════════════════════════════

    public Message showDiff() {
        StringBuilder diff = new StringBuilder("--- a/").append(incident.filePath())
            .append("\n+++ b/").append(incident.filePath()).append('\n');
        incident.fix().ifPresent(patch -> {
            patch.buggyCode().lines().forEach(line -> diff.append("- ").append(line).append('\n'));
            patch.fixedCode().lines().forEach(line -> diff.append("+ ").append(line).append('\n'));
        });
        return Message.at(clock, incident.agentOwner(),
            "**Proposed Fix:** " + incident.fixDescription() + "\n```diff\n" + diff + "```",
            MessageType.CODE);
    }

    public Message apply() {
        return speech(incident.agentOwner(), "✅ Fix applied locally to `" + incident.filePath() + "`");
    }

    public Message build() {
        return Message.at(clock, incident.agentOwner(),
            "**" + deployTarget() + " Build:**\n"
            + "```\n"
            + "▶ Building project...\n"
            + "✓ Compiled successfully in 8.2s\n"
            + "▶ Running tests... passed\n"
            + "✓ Build ready for deployment\n"
            + "```",
            MessageType.CODE);
    }

    public Message approvalRequest() {
        return Message.at(clock, CHAIR,
            "⚠️ **HUMAN APPROVAL REQUIRED**\n\n"
            + "@" + approver + " - Please review the proposed fix and approve deployment to production.\n\n"
            + "**Service:** " + service() + "\n"
            + "**File:** `" + incident.filePath() + "`\n"
            + "**Change:** " + incident.fixDescription(),
            MessageType.APPROVAL_REQUEST);
    }

    public Message waiting(Duration timeout, ApprovalDecision timeoutDefault) {
        String fallback = timeoutDefault == ApprovalDecision.GRANTED ? "auto-approves" : "auto-rejects";
        return Message.at(clock, SYSTEM,
            "Waiting for " + approver + "'s approval... (" + fallback + " in " + timeout.toSeconds() + "s)",
            MessageType.CONTROL);
    }

    public Message approved(ApprovalOutcome outcome) {
        String text = outcome.isTimedOut()
            ? "✅ **Auto-approved** - Fix looks good, proceeding with deployment."
            : "✅ **Approved!** Looks good, deploy to production.";
        return Message.at(clock, actor(outcome), text, MessageType.HUMAN);
    }

    public Message rejected(ApprovalOutcome outcome) {
        String headline = outcome.isTimedOut()
            ? "⌛ **Approval window expired.** Deployment not approved."
            : "❌ **Deployment rejected by " + actor(outcome) + ".**";
        return Message.at(clock, CHAIR,
            headline + "\nTriage paused. Manual intervention required.",
            MessageType.CONTROL);
    }

    // ═══════════════════════════════════════════════════════════════
    // DEPLOY, CLOSE & REPORT
    // ═══════════════════════════════════════════════════════════════

    public Message deploy() {
        return Message.at(clock, incident.agentOwner(),
            "**" + deployTarget() + " Deployment:**\n"
            + "```\n"
            + "▶ Human approval received ✓\n"
            + "▶ Deploying to production...\n"
            + "✓ https://" + incident.service() + ".prod.example.com\n"
            + "✓ Deployment to " + incident.service() + " complete!\n"
            + "```",
            MessageType.CODE);
    }

    public Message confirm() {
        return speech(CHAIR, "✅ Fix deployed. Monitoring error rates...");
    }

    public Message close() {
        String status = incident.hasFix()
            ? "Error rate normalized. Fix confirmed working.\n"
            : "No code change shipped. " + incident.agentOwner() + " owns the manual follow-up.\n";
        return speech(CHAIR,
            "📝 **Closing triage call.**\n"
            + status
            + "RCA to follow. Thank you all!");
    }

    public Message report() {
        String fix = incident.hasFix()
            ? "**File:** `" + incident.filePath() + "`\n**Change:** " + incident.fixDescription()
            : "**File:** `" + incident.filePath() + "`\n**Change:** none yet, manual remediation pending";
        String text = "# 📋 Root Cause Analysis\n\n"
            + "## What Happened\n"
            + "**" + service() + "** service returned `" + incident.errorCode() + "` errors.\n\n"
            + "## Error Details\n"
            + incident.errorMessage() + "\n\n"
            + "## Why It Happened\n"
            + incident.rootCause() + "\n\n"
            + "## Customer Impact\n"
            + IMPACT.getOrDefault(incident.service(), "Service degradation affecting users.") + "\n\n"
            + "## Fix Applied\n"
            + fix + "\n\n"
            + "## Preventive Actions\n"
            + "- Add monitoring for `" + incident.errorCode() + "` errors\n"
            + "- Add integration tests for " + incident.service() + " service\n"
            + "- Review deployment procedures\n\n"
            + "## Timeline\n"
            + "- " + LocalTime.now(clock).format(HH_MM) + " - Alert triggered\n"
            + "- +2 min - Triage opened\n"
            + "- +5 min - Root cause identified by " + incident.agentOwner() + "\n"
            + (incident.hasFix() ? "- +8 min - Fix deployed\n" : "")
            + "- +10 min - Incident " + (incident.hasFix() ? "resolved" : "handed over") + "\n";
        return Message.at(clock, SYSTEM, text, MessageType.RCA);
    }

    private String actor(ApprovalOutcome outcome) {
        return outcome.decidedBy() != null ? outcome.decidedBy() : approver;
    }

    private String service() {
        return incident.service().toUpperCase(Locale.ROOT);
    }

    private Message speech(String agent, String text) {
        return Message.speech(clock, agent, text);
    }
}
