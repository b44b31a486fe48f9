package in.warroom.service.triage;

import in.warroom.domain.approval.ApprovalDecision;
import in.warroom.domain.approval.ApprovalOutcome;
import in.warroom.domain.model.Incident;
import in.warroom.domain.model.Message;
import in.warroom.service.approval.ApprovalGate;
import in.warroom.transport.stream.BroadcastHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Drives one triage run through the fixed script.
 *
 * Flow:
 * 1. Open, assessment, deploy history, routing, domain analysis, code inspection
 * 2. If the incident carries a patch: diff, apply, build, human approval gate, deploy, confirm
 * 3. Close and RCA report
 *
 * A rejection at the gate ends the run right after the rejection notice. Pacing sleeps
 * happen on the calling thread only, never inside the hub.
 */
public final class TriageOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TriageOrchestrator.class);

    /**
     * Actor recorded when a pending approval is abandoned because the run was interrupted.
     */
    static final String SHUTDOWN_ACTOR = "shutdown";

    private final BroadcastHub hub;
    private final ApprovalGate gate;
    private final Pacer pacer;
    private final Duration approvalTimeout;
    private final String approver;
    private final Clock clock;
    private final Random random;

    public TriageOrchestrator(BroadcastHub hub, ApprovalGate gate, Pacer pacer,
                              Duration approvalTimeout, String approver, Clock clock, Random random) {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.approvalTimeout = Objects.requireNonNull(approvalTimeout, "approvalTimeout");
        this.approver = Objects.requireNonNull(approver, "approver");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Run the script for one incident on the calling thread.
     *
     * @return COMPLETED if the report was published, REJECTED if the gate said no
     * @throws InterruptedException if the run thread is interrupted (shutdown)
     */
    public RunResult run(Incident incident) throws InterruptedException {
        TriageScript script = new TriageScript(incident, approver, clock, random);
        log.info("[TRIAGE] {} starting: service={}, error={}, owner={}, fix={}",
            script.ticketId(), incident.service(), incident.errorCode(), incident.agentOwner(), incident.hasFix());

        pacer.pause(TriageStep.LEAD_IN);

        say(TriageStep.OPEN, script.open());
        say(TriageStep.REQUEST_ASSESSMENT, script.requestAssessment());
        say(TriageStep.ASSESSMENT, script.assessment());
        say(TriageStep.REQUEST_DEPLOYS, script.requestDeploys());
        say(TriageStep.DEPLOYS, script.deploys());
        say(TriageStep.PAST_INCIDENTS, script.pastIncidents());
        say(TriageStep.ROUTE, script.route());
        say(TriageStep.DOMAIN_ANALYSIS, script.domainAnalysis());
        say(TriageStep.DOMAIN_CONFIRM, script.domainConfirm());
        say(TriageStep.REQUEST_FIX, script.requestFix());
        say(TriageStep.INSPECT, script.inspect());

        if (incident.hasFix()) {
            say(TriageStep.SHOW_DIFF, script.showDiff());
            say(TriageStep.APPLY, script.apply());
            say(TriageStep.BUILD, script.build());

            ApprovalOutcome outcome = requestApproval(script);
            if (!outcome.isGranted()) {
                hub.publish(script.rejected(outcome));
                log.info("[TRIAGE] {} stopped at approval gate ({})", script.ticketId(), outcome.state());
                return RunResult.REJECTED;
            }
            say(TriageStep.APPROVAL, script.approved(outcome));

            say(TriageStep.DEPLOY, script.deploy());
            say(TriageStep.CONFIRM, script.confirm());
        } else {
            log.info("[TRIAGE] {} has no patch, skipping diff/build/approval/deploy", script.ticketId());
        }

        say(TriageStep.CLOSE, script.close());
        say(TriageStep.REPORT, script.report());

        log.info("[TRIAGE] {} completed", script.ticketId());
        return RunResult.COMPLETED;
    }

    private ApprovalOutcome requestApproval(TriageScript script) throws InterruptedException {
        gate.open(approvalTimeout);
        hub.publish(script.approvalRequest());
        hub.publish(script.waiting(approvalTimeout, gate.getTimeoutDefault()));
        log.info("[TRIAGE] {} waiting up to {}s for {}", script.ticketId(), approvalTimeout.toSeconds(), approver);
        try {
            ApprovalOutcome outcome = gate.awaitOutcome();
            log.info("[TRIAGE] {} approval settled: state={}, decision={}, by={}",
                script.ticketId(), outcome.state(), outcome.decision(), outcome.decidedBy());
            return outcome;
        } catch (InterruptedException e) {
            gate.resolve(ApprovalDecision.REJECTED, SHUTDOWN_ACTOR);
            throw e;
        }
    }

    private void say(TriageStep step, Message message) throws InterruptedException {
        hub.publish(message);
        log.debug("[TRIAGE] {} -> {}", step, message.agent());
        pacer.pause(step.pause());
    }
}
