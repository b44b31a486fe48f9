package in.warroom.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.warroom.application.port.output.IncidentProvider;
import in.warroom.domain.approval.ApprovalDecision;
import in.warroom.domain.approval.ApprovalOutcome;
import in.warroom.domain.approval.ResolveResult;
import in.warroom.domain.model.Incident;
import in.warroom.domain.model.Participant;
import in.warroom.service.approval.ApprovalGate;
import in.warroom.service.session.AlreadyRunningException;
import in.warroom.service.session.NoIncidentAvailableException;
import in.warroom.service.session.SessionManager;
import in.warroom.transport.stream.BroadcastHub;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP handlers for the war room control endpoints.
 *
 * Provides:
 * - POST /start - Launch a triage run (202, or 400 if one is active)
 * - POST /approve, POST /reject - Settle the pending approval (idempotent)
 * - GET /approval-status - Gate snapshot
 * - GET /current-failure - Incident of the active or last run
 * - GET /buggy-code - Pre-fix source of that incident's patched file
 * - GET /participants - Call roster
 * - GET /api/health - Liveness and counters
 */
public final class TriageHandlers {
    private static final Logger log = LoggerFactory.getLogger(TriageHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // JSON Response Keys
    private static final String JSON_STATUS = "status";
    private static final String JSON_ERROR = "error";
    private static final String JSON_BY = "by";

    static final String NO_CODE = "// No code available";

    private final SessionManager sessionManager;
    private final IncidentProvider incidentProvider;
    private final ApprovalGate gate;
    private final BroadcastHub hub;
    private final String approverName;

    public TriageHandlers(SessionManager sessionManager, IncidentProvider incidentProvider,
                          ApprovalGate gate, BroadcastHub hub, String approverName) {
        this.sessionManager = sessionManager;
        this.incidentProvider = incidentProvider;
        this.gate = gate;
        this.hub = hub;
        this.approverName = approverName;
    }

    /**
     * POST /start
     */
    public void start(HttpServerExchange exchange) {
        try {
            sessionManager.start(incidentProvider);
            ObjectNode body = MAPPER.createObjectNode();
            body.put(JSON_STATUS, "started");
            sendJson(exchange, StatusCodes.ACCEPTED, body);
            log.info("POST /start → 202 Accepted");

        } catch (AlreadyRunningException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "already running");
            log.info("POST /start → 400 (already running)");

        } catch (NoIncidentAvailableException e) {
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "no incident available");
            log.warn("POST /start → 503 ({})", e.getMessage());

        } catch (Exception e) {
            log.error("Unexpected error starting triage: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "failed to start triage");
        }
    }

    /**
     * POST /approve
     */
    public void approve(HttpServerExchange exchange) {
        resolve(exchange, ApprovalDecision.GRANTED);
    }

    /**
     * POST /reject
     */
    public void reject(HttpServerExchange exchange) {
        resolve(exchange, ApprovalDecision.REJECTED);
    }

    private void resolve(HttpServerExchange exchange, ApprovalDecision decision) {
        try {
            ResolveResult result = gate.resolve(decision, approverName);
            ApprovalOutcome outcome = result.outcome();

            ObjectNode body = MAPPER.createObjectNode();
            body.put(JSON_STATUS, describe(outcome));
            body.put(JSON_BY, actorOf(outcome));
            body.put("applied", result.applied());
            sendJson(exchange, StatusCodes.OK, body);

            log.info("POST /{} → 200 (applied={}, state={})",
                decision == ApprovalDecision.GRANTED ? "approve" : "reject", result.applied(), outcome.state());

        } catch (Exception e) {
            log.error("Unexpected error resolving approval: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "failed to resolve approval");
        }
    }

    /**
     * GET /approval-status
     */
    public void approvalStatus(HttpServerExchange exchange) {
        ApprovalOutcome outcome = gate.status();
        ObjectNode body = MAPPER.createObjectNode();
        body.put("pending", outcome.isPending());
        body.put("granted", outcome.isGranted());
        body.put("state", outcome.state().name().toLowerCase(Locale.ROOT));
        if (outcome.isPending() && outcome.deadline() != null) {
            body.put("deadline", outcome.deadline().toString());
        }
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * GET /current-failure
     */
    public void currentFailure(HttpServerExchange exchange) {
        Optional<Incident> current = sessionManager.current();
        ObjectNode body = MAPPER.createObjectNode();
        if (current.isEmpty()) {
            body.put(JSON_STATUS, "no incident");
        } else {
            Incident incident = current.get();
            body.put("id", incident.id());
            body.put("service", incident.service());
            body.put("error_code", incident.errorCode());
            body.put("message", incident.errorMessage());
            body.put("file", incident.filePath());
            body.put("agent_owner", incident.agentOwner());
            body.put("has_fix", incident.hasFix());
            body.put("running", sessionManager.isRunning());
        }
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * GET /buggy-code
     */
    public void buggyCode(HttpServerExchange exchange) {
        Optional<Incident> withPatch = sessionManager.current().filter(Incident::hasFix);
        ObjectNode body = MAPPER.createObjectNode();
        if (withPatch.isPresent()) {
            Incident incident = withPatch.get();
            body.put("code", incident.fix().orElseThrow().buggyCode());
            body.put("file", incident.filePath());
        } else {
            body.put("code", NO_CODE);
            body.put("file", "unknown");
        }
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * GET /participants
     */
    public void participants(HttpServerExchange exchange) {
        ObjectNode body = MAPPER.createObjectNode();
        body.set("participants", MAPPER.valueToTree(Participant.roster(approverName)));
        sendJson(exchange, StatusCodes.OK, body);
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_STATUS, "ok");
        body.put("ts", Instant.now().toString());
        body.put("running", sessionManager.isRunning());
        body.put("subscribers", hub.getSubscriberCount());
        sendJson(exchange, StatusCodes.OK, body);
    }

    private String describe(ApprovalOutcome outcome) {
        return switch (outcome.state()) {
            case GRANTED -> "approved";
            case REJECTED -> "rejected";
            case TIMED_OUT -> outcome.isGranted() ? "auto-approved" : "auto-rejected";
            case PENDING -> "pending";
            case IDLE -> "no_pending_approval";
        };
    }

    private String actorOf(ApprovalOutcome outcome) {
        if (outcome.decidedBy() != null) {
            return outcome.decidedBy();
        }
        return outcome.isTimedOut() ? "auto" : approverName;
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, ObjectNode body) {
        try {
            String json = MAPPER.writeValueAsString(body);
            exchange.setStatusCode(statusCode);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
            exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
        } catch (Exception e) {
            log.error("Failed to serialize response: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"error\":\"serialization failed\"}", StandardCharsets.UTF_8);
        }
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_ERROR, message);
        sendJson(exchange, statusCode, body);
    }
}
