package in.warroom.bootstrap;

import in.warroom.application.port.output.IncidentProvider;
import in.warroom.config.WarRoomConfig;
import in.warroom.infrastructure.catalog.CatalogIncidentProvider;
import in.warroom.infrastructure.metrics.PrometheusMetricsHandler;
import in.warroom.infrastructure.metrics.PrometheusWarRoomMetrics;
import in.warroom.service.approval.ApprovalGate;
import in.warroom.service.session.SessionManager;
import in.warroom.service.triage.ScaledPacer;
import in.warroom.service.triage.TriageOrchestrator;
import in.warroom.transport.http.StreamHandler;
import in.warroom.transport.http.TriageHandlers;
import in.warroom.transport.stream.BroadcastHub;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * War room bootstrap.
 *
 * Wires:
 * - Broadcast hub (SSE fan-out with per-subscriber queues)
 * - Approval gate (human decision with default-on-timeout)
 * - Triage orchestrator + session manager (single active run)
 * - Incident catalog
 * - Undertow HTTP routes and Prometheus /metrics
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== War Room Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        WarRoomConfig config = WarRoomConfig.fromEnv().validate();
        log.info("Config: port={}, approvalTimeout={}s, approvalDefault={}, keepalive={}s, queueCapacity={}, "
                + "stepDelayScale={}, maxStepDelay={}ms",
            config.port(), config.approvalTimeout().toSeconds(), config.approvalDefault(),
            config.keepaliveInterval().toSeconds(), config.subscriberQueueCapacity(),
            config.stepDelayScale(), config.maxStepDelay().toMillis());

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusWarRoomMetrics metrics = new PrometheusWarRoomMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Core: hub, gate, orchestrator, session
        // ═══════════════════════════════════════════════════════════════
        Random random = new SecureRandom();
        Clock clock = Clock.systemDefaultZone();

        BroadcastHub hub = new BroadcastHub(config.subscriberQueueCapacity(), config.keepaliveInterval(), metrics);
        ApprovalGate gate = new ApprovalGate(config.approvalDefault(), metrics);
        TriageOrchestrator orchestrator = new TriageOrchestrator(
            hub, gate,
            new ScaledPacer(config.stepDelayScale(), config.maxStepDelay()),
            config.approvalTimeout(), config.approverName(), clock, random);
        SessionManager sessionManager = new SessionManager(orchestrator, gate, metrics);

        IncidentProvider incidentProvider = CatalogIncidentProvider.load(config.incidentCatalog(), random);
        log.info("✓ Triage engine ready");

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        TriageHandlers api = new TriageHandlers(sessionManager, incidentProvider, gate, hub, config.approverName());
        StreamHandler streamHandler = new StreamHandler(hub);
        HttpHandler root = cors(routes(api, streamHandler, new PrometheusMetricsHandler(metrics.getRegistry()), config.port()));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), config.bindHost())
            .setHandler(root)
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down war room...");
            hub.close();
            sessionManager.stop();
            streamHandler.close();
            server.stop();
            log.info("War room stopped");
        }, "shutdown"));

        server.start();
        log.info("✓ War room started on http://localhost:{}/", config.port());
    }

    /**
     * Route table for the war room API.
     */
    public static RoutingHandler routes(TriageHandlers api, HttpHandler stream, HttpHandler metrics, int port) {
        return Handlers.routing()
            .post("/start", api::start)
            .post("/approve", api::approve)
            .post("/reject", api::reject)
            .get("/approval-status", api::approvalStatus)
            .get("/current-failure", api::currentFailure)
            .get("/buggy-code", api::buggyCode)
            .get("/participants", api::participants)
            .get("/api/health", api::health)
            .get("/stream", stream)
            .get("/metrics", metrics)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "War Room\n\n" +
                    "Control: POST /start, /approve, /reject\n" +
                    "Status:  GET /approval-status, /current-failure, /buggy-code, /participants, /api/health, /metrics\n" +
                    "Stream:  GET http://localhost:" + port + "/stream (text/event-stream)\n"
                );
            });
    }

    /**
     * Permissive CORS wrapper; answers preflight requests directly.
     */
    static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    private App() {}
}
