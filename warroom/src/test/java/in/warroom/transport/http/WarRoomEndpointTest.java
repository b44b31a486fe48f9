package in.warroom.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.warroom.application.port.output.IncidentProvider;
import in.warroom.bootstrap.App;
import in.warroom.domain.approval.ApprovalDecision;
import in.warroom.domain.model.Incident;
import in.warroom.domain.model.TestIncidents;
import in.warroom.infrastructure.metrics.PrometheusMetricsHandler;
import in.warroom.infrastructure.metrics.PrometheusWarRoomMetrics;
import in.warroom.service.approval.ApprovalGate;
import in.warroom.service.session.SessionManager;
import in.warroom.service.triage.Pacer;
import in.warroom.service.triage.TriageOrchestrator;
import in.warroom.transport.stream.BroadcastHub;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the war room HTTP surface.
 * Runs a real Undertow server on a local port with an unpaced orchestrator.
 */
class WarRoomEndpointTest {

    private static final int PORT = 19095;
    private static final String BASE = "http://localhost:" + PORT;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(Duration.ofSeconds(2))
        .build();

    private BroadcastHub hub;
    private ApprovalGate gate;
    private SessionManager sessionManager;
    private StreamHandler streamHandler;
    private Undertow server;

    private void startServer(IncidentProvider provider, Duration approvalTimeout) {
        startServer(provider, approvalTimeout, Duration.ofSeconds(30));
    }

    private void startServer(IncidentProvider provider, Duration approvalTimeout, Duration keepalive) {
        PrometheusWarRoomMetrics metrics = new PrometheusWarRoomMetrics(new CollectorRegistry());
        hub = new BroadcastHub(256, keepalive, metrics);
        gate = new ApprovalGate(ApprovalDecision.GRANTED, metrics);
        TriageOrchestrator orchestrator = new TriageOrchestrator(
            hub, gate, Pacer.none(), approvalTimeout, "Nitin", Clock.systemUTC(), new Random(7));
        sessionManager = new SessionManager(orchestrator, gate, metrics);
        streamHandler = new StreamHandler(hub);
        TriageHandlers api = new TriageHandlers(sessionManager, provider, gate, hub, "Nitin");

        server = Undertow.builder()
            .addHttpListener(PORT, "localhost")
            .setHandler(App.routes(api, streamHandler, new PrometheusMetricsHandler(metrics.getRegistry()), PORT))
            .build();
        server.start();
    }

    private static IncidentProvider fixed(Incident incident) {
        return () -> Optional.of(incident);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            hub.close();
            sessionManager.stop();
            streamHandler.close();
            server.stop();
        }
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + path))
            .POST(HttpRequest.BodyPublishers.noBody())
            .timeout(Duration.ofSeconds(5))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + path))
            .GET()
            .timeout(Duration.ofSeconds(5))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    /**
     * Open /stream and pump its lines into a queue on a background thread.
     */
    private BlockingQueue<String> openStream() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create(BASE + "/stream")).GET().build();
        HttpResponse<Stream<String>> response = client.send(request, HttpResponse.BodyHandlers.ofLines());
        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));

        BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        Thread pump = new Thread(() -> {
            try (Stream<String> body = response.body()) {
                body.filter(line -> !line.isEmpty()).forEach(lines::add);
            } catch (RuntimeException e) {
                lines.add("closed: " + e.getMessage());
            }
        }, "test-stream-reader");
        pump.setDaemon(true);
        pump.start();

        String first = lines.poll(5, TimeUnit.SECONDS);
        assertNotNull(first, "Stream should send a connected comment");
        assertTrue(first.startsWith(": connected"), "Unexpected first line: " + first);
        return lines;
    }

    private static JsonNode awaitMessageType(BlockingQueue<String> lines, String type) throws Exception {
        while (true) {
            String line = lines.poll(5, TimeUnit.SECONDS);
            assertNotNull(line, "Timed out waiting for a " + type + " message");
            assertTrue(line.startsWith("data: "), "Unexpected SSE line: " + line);
            JsonNode node = MAPPER.readTree(line.substring("data: ".length()));
            if (type.equals(node.path("message_type").asText())) {
                return node;
            }
        }
    }

    @Test
    void testStatusEndpointsBeforeAnyRun() throws Exception {
        startServer(fixed(TestIncidents.billingWithFix()), Duration.ofSeconds(10));

        JsonNode status = json(get("/approval-status"));
        assertFalse(status.get("pending").asBoolean());
        assertFalse(status.get("granted").asBoolean());
        assertEquals("idle", status.get("state").asText());
        assertFalse(status.has("deadline"));

        assertEquals("no incident", json(get("/current-failure")).get("status").asText());

        JsonNode health = json(get("/api/health"));
        assertEquals("ok", health.get("status").asText());
        assertFalse(health.get("running").asBoolean());

        JsonNode approve = json(post("/approve"));
        assertEquals("no_pending_approval", approve.get("status").asText());
        assertFalse(approve.get("applied").asBoolean());
    }

    @Test
    void testParticipantsRoster() throws Exception {
        startServer(fixed(TestIncidents.billingWithFix()), Duration.ofSeconds(10));

        JsonNode participants = json(get("/participants")).get("participants");

        assertTrue(participants.isArray());
        assertTrue(participants.size() >= 6, "Roster should list chair, main, domain agents, SRE and approver");
        assertTrue(participants.toString().contains("Nitin"));
    }

    @Test
    void testStartApproveLifecycle() throws Exception {
        startServer(fixed(TestIncidents.billingWithFix()), Duration.ofSeconds(10));
        BlockingQueue<String> stream = openStream();

        HttpResponse<String> started = post("/start");
        assertEquals(202, started.statusCode());
        assertEquals("started", json(started).get("status").asText());

        awaitMessageType(stream, "approval_request");

        HttpResponse<String> again = post("/start");
        assertEquals(400, again.statusCode(), "Second start while running must be refused");
        assertEquals("already running", json(again).get("error").asText());

        awaitMessageType(stream, "control");   // waiting notice
        JsonNode pending = json(get("/approval-status"));
        assertTrue(pending.get("pending").asBoolean());
        assertTrue(pending.has("deadline"));

        JsonNode approve = json(post("/approve"));
        assertEquals("approved", approve.get("status").asText());
        assertEquals("Nitin", approve.get("by").asText());
        assertTrue(approve.get("applied").asBoolean());

        JsonNode rejectLate = json(post("/reject"));
        assertEquals("approved", rejectLate.get("status").asText(), "Decision is already final");
        assertFalse(rejectLate.get("applied").asBoolean());

        JsonNode human = awaitMessageType(stream, "human");
        assertEquals("Nitin", human.get("agent").asText());
        JsonNode rca = awaitMessageType(stream, "rca");
        assertEquals("System", rca.get("agent").asText());
        assertTrue(rca.get("timestamp").asText().matches("\\d{2}:\\d{2}:\\d{2}"));

        assertTrue(sessionManager.awaitIdle(Duration.ofSeconds(5)));
        JsonNode failure = json(get("/current-failure"));
        assertEquals("BILLING_400", failure.get("error_code").asText());
        assertTrue(failure.get("has_fix").asBoolean());
        assertFalse(failure.get("running").asBoolean());

        assertEquals(202, post("/start").statusCode(), "New run admitted after completion");
    }

    @Test
    void testRejectEndsRunWithNotice() throws Exception {
        startServer(fixed(TestIncidents.billingWithFix()), Duration.ofSeconds(10));
        BlockingQueue<String> stream = openStream();

        post("/start");
        awaitMessageType(stream, "control");

        JsonNode reject = json(post("/reject"));
        assertEquals("rejected", reject.get("status").asText());
        assertTrue(reject.get("applied").asBoolean());

        JsonNode notice = awaitMessageType(stream, "control");
        assertTrue(notice.get("text").asText().contains("rejected by Nitin"));
        assertTrue(sessionManager.awaitIdle(Duration.ofSeconds(5)));
        assertEquals("rejected", json(get("/approval-status")).get("state").asText());
    }

    @Test
    void testStartWithoutIncidentReturns503() throws Exception {
        startServer(Optional::empty, Duration.ofSeconds(10));

        HttpResponse<String> response = post("/start");

        assertEquals(503, response.statusCode());
        assertEquals("no incident available", json(response).get("error").asText());
        assertFalse(json(get("/api/health")).get("running").asBoolean());
    }

    @Test
    void testMetricsEndpointExposesCounters() throws Exception {
        startServer(fixed(TestIncidents.databaseWithoutFix()), Duration.ofSeconds(10));

        post("/start");
        assertTrue(sessionManager.awaitIdle(Duration.ofSeconds(5)));
        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("warroom_messages_published_total"));
        assertTrue(response.body().contains("warroom_runs_total"));
    }

    @Test
    void testUnknownPathReturnsHelp() throws Exception {
        startServer(fixed(TestIncidents.billingWithFix()), Duration.ofSeconds(10));

        HttpResponse<String> response = get("/nope");

        assertEquals(404, response.statusCode());
        assertTrue(response.body().contains("/stream"));
    }

    @Test
    void testIdleStreamReceivesPing() throws Exception {
        startServer(fixed(TestIncidents.billingWithFix()), Duration.ofSeconds(10), Duration.ofMillis(200));
        BlockingQueue<String> stream = openStream();

        String first = stream.poll(5, TimeUnit.SECONDS);

        assertEquals("data: {\"type\":\"ping\"}", first, "Idle stream should carry a ping event");
        assertEquals("data: " + StreamHandler.PING_JSON, stream.poll(5, TimeUnit.SECONDS), "Pings repeat while idle");
    }

    @Test
    void testBuggyCodeFollowsCurrentIncident() throws Exception {
        Incident incident = TestIncidents.billingWithFix();
        startServer(fixed(incident), Duration.ofMillis(100));

        JsonNode before = json(get("/buggy-code"));
        assertEquals(TriageHandlers.NO_CODE, before.get("code").asText());
        assertEquals("unknown", before.get("file").asText());

        post("/start");
        assertTrue(sessionManager.awaitIdle(Duration.ofSeconds(5)), "Run should auto-approve and finish");

        JsonNode after = json(get("/buggy-code"));
        assertEquals(incident.fix().orElseThrow().buggyCode(), after.get("code").asText());
        assertEquals("services/billing.py", after.get("file").asText());
    }

    @Test
    void testBuggyCodeWithoutPatch() throws Exception {
        startServer(fixed(TestIncidents.databaseWithoutFix()), Duration.ofSeconds(10));

        post("/start");
        assertTrue(sessionManager.awaitIdle(Duration.ofSeconds(5)));

        JsonNode body = json(get("/buggy-code"));
        assertEquals("// No code available", body.get("code").asText(), "Incident without a patch has no code to show");
        assertEquals("unknown", body.get("file").asText());
    }
}
