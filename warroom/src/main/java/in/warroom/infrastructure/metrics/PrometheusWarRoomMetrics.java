package in.warroom.infrastructure.metrics;

import in.warroom.domain.approval.GateState;
import in.warroom.domain.model.MessageType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Locale;

/**
 * Prometheus implementation of WarRoomMetrics.
 *
 * Key Metrics:
 * - warroom_messages_published_total{message_type} - Messages fanned out
 * - warroom_message_deliveries_total - Per-subscriber queue insertions
 * - warroom_subscribers_active - Live stream subscribers
 * - warroom_subscriber_messages_dropped_total - Backlog overruns (oldest dropped)
 * - warroom_keepalives_total - Pings sent on idle streams
 * - warroom_approvals_total{outcome} - Gate settlements
 * - warroom_runs_total{result} - Finished triage runs
 * - warroom_run_duration_seconds - Triage run wall time
 *
 * Usage:
 * <pre>
 * PrometheusWarRoomMetrics metrics = new PrometheusWarRoomMetrics();
 * BroadcastHub hub = new BroadcastHub(capacity, keepalive, metrics);
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusWarRoomMetrics implements WarRoomMetrics {

    private final CollectorRegistry registry;

    private final Counter publishedCounter;
    private final Counter deliveryCounter;
    private final Gauge subscribersActive;
    private final Counter droppedCounter;
    private final Counter keepaliveCounter;
    private final Counter approvalCounter;
    private final Counter runCounter;
    private final Histogram runDuration;

    public PrometheusWarRoomMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusWarRoomMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.publishedCounter = Counter.build()
            .name("warroom_messages_published_total")
            .help("Total number of messages published to the hub")
            .labelNames("message_type")
            .register(registry);

        this.deliveryCounter = Counter.build()
            .name("warroom_message_deliveries_total")
            .help("Total number of messages queued for individual subscribers")
            .register(registry);

        this.subscribersActive = Gauge.build()
            .name("warroom_subscribers_active")
            .help("Number of live stream subscribers")
            .register(registry);

        this.droppedCounter = Counter.build()
            .name("warroom_subscriber_messages_dropped_total")
            .help("Messages dropped from full subscriber queues")
            .register(registry);

        this.keepaliveCounter = Counter.build()
            .name("warroom_keepalives_total")
            .help("Keepalive pings emitted on idle subscribers")
            .register(registry);

        this.approvalCounter = Counter.build()
            .name("warroom_approvals_total")
            .help("Approval gate settlements by outcome")
            .labelNames("outcome")
            .register(registry);

        this.runCounter = Counter.build()
            .name("warroom_runs_total")
            .help("Finished triage runs by result")
            .labelNames("result")
            .register(registry);

        this.runDuration = Histogram.build()
            .name("warroom_run_duration_seconds")
            .help("Triage run wall time in seconds")
            .buckets(1, 5, 10, 30, 60, 120, 300)
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordPublished(MessageType type, int recipients) {
        publishedCounter.labels(type.wireName()).inc();
        deliveryCounter.inc(recipients);
    }

    @Override
    public void recordSubscriberCount(int count) {
        subscribersActive.set(count);
    }

    @Override
    public void recordDropped() {
        droppedCounter.inc();
    }

    @Override
    public void recordKeepalive() {
        keepaliveCounter.inc();
    }

    @Override
    public void recordApproval(GateState outcome) {
        approvalCounter.labels(outcome.name().toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void recordRun(String result, Duration duration) {
        runCounter.labels(result).inc();
        runDuration.observe(duration.toMillis() / 1000.0);
    }
}
