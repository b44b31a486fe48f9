package in.warroom.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics - scrape endpoint for the war room registry.
 *
 * Honours the scraper's Accept header (Prometheus text 0.0.4 or OpenMetrics) and the
 * {@code name[]} query parameter, e.g. {@code /metrics?name[]=warroom_subscribers_active}.
 *
 * Example output:
 * <pre>
 * # HELP warroom_messages_published_total Total number of messages published to the hub
 * # TYPE warroom_messages_published_total counter
 * warroom_messages_published_total{message_type="speech",} 14.0
 * warroom_messages_published_total{message_type="rca",} 1.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private static final String NAME_PARAM = "name[]";

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer,
                names.isEmpty() ? registry.metricFamilySamples() : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString(), StandardCharsets.UTF_8);
        log.debug("[METRICS] Served {} ({} families requested)", contentType, names.isEmpty() ? "all" : names.size());
    }

    // Empty set means every family
    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get(NAME_PARAM);
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
