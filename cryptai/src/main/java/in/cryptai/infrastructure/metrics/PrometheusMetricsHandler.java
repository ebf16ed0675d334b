package in.cryptai.infrastructure.metrics;

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
 * Scrape endpoint: GET /metrics.
 *
 * Format follows the Accept header (OpenMetrics when asked for, text 0.0.4
 * otherwise). Repeated {@code name[]} query parameters restrict the output to
 * those metric families.
 *
 * <pre>
 * # HELP generation_runs_total Hourly generation runs by outcome
 * # TYPE generation_runs_total counter
 * generation_runs_total{outcome="completed",} 24.0
 * generation_runs_total{outcome="already_done",} 3.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

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
            log.error("[METRICS] Export failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        String body = writer.toString();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body, StandardCharsets.UTF_8);
        log.debug("[METRICS] Served {} bytes ({} families requested)", body.length(),
            names.isEmpty() ? "all" : names.size());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
