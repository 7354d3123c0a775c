package io.optionsnap.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves the collector registry for Prometheus scraping.
 *
 * The format follows the Accept header (text 0.0.4 or OpenMetrics).
 * {@code ?name[]=optionsnap_snapshot_index} restricts the output to the named samples.
 *
 * Example output:
 * <pre>
 * # HELP optionsnap_snapshot_rows Total number of quote entries saved or dropped by snapshot passes
 * # TYPE optionsnap_snapshot_rows counter
 * optionsnap_snapshot_rows_total{outcome="saved",} 41230.0
 * optionsnap_snapshot_rows_total{outcome="dropped",} 18890.0
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
        try {
            StringWriter writer = new StringWriter();
            TextFormat.writeFormat(contentType, writer, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));

            exchange.setStatusCode(200);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
            exchange.getResponseSender().send(writer.toString());
            log.debug("[METRICS] Served {} bytes ({} names requested)", writer.getBuffer().length(), names.size());
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Collections.emptySet() : new HashSet<>(values);
    }
}
