package io.slobengine.infrastructure.metrics;

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

/**
 * Undertow handler serving the registry in Prometheus text format.
 *
 * <pre>
 * # HELP slob_orders_total Bracket submission outcomes and fills
 * # TYPE slob_orders_total counter
 * slob_orders_total{outcome="placed",} 3.0
 * slob_orders_total{outcome="duplicate_order",} 1.0
 * </pre>
 */
public final class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;
    private final Runnable beforeScrape;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this(registry, () -> { });
    }

    /**
     * @param beforeScrape refreshes pull-style gauges right before they are written
     */
    public PrometheusMetricsHandler(CollectorRegistry registry, Runnable beforeScrape) {
        this.registry = registry;
        this.beforeScrape = beforeScrape;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String body;
        try {
            beforeScrape.run();
            body = render();
        } catch (IOException | RuntimeException e) {
            log.error("[METRICS] Scrape failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("metrics unavailable: " + e.getMessage());
            return;
        }

        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(body);
        log.debug("[METRICS] Scrape served, {} bytes", body.length());
    }

    String render() throws IOException {
        StringWriter out = new StringWriter(4096);
        TextFormat.write004(out, registry.metricFamilySamples());
        return out.toString();
    }
}
