package io.slobengine.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Endpoint accessibility and text format
 * - Engine metrics registered and exported
 * - Pull-style gauges refreshed before each scrape
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19091;
    private Undertow server;
    private PrometheusEngineMetrics metrics;
    private HttpClient httpClient;
    private final AtomicInteger refreshes = new AtomicInteger();

    @BeforeEach
    public void setUp() {
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusEngineMetrics(registry);

        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry(), () -> {
            refreshes.incrementAndGet();
            metrics.updateRisk(new BigDecimal("50000"), BigDecimal.ZERO);
        });

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addPrefixPath("/metrics", metricsHandler))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testMetricsEndpointAccessible() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be Prometheus text format");
        assertFalse(response.body().isEmpty(), "Response body should not be empty");
    }

    @Test
    public void testMetricsRecordedAndExported() throws Exception {
        metrics.recordOrder("PLACED");
        metrics.recordOrder("DUPLICATE_ORDER");
        metrics.recordCandle(true);

        String body = scrape().body();

        assertTrue(body.contains("# TYPE slob_orders_total counter"), "Should declare slob_orders_total");
        assertTrue(body.contains("slob_orders_total{outcome=\"placed\",} 1.0"), "Placed order should be exported");
        assertTrue(body.contains("slob_orders_total{outcome=\"duplicate_order\",} 1.0"),
            "Duplicate order should be exported");
        assertTrue(body.contains("slob_candles_total{kind=\"synthetic\",} 1.0"), "Synthetic candle should be exported");
        assertTrue(body.contains("slob_equity 50000.0"), "Refreshed equity gauge should be exported");
    }

    @Test
    public void testRefreshRunsOnEveryScrape() throws Exception {
        scrape();
        scrape();

        assertEquals(2, refreshes.get(), "Gauges should be refreshed once per scrape");
    }

    private HttpResponse<String> scrape() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics"))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
