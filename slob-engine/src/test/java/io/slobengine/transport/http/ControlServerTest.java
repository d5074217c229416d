package io.slobengine.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.slobengine.application.monitoring.AlertService;
import io.slobengine.application.service.Engine;
import io.slobengine.application.service.EngineConfig;
import io.slobengine.infrastructure.metrics.PrometheusEngineMetrics;
import io.slobengine.infrastructure.metrics.PrometheusMetricsHandler;
import io.slobengine.infrastructure.persistence.InMemoryStateStore;
import io.slobengine.infrastructure.venue.paper.PaperVenueClient;
import io.slobengine.service.core.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Health reflects safe mode
 * - Status serialized as JSON
 * - Operator actions return 409 when they do not apply
 * - Metrics served next to the control routes
 */
public class ControlServerTest {

    private static final int TEST_PORT = 19092;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PaperVenueClient venue;
    private Engine engine;
    private ControlServer server;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        venue = new PaperVenueClient();
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics(new CollectorRegistry());
        engine = new Engine(EngineConfig.defaults("NQ"), venue, new InMemoryStateStore(), new EventBus(),
            new AlertService(), metrics, d -> { }, Clock.systemUTC());

        server = new ControlServer("localhost", TEST_PORT, new ControlHandlers(engine),
            new PrometheusMetricsHandler(metrics.getRegistry(), engine::refreshMetrics));
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        server.stop();
        engine.shutdown(Duration.ofSeconds(2));
    }

    @Test
    public void testHealthUp() throws Exception {
        engine.start();

        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("UP", body.get("status").asText());
        assertEquals("CONNECTED", body.get("connection").asText());
    }

    @Test
    public void testHealthDegradedInSafeMode() throws Exception {
        venue.failNextConnects(5);
        engine.start();

        HttpResponse<String> response = get("/health");

        assertEquals(503, response.statusCode(), "Safe mode should fail the health check");
        assertEquals("DEGRADED", MAPPER.readTree(response.body()).get("status").asText());
    }

    @Test
    public void testStatusJson() throws Exception {
        engine.start();

        HttpResponse<String> response = get("/status");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("application/json"));
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("NQ", body.get("symbol").asText());
        assertEquals("PAPER", body.get("venue").asText());
        assertTrue(body.get("running").asBoolean());
        assertFalse(body.get("tradingHalted").asBoolean());
    }

    @Test
    public void testClearSafeMode() throws Exception {
        venue.failNextConnects(5);
        engine.start();

        HttpResponse<String> cleared = post("/safe-mode/clear?by=alice");
        assertEquals(200, cleared.statusCode());
        assertTrue(MAPPER.readTree(cleared.body()).get("cleared").asBoolean());

        HttpResponse<String> again = post("/safe-mode/clear");
        assertEquals(409, again.statusCode(), "Nothing to clear once connected");
    }

    @Test
    public void testResumeTrading() throws Exception {
        engine.start();
        assertEquals(409, post("/trading/resume").statusCode(), "Trading is not halted");

        engine.getRiskManager().updateAfterTrade(new BigDecimal("-13000"));

        HttpResponse<String> resumed = post("/trading/resume");
        assertEquals(200, resumed.statusCode());
        assertTrue(MAPPER.readTree(resumed.body()).get("resumed").asBoolean());
    }

    @Test
    public void testMetricsAndFallback() throws Exception {
        engine.start();

        HttpResponse<String> metrics = get("/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("slob_equity 50000.0"), "Equity refreshed before the scrape");

        HttpResponse<String> unknown = get("/positions");
        assertEquals(404, unknown.statusCode());
        assertTrue(unknown.body().contains("/safe-mode/clear"));
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .POST(HttpRequest.BodyPublishers.noBody())
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
