package io.slobengine.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.slobengine.domain.connection.ConnectionPhase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusEngineMetricsTest {

    private CollectorRegistry registry;
    private PrometheusEngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusEngineMetrics(registry);
    }

    @Test
    void testCountersByLabel() {
        metrics.recordTick();
        metrics.recordTick();
        metrics.recordCandle(false);
        metrics.recordCandle(true);
        metrics.recordCandle(false);
        metrics.recordSetup(EngineMetrics.SetupOutcome.COMPLETED);
        metrics.recordOrder("PLACED");
        metrics.recordConnectionEvent(EngineMetrics.ConnectionEvent.SAFE_MODE_ENTERED);

        assertEquals(2.0, sample("slob_ticks_total"));
        assertEquals(2.0, sample("slob_candles_total", "kind", "real"));
        assertEquals(1.0, sample("slob_candles_total", "kind", "synthetic"));
        assertEquals(1.0, sample("slob_setups_total", "outcome", "completed"));
        assertEquals(1.0, sample("slob_orders_total", "outcome", "placed"));
        assertEquals(1.0, sample("slob_connection_events_total", "event", "safe_mode_entered"));
    }

    @Test
    void testGauges() {
        metrics.updateConnectionPhase(ConnectionPhase.SAFE_MODE);
        metrics.updateRisk(new BigDecimal("42000"), new BigDecimal("0.16"));

        assertEquals(ConnectionPhase.SAFE_MODE.ordinal(), sample("slob_connection_phase"), 0.0);
        assertEquals(42000.0, sample("slob_equity"), 0.001);
        assertEquals(0.16, sample("slob_drawdown_ratio"), 0.0001);
    }

    @Test
    void testHandlerErrorsFollowRunningTotal() {
        metrics.updateHandlerErrors(3);
        metrics.updateHandlerErrors(3);
        metrics.updateHandlerErrors(5);
        metrics.updateHandlerErrors(4);

        assertEquals(5.0, sample("slob_event_handler_errors_total"), "Counter should only move forward");
    }

    private double sample(String name) {
        Double value = registry.getSampleValue(name);
        assertNotNull(value, "Missing sample " + name);
        return value;
    }

    private double sample(String name, String label, String labelValue) {
        Double value = registry.getSampleValue(name, new String[]{label}, new String[]{labelValue});
        assertNotNull(value, "Missing sample " + name + "{" + label + "=" + labelValue + "}");
        return value;
    }
}
