package io.slobengine.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.slobengine.domain.connection.ConnectionPhase;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - slob_ticks_total - Ticks accepted by the engine
 * - slob_candles_total{kind} - Completed candles, real or synthetic
 * - slob_setups_total{outcome} - Setup lifecycle outcomes
 * - slob_orders_total{outcome} - Bracket submission outcomes and fills
 * - slob_connection_events_total{event} - Link losses, restores, safe mode
 * - slob_connection_phase - 0=DISCONNECTED 1=CONNECTING 2=CONNECTED 3=SAFE_MODE
 * - slob_equity / slob_drawdown_ratio - Account state from the risk manager
 * - slob_event_handler_errors_total - Event handler failures reported by the bus
 */
public class PrometheusEngineMetrics implements EngineMetrics {

    private final CollectorRegistry registry;

    private final Counter tickCounter;
    private final Counter candleCounter;
    private final Counter setupCounter;
    private final Counter orderCounter;
    private final Counter connectionEventCounter;
    private final Gauge connectionPhase;
    private final Gauge equity;
    private final Gauge drawdown;
    private final Counter handlerErrors;
    private long lastHandlerErrors;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.tickCounter = Counter.build()
            .name("slob_ticks_total")
            .help("Total number of ticks accepted")
            .register(registry);

        this.candleCounter = Counter.build()
            .name("slob_candles_total")
            .help("Total number of completed candles")
            .labelNames("kind")
            .register(registry);

        this.setupCounter = Counter.build()
            .name("slob_setups_total")
            .help("Setup lifecycle outcomes")
            .labelNames("outcome")
            .register(registry);

        this.orderCounter = Counter.build()
            .name("slob_orders_total")
            .help("Bracket submission outcomes and fills")
            .labelNames("outcome")
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("slob_connection_events_total")
            .help("Venue connection events")
            .labelNames("event")
            .register(registry);

        this.connectionPhase = Gauge.build()
            .name("slob_connection_phase")
            .help("Venue link phase (0=DISCONNECTED, 1=CONNECTING, 2=CONNECTED, 3=SAFE_MODE)")
            .register(registry);

        this.equity = Gauge.build()
            .name("slob_equity")
            .help("Account equity tracked by the risk manager")
            .register(registry);

        this.drawdown = Gauge.build()
            .name("slob_drawdown_ratio")
            .help("Drawdown from peak equity (0.25 = 25%)")
            .register(registry);

        this.handlerErrors = Counter.build()
            .name("slob_event_handler_errors_total")
            .help("Event handler failures isolated by the event bus")
            .register(registry);
    }

    @Override
    public void recordTick() {
        tickCounter.inc();
    }

    @Override
    public void recordCandle(boolean synthetic) {
        candleCounter.labels(synthetic ? "synthetic" : "real").inc();
    }

    @Override
    public void recordSetup(SetupOutcome outcome) {
        setupCounter.labels(outcome.name().toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void recordOrder(String outcome) {
        orderCounter.labels(outcome.toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {
        connectionEventCounter.labels(event.name().toLowerCase(Locale.ROOT)).inc();
    }

    @Override
    public void updateConnectionPhase(ConnectionPhase phase) {
        connectionPhase.set(phase.ordinal());
    }

    @Override
    public void updateRisk(BigDecimal equityValue, BigDecimal drawdownValue) {
        if (equityValue != null) {
            equity.set(equityValue.doubleValue());
        }
        if (drawdownValue != null) {
            drawdown.set(drawdownValue.doubleValue());
        }
    }

    @Override
    public synchronized void updateHandlerErrors(long errors) {
        // The bus keeps a running total; the counter only moves forward by the difference
        if (errors > lastHandlerErrors) {
            handlerErrors.inc(errors - lastHandlerErrors);
            lastHandlerErrors = errors;
        }
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
