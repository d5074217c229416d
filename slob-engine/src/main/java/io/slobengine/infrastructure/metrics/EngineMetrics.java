package io.slobengine.infrastructure.metrics;

import io.slobengine.domain.connection.ConnectionPhase;

import java.math.BigDecimal;

/**
 * Engine metrics interface for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or any other backend.
 */
public interface EngineMetrics {

    void recordTick();

    /**
     * @param synthetic true for gap-fill candles
     */
    void recordCandle(boolean synthetic);

    void recordSetup(SetupOutcome outcome);

    void recordOrder(String outcome);

    void recordConnectionEvent(ConnectionEvent event);

    void updateConnectionPhase(ConnectionPhase phase);

    void updateRisk(BigDecimal equity, BigDecimal drawdown);

    void updateHandlerErrors(long errors);

    enum SetupOutcome {
        DETECTED,
        COMPLETED,
        INVALIDATED
    }

    enum ConnectionEvent {
        LOST,
        RESTORED,
        SAFE_MODE_ENTERED,
        SAFE_MODE_CLEARED
    }

    /**
     * Discards everything. For tests and tools that do not expose metrics.
     */
    EngineMetrics NOOP = new EngineMetrics() {
        @Override
        public void recordTick() {
        }

        @Override
        public void recordCandle(boolean synthetic) {
        }

        @Override
        public void recordSetup(SetupOutcome outcome) {
        }

        @Override
        public void recordOrder(String outcome) {
        }

        @Override
        public void recordConnectionEvent(ConnectionEvent event) {
        }

        @Override
        public void updateConnectionPhase(ConnectionPhase phase) {
        }

        @Override
        public void updateRisk(BigDecimal equity, BigDecimal drawdown) {
        }

        @Override
        public void updateHandlerErrors(long errors) {
        }
    };
}
