package io.slobengine.domain.common;

/**
 * Event kinds published on the engine's event bus.
 */
public enum EventType {
    // Market data
    CANDLE_COMPLETED,

    // Setup detection
    SETUP_DETECTED,
    SETUP_INVALIDATED,

    // Execution
    ORDER_PLACED,
    ORDER_FILLED,
    ORDER_REJECTED,

    // Venue link
    CONNECTION_LOST,
    CONNECTION_RESTORED,
    SAFE_MODE_ENTERED,
    SAFE_MODE_CLEARED,

    // Risk / recovery
    TRADING_HALTED,
    RECONCILIATION_ALERT
}
