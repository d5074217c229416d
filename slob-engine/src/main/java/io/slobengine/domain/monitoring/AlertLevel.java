package io.slobengine.domain.monitoring;

/**
 * Alert severity. CRITICAL alerts require operator action.
 */
public enum AlertLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO
}
