package io.slobengine.domain.setup;

public enum InvalidationReason {
    CONSOL_TIMEOUT,
    CONSOL_RANGE_INVALID,
    LIQ2_TIMEOUT,
    RETRACEMENT_EXCEEDED,
    ENTRY_TIMEOUT,
    MARKET_CLOSED,
    NEGATIVE_RISK_REWARD,
    ENGINE_SHUTDOWN
}
