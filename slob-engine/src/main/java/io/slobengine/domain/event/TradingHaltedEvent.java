package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Drawdown crossed the halt threshold; new orders are refused until trading is resumed.
 */
public record TradingHaltedEvent(
    BigDecimal drawdown,
    BigDecimal equity,
    BigDecimal peakEquity,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.TRADING_HALTED;
    }
}
