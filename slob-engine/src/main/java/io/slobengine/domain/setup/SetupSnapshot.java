package io.slobengine.domain.setup;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Immutable, serializable image of a {@link SetupCandidate}.
 * Stored as JSON by the state store and read back at startup.
 */
public record SetupSnapshot(
    String id,
    String symbol,
    Direction direction,
    SetupState state,
    BigDecimal sessionHigh,
    BigDecimal sessionLow,
    Instant liq1Time,
    BigDecimal liq1Price,
    List<CandleSnapshot> consolCandles,
    BigDecimal consolHigh,
    BigDecimal consolLow,
    Instant consolFrozenAt,
    Instant noWickTime,
    BigDecimal noWickHigh,
    BigDecimal noWickLow,
    CandleSnapshot liq2Candle,
    Instant liq2Time,
    BigDecimal entryPrice,
    Instant entryTime,
    BigDecimal stopPrice,
    BigDecimal targetPrice,
    BigDecimal riskReward,
    int candlesProcessed,
    int candlesSinceFreeze,
    int candlesSinceLiq2,
    Instant lastCandleTime,
    InvalidationReason invalidationReason,
    List<StateTransition> transitions,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean isActive() {
        return state != null && !state.isTerminal();
    }

    /**
     * Whether this image may overwrite {@code stored}: never older than it, and never an
     * active state over a terminal one.
     */
    public boolean canReplace(SetupSnapshot stored) {
        if (stored == null) {
            return true;
        }
        if (isActive() && !stored.isActive()) {
            return false;
        }
        if (stored.updatedAt() == null || updatedAt == null) {
            return stored.updatedAt() == null;
        }
        return !updatedAt.isBefore(stored.updatedAt());
    }
}
