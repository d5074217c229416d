package io.slobengine.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-trading-day snapshot of session levels and account equity.
 */
public record SessionState(
    LocalDate tradingDate,
    BigDecimal sessionHigh,
    BigDecimal sessionLow,
    BigDecimal equity,
    BigDecimal peakEquity,
    int tradesToday,
    BigDecimal pnlToday,
    boolean tradingHalted,
    Instant updatedAt
) {
}
