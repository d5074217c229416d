package io.slobengine.service.risk;

import java.math.BigDecimal;

/**
 * Immutable view of the account as seen by the risk manager.
 */
public record RiskState(
    BigDecimal equity,
    BigDecimal peakEquity,
    BigDecimal drawdown,
    boolean tradingHalted,
    int tradesToday,
    BigDecimal pnlToday
) {
}
