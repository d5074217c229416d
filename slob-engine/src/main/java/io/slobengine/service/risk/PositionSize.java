package io.slobengine.service.risk;

import java.math.BigDecimal;

/**
 * Result of a sizing decision.
 *
 * @param contracts  contracts to trade, 0 when refused
 * @param riskAmount currency at risk for the chosen size
 * @param method     how the size was derived
 * @param reason     human readable detail
 */
public record PositionSize(int contracts, BigDecimal riskAmount, Method method, String reason) {

    public enum Method {
        FIXED_RISK,
        ATR_ADJUSTED,
        DRAWDOWN_REDUCED,
        HALTED,
        INVALID
    }

    public static PositionSize refused(Method method, String reason) {
        return new PositionSize(0, BigDecimal.ZERO, method, reason);
    }

    public boolean isTradable() {
        return contracts > 0;
    }

    public String getSummary() {
        return String.format("%d contract(s), risk=%s, method=%s (%s)", contracts, riskAmount, method, reason);
    }
}
