package io.slobengine.service.risk;

import java.math.BigDecimal;

/**
 * Position sizing and drawdown policy.
 *
 * Ratios are fractions (0.02 = 2%), not percentages.
 */
public record RiskConfig(
    BigDecimal initialEquity,
    BigDecimal maxRiskPerTrade,        // fraction of equity risked per trade
    BigDecimal pointValue,             // currency per point per contract
    int maxPositionSize,               // hard contract cap
    BigDecimal reduceSizeAtDrawdown,   // drawdown at which size is scaled down
    BigDecimal drawdownSizeMultiplier, // scale applied past reduceSizeAtDrawdown
    BigDecimal maxDrawdownStop         // drawdown at which trading halts
) {
    public RiskConfig {
        if (initialEquity == null || initialEquity.signum() <= 0) {
            throw new IllegalArgumentException("Initial equity must be positive");
        }
        if (maxRiskPerTrade == null || maxRiskPerTrade.signum() <= 0 || maxRiskPerTrade.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalArgumentException("maxRiskPerTrade must be in (0, 1)");
        }
        if (pointValue == null || pointValue.signum() <= 0) {
            throw new IllegalArgumentException("Point value must be positive");
        }
        if (maxPositionSize < 1) {
            throw new IllegalArgumentException("maxPositionSize must be at least 1");
        }
        if (reduceSizeAtDrawdown == null || maxDrawdownStop == null
            || reduceSizeAtDrawdown.compareTo(maxDrawdownStop) > 0) {
            throw new IllegalArgumentException("reduceSizeAtDrawdown must not exceed maxDrawdownStop");
        }
        if (drawdownSizeMultiplier == null || drawdownSizeMultiplier.signum() <= 0
            || drawdownSizeMultiplier.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("drawdownSizeMultiplier must be in (0, 1]");
        }
    }

    public static RiskConfig defaults() {
        return withEquity(new BigDecimal("50000"));
    }

    public static RiskConfig withEquity(BigDecimal initialEquity) {
        return new RiskConfig(
            initialEquity,
            new BigDecimal("0.02"),  // 2% per trade
            new BigDecimal("20"),    // index future point value
            5,
            new BigDecimal("0.15"),  // halve size at 15% drawdown
            new BigDecimal("0.5"),
            new BigDecimal("0.25")   // stop trading at 25% drawdown
        );
    }

    public RiskConfig withMaxPositionSize(int contracts) {
        return new RiskConfig(initialEquity, maxRiskPerTrade, pointValue, contracts,
            reduceSizeAtDrawdown, drawdownSizeMultiplier, maxDrawdownStop);
    }
}
