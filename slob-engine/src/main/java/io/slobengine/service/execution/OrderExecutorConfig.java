package io.slobengine.service.execution;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Submission retry policy and contract economics.
 */
public record OrderExecutorConfig(
    int maxRetryAttempts,     // total submission attempts per bracket
    Duration retryDelay,      // base delay, doubled after each failed attempt
    BigDecimal pointValue     // currency per point per contract, used for trade pnl
) {
    public OrderExecutorConfig {
        if (maxRetryAttempts < 1) {
            throw new IllegalArgumentException("maxRetryAttempts must be at least 1");
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay cannot be negative");
        }
        if (pointValue == null || pointValue.signum() <= 0) {
            throw new IllegalArgumentException("Point value must be positive");
        }
    }

    public static OrderExecutorConfig defaults() {
        return new OrderExecutorConfig(3, Duration.ofSeconds(1), new BigDecimal("20"));
    }
}
