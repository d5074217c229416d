package io.slobengine.domain.setup;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One applied state change, stamped with the candle that caused it.
 */
public record StateTransition(
    SetupState from,
    SetupState to,
    Instant candleTime,
    BigDecimal price,
    String reason
) {
}
