package io.slobengine.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Market tick as delivered by the venue.
 * Validation happens in CandleAggregator so a bad tick is counted rather than thrown.
 */
public record Tick(
    String symbol,
    BigDecimal price,
    long size,
    Instant timestamp
) {
    public boolean isWellFormed() {
        return symbol != null && !symbol.isBlank()
            && price != null && price.signum() > 0
            && size >= 0
            && timestamp != null;
    }
}
