package io.slobengine.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fill notification pushed by the venue.
 */
public record VenueFill(
    String venueOrderId,
    String reference,
    String symbol,
    BigDecimal price,
    int quantity,
    Instant timestamp
) {
}
