package io.slobengine.domain.order;

import java.math.BigDecimal;

/**
 * Order as reported by the venue in open/recent order queries.
 */
public record VenueOrder(
    String venueOrderId,
    String symbol,
    String reference,
    String action,
    int quantity,
    BigDecimal price,
    OrderStatus status
) {
}
