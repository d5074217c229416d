package io.slobengine.domain.order;

import java.math.BigDecimal;

/**
 * Net position held at the venue. quantity is signed: negative is short.
 */
public record VenuePosition(
    String symbol,
    int quantity,
    BigDecimal averagePrice
) {
    public boolean isFlat() {
        return quantity == 0;
    }
}
