package io.slobengine.domain.order;

import java.math.BigDecimal;

/**
 * One leg of a bracket. The reference is fixed when the bracket is built and reused on retries.
 */
public record BracketLeg(
    LegRole role,
    OrderType orderType,
    String action,
    BigDecimal price,
    String reference,
    String venueOrderId
) {
    public BracketLeg {
        if (role == null) {
            throw new IllegalArgumentException("Leg role cannot be null");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Leg price must be positive");
        }
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Leg reference cannot be null or empty");
        }
    }

    public BracketLeg withVenueOrderId(String id) {
        return new BracketLeg(role, orderType, action, price, reference, id);
    }
}
