package io.slobengine.domain.order;

import io.slobengine.domain.setup.Direction;

import java.time.Instant;
import java.util.List;

/**
 * Entry + stop-loss + take-profit submitted together for one setup.
 *
 * idempotencyKey is derived from the setup id only, so it survives restarts.
 */
public record BracketOrder(
    String setupId,
    String idempotencyKey,
    String symbol,
    Direction direction,
    int quantity,
    Instant submittedAt,
    BracketLeg entry,
    BracketLeg stopLoss,
    BracketLeg takeProfit,
    OrderStatus status
) {
    public BracketOrder {
        if (setupId == null || setupId.isBlank()) {
            throw new IllegalArgumentException("Setup id cannot be null or empty");
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (entry == null || stopLoss == null || takeProfit == null) {
            throw new IllegalArgumentException("Bracket requires entry, stop-loss and take-profit legs");
        }
    }

    public List<BracketLeg> legs() {
        return List.of(entry, stopLoss, takeProfit);
    }

    public BracketLeg leg(LegRole role) {
        switch (role) {
            case ENTRY:
                return entry;
            case STOP_LOSS:
                return stopLoss;
            default:
                return takeProfit;
        }
    }

    /**
     * Find the leg whose reference or venue id matches.
     */
    public BracketLeg findLeg(String reference, String venueOrderId) {
        for (BracketLeg leg : legs()) {
            if (reference != null && reference.equals(leg.reference())) {
                return leg;
            }
            if (venueOrderId != null && venueOrderId.equals(leg.venueOrderId())) {
                return leg;
            }
        }
        return null;
    }

    public BracketOrder withStatus(OrderStatus newStatus) {
        return new BracketOrder(setupId, idempotencyKey, symbol, direction, quantity, submittedAt,
            entry, stopLoss, takeProfit, newStatus);
    }

    public BracketOrder withVenueOrderIds(String entryId, String stopId, String targetId) {
        return new BracketOrder(setupId, idempotencyKey, symbol, direction, quantity, submittedAt,
            entry.withVenueOrderId(entryId),
            stopLoss.withVenueOrderId(stopId),
            takeProfit.withVenueOrderId(targetId),
            status);
    }
}
