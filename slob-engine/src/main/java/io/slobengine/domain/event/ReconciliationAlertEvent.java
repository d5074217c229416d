package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;

import java.time.Instant;

/**
 * Venue holds a position with no matching local trade. Requires operator action;
 * the engine never adopts or closes such a position on its own.
 */
public record ReconciliationAlertEvent(
    String symbol,
    int venueQuantity,
    String message,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.RECONCILIATION_ALERT;
    }
}
