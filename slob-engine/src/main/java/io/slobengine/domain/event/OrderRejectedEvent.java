package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.order.OrderResult;

import java.time.Instant;

/**
 * Submission refused, failed, or detected as a duplicate.
 */
public record OrderRejectedEvent(
    String setupId,
    OrderResult.Outcome outcome,
    String reason,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.ORDER_REJECTED;
    }
}
