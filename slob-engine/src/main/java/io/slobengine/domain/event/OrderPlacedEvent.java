package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.order.BracketOrder;

import java.time.Instant;

public record OrderPlacedEvent(
    BracketOrder bracket,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.ORDER_PLACED;
    }
}
