package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.order.LegRole;
import io.slobengine.domain.order.VenueFill;

import java.time.Instant;

public record OrderFilledEvent(
    String setupId,
    LegRole role,
    VenueFill fill,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.ORDER_FILLED;
    }
}
