package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;

import java.time.Instant;

public record ConnectionLostEvent(
    String venue,
    String reason,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.CONNECTION_LOST;
    }
}
