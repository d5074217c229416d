package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;

import java.time.Instant;

public record SafeModeClearedEvent(
    String venue,
    String clearedBy,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.SAFE_MODE_CLEARED;
    }
}
