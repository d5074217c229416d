package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;

import java.time.Instant;

public record ConnectionRestoredEvent(
    String venue,
    int attempts,
    int resubscribedSymbols,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.CONNECTION_RESTORED;
    }
}
