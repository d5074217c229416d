package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.setup.InvalidationReason;
import io.slobengine.domain.setup.SetupState;

import java.time.Instant;

public record SetupInvalidatedEvent(
    String setupId,
    String symbol,
    SetupState lastState,
    InvalidationReason reason,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.SETUP_INVALIDATED;
    }
}
