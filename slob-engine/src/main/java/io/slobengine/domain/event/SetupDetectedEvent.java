package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.setup.SetupSnapshot;

import java.time.Instant;

/**
 * A setup reached SETUP_COMPLETE; entry, stop and target are final.
 */
public record SetupDetectedEvent(
    SetupSnapshot setup,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.SETUP_DETECTED;
    }
}
