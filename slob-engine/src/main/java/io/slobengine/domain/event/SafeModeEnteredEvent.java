package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;

import java.time.Instant;

/**
 * Reconnection budget exhausted. Published with publishAndWait so every observer
 * has seen it before the supervisor returns.
 */
public record SafeModeEnteredEvent(
    String venue,
    int consecutiveFailures,
    String reason,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.SAFE_MODE_ENTERED;
    }
}
