package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;

import java.time.Instant;

/**
 * Typed event carried by the event bus. Each kind has a fixed payload shape.
 */
public interface EngineEvent {

    EventType type();

    Instant timestamp();
}
