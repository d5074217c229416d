package io.slobengine.service.core;

import io.slobengine.domain.event.EngineEvent;

/**
 * Subscriber callback. Exceptions are caught and counted by the bus.
 */
@FunctionalInterface
public interface EventHandler<E extends EngineEvent> {
    void handle(E event) throws Exception;
}
