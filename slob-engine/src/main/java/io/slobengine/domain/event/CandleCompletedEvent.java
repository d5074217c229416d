package io.slobengine.domain.event;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.data.Candle;

import java.time.Instant;

public record CandleCompletedEvent(
    Candle candle,
    Instant timestamp
) implements EngineEvent {
    @Override
    public EventType type() {
        return EventType.CANDLE_COMPLETED;
    }
}
