package io.slobengine.service.setup;

import io.slobengine.domain.setup.SetupCandidate;

import java.time.Instant;
import java.util.List;

/**
 * Result of feeding one candle to the tracker.
 *
 * @param updated     every candidate that consumed the candle (including new ones and terminal ones)
 * @param completed   candidates that reached SETUP_COMPLETE on this candle
 * @param invalidated candidates that reached INVALIDATED on this candle
 * @param rejected    true when the candle was malformed or out of order and nothing changed
 */
public record CandleUpdate(
    Instant candleTime,
    List<SetupCandidate> updated,
    List<SetupCandidate> completed,
    List<SetupCandidate> invalidated,
    boolean rejected,
    String message
) {
    static CandleUpdate rejected(Instant candleTime, String message) {
        return new CandleUpdate(candleTime, List.of(), List.of(), List.of(), true, message);
    }

    public boolean hasCompleted() {
        return !completed.isEmpty();
    }
}
