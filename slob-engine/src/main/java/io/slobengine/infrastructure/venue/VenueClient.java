package io.slobengine.infrastructure.venue;

import io.slobengine.domain.data.Tick;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.order.VenueFill;
import io.slobengine.domain.order.VenueOrder;
import io.slobengine.domain.order.VenuePosition;

import java.util.List;
import java.util.function.Consumer;

/**
 * Typed capability set of an execution venue.
 *
 * Implementations own the wire protocol. Connectivity failures surface as
 * {@link VenueConnectionException}; callers decide on retry and backoff.
 */
public interface VenueClient {

    /**
     * Venue identifier used in logs and events (e.g. "PAPER").
     */
    String getVenueName();

    void connect();

    void disconnect();

    boolean isConnected();

    /**
     * Synchronous liveness probe. Returns normally when the venue answered.
     *
     * @throws VenueConnectionException if the venue did not answer
     */
    void ping();

    void subscribe(String symbol);

    void unsubscribe(String symbol);

    /**
     * Submit entry, stop-loss and take-profit as one bracket.
     *
     * @return the bracket with venue order ids filled in
     */
    BracketOrder submitBracket(BracketOrder bracket);

    List<VenueOrder> queryOpenOrders();

    /**
     * Orders submitted during the current venue session, any status.
     */
    List<VenueOrder> queryRecentOrders();

    List<VenuePosition> queryPositions();

    void setTickListener(Consumer<Tick> listener);

    void setFillListener(Consumer<VenueFill> listener);
}
