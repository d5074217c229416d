package io.slobengine.application.port.output;

import io.slobengine.domain.data.Candle;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.setup.SetupSnapshot;
import io.slobengine.domain.trade.SessionState;
import io.slobengine.domain.trade.Trade;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable engine state used for crash recovery.
 *
 * Saves are upserts keyed by the natural id (setup id, trade id, setup id of the bracket,
 * symbol + bucket time, trading date). Failures surface as {@link StateStoreException}.
 */
public interface StateStore {

    void saveSetup(SetupSnapshot setup);

    /**
     * Setups not yet in a terminal state. Unreadable rows are skipped.
     */
    List<SetupSnapshot> loadActiveSetups();

    void saveTrade(Trade trade);

    List<Trade> loadOpenTrades();

    void saveBracket(BracketOrder bracket);

    List<BracketOrder> loadBrackets();

    void saveCandle(Candle candle);

    List<Candle> loadCandles(String symbol, Instant from, Instant to);

    void saveSessionState(SessionState state);

    Optional<SessionState> loadSessionState(LocalDate tradingDate);

    /**
     * Release resources.
     */
    void shutdown();
}
