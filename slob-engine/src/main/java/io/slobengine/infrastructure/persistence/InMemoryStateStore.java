package io.slobengine.infrastructure.persistence;

import io.slobengine.application.port.output.StateStore;
import io.slobengine.domain.data.Candle;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.setup.SetupSnapshot;
import io.slobengine.domain.trade.SessionState;
import io.slobengine.domain.trade.Trade;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Non-durable StateStore for paper runs and tests.
 */
public final class InMemoryStateStore implements StateStore {

    private final Map<String, SetupSnapshot> setups = new ConcurrentHashMap<>();
    private final Map<String, Trade> trades = new ConcurrentHashMap<>();
    private final Map<String, BracketOrder> brackets = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentSkipListMap<Instant, Candle>> candles = new ConcurrentHashMap<>();
    private final Map<LocalDate, SessionState> sessions = new ConcurrentHashMap<>();

    @Override
    public void saveSetup(SetupSnapshot setup) {
        setups.compute(setup.id(), (id, stored) -> setup.canReplace(stored) ? setup : stored);
    }

    @Override
    public List<SetupSnapshot> loadActiveSetups() {
        List<SetupSnapshot> result = new ArrayList<>();
        for (SetupSnapshot s : setups.values()) {
            if (s.isActive()) {
                result.add(s);
            }
        }
        result.sort(Comparator.comparing(SetupSnapshot::createdAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return result;
    }

    public Optional<SetupSnapshot> findSetup(String id) {
        return Optional.ofNullable(setups.get(id));
    }

    @Override
    public void saveTrade(Trade trade) {
        trades.put(trade.tradeId(), trade);
    }

    @Override
    public List<Trade> loadOpenTrades() {
        List<Trade> result = new ArrayList<>();
        for (Trade t : trades.values()) {
            if (t.isOpen()) {
                result.add(t);
            }
        }
        return result;
    }

    public Optional<Trade> findTrade(String tradeId) {
        return Optional.ofNullable(trades.get(tradeId));
    }

    @Override
    public void saveBracket(BracketOrder bracket) {
        brackets.put(bracket.setupId(), bracket);
    }

    @Override
    public List<BracketOrder> loadBrackets() {
        return new ArrayList<>(brackets.values());
    }

    @Override
    public void saveCandle(Candle candle) {
        candles.computeIfAbsent(candle.symbol(), k -> new ConcurrentSkipListMap<>())
            .put(candle.timestamp(), candle);
    }

    @Override
    public List<Candle> loadCandles(String symbol, Instant from, Instant to) {
        ConcurrentSkipListMap<Instant, Candle> series = candles.get(symbol);
        if (series == null) {
            return List.of();
        }
        return new ArrayList<>(series.subMap(from, true, to, true).values());
    }

    @Override
    public void saveSessionState(SessionState state) {
        sessions.put(state.tradingDate(), state);
    }

    @Override
    public Optional<SessionState> loadSessionState(LocalDate tradingDate) {
        return Optional.ofNullable(sessions.get(tradingDate));
    }

    @Override
    public void shutdown() {
        // Nothing to release
    }
}
