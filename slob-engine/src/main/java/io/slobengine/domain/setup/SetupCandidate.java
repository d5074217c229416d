package io.slobengine.domain.setup;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * A single setup detection attempt.
 *
 * Owned by SetupTracker until it reaches a terminal state; all mutation happens on the
 * engine thread. Persistence goes through {@link SetupSnapshot}.
 *
 * Stop and target are write-once: the first value computed at entry trigger is kept for
 * the lifetime of the setup.
 */
public final class SetupCandidate {

    private final String id;
    private final String symbol;
    private final Direction direction;
    private final BigDecimal sessionHigh;
    private final BigDecimal sessionLow;
    private final Instant createdAt;

    private SetupState state;
    private Instant liq1Time;
    private BigDecimal liq1Price;

    private final List<CandleSnapshot> consolCandles;
    private BigDecimal consolHigh;
    private BigDecimal consolLow;
    private Instant consolFrozenAt;

    private Instant noWickTime;
    private BigDecimal noWickHigh;
    private BigDecimal noWickLow;

    private CandleSnapshot liq2Candle;
    private Instant liq2Time;

    private BigDecimal entryPrice;
    private Instant entryTime;
    private BigDecimal stopPrice;
    private BigDecimal targetPrice;
    private BigDecimal riskReward;

    private int candlesProcessed;
    private int candlesSinceFreeze;
    private int candlesSinceLiq2;
    private Instant lastCandleTime;

    private InvalidationReason invalidationReason;
    private final List<StateTransition> transitions;
    private Instant updatedAt;

    public SetupCandidate(String symbol, Direction direction, BigDecimal sessionHigh,
                          BigDecimal sessionLow, Instant createdAt) {
        this(UUID.randomUUID().toString(), symbol, direction, sessionHigh, sessionLow, createdAt);
    }

    public SetupCandidate(String id, String symbol, Direction direction, BigDecimal sessionHigh,
                          BigDecimal sessionLow, Instant createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Setup id cannot be null or empty");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Direction cannot be null");
        }
        this.id = id;
        this.symbol = symbol;
        this.direction = direction;
        this.sessionHigh = sessionHigh;
        this.sessionLow = sessionLow;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.state = SetupState.WATCHING_LIQ1;
        this.consolCandles = new ArrayList<>();
        this.transitions = new ArrayList<>();
    }

    // ═══════════════════════════════════════════════════════════════
    // State
    // ═══════════════════════════════════════════════════════════════

    /**
     * Apply a state change and record it. Legality is checked by StateTransitionValidator.
     */
    public void applyTransition(SetupState to, Instant candleTime, BigDecimal price, String reason) {
        transitions.add(new StateTransition(state, to, candleTime, price, reason));
        this.state = to;
        this.updatedAt = candleTime;
    }

    public void markInvalidated(InvalidationReason reason) {
        this.invalidationReason = reason;
    }

    public boolean isActive() {
        return !state.isTerminal();
    }

    // ═══════════════════════════════════════════════════════════════
    // LIQ#1
    // ═══════════════════════════════════════════════════════════════

    public void recordLiq1(Instant time, BigDecimal price) {
        this.liq1Time = time;
        this.liq1Price = price;
    }

    // ═══════════════════════════════════════════════════════════════
    // Consolidation
    // ═══════════════════════════════════════════════════════════════

    public void admitConsolidationCandle(CandleSnapshot candle) {
        consolCandles.add(candle);
        recomputeConsolidationBounds();
    }

    /**
     * Max/min over every admitted consolidation candle.
     */
    public void recomputeConsolidationBounds() {
        BigDecimal high = null;
        BigDecimal low = null;
        for (CandleSnapshot c : consolCandles) {
            high = high == null ? c.high() : high.max(c.high());
            low = low == null ? c.low() : low.min(c.low());
        }
        this.consolHigh = high;
        this.consolLow = low;
    }

    public void freezeConsolidation(Instant at) {
        recomputeConsolidationBounds();
        this.consolFrozenAt = at;
    }

    public boolean isConsolidationFrozen() {
        return consolFrozenAt != null;
    }

    public void recordNoWick(CandleSnapshot candle) {
        this.noWickTime = candle.timestamp();
        this.noWickHigh = candle.high();
        this.noWickLow = candle.low();
    }

    // ═══════════════════════════════════════════════════════════════
    // LIQ#2 / entry
    // ═══════════════════════════════════════════════════════════════

    public void recordLiq2(CandleSnapshot candle) {
        if (liq2Candle != null) {
            throw new IllegalStateException("LIQ#2 candle already frozen for setup " + id);
        }
        this.liq2Candle = candle;
        this.liq2Time = candle.timestamp();
    }

    public void recordEntry(Instant time, BigDecimal price) {
        this.entryTime = time;
        this.entryPrice = price;
    }

    public void setStopAndTarget(BigDecimal stop, BigDecimal target) {
        if (stopPrice != null || targetPrice != null) {
            throw new IllegalStateException("Stop/target already set for setup " + id);
        }
        this.stopPrice = stop;
        this.targetPrice = target;
    }

    public void setRiskReward(BigDecimal riskReward) {
        this.riskReward = riskReward;
    }

    // ═══════════════════════════════════════════════════════════════
    // Counters
    // ═══════════════════════════════════════════════════════════════

    public void countCandle(Instant candleTime) {
        candlesProcessed++;
        lastCandleTime = candleTime;
        updatedAt = candleTime;
        if (state == SetupState.WATCHING_LIQ2) {
            candlesSinceFreeze++;
        } else if (state == SetupState.WAITING_ENTRY) {
            candlesSinceLiq2++;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Persistence
    // ═══════════════════════════════════════════════════════════════

    public SetupSnapshot toSnapshot() {
        return new SetupSnapshot(
            id, symbol, direction, state, sessionHigh, sessionLow,
            liq1Time, liq1Price,
            List.copyOf(consolCandles), consolHigh, consolLow, consolFrozenAt,
            noWickTime, noWickHigh, noWickLow,
            liq2Candle, liq2Time,
            entryPrice, entryTime, stopPrice, targetPrice, riskReward,
            candlesProcessed, candlesSinceFreeze, candlesSinceLiq2, lastCandleTime,
            invalidationReason, List.copyOf(transitions), createdAt, updatedAt
        );
    }

    public static SetupCandidate fromSnapshot(SetupSnapshot s) {
        SetupCandidate c = new SetupCandidate(s.id(), s.symbol(), s.direction(),
            s.sessionHigh(), s.sessionLow(), s.createdAt());
        c.state = s.state();
        c.liq1Time = s.liq1Time();
        c.liq1Price = s.liq1Price();
        if (s.consolCandles() != null) {
            c.consolCandles.addAll(s.consolCandles());
        }
        c.consolHigh = s.consolHigh();
        c.consolLow = s.consolLow();
        c.consolFrozenAt = s.consolFrozenAt();
        c.noWickTime = s.noWickTime();
        c.noWickHigh = s.noWickHigh();
        c.noWickLow = s.noWickLow();
        c.liq2Candle = s.liq2Candle();
        c.liq2Time = s.liq2Time();
        c.entryPrice = s.entryPrice();
        c.entryTime = s.entryTime();
        c.stopPrice = s.stopPrice();
        c.targetPrice = s.targetPrice();
        c.riskReward = s.riskReward();
        c.candlesProcessed = s.candlesProcessed();
        c.candlesSinceFreeze = s.candlesSinceFreeze();
        c.candlesSinceLiq2 = s.candlesSinceLiq2();
        c.lastCandleTime = s.lastCandleTime();
        c.invalidationReason = s.invalidationReason();
        if (s.transitions() != null) {
            c.transitions.addAll(s.transitions());
        }
        c.updatedAt = s.updatedAt();
        return c;
    }

    // ═══════════════════════════════════════════════════════════════
    // Getters
    // ═══════════════════════════════════════════════════════════════

    public String getId() { return id; }
    public String getSymbol() { return symbol; }
    public Direction getDirection() { return direction; }
    public SetupState getState() { return state; }
    public BigDecimal getSessionHigh() { return sessionHigh; }
    public BigDecimal getSessionLow() { return sessionLow; }
    public Instant getLiq1Time() { return liq1Time; }
    public BigDecimal getLiq1Price() { return liq1Price; }
    public List<CandleSnapshot> getConsolCandles() { return Collections.unmodifiableList(consolCandles); }
    public int getConsolCandleCount() { return consolCandles.size(); }
    public BigDecimal getConsolHigh() { return consolHigh; }
    public BigDecimal getConsolLow() { return consolLow; }
    public Instant getConsolFrozenAt() { return consolFrozenAt; }
    public Instant getNoWickTime() { return noWickTime; }
    public BigDecimal getNoWickHigh() { return noWickHigh; }
    public BigDecimal getNoWickLow() { return noWickLow; }
    public boolean hasNoWick() { return noWickTime != null; }
    public CandleSnapshot getLiq2Candle() { return liq2Candle; }
    public Instant getLiq2Time() { return liq2Time; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public Instant getEntryTime() { return entryTime; }
    public BigDecimal getStopPrice() { return stopPrice; }
    public BigDecimal getTargetPrice() { return targetPrice; }
    public BigDecimal getRiskReward() { return riskReward; }
    public int getCandlesProcessed() { return candlesProcessed; }
    public int getCandlesSinceFreeze() { return candlesSinceFreeze; }
    public int getCandlesSinceLiq2() { return candlesSinceLiq2; }
    public Instant getLastCandleTime() { return lastCandleTime; }
    public InvalidationReason getInvalidationReason() { return invalidationReason; }
    public List<StateTransition> getTransitions() { return Collections.unmodifiableList(transitions); }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public String shortId() {
        return id.length() > 8 ? id.substring(0, 8) : id;
    }

    @Override
    public String toString() {
        return "SetupCandidate{" + shortId() + " " + direction + " " + state + "}";
    }
}
