package io.slobengine.service.setup;

import io.slobengine.domain.data.Candle;
import io.slobengine.domain.event.EngineEvent;
import io.slobengine.domain.event.SetupDetectedEvent;
import io.slobengine.domain.event.SetupInvalidatedEvent;
import io.slobengine.domain.setup.CandleSnapshot;
import io.slobengine.domain.setup.Direction;
import io.slobengine.domain.setup.InvalidationReason;
import io.slobengine.domain.setup.SetupCandidate;
import io.slobengine.domain.setup.SetupSnapshot;
import io.slobengine.domain.setup.SetupState;
import io.slobengine.domain.setup.StateTransition;
import io.slobengine.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * SetupTracker - candle-by-candle detection of the liquidity-sweep setup.
 *
 * CAUSALITY:
 * Every decision for a candle uses that candle and earlier candles only. Candles must arrive
 * in strictly increasing time; anything else is rejected and leaves all candidates untouched.
 *
 * FREEZE-ON-TRANSITION:
 * The candle that breaks the consolidation bound is never admitted to the window. Bounds are
 * taken from the strictly earlier candles, frozen, and the same candle is then evaluated as a
 * LIQ#2 candidate against the frozen bounds. Later candles never re-enter the window.
 *
 * STOP:
 * Computed once at entry trigger from the frozen LIQ#2 candle (spike rule) and never changed.
 *
 * Multiple candidates may be active at once; they live in a map keyed by id.
 * All public methods are synchronized: the event dispatch thread feeds candles while the
 * control surface and shutdown read state.
 */
public final class SetupTracker {
    private static final Logger log = LoggerFactory.getLogger(SetupTracker.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = new BigDecimal("100");
    private static final int RECENT_LIMIT = 100;
    private static final int JOURNAL_LIMIT = 10_000;

    /**
     * A transition as it happened, in global order across candidates.
     */
    public record JournalEntry(String setupId, StateTransition transition) {}

    private final SetupTrackerConfig config;
    private final EventBus eventBus;
    private final Supplier<String> idGenerator;
    private final NoWickDetector noWickDetector;

    private LocalDate currentDate;
    private BigDecimal sessionHigh;
    private BigDecimal sessionLow;
    private Instant lastCandleTime;
    private boolean accepting = true;

    private final Map<String, SetupCandidate> activeCandidates = new LinkedHashMap<>();
    private final Deque<SetupCandidate> recentTerminal = new ArrayDeque<>();
    private final Deque<JournalEntry> journal = new ArrayDeque<>();

    private final Deque<Candle> atrWindow = new ArrayDeque<>();
    private BigDecimal atr;

    // Statistics
    private long candlesProcessed;
    private long candlesRejected;
    private long liq1Detected;
    private long setupsCompleted;
    private long setupsInvalidated;

    public SetupTracker(SetupTrackerConfig config, EventBus eventBus) {
        this(config, eventBus, () -> UUID.randomUUID().toString());
    }

    public SetupTracker(SetupTrackerConfig config, EventBus eventBus, Supplier<String> idGenerator) {
        this.config = config;
        this.eventBus = eventBus;
        this.idGenerator = idGenerator;
        this.noWickDetector = new NoWickDetector(config.noWickMaxWickRatio(), config.noWickMinCandles());
        log.info("[SETUP] Tracker initialized for {} (consolidation {}-{} candles, range {}-{}%)",
            config.symbol(), config.consolMinCandles(), config.consolMaxCandles(),
            config.consolMinRangePct(), config.consolMaxRangePct());
    }

    // ═══════════════════════════════════════════════════════════════
    // CANDLE INPUT
    // ═══════════════════════════════════════════════════════════════

    public synchronized CandleUpdate onCandle(Candle candle) {
        if (candle == null) {
            candlesRejected++;
            log.warn("[SETUP] Rejected null candle");
            return CandleUpdate.rejected(null, "Null candle");
        }
        Instant ts = candle.timestamp();
        if (!config.symbol().equals(candle.symbol())) {
            candlesRejected++;
            log.warn("[SETUP] Rejected candle for {} (tracker symbol {})", candle.symbol(), config.symbol());
            return CandleUpdate.rejected(ts, "Wrong symbol");
        }
        if (!candle.isWellFormed()) {
            candlesRejected++;
            log.warn("[SETUP] Rejected malformed candle at {}: O={} H={} L={} C={}",
                ts, candle.open(), candle.high(), candle.low(), candle.close());
            return CandleUpdate.rejected(ts, "Malformed candle");
        }
        if (lastCandleTime != null && !ts.isAfter(lastCandleTime)) {
            candlesRejected++;
            log.warn("[SETUP] Rejected out-of-order candle at {} (last admitted {})", ts, lastCandleTime);
            return CandleUpdate.rejected(ts, "Out-of-order candle");
        }

        lastCandleTime = ts;
        candlesProcessed++;
        updateAtr(candle);

        List<SetupCandidate> updated = new ArrayList<>();
        List<SetupCandidate> completed = new ArrayList<>();
        List<SetupCandidate> invalidated = new ArrayList<>();

        ZonedDateTime local = ts.atZone(config.zone());
        if (!local.toLocalDate().equals(currentDate)) {
            startNewDay(local.toLocalDate(), candle, updated, invalidated);
        }

        LocalTime time = local.toLocalTime();
        if (inReferenceSession(time)) {
            extendSessionLevels(candle);
            return finish(candle, updated, completed, invalidated, "Reference session - tracking levels");
        }
        if (!inTradingWindow(time)) {
            if (!time.isBefore(config.tradingClose())) {
                invalidateAll(InvalidationReason.MARKET_CLOSED, candle, updated, invalidated);
            }
            return finish(candle, updated, completed, invalidated, "Outside trading window");
        }
        if (sessionHigh == null || sessionLow == null) {
            return finish(candle, updated, completed, invalidated, "Waiting for session levels");
        }

        SetupCandidate created = null;
        if (accepting) {
            Direction direction = detectLiq1(candle);
            if (direction != null) {
                created = openCandidate(candle, direction);
            }
        }

        for (SetupCandidate candidate : new ArrayList<>(activeCandidates.values())) {
            // The LIQ#1 candle never joins its own consolidation
            if (candidate == created) {
                continue;
            }
            updateCandidate(candidate, candle);
            updated.add(candidate);
            if (candidate.getState() == SetupState.SETUP_COMPLETE) {
                completed.add(candidate);
            } else if (candidate.getState() == SetupState.INVALIDATED) {
                invalidated.add(candidate);
            }
        }
        if (created != null) {
            updated.add(created);
        }

        return finish(candle, updated, completed, invalidated,
            activeCandidates.size() + " active candidate(s)");
    }

    private CandleUpdate finish(Candle candle, List<SetupCandidate> updated, List<SetupCandidate> completed,
                                List<SetupCandidate> invalidated, String message) {
        for (SetupCandidate c : completed) {
            retire(c);
            setupsCompleted++;
            publish(new SetupDetectedEvent(c.toSnapshot(), Instant.now()));
        }
        for (SetupCandidate c : invalidated) {
            retire(c);
            setupsInvalidated++;
            List<StateTransition> transitions = c.getTransitions();
            SetupState lastState = transitions.get(transitions.size() - 1).from();
            publish(new SetupInvalidatedEvent(c.getId(), c.getSymbol(), lastState,
                c.getInvalidationReason(), Instant.now()));
        }
        return new CandleUpdate(candle.timestamp(), List.copyOf(updated), List.copyOf(completed),
            List.copyOf(invalidated), false, message);
    }

    private void retire(SetupCandidate candidate) {
        activeCandidates.remove(candidate.getId());
        recentTerminal.addLast(candidate);
        if (recentTerminal.size() > RECENT_LIMIT) {
            recentTerminal.removeFirst();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // SESSION
    // ═══════════════════════════════════════════════════════════════

    private void startNewDay(LocalDate date, Candle candle, List<SetupCandidate> updated,
                             List<SetupCandidate> invalidated) {
        if (currentDate != null) {
            invalidateAll(InvalidationReason.MARKET_CLOSED, candle, updated, invalidated);
        }
        currentDate = date;
        sessionHigh = null;
        sessionLow = null;
        log.info("[SETUP] New trading day {} for {}", date, config.symbol());
    }

    private void invalidateAll(InvalidationReason reason, Candle candle, List<SetupCandidate> updated,
                               List<SetupCandidate> invalidated) {
        for (SetupCandidate c : new ArrayList<>(activeCandidates.values())) {
            invalidate(c, reason, candle.timestamp(), candle.open());
            updated.add(c);
            invalidated.add(c);
        }
    }

    private boolean inReferenceSession(LocalTime time) {
        return !time.isBefore(config.sessionOpen()) && time.isBefore(config.sessionClose());
    }

    private boolean inTradingWindow(LocalTime time) {
        return !time.isBefore(config.tradingOpen()) && time.isBefore(config.tradingClose());
    }

    private void extendSessionLevels(Candle candle) {
        sessionHigh = sessionHigh == null ? candle.high() : sessionHigh.max(candle.high());
        sessionLow = sessionLow == null ? candle.low() : sessionLow.min(candle.low());
    }

    // ═══════════════════════════════════════════════════════════════
    // LIQ#1
    // ═══════════════════════════════════════════════════════════════

    private Direction detectLiq1(Candle candle) {
        if (candle.close().compareTo(sessionHigh) > 0 && !inCooldown(Direction.SHORT, candle.timestamp())) {
            return Direction.SHORT;
        }
        if (candle.close().compareTo(sessionLow) < 0 && !inCooldown(Direction.LONG, candle.timestamp())) {
            return Direction.LONG;
        }
        return null;
    }

    private boolean inCooldown(Direction direction, Instant ts) {
        for (SetupCandidate c : activeCandidates.values()) {
            if (c.getDirection() == direction
                && c.getState() == SetupState.WATCHING_CONSOL
                && Duration.between(c.getLiq1Time(), ts).compareTo(config.liq1Cooldown()) < 0) {
                return true;
            }
        }
        return false;
    }

    private SetupCandidate openCandidate(Candle candle, Direction direction) {
        SetupCandidate c = new SetupCandidate(idGenerator.get(), config.symbol(), direction,
            sessionHigh, sessionLow, candle.timestamp());
        BigDecimal price = direction == Direction.SHORT ? candle.high() : candle.low();
        c.recordLiq1(candle.timestamp(), price);
        transition(c, SetupState.WATCHING_CONSOL, candle.timestamp(), price,
            "LIQ#1 " + direction + " @ " + price);
        activeCandidates.put(c.getId(), c);
        liq1Detected++;
        log.info("[SETUP] LIQ#1 {} detected {} @ {} (session high {}, low {})",
            direction, c.shortId(), price, sessionHigh, sessionLow);
        return c;
    }

    // ═══════════════════════════════════════════════════════════════
    // CANDIDATE STATE MACHINE
    // ═══════════════════════════════════════════════════════════════

    private void updateCandidate(SetupCandidate c, Candle candle) {
        c.countCandle(candle.timestamp());
        switch (c.getState()) {
            case WATCHING_CONSOL:
                updateConsolidation(c, candle);
                break;
            case WATCHING_LIQ2:
                updateLiq2(c, candle, false);
                break;
            case WAITING_ENTRY:
                updateEntry(c, candle);
                break;
            default:
                log.warn("[SETUP] Candidate {} in unexpected state {}", c.shortId(), c.getState());
        }
    }

    private void updateConsolidation(SetupCandidate c, Candle candle) {
        Instant ts = candle.timestamp();

        if (c.getConsolCandleCount() > 0 && breaksBounds(c, candle) && isEligible(c)) {
            // Bounds are still max/min of the strictly earlier candles: this candle was never admitted.
            c.freezeConsolidation(ts);
            if (!isRangeValid(c)) {
                log.info("[SETUP] {} consolidation range {}% outside {}-{}%", c.shortId(),
                    rangePct(c), config.consolMinRangePct(), config.consolMaxRangePct());
                invalidate(c, InvalidationReason.CONSOL_RANGE_INVALID, ts, candle.close());
                return;
            }
            BigDecimal level = c.getDirection() == Direction.SHORT ? c.getConsolHigh() : c.getConsolLow();
            transition(c, SetupState.WATCHING_LIQ2, ts, level,
                "Consolidation frozen: " + c.getConsolCandleCount() + " candles ["
                    + c.getConsolLow() + ", " + c.getConsolHigh() + "]");
            log.info("[SETUP] {} consolidation frozen: {} candles, range [{}, {}]",
                c.shortId(), c.getConsolCandleCount(), c.getConsolLow(), c.getConsolHigh());
            updateLiq2(c, candle, true);
            return;
        }

        if (c.getConsolCandleCount() >= config.consolMaxCandles()) {
            invalidate(c, InvalidationReason.CONSOL_TIMEOUT, ts, candle.close());
            return;
        }

        c.admitConsolidationCandle(CandleSnapshot.of(candle));

        // The window only grows, so a range already too wide can never recover.
        if (c.getConsolCandleCount() >= config.consolMinCandles()
            && rangePct(c).compareTo(config.consolMaxRangePct()) > 0) {
            invalidate(c, InvalidationReason.CONSOL_RANGE_INVALID, ts, candle.close());
            return;
        }

        if (!c.hasNoWick()) {
            CandleSnapshot noWick = noWickDetector.find(c.getConsolCandles(), c.getDirection());
            if (noWick != null) {
                c.recordNoWick(noWick);
                log.debug("[SETUP] {} no-wick candle at {} [{}, {}]",
                    c.shortId(), noWick.timestamp(), noWick.low(), noWick.high());
            }
        }
    }

    private void updateLiq2(SetupCandidate c, Candle candle, boolean freezingCandle) {
        Instant ts = candle.timestamp();

        if (!freezingCandle && c.getCandlesSinceFreeze() > config.maxEntryWaitCandles()) {
            invalidate(c, InvalidationReason.LIQ2_TIMEOUT, ts, candle.close());
            return;
        }
        if (retracementExceeded(c, candle)) {
            invalidate(c, InvalidationReason.RETRACEMENT_EXCEEDED, ts, candle.close());
            return;
        }
        if (!config.liq2MinWait().isZero()
            && Duration.between(c.getConsolFrozenAt(), ts).compareTo(config.liq2MinWait()) < 0) {
            return;
        }

        boolean sweep = c.getDirection() == Direction.SHORT
            ? candle.high().compareTo(c.getConsolHigh()) > 0
            : candle.low().compareTo(c.getConsolLow()) < 0;
        if (!sweep) {
            return;
        }

        c.recordLiq2(CandleSnapshot.of(candle));
        BigDecimal price = c.getDirection() == Direction.SHORT ? candle.high() : candle.low();
        transition(c, SetupState.WAITING_ENTRY, ts, price, "LIQ#2 " + c.getDirection() + " @ " + price);
        log.info("[SETUP] LIQ#2 {} detected {} @ {}", c.getDirection(), c.shortId(), price);
    }

    private void updateEntry(SetupCandidate c, Candle candle) {
        Instant ts = candle.timestamp();

        if (c.getCandlesSinceLiq2() > config.maxEntryWaitCandles()) {
            invalidate(c, InvalidationReason.ENTRY_TIMEOUT, ts, candle.close());
            return;
        }

        boolean shortSetup = c.getDirection() == Direction.SHORT;
        boolean triggered = shortSetup
            ? candle.close().compareTo(c.getNoWickLow()) < 0
            : candle.close().compareTo(c.getNoWickHigh()) > 0;
        if (!triggered) {
            return;
        }

        BigDecimal entry = candle.close();
        BigDecimal stop = StopLossCalculator.stopFor(c.getDirection(), c.getLiq2Candle(), config.stopBuffer());
        BigDecimal target = shortSetup
            ? c.getSessionLow().subtract(config.targetBuffer())
            : c.getSessionHigh().add(config.targetBuffer());

        BigDecimal risk = shortSetup ? stop.subtract(entry) : entry.subtract(stop);
        BigDecimal reward = shortSetup ? entry.subtract(target) : target.subtract(entry);
        BigDecimal riskReward = risk.signum() > 0 ? reward.divide(risk, MC) : BigDecimal.ZERO;

        c.recordEntry(ts, entry);
        c.setStopAndTarget(stop, target);
        c.setRiskReward(riskReward);

        if (riskReward.signum() <= 0) {
            log.warn("[SETUP] {} filtered: R:R {} (entry {}, stop {}, target {})",
                c.shortId(), riskReward, entry, stop, target);
            invalidate(c, InvalidationReason.NEGATIVE_RISK_REWARD, ts, entry);
            return;
        }

        transition(c, SetupState.SETUP_COMPLETE, ts, entry, "Entry trigger @ " + entry);
        log.info("[SETUP] COMPLETE {} {} | entry {} stop {} target {} R:R {}",
            c.getDirection(), c.shortId(), entry, stop, target, riskReward.setScale(2, RoundingMode.HALF_UP));
    }

    // ═══════════════════════════════════════════════════════════════
    // RULES
    // ═══════════════════════════════════════════════════════════════

    private boolean breaksBounds(SetupCandidate c, Candle candle) {
        return c.getDirection() == Direction.SHORT
            ? candle.high().compareTo(c.getConsolHigh()) > 0
            : candle.low().compareTo(c.getConsolLow()) < 0;
    }

    private boolean isEligible(SetupCandidate c) {
        return c.getConsolCandleCount() >= config.consolMinCandles() && c.hasNoWick();
    }

    private BigDecimal rangePct(SetupCandidate c) {
        if (c.getConsolHigh() == null || c.getConsolHigh().signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return c.getConsolHigh().subtract(c.getConsolLow()).multiply(HUNDRED).divide(c.getConsolHigh(), MC);
    }

    private boolean isRangeValid(SetupCandidate c) {
        if (c.getConsolLow() == null || c.getConsolLow().signum() <= 0) {
            return false;
        }
        BigDecimal pct = rangePct(c);
        return pct.compareTo(config.consolMinRangePct()) >= 0 && pct.compareTo(config.consolMaxRangePct()) <= 0;
    }

    private boolean retracementExceeded(SetupCandidate c, Candle candle) {
        if (c.getDirection() == Direction.SHORT) {
            BigDecimal limit = config.maxRetracementPoints().min(candle.high().multiply(config.retracementPriceCap()));
            return candle.high().compareTo(c.getNoWickHigh().add(limit)) > 0;
        }
        BigDecimal limit = config.maxRetracementPoints().min(candle.low().multiply(config.retracementPriceCap()));
        return candle.low().compareTo(c.getNoWickLow().subtract(limit)) < 0;
    }

    private void transition(SetupCandidate c, SetupState to, Instant ts, BigDecimal price, String reason) {
        StateTransitionValidator.transition(c, to, ts, price, reason);
        journal(c);
    }

    private void invalidate(SetupCandidate c, InvalidationReason reason, Instant ts, BigDecimal price) {
        StateTransitionValidator.invalidate(c, reason, ts, price);
        journal(c);
        log.info("[SETUP] {} invalidated: {}", c.shortId(), reason);
    }

    private void journal(SetupCandidate c) {
        List<StateTransition> transitions = c.getTransitions();
        journal.addLast(new JournalEntry(c.getId(), transitions.get(transitions.size() - 1)));
        if (journal.size() > JOURNAL_LIMIT) {
            journal.removeFirst();
        }
    }

    private void publish(EngineEvent event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // VOLATILITY
    // ═══════════════════════════════════════════════════════════════

    private void updateAtr(Candle candle) {
        atrWindow.addLast(candle);
        while (atrWindow.size() > config.atrPeriod() + 1) {
            atrWindow.removeFirst();
        }
        if (atrWindow.size() < 2) {
            return;
        }
        BigDecimal sum = BigDecimal.ZERO;
        Iterator<Candle> it = atrWindow.iterator();
        Candle prev = it.next();
        int count = 0;
        while (it.hasNext()) {
            Candle curr = it.next();
            BigDecimal tr = curr.range()
                .max(curr.high().subtract(prev.close()).abs())
                .max(curr.low().subtract(prev.close()).abs());
            sum = sum.add(tr);
            count++;
            prev = curr;
        }
        atr = sum.divide(BigDecimal.valueOf(count), MC);
    }

    // ═══════════════════════════════════════════════════════════════
    // RECOVERY / CONTROL
    // ═══════════════════════════════════════════════════════════════

    /**
     * Put persisted non-terminal candidates back into the active map.
     * Candles at or before the latest restored candle are then rejected as out of order.
     */
    public synchronized int restore(Collection<SetupCandidate> candidates) {
        int restored = 0;
        for (SetupCandidate c : candidates) {
            if (!c.isActive() || !config.symbol().equals(c.getSymbol())) {
                continue;
            }
            activeCandidates.put(c.getId(), c);
            Instant seen = c.getLastCandleTime() != null ? c.getLastCandleTime() : c.getLiq1Time();
            if (seen != null && (lastCandleTime == null || seen.isAfter(lastCandleTime))) {
                lastCandleTime = seen;
            }
            restored++;
        }
        log.info("[SETUP] Restored {} active candidate(s) for {}", restored, config.symbol());
        return restored;
    }

    public synchronized void restoreSession(LocalDate date, BigDecimal high, BigDecimal low) {
        this.currentDate = date;
        this.sessionHigh = high;
        this.sessionLow = low;
        log.info("[SETUP] Restored session {} levels high={} low={}", date, high, low);
    }

    /**
     * Stop opening new candidates. Existing candidates keep their state.
     */
    public synchronized void stopAccepting() {
        accepting = false;
    }

    public synchronized boolean isAccepting() {
        return accepting;
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    public synchronized List<SetupCandidate> getActiveCandidates() {
        return new ArrayList<>(activeCandidates.values());
    }

    /**
     * Images of every active candidate, taken under the tracker lock so none reflects a
     * half-applied candle.
     */
    public synchronized List<SetupSnapshot> snapshotActive() {
        List<SetupSnapshot> snapshots = new ArrayList<>(activeCandidates.size());
        for (SetupCandidate c : activeCandidates.values()) {
            snapshots.add(c.toSnapshot());
        }
        return snapshots;
    }

    public synchronized SetupCandidate getCandidate(String id) {
        SetupCandidate active = activeCandidates.get(id);
        if (active != null) {
            return active;
        }
        for (SetupCandidate c : recentTerminal) {
            if (c.getId().equals(id)) {
                return c;
            }
        }
        return null;
    }

    public synchronized List<SetupCandidate> getRecentTerminal() {
        return new ArrayList<>(recentTerminal);
    }

    public synchronized List<JournalEntry> getJournal() {
        return new ArrayList<>(journal);
    }

    public synchronized BigDecimal getAtr() {
        return atr;
    }

    public synchronized BigDecimal getSessionHigh() {
        return sessionHigh;
    }

    public synchronized BigDecimal getSessionLow() {
        return sessionLow;
    }

    public synchronized LocalDate getCurrentDate() {
        return currentDate;
    }

    public SetupTrackerConfig getConfig() {
        return config;
    }

    public synchronized Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("candlesProcessed", candlesProcessed);
        stats.put("candlesRejected", candlesRejected);
        stats.put("liq1Detected", liq1Detected);
        stats.put("setupsCompleted", setupsCompleted);
        stats.put("setupsInvalidated", setupsInvalidated);
        stats.put("candidatesActive", activeCandidates.size());
        stats.put("sessionHigh", sessionHigh);
        stats.put("sessionLow", sessionLow);
        stats.put("atr", atr);
        return stats;
    }
}
