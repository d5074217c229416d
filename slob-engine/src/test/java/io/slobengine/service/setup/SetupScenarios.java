package io.slobengine.service.setup;

import io.slobengine.domain.data.Candle;
import io.slobengine.domain.data.Tick;
import io.slobengine.domain.setup.SetupCandidate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Hand-built candle sequences for the default tracker config (UTC, reference session
 * 09:00-15:30, trading window 15:30-22:00, 15 consolidation candles).
 *
 * SHORT: session [14900, 15120], LIQ#1 close 15125, consolidation [15100, 15120] with the
 * no-wick candle third, LIQ#2 high 15125 at 15:46, entry close 15095 at 15:47.
 * Stop 15127 (high + 2, no spike), target 14899.
 *
 * LONG mirrors it: session [14880, 15100], consolidation [14880, 14900], LIQ#2 low 14875,
 * entry close 14905. Stop 14873, target 15101.
 */
public final class SetupScenarios {

    public static final String SYMBOL = "NQ";
    public static final LocalDate DAY = LocalDate.of(2024, 1, 2);

    public static final BigDecimal SHORT_ENTRY = new BigDecimal("15095");
    public static final BigDecimal SHORT_STOP = new BigDecimal("15127");
    public static final BigDecimal SHORT_TARGET = new BigDecimal("14899");

    public static final BigDecimal LONG_ENTRY = new BigDecimal("14905");
    public static final BigDecimal LONG_STOP = new BigDecimal("14873");
    public static final BigDecimal LONG_TARGET = new BigDecimal("15101");

    public static final int CONSOLIDATION_CANDLES = 15;

    private SetupScenarios() {}

    public static Instant at(String hhmm) {
        return at(DAY, hhmm);
    }

    public static Instant at(LocalDate day, String hhmm) {
        return day.atTime(LocalTime.parse(hhmm)).toInstant(ZoneOffset.UTC);
    }

    public static Candle candle(Instant ts, String open, String high, String low, String close) {
        return new Candle(SYMBOL, ts, new BigDecimal(open), new BigDecimal(high),
            new BigDecimal(low), new BigDecimal(close), 10, 4);
    }

    // ═══════════════════════════════════════════════════════════════
    // SHORT
    // ═══════════════════════════════════════════════════════════════

    /** Reference session, LIQ#1 and the consolidation window; ends at 15:45. */
    public static List<Candle> shortUntilConsolidation() {
        List<Candle> candles = new ArrayList<>();
        candles.add(candle(at("09:00"), "15000", "15120", "14900", "15050"));
        candles.add(candle(at("15:30"), "15110", "15135", "15105", "15125"));
        Instant t = at("15:31");
        for (int i = 1; i <= CONSOLIDATION_CANDLES; i++) {
            if (i == 3) {
                candles.add(candle(t, "15102", "15115", "15100", "15114"));
            } else {
                candles.add(candle(t, "15118", "15120", "15100", "15110"));
            }
            t = t.plusSeconds(60);
        }
        return candles;
    }

    public static Candle shortLiq2() {
        return candle(at("15:46"), "15118", "15125", "15112", "15113");
    }

    public static Candle shortEntry() {
        return candle(at("15:47"), "15110", "15111", "15090", "15095");
    }

    public static List<Candle> shortSequence() {
        List<Candle> candles = shortUntilConsolidation();
        candles.add(shortLiq2());
        candles.add(shortEntry());
        return candles;
    }

    // ═══════════════════════════════════════════════════════════════
    // LONG
    // ═══════════════════════════════════════════════════════════════

    public static List<Candle> longSequence() {
        List<Candle> candles = new ArrayList<>();
        candles.add(candle(at("09:00"), "15000", "15100", "14880", "14950"));
        candles.add(candle(at("15:30"), "14890", "14895", "14865", "14875"));
        Instant t = at("15:31");
        for (int i = 1; i <= CONSOLIDATION_CANDLES; i++) {
            if (i == 3) {
                candles.add(candle(t, "14898", "14900", "14885", "14886"));
            } else {
                candles.add(candle(t, "14882", "14900", "14880", "14890"));
            }
            t = t.plusSeconds(60);
        }
        candles.add(candle(at("15:46"), "14882", "14888", "14875", "14887"));
        candles.add(candle(at("15:47"), "14890", "14910", "14889", "14905"));
        return candles;
    }

    // ═══════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════

    public static Supplier<String> sequentialIds(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return () -> prefix + "-" + seq.incrementAndGet();
    }

    /** Run the SHORT sequence through a fresh tracker and return the completed setup. */
    public static SetupCandidate completedShortSetup(String id) {
        SetupTracker tracker = new SetupTracker(SetupTrackerConfig.defaults(SYMBOL), null, () -> id);
        SetupCandidate completed = null;
        for (Candle c : shortSequence()) {
            CandleUpdate update = tracker.onCandle(c);
            if (update.hasCompleted()) {
                completed = update.completed().get(0);
            }
        }
        if (completed == null) {
            throw new IllegalStateException("SHORT scenario did not complete");
        }
        return completed;
    }

    /**
     * Four ticks inside the candle's minute that rebuild the same OHLC.
     */
    public static List<Tick> ticksFor(Candle candle) {
        Instant ts = candle.timestamp();
        return List.of(
            new Tick(candle.symbol(), candle.open(), 1, ts),
            new Tick(candle.symbol(), candle.high(), 1, ts.plusSeconds(15)),
            new Tick(candle.symbol(), candle.low(), 1, ts.plusSeconds(30)),
            new Tick(candle.symbol(), candle.close(), 1, ts.plusSeconds(45)));
    }
}
