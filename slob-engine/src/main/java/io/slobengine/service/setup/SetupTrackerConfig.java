package io.slobengine.service.setup;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Tunables for setup detection.
 *
 * Defaults:
 * - Reference session 09:00-15:30 UTC (session high/low), trading window 15:30-22:00 UTC
 * - Consolidation 15-120 candles, range 0.1%-0.5% of the consolidation high
 * - LIQ#2 may fire on the freezing candle itself (no minimum wait)
 * - 20 candles max between freeze and LIQ#2, and between LIQ#2 and entry
 * - Stop buffer 2 points (spike rule), target buffer 1 point
 */
public final class SetupTrackerConfig {

    private final String symbol;
    private final ZoneId zone;
    private final LocalTime sessionOpen;
    private final LocalTime sessionClose;
    private final LocalTime tradingOpen;
    private final LocalTime tradingClose;
    private final int consolMinCandles;
    private final int consolMaxCandles;
    private final BigDecimal consolMinRangePct;
    private final BigDecimal consolMaxRangePct;
    private final Duration liq2MinWait;
    private final int maxEntryWaitCandles;
    private final BigDecimal maxRetracementPoints;
    private final BigDecimal retracementPriceCap;
    private final BigDecimal stopBuffer;
    private final BigDecimal targetBuffer;
    private final Duration liq1Cooldown;
    private final BigDecimal noWickMaxWickRatio;
    private final int noWickMinCandles;
    private final int atrPeriod;

    private SetupTrackerConfig(Builder b) {
        this.symbol = b.symbol;
        this.zone = b.zone;
        this.sessionOpen = b.sessionOpen;
        this.sessionClose = b.sessionClose;
        this.tradingOpen = b.tradingOpen;
        this.tradingClose = b.tradingClose;
        this.consolMinCandles = b.consolMinCandles;
        this.consolMaxCandles = b.consolMaxCandles;
        this.consolMinRangePct = b.consolMinRangePct;
        this.consolMaxRangePct = b.consolMaxRangePct;
        this.liq2MinWait = b.liq2MinWait;
        this.maxEntryWaitCandles = b.maxEntryWaitCandles;
        this.maxRetracementPoints = b.maxRetracementPoints;
        this.retracementPriceCap = b.retracementPriceCap;
        this.stopBuffer = b.stopBuffer;
        this.targetBuffer = b.targetBuffer;
        this.liq1Cooldown = b.liq1Cooldown;
        this.noWickMaxWickRatio = b.noWickMaxWickRatio;
        this.noWickMinCandles = b.noWickMinCandles;
        this.atrPeriod = b.atrPeriod;
    }

    public static SetupTrackerConfig defaults(String symbol) {
        return builder().symbol(symbol).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String symbol() { return symbol; }
    public ZoneId zone() { return zone; }
    public LocalTime sessionOpen() { return sessionOpen; }
    public LocalTime sessionClose() { return sessionClose; }
    public LocalTime tradingOpen() { return tradingOpen; }
    public LocalTime tradingClose() { return tradingClose; }
    public int consolMinCandles() { return consolMinCandles; }
    public int consolMaxCandles() { return consolMaxCandles; }
    public BigDecimal consolMinRangePct() { return consolMinRangePct; }
    public BigDecimal consolMaxRangePct() { return consolMaxRangePct; }
    public Duration liq2MinWait() { return liq2MinWait; }
    public int maxEntryWaitCandles() { return maxEntryWaitCandles; }
    public BigDecimal maxRetracementPoints() { return maxRetracementPoints; }
    public BigDecimal retracementPriceCap() { return retracementPriceCap; }
    public BigDecimal stopBuffer() { return stopBuffer; }
    public BigDecimal targetBuffer() { return targetBuffer; }
    public Duration liq1Cooldown() { return liq1Cooldown; }
    public BigDecimal noWickMaxWickRatio() { return noWickMaxWickRatio; }
    public int noWickMinCandles() { return noWickMinCandles; }
    public int atrPeriod() { return atrPeriod; }

    public static class Builder {
        private String symbol = "NQ";
        private ZoneId zone = ZoneOffset.UTC;
        private LocalTime sessionOpen = LocalTime.of(9, 0);
        private LocalTime sessionClose = LocalTime.of(15, 30);
        private LocalTime tradingOpen = LocalTime.of(15, 30);
        private LocalTime tradingClose = LocalTime.of(22, 0);
        private int consolMinCandles = 15;
        private int consolMaxCandles = 120;
        private BigDecimal consolMinRangePct = new BigDecimal("0.1");
        private BigDecimal consolMaxRangePct = new BigDecimal("0.5");
        private Duration liq2MinWait = Duration.ZERO;
        private int maxEntryWaitCandles = 20;
        private BigDecimal maxRetracementPoints = new BigDecimal("100");
        private BigDecimal retracementPriceCap = new BigDecimal("0.01");
        private BigDecimal stopBuffer = new BigDecimal("2");
        private BigDecimal targetBuffer = new BigDecimal("1");
        private Duration liq1Cooldown = Duration.ofMinutes(5);
        private BigDecimal noWickMaxWickRatio = new BigDecimal("0.20");
        private int noWickMinCandles = 3;
        private int atrPeriod = 14;

        public Builder symbol(String symbol) {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("Symbol cannot be null or empty");
            }
            this.symbol = symbol;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder referenceSession(LocalTime open, LocalTime close) {
            if (!open.isBefore(close)) {
                throw new IllegalArgumentException("Session open must be before session close");
            }
            this.sessionOpen = open;
            this.sessionClose = close;
            return this;
        }

        public Builder tradingWindow(LocalTime open, LocalTime close) {
            if (!open.isBefore(close)) {
                throw new IllegalArgumentException("Trading open must be before trading close");
            }
            this.tradingOpen = open;
            this.tradingClose = close;
            return this;
        }

        public Builder consolidationCandles(int min, int max) {
            if (min <= 0 || max < min) {
                throw new IllegalArgumentException("Consolidation candles must satisfy 0 < min <= max");
            }
            this.consolMinCandles = min;
            this.consolMaxCandles = max;
            return this;
        }

        public Builder consolidationRangePct(BigDecimal min, BigDecimal max) {
            if (min.signum() < 0 || max.compareTo(min) < 0) {
                throw new IllegalArgumentException("Consolidation range must satisfy 0 <= min <= max");
            }
            this.consolMinRangePct = min;
            this.consolMaxRangePct = max;
            return this;
        }

        public Builder liq2MinWait(Duration wait) {
            if (wait.isNegative()) {
                throw new IllegalArgumentException("LIQ#2 minimum wait cannot be negative");
            }
            this.liq2MinWait = wait;
            return this;
        }

        public Builder maxEntryWaitCandles(int candles) {
            if (candles <= 0) {
                throw new IllegalArgumentException("Max entry wait must be positive");
            }
            this.maxEntryWaitCandles = candles;
            return this;
        }

        public Builder maxRetracement(BigDecimal points, BigDecimal priceCap) {
            this.maxRetracementPoints = points;
            this.retracementPriceCap = priceCap;
            return this;
        }

        public Builder stopBuffer(BigDecimal buffer) {
            if (buffer.signum() < 0) {
                throw new IllegalArgumentException("Stop buffer cannot be negative");
            }
            this.stopBuffer = buffer;
            return this;
        }

        public Builder targetBuffer(BigDecimal buffer) {
            if (buffer.signum() < 0) {
                throw new IllegalArgumentException("Target buffer cannot be negative");
            }
            this.targetBuffer = buffer;
            return this;
        }

        public Builder liq1Cooldown(Duration cooldown) {
            this.liq1Cooldown = cooldown;
            return this;
        }

        public Builder noWick(BigDecimal maxWickRatio, int minCandles) {
            this.noWickMaxWickRatio = maxWickRatio;
            this.noWickMinCandles = minCandles;
            return this;
        }

        public Builder atrPeriod(int period) {
            if (period <= 0) {
                throw new IllegalArgumentException("ATR period must be positive");
            }
            this.atrPeriod = period;
            return this;
        }

        public SetupTrackerConfig build() {
            if (tradingOpen.isBefore(sessionClose)) {
                throw new IllegalArgumentException("Trading window must start after the reference session closes");
            }
            return new SetupTrackerConfig(this);
        }
    }
}
