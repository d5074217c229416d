package io.slobengine.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * OHLCV candle for one bucket of one symbol.
 *
 * (symbol, timestamp) is unique; timestamp is the bucket start.
 * A candle with tickCount == 0 is a synthetic gap-fill candle.
 */
public record Candle(
    String symbol,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    long volume,
    int tickCount
) {
    public Candle {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("OHLC prices cannot be null");
        }
    }

    /**
     * Flat candle used to fill a short gap: O=H=L=C=price, no volume.
     */
    public static Candle flat(String symbol, Instant timestamp, BigDecimal price) {
        return new Candle(symbol, timestamp, price, price, price, price, 0L, 0);
    }

    public boolean isSynthetic() {
        return tickCount == 0;
    }

    /**
     * High is the max and low is the min of the four prices.
     */
    public boolean isWellFormed() {
        return high.compareTo(low) >= 0
            && open.compareTo(low) >= 0 && open.compareTo(high) <= 0
            && close.compareTo(low) >= 0 && close.compareTo(high) <= 0
            && volume >= 0;
    }

    public BigDecimal body() {
        return close.subtract(open).abs();
    }

    public BigDecimal bodyTop() {
        return close.max(open);
    }

    public BigDecimal bodyBottom() {
        return close.min(open);
    }

    public BigDecimal upperWick() {
        return high.subtract(bodyTop());
    }

    public BigDecimal lowerWick() {
        return bodyBottom().subtract(low);
    }

    public BigDecimal range() {
        return high.subtract(low);
    }

    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    public boolean isBearish() {
        return close.compareTo(open) < 0;
    }
}
