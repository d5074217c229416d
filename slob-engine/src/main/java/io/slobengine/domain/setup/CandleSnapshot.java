package io.slobengine.domain.setup;

import io.slobengine.domain.data.Candle;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Frozen copy of a candle's OHLC. Used for the LIQ#2 candle and the consolidation window.
 */
public record CandleSnapshot(
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close
) {
    public static CandleSnapshot of(Candle candle) {
        return new CandleSnapshot(candle.timestamp(), candle.open(), candle.high(), candle.low(), candle.close());
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
}
