package io.slobengine.service.setup;

import io.slobengine.domain.setup.CandleSnapshot;
import io.slobengine.domain.setup.Direction;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Finds the no-wick reference candle inside a consolidation window.
 *
 * SHORT: bullish candle with upper wick < maxWickRatio x body.
 * LONG: bearish candle with lower wick < maxWickRatio x body.
 * The first qualifying candle wins; candles without a body never qualify.
 */
final class NoWickDetector {

    private static final MathContext MC = MathContext.DECIMAL64;

    private final BigDecimal maxWickRatio;
    private final int minCandles;

    NoWickDetector(BigDecimal maxWickRatio, int minCandles) {
        this.maxWickRatio = maxWickRatio;
        this.minCandles = minCandles;
    }

    CandleSnapshot find(List<CandleSnapshot> window, Direction direction) {
        if (window.size() < minCandles) {
            return null;
        }
        for (CandleSnapshot c : window) {
            BigDecimal body = c.body();
            if (body.signum() <= 0) {
                continue;
            }
            boolean bullish = c.close().compareTo(c.open()) > 0;
            if (direction == Direction.SHORT && bullish && ratio(c.upperWick(), body) < 0) {
                return c;
            }
            if (direction == Direction.LONG && !bullish && ratio(c.lowerWick(), body) < 0) {
                return c;
            }
        }
        return null;
    }

    private int ratio(BigDecimal wick, BigDecimal body) {
        return wick.divide(body, MC).compareTo(maxWickRatio);
    }
}
