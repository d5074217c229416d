package io.slobengine.service.setup;

import io.slobengine.domain.setup.CandleSnapshot;
import io.slobengine.domain.setup.Direction;

import java.math.BigDecimal;

/**
 * Stop placement from the frozen LIQ#2 candle ("spike rule").
 *
 * SHORT: upperWick > 2 x body and body > 0 -> body top + buffer, else high + buffer.
 * LONG mirrors it: lowerWick > 2 x body and body > 0 -> body bottom - buffer, else low - buffer.
 */
public final class StopLossCalculator {

    private static final BigDecimal SPIKE_RATIO = new BigDecimal("2");

    private StopLossCalculator() {}

    public static BigDecimal stopFor(Direction direction, CandleSnapshot liq2, BigDecimal buffer) {
        if (liq2 == null) {
            throw new IllegalArgumentException("LIQ#2 candle is required");
        }
        BigDecimal body = liq2.body();
        if (direction == Direction.SHORT) {
            return isSpike(liq2.upperWick(), body)
                ? liq2.bodyTop().add(buffer)
                : liq2.high().add(buffer);
        }
        return isSpike(liq2.lowerWick(), body)
            ? liq2.bodyBottom().subtract(buffer)
            : liq2.low().subtract(buffer);
    }

    public static boolean isSpike(BigDecimal wick, BigDecimal body) {
        return body.signum() > 0 && wick.compareTo(body.multiply(SPIKE_RATIO)) > 0;
    }
}
