package io.slobengine.service.setup;

import io.slobengine.domain.setup.CandleSnapshot;
import io.slobengine.domain.setup.Direction;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Spike regime uses the body top (SHORT) / body bottom (LONG)
 * - Normal regime uses the wick extreme
 * - Doji never counts as a spike
 */
class StopLossCalculatorTest {

    private static final BigDecimal BUFFER = new BigDecimal("2");

    private static CandleSnapshot snap(String open, String high, String low, String close) {
        return new CandleSnapshot(Instant.parse("2024-01-02T15:46:00Z"),
            new BigDecimal(open), new BigDecimal(high), new BigDecimal(low), new BigDecimal(close));
    }

    @Test
    void testShortSpikeUsesBodyTop() {
        // body 15, upper wick 45: ratio 3 > 2
        CandleSnapshot liq2 = snap("15290", "15350", "15285", "15305");

        BigDecimal stop = StopLossCalculator.stopFor(Direction.SHORT, liq2, BUFFER);

        assertEquals(0, new BigDecimal("15307").compareTo(stop), "Spike stop is body top + buffer");
    }

    @Test
    void testShortNormalUsesHigh() {
        // body 10, upper wick 5: ratio 0.5
        CandleSnapshot liq2 = snap("15290", "15305", "15285", "15300");

        BigDecimal stop = StopLossCalculator.stopFor(Direction.SHORT, liq2, BUFFER);

        assertEquals(0, new BigDecimal("15307").compareTo(stop), "Normal stop is high + buffer");
    }

    @Test
    void testExactlyTwiceBodyIsNotSpike() {
        // body 10, upper wick 20: not strictly greater
        CandleSnapshot liq2 = snap("15290", "15320", "15285", "15300");

        BigDecimal stop = StopLossCalculator.stopFor(Direction.SHORT, liq2, BUFFER);

        assertEquals(0, new BigDecimal("15322").compareTo(stop));
    }

    @Test
    void testDojiUsesHigh() {
        CandleSnapshot liq2 = snap("15300", "15340", "15290", "15300");

        assertFalse(StopLossCalculator.isSpike(liq2.upperWick(), liq2.body()));
        assertEquals(0, new BigDecimal("15342").compareTo(StopLossCalculator.stopFor(Direction.SHORT, liq2, BUFFER)));
    }

    @Test
    void testLongSpikeUsesBodyBottom() {
        // body 15, lower wick 45
        CandleSnapshot liq2 = snap("15305", "15310", "15245", "15290");

        BigDecimal stop = StopLossCalculator.stopFor(Direction.LONG, liq2, BUFFER);

        assertEquals(0, new BigDecimal("15288").compareTo(stop), "Spike stop is body bottom - buffer");
    }

    @Test
    void testLongNormalUsesLow() {
        CandleSnapshot liq2 = snap("15290", "15305", "15285", "15300");

        BigDecimal stop = StopLossCalculator.stopFor(Direction.LONG, liq2, BUFFER);

        assertEquals(0, new BigDecimal("15283").compareTo(stop));
    }

    @Test
    void testMissingCandleRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> StopLossCalculator.stopFor(Direction.SHORT, null, BUFFER));
    }
}
