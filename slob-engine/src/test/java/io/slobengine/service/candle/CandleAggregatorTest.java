package io.slobengine.service.candle;

import io.slobengine.domain.common.EventType;
import io.slobengine.domain.data.Candle;
import io.slobengine.domain.data.Tick;
import io.slobengine.domain.event.CandleCompletedEvent;
import io.slobengine.service.core.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - OHLCV folding within one bucket
 * - Exactly one completion per bucket
 * - Flat gap fill for short gaps, no fill for long gaps
 * - Out-of-order and malformed ticks rejected
 * - Forced completion on shutdown
 */
class CandleAggregatorTest {

    private static final Instant T0 = Instant.parse("2024-01-02T15:30:00Z");

    private EventBus bus;
    private CandleAggregator aggregator;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        aggregator = new CandleAggregator(bus, Duration.ofMinutes(1), 2);
    }

    @AfterEach
    void tearDown() {
        bus.shutdown(Duration.ofSeconds(1));
    }

    private static Tick tick(String price, long size, long secondsAfterT0) {
        return new Tick("NQ", new BigDecimal(price), size, T0.plusSeconds(secondsAfterT0));
    }

    @Test
    void testFoldsTicksIntoOneCandle() {
        assertTrue(aggregator.onTick(tick("15000", 1, 0)).isEmpty());
        assertTrue(aggregator.onTick(tick("15010", 2, 10)).isEmpty());
        assertTrue(aggregator.onTick(tick("14995", 3, 20)).isEmpty());
        assertTrue(aggregator.onTick(tick("15005", 4, 59)).isEmpty());

        List<Candle> completed = aggregator.onTick(tick("15006", 1, 60));

        assertEquals(1, completed.size());
        Candle c = completed.get(0);
        assertEquals(T0, c.timestamp());
        assertEquals(0, new BigDecimal("15000").compareTo(c.open()));
        assertEquals(0, new BigDecimal("15010").compareTo(c.high()));
        assertEquals(0, new BigDecimal("14995").compareTo(c.low()));
        assertEquals(0, new BigDecimal("15005").compareTo(c.close()));
        assertEquals(10L, c.volume());
        assertEquals(4, c.tickCount());
    }

    @Test
    void testPublishesCompletionExactlyOnce() throws InterruptedException {
        List<Candle> published = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        bus.subscribe(CandleCompletedEvent.class, e -> {
            published.add(e.candle());
            latch.countDown();
        });

        aggregator.onTick(tick("15000", 1, 0));
        aggregator.onTick(tick("15001", 1, 30));
        aggregator.onTick(tick("15002", 1, 60));
        aggregator.onTick(tick("15003", 1, 90));
        aggregator.onTick(tick("15004", 1, 120));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(2, published.size());
        assertEquals(T0, published.get(0).timestamp());
        assertEquals(T0.plusSeconds(60), published.get(1).timestamp());
        assertEquals(2, bus.getHistory(EventType.CANDLE_COMPLETED, 10).size());
    }

    @Test
    void testShortGapFilledWithFlatCandles() {
        aggregator.onTick(tick("15000", 1, 0));
        aggregator.onTick(tick("15004", 1, 30));

        // Next tick lands two buckets later: one missing bucket
        List<Candle> completed = aggregator.onTick(tick("15010", 1, 120));

        assertEquals(2, completed.size());
        Candle gap = completed.get(1);
        assertEquals(T0.plusSeconds(60), gap.timestamp());
        assertTrue(gap.isSynthetic(), "Gap candle should be synthetic");
        assertEquals(0, new BigDecimal("15004").compareTo(gap.open()));
        assertEquals(0, new BigDecimal("15004").compareTo(gap.high()));
        assertEquals(0, new BigDecimal("15004").compareTo(gap.close()));
        assertEquals(0L, gap.volume());
    }

    @Test
    void testLongGapNotFilled() {
        aggregator.onTick(tick("15000", 1, 0));

        List<Candle> completed = aggregator.onTick(tick("15010", 1, 600));

        assertEquals(1, completed.size(), "Only the closed candle, no gap fill");
        assertEquals(1L, aggregator.getStats().get("gapsSkipped"));
    }

    @Test
    void testOutOfOrderTickRejected() {
        aggregator.onTick(tick("15000", 1, 60));

        assertTrue(aggregator.onTick(tick("14990", 1, 10)).isEmpty());
        assertEquals(1L, aggregator.getStats().get("ticksRejected"));
        assertEquals(0, new BigDecimal("15000").compareTo(aggregator.getOpenCandle("NQ").low()),
            "Rejected tick must not touch the open candle");
    }

    @Test
    void testMalformedTickRejected() {
        assertTrue(aggregator.onTick(new Tick("NQ", BigDecimal.ZERO, 1, T0)).isEmpty());
        assertTrue(aggregator.onTick(new Tick("", new BigDecimal("15000"), 1, T0)).isEmpty());
        assertTrue(aggregator.onTick(null).isEmpty());

        assertEquals(3L, aggregator.getStats().get("ticksRejected"));
        assertNull(aggregator.getOpenCandle("NQ"));
    }

    @Test
    void testForceCompleteDoesNotReopenBucket() {
        aggregator.onTick(tick("15000", 1, 0));

        List<Candle> forced = aggregator.forceCompleteAll();
        assertEquals(1, forced.size());

        assertTrue(aggregator.onTick(tick("15001", 1, 30)).isEmpty());
        assertEquals(1L, aggregator.getStats().get("ticksRejected"), "Late tick for a completed bucket");
        assertNull(aggregator.getOpenCandle("NQ"));
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new CandleAggregator(bus, Duration.ZERO, 2));
        assertThrows(IllegalArgumentException.class, () -> new CandleAggregator(bus, Duration.ofMinutes(1), 0));
    }
}
