package io.slobengine.service.candle;

import io.slobengine.domain.data.Tick;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - FIFO hand-off
 * - Overflow drops and counts instead of blocking
 * - Poll timeout returns null
 */
class TickBufferTest {

    private static Tick tick(int seq) {
        return new Tick("NQ", new BigDecimal("15000"), seq, Instant.parse("2024-01-02T15:00:00Z").plusSeconds(seq));
    }

    @Test
    void testFifoOrder() throws InterruptedException {
        TickBuffer buffer = new TickBuffer(10);
        buffer.offer(tick(1));
        buffer.offer(tick(2));

        assertEquals(1, buffer.poll(Duration.ofMillis(10)).size());
        assertEquals(2, buffer.poll(Duration.ofMillis(10)).size());
    }

    @Test
    void testOverflowDropsWithoutBlocking() {
        TickBuffer buffer = new TickBuffer(2);

        assertTrue(buffer.offer(tick(1)));
        assertTrue(buffer.offer(tick(2)));
        assertFalse(buffer.offer(tick(3)), "Full buffer should reject");

        assertEquals(2, buffer.size());
        assertEquals(1L, buffer.getStats().get("dropped"));
        assertEquals(1.0, buffer.utilization(), 0.0001);
    }

    @Test
    void testPollTimeoutReturnsNull() throws InterruptedException {
        TickBuffer buffer = new TickBuffer(2);
        assertNull(buffer.poll(Duration.ofMillis(20)));
    }

    @Test
    void testDrainEmptiesInArrivalOrder() {
        TickBuffer buffer = new TickBuffer(5);
        buffer.offer(tick(1));
        buffer.offer(tick(2));
        buffer.offer(tick(3));

        List<Tick> drained = buffer.drain();

        assertEquals(3, drained.size());
        assertEquals(1, drained.get(0).size());
        assertEquals(3, drained.get(2).size());
        assertEquals(0, buffer.size());
        assertEquals(3L, buffer.getStats().get("dequeued"));
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new TickBuffer(0));
    }
}
