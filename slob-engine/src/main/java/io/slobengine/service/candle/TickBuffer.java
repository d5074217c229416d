package io.slobengine.service.candle;

import io.slobengine.domain.data.Tick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the venue callback thread and the engine thread.
 *
 * offer() never blocks the venue thread. When the buffer is full the tick is dropped
 * and counted; the warning is rate-limited to one per 1,000 drops.
 */
public final class TickBuffer {
    private static final Logger log = LoggerFactory.getLogger(TickBuffer.class);

    public static final int DEFAULT_CAPACITY = 10_000;

    private final BlockingQueue<Tick> queue;
    private final int capacity;

    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong dequeued = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public TickBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public TickBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public boolean offer(Tick tick) {
        if (queue.offer(tick)) {
            enqueued.incrementAndGet();
            return true;
        }
        long total = dropped.incrementAndGet();
        if (total == 1 || total % 1000 == 0) {
            log.warn("[TickBuffer] Overflow ({}/{}), dropped {} tick(s) so far", queue.size(), capacity, total);
        }
        return false;
    }

    /**
     * Wait up to the timeout for the next tick.
     *
     * @return the tick, or null on timeout
     */
    public Tick poll(Duration timeout) throws InterruptedException {
        Tick tick = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (tick != null) {
            dequeued.incrementAndGet();
        }
        return tick;
    }

    /**
     * Remove everything currently queued, in arrival order.
     */
    public List<Tick> drain() {
        List<Tick> ticks = new ArrayList<>();
        queue.drainTo(ticks);
        dequeued.addAndGet(ticks.size());
        return ticks;
    }

    public int size() {
        return queue.size();
    }

    public double utilization() {
        return (double) queue.size() / capacity;
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("capacity", capacity);
        stats.put("size", queue.size());
        stats.put("enqueued", enqueued.get());
        stats.put("dequeued", dequeued.get());
        stats.put("dropped", dropped.get());
        return stats;
    }
}
