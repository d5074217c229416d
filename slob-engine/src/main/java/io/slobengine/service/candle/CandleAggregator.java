package io.slobengine.service.candle;

import io.slobengine.domain.data.Candle;
import io.slobengine.domain.data.Tick;
import io.slobengine.domain.event.CandleCompletedEvent;
import io.slobengine.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CandleAggregator - fold ticks into fixed-width OHLCV buckets.
 *
 * Pattern: one open (partial) bucket per symbol
 * - A tick in a later bucket closes the open one and emits CANDLE_COMPLETED exactly once
 * - Short gaps (at most maxGapFillDistance buckets apart) are filled with flat candles at the
 *   prior close; longer gaps are left absent
 * - Ticks older than the open bucket are rejected, a completed bucket is never reopened
 *
 * Not thread-safe per symbol: the engine thread is the only caller of onTick().
 */
public final class CandleAggregator {
    private static final Logger log = LoggerFactory.getLogger(CandleAggregator.class);

    public static final Duration DEFAULT_BUCKET = Duration.ofMinutes(1);
    public static final int DEFAULT_MAX_GAP_FILL_DISTANCE = 2;

    private final EventBus eventBus;
    private final long bucketMillis;
    private final int maxGapFillDistance;

    // symbol -> open bucket
    private final Map<String, PartialCandle> partialCandles = new ConcurrentHashMap<>();
    // symbol -> start of the last emitted bucket
    private final Map<String, Long> lastCompletedBucket = new ConcurrentHashMap<>();
    // symbol -> last emitted candle, for gap-fill price after a forced completion
    private final Map<String, Candle> lastCandles = new ConcurrentHashMap<>();

    private final AtomicLong ticksProcessed = new AtomicLong();
    private final AtomicLong ticksRejected = new AtomicLong();
    private final AtomicLong candlesCompleted = new AtomicLong();
    private final AtomicLong gapCandles = new AtomicLong();
    private final AtomicLong gapsSkipped = new AtomicLong();

    public CandleAggregator(EventBus eventBus) {
        this(eventBus, DEFAULT_BUCKET, DEFAULT_MAX_GAP_FILL_DISTANCE);
    }

    public CandleAggregator(EventBus eventBus, Duration bucket, int maxGapFillDistance) {
        if (bucket == null || bucket.isZero() || bucket.isNegative()) {
            throw new IllegalArgumentException("Bucket width must be positive");
        }
        if (maxGapFillDistance < 1) {
            throw new IllegalArgumentException("Max gap fill distance must be at least 1");
        }
        this.eventBus = eventBus;
        this.bucketMillis = bucket.toMillis();
        this.maxGapFillDistance = maxGapFillDistance;
    }

    /**
     * Fold one tick.
     *
     * @return candles completed by this tick (closed bucket followed by any gap fills), oldest first
     */
    public List<Candle> onTick(Tick tick) {
        if (tick == null || !tick.isWellFormed()) {
            ticksRejected.incrementAndGet();
            log.warn("[CandleAggregator] Rejected malformed tick: {}", tick);
            return List.of();
        }

        String symbol = tick.symbol();
        long bucket = bucketStart(tick.timestamp());
        PartialCandle partial = partialCandles.get(symbol);
        List<Candle> completed = new ArrayList<>();

        if (partial != null && bucket < partial.startMillis) {
            ticksRejected.incrementAndGet();
            log.warn("[CandleAggregator] Out-of-order tick for {} at {} (open bucket {})",
                symbol, tick.timestamp(), Instant.ofEpochMilli(partial.startMillis));
            return List.of();
        }
        Long lastDone = lastCompletedBucket.get(symbol);
        if (partial == null && lastDone != null && bucket <= lastDone) {
            ticksRejected.incrementAndGet();
            log.warn("[CandleAggregator] Late tick for {} at {}: bucket already completed", symbol, tick.timestamp());
            return List.of();
        }

        ticksProcessed.incrementAndGet();

        if (partial != null && bucket != partial.startMillis) {
            Candle closed = partial.toCandle(symbol);
            partialCandles.remove(symbol);
            emit(closed);
            completed.add(closed);
            completed.addAll(fillGap(symbol, partial.startMillis, bucket, closed.close()));
            partial = null;
        } else if (partial == null && lastDone != null) {
            // Open bucket was force-completed earlier; still bridge short gaps.
            Candle previous = lastCandles.get(symbol);
            if (previous != null) {
                completed.addAll(fillGap(symbol, lastDone, bucket, previous.close()));
            }
        }

        if (partial == null) {
            partial = new PartialCandle(bucket, tick.price());
            partialCandles.put(symbol, partial);
        }
        partial.update(tick.price(), tick.size());
        return completed;
    }

    private List<Candle> fillGap(String symbol, long fromBucket, long toBucket, BigDecimal priorClose) {
        long distance = (toBucket - fromBucket) / bucketMillis;
        if (distance <= 1) {
            return List.of();
        }
        if (distance > maxGapFillDistance) {
            gapsSkipped.incrementAndGet();
            log.warn("[CandleAggregator] Gap of {} buckets for {} ({} -> {}), not filling",
                distance - 1, symbol, Instant.ofEpochMilli(fromBucket), Instant.ofEpochMilli(toBucket));
            return List.of();
        }

        List<Candle> filled = new ArrayList<>();
        for (long b = fromBucket + bucketMillis; b < toBucket; b += bucketMillis) {
            Candle flat = Candle.flat(symbol, Instant.ofEpochMilli(b), priorClose);
            gapCandles.incrementAndGet();
            emit(flat);
            filled.add(flat);
        }
        log.info("[CandleAggregator] Filled {} gap candle(s) for {} at {}", filled.size(), symbol, priorClose);
        return filled;
    }

    private void emit(Candle candle) {
        lastCompletedBucket.put(candle.symbol(), candle.timestamp().toEpochMilli());
        lastCandles.put(candle.symbol(), candle);
        candlesCompleted.incrementAndGet();
        log.debug("[CandleAggregator] Candle completed: {} {} O={} H={} L={} C={} V={}",
            candle.symbol(), candle.timestamp(), candle.open(), candle.high(), candle.low(),
            candle.close(), candle.volume());
        if (eventBus != null) {
            eventBus.publish(new CandleCompletedEvent(candle, Instant.now()));
        }
    }

    /**
     * Finalize every open bucket. Used on shutdown.
     */
    public List<Candle> forceCompleteAll() {
        List<Candle> completed = new ArrayList<>();
        log.info("[CandleAggregator] Force completing {} open candle(s)", partialCandles.size());
        for (String symbol : new ArrayList<>(partialCandles.keySet())) {
            PartialCandle partial = partialCandles.remove(symbol);
            if (partial != null) {
                Candle candle = partial.toCandle(symbol);
                emit(candle);
                completed.add(candle);
            }
        }
        return completed;
    }

    public Candle getOpenCandle(String symbol) {
        PartialCandle partial = partialCandles.get(symbol);
        return partial == null ? null : partial.toCandle(symbol);
    }

    private long bucketStart(Instant timestamp) {
        return Math.floorDiv(timestamp.toEpochMilli(), bucketMillis) * bucketMillis;
    }

    public Map<String, Long> getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("ticksProcessed", ticksProcessed.get());
        stats.put("ticksRejected", ticksRejected.get());
        stats.put("candlesCompleted", candlesCompleted.get());
        stats.put("gapCandles", gapCandles.get());
        stats.put("gapsSkipped", gapsSkipped.get());
        stats.put("openCandles", (long) partialCandles.size());
        return stats;
    }

    /**
     * Mutable accumulator for the open bucket.
     */
    private static final class PartialCandle {
        final long startMillis;
        final BigDecimal open;
        BigDecimal high;
        BigDecimal low;
        BigDecimal close;
        long volume;
        int tickCount;

        PartialCandle(long startMillis, BigDecimal firstPrice) {
            this.startMillis = startMillis;
            this.open = firstPrice;
            this.high = firstPrice;
            this.low = firstPrice;
            this.close = firstPrice;
        }

        void update(BigDecimal price, long size) {
            high = high.max(price);
            low = low.min(price);
            close = price;
            volume += size;
            tickCount++;
        }

        Candle toCandle(String symbol) {
            return new Candle(symbol, Instant.ofEpochMilli(startMillis), open, high, low, close, volume, tickCount);
        }
    }
}
