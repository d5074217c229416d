package io.slobengine.infrastructure.venue.paper;

import io.slobengine.domain.data.Tick;
import io.slobengine.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Feeds recorded ticks into a {@link PaperVenueClient}.
 *
 * CSV layout: timestamp,symbol,price,size with ISO-8601 timestamps. A header line is optional,
 * blank lines and lines starting with '#' are ignored, malformed lines are logged and skipped.
 */
public final class TickReplayer {
    private static final Logger log = LoggerFactory.getLogger(TickReplayer.class);

    private final PaperVenueClient venue;
    private final Sleeper sleeper;
    private final double speed;     // 1.0 = recorded pace, 0 = no pacing

    public TickReplayer(PaperVenueClient venue) {
        this(venue, Sleeper.SYSTEM, 0);
    }

    public TickReplayer(PaperVenueClient venue, Sleeper sleeper, double speed) {
        if (speed < 0) {
            throw new IllegalArgumentException("Replay speed cannot be negative");
        }
        this.venue = venue;
        this.sleeper = sleeper;
        this.speed = speed;
    }

    public ReplayResult replay(Path file) throws IOException {
        log.info("[REPLAY] Replaying {} (speed={})", file, speed);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return replay(reader);
        }
    }

    public ReplayResult replay(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);
        int published = 0;
        int dropped = 0;
        int malformed = 0;
        int lineNo = 0;
        Instant previous = null;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || isHeader(trimmed)) {
                continue;
            }
            Tick tick;
            try {
                tick = parseLine(trimmed);
            } catch (IllegalArgumentException | DateTimeParseException e) {
                malformed++;
                log.warn("[REPLAY] Line {} skipped: {}", lineNo, e.getMessage());
                continue;
            }

            if (!pace(previous, tick.timestamp())) {
                log.warn("[REPLAY] Interrupted at line {}", lineNo);
                break;
            }
            previous = tick.timestamp();

            if (venue.publishTick(tick)) {
                published++;
            } else {
                dropped++;
            }
        }

        ReplayResult result = new ReplayResult(published, dropped, malformed);
        log.info("[REPLAY] Done: published={} dropped={} malformed={}", published, dropped, malformed);
        return result;
    }

    /**
     * @return false when interrupted
     */
    private boolean pace(Instant previous, Instant current) {
        if (speed == 0 || previous == null || !current.isAfter(previous)) {
            return true;
        }
        long nanos = (long) (Duration.between(previous, current).toNanos() / speed);
        try {
            sleeper.sleep(Duration.ofNanos(nanos));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isHeader(String line) {
        return line.regionMatches(true, 0, "timestamp", 0, "timestamp".length());
    }

    static Tick parseLine(String line) {
        String[] parts = line.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Expected 4 fields, got " + parts.length);
        }
        Instant timestamp = Instant.parse(parts[0].trim());
        String symbol = parts[1].trim();
        BigDecimal price = new BigDecimal(parts[2].trim());
        long size = Long.parseLong(parts[3].trim());
        Tick tick = new Tick(symbol, price, size, timestamp);
        if (!tick.isWellFormed()) {
            throw new IllegalArgumentException("Malformed tick: " + line);
        }
        return tick;
    }

    public record ReplayResult(int published, int dropped, int malformed) {
    }
}
