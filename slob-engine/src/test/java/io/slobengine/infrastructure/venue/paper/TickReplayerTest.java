package io.slobengine.infrastructure.venue.paper;

import io.slobengine.domain.data.Tick;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - CSV parsing, header and comment handling
 * - Malformed lines counted and skipped
 * - Unsubscribed ticks reported as dropped
 * - Pacing scaled by replay speed
 */
class TickReplayerTest {

    private static final String CSV = String.join("\n",
        "timestamp,symbol,price,size",
        "# recorded session",
        "2024-01-02T15:30:00Z,NQ,15000.25,2",
        "",
        "2024-01-02T15:30:02Z,NQ,15001.00,1",
        "2024-01-02T15:30:03Z,NQ,not-a-price,1",
        "2024-01-02T15:30:04Z,NQ,15002.50",
        "2024-01-02T15:30:06Z,NQ,15003.00,4");

    private PaperVenueClient venue;
    private List<Tick> received;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        venue = new PaperVenueClient();
        received = new ArrayList<>();
        sleeps = new ArrayList<>();
        venue.setTickListener(received::add);
        venue.connect();
        venue.subscribe("NQ");
    }

    @Test
    void testParseLine() {
        Tick tick = TickReplayer.parseLine("2024-01-02T15:30:00Z, NQ, 15000.25, 2");

        assertEquals("NQ", tick.symbol());
        assertEquals(0, new BigDecimal("15000.25").compareTo(tick.price()));
        assertEquals(2, tick.size());
        assertEquals(Instant.parse("2024-01-02T15:30:00Z"), tick.timestamp());
    }

    @Test
    void testParseLineRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> TickReplayer.parseLine("a,b,c"));
        assertThrows(IllegalArgumentException.class,
            () -> TickReplayer.parseLine("2024-01-02T15:30:00Z,NQ,-1,1"));
    }

    @Test
    void testReplaySkipsMalformedLines() throws IOException {
        TickReplayer replayer = new TickReplayer(venue, sleeps::add, 0);

        TickReplayer.ReplayResult result = replayer.replay(new StringReader(CSV));

        assertEquals(3, result.published());
        assertEquals(2, result.malformed());
        assertEquals(0, result.dropped());
        assertEquals(3, received.size());
        assertTrue(sleeps.isEmpty(), "Speed 0 replays without pacing");
    }

    @Test
    void testPacingScaledBySpeed() throws IOException {
        TickReplayer replayer = new TickReplayer(venue, sleeps::add, 2.0);

        replayer.replay(new StringReader(CSV));

        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void testUnsubscribedTicksDropped() throws IOException {
        venue.unsubscribe("NQ");

        TickReplayer.ReplayResult result = new TickReplayer(venue, sleeps::add, 0).replay(new StringReader(CSV));

        assertEquals(0, result.published());
        assertEquals(3, result.dropped());
    }

    @Test
    void testReplayFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("ticks.csv");
        Files.writeString(file, CSV, StandardCharsets.UTF_8);

        TickReplayer.ReplayResult result = new TickReplayer(venue, sleeps::add, 0).replay(file);

        assertEquals(3, result.published());
    }

    @Test
    void testNegativeSpeedRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TickReplayer(venue, sleeps::add, -1));
    }
}
