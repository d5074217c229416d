package io.slobengine.chaos;

import io.slobengine.application.monitoring.AlertService;
import io.slobengine.application.service.Engine;
import io.slobengine.application.service.EngineConfig;
import io.slobengine.domain.common.EventType;
import io.slobengine.domain.data.Candle;
import io.slobengine.domain.data.Tick;
import io.slobengine.domain.event.CandleCompletedEvent;
import io.slobengine.domain.event.EngineEvent;
import io.slobengine.domain.event.OrderRejectedEvent;
import io.slobengine.domain.order.OrderResult;
import io.slobengine.infrastructure.metrics.EngineMetrics;
import io.slobengine.infrastructure.persistence.InMemoryStateStore;
import io.slobengine.infrastructure.venue.paper.PaperVenueClient;
import io.slobengine.service.core.EventBus;
import io.slobengine.service.setup.SetupScenarios;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failure scenarios against the wired engine and the paper venue.
 *
 * Simulates:
 * - Submit acknowledgements lost on the wire
 * - Venue unreachable when a setup completes
 * - A subscriber that throws on every candle
 *
 * Goals:
 * - Never more than one bracket per setup at the venue
 * - Safe mode instead of retrying forever
 * - One failing subscriber does not stop the pipeline
 */
@DisplayName("Venue Chaos Tests")
public class VenueChaosTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private EventBus bus;
    private AlertService alerts;
    private PaperVenueClient venue;
    private List<Duration> sleeps;
    private Engine engine;

    @BeforeEach
    public void setUp() {
        bus = new EventBus();
        alerts = new AlertService();
        venue = new PaperVenueClient();
        sleeps = new CopyOnWriteArrayList<>();
        engine = new Engine(EngineConfig.defaults(SetupScenarios.SYMBOL), venue, new InMemoryStateStore(), bus,
            alerts, EngineMetrics.NOOP, sleeps::add,
            Clock.fixed(Instant.parse("2024-01-02T08:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    public void tearDown() {
        engine.shutdown(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Chaos 1: Lost submit acknowledgement")
    public void testLostAckDoesNotDuplicate() {
        engine.start();
        venue.loseNextAcks(1);

        replayShortSequence();
        closeEntryCandle();

        awaitTrue(() -> bus.getHistory(EventType.ORDER_PLACED, 10).size() == 1, "bracket adopted");
        assertEquals(1, venue.getBracketCount(), "Lost ack must not produce a second bracket");
        assertTrue(bus.getHistory(EventType.ORDER_REJECTED, 10).isEmpty());
    }

    @Test
    @DisplayName("Chaos 2: Venue unreachable when the setup completes")
    public void testVenueDownAtEntry() {
        engine.start();
        replayShortSequence();
        awaitTrue(() -> engine.getTickBuffer().size() == 0
            && engine.getAggregator().getOpenCandle(SetupScenarios.SYMBOL) != null
            && engine.getAggregator().getOpenCandle(SetupScenarios.SYMBOL).tickCount() == 4,
            "entry candle built");

        venue.failNextConnects(100);
        venue.dropConnection();
        engine.getAggregator().forceCompleteAll();

        awaitTrue(() -> !bus.getHistory(EventType.ORDER_REJECTED, 10).isEmpty(), "order outcome");
        EngineEvent event = bus.getHistory(EventType.ORDER_REJECTED, 10).get(0);
        assertEquals(OrderResult.Outcome.FAILED, ((OrderRejectedEvent) event).outcome());
        assertEquals(0, venue.getBracketCount());
        assertTrue(engine.getStatus().safeMode(), "Exhausted reconnect budget should end in safe mode");
        assertTrue(alerts.getRecentAlerts().stream().anyMatch(a -> "SAFE_MODE".equals(a.type())));
        assertFalse(sleeps.isEmpty(), "Reconnect should have backed off");
    }

    @Test
    @DisplayName("Chaos 3: Subscriber throws on every candle")
    public void testFailingSubscriberIsolated() {
        bus.subscribe(CandleCompletedEvent.class, e -> {
            throw new IllegalStateException("dashboard offline");
        });
        engine.start();

        replayShortSequence();
        closeEntryCandle();

        awaitTrue(() -> bus.getHistory(EventType.ORDER_PLACED, 10).size() == 1, "bracket placed");
        assertTrue(bus.getHandlerErrors() >= 18, "Every candle should have hit the failing subscriber");
        assertEquals(1, venue.getBracketCount());
    }

    private void replayShortSequence() {
        for (Candle candle : SetupScenarios.shortSequence()) {
            for (Tick tick : SetupScenarios.ticksFor(candle)) {
                assertTrue(venue.publishTick(tick));
            }
        }
    }

    private void closeEntryCandle() {
        venue.publishTick(new Tick(SetupScenarios.SYMBOL, new BigDecimal("15095"), 1, SetupScenarios.at("15:48")));
    }

    private static void awaitTrue(BooleanSupplier condition, String what) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Timed out waiting for " + what);
            }
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted waiting for " + what);
            }
        }
    }
}
