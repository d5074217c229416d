package io.slobengine.infrastructure.venue.paper;

import io.slobengine.domain.data.Tick;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.order.OrderStatus;
import io.slobengine.domain.order.VenueFill;
import io.slobengine.domain.order.VenueOrder;
import io.slobengine.domain.order.VenuePosition;
import io.slobengine.infrastructure.venue.VenueConnectionException;
import io.slobengine.service.execution.BracketFactory;
import io.slobengine.service.setup.SetupScenarios;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Connection gating and failure injection
 * - Tick delivery only for subscribed symbols
 * - Bracket matching: entry on next tick, stop/target one-cancels-other
 * - Lost acknowledgement keeps the bracket at the venue
 */
class PaperVenueClientTest {

    private static final Instant T0 = Instant.parse("2024-01-02T15:48:00Z");

    private PaperVenueClient venue;
    private List<Tick> ticks;
    private List<VenueFill> fills;

    @BeforeEach
    void setUp() {
        venue = new PaperVenueClient();
        ticks = new ArrayList<>();
        fills = new ArrayList<>();
        venue.setTickListener(ticks::add);
        venue.setFillListener(fills::add);
    }

    private static Tick tick(String price, long seconds) {
        return new Tick("NQ", new BigDecimal(price), 1, T0.plusSeconds(seconds));
    }

    private static BracketOrder shortBracket() {
        return BracketFactory.build(SetupScenarios.completedShortSetup("s1"), 2, T0);
    }

    @Test
    void testRequiresConnection() {
        assertThrows(VenueConnectionException.class, () -> venue.subscribe("NQ"));
        assertThrows(VenueConnectionException.class, () -> venue.submitBracket(shortBracket()));
        assertThrows(VenueConnectionException.class, venue::ping);
    }

    @Test
    void testFailureInjection() {
        venue.failNextConnects(2);

        assertThrows(VenueConnectionException.class, venue::connect);
        assertThrows(VenueConnectionException.class, venue::connect);
        venue.connect();
        assertTrue(venue.isConnected());

        venue.setPingFailing(true);
        assertThrows(VenueConnectionException.class, venue::ping);

        venue.dropConnection();
        assertFalse(venue.isConnected());
    }

    @Test
    void testTicksOnlyForSubscribedSymbols() {
        venue.connect();
        venue.subscribe("NQ");

        assertTrue(venue.publishTick(tick("15000", 0)));
        assertFalse(venue.publishTick(new Tick("ES", new BigDecimal("4800"), 1, T0)));

        venue.dropConnection();
        assertFalse(venue.publishTick(tick("15001", 1)), "No delivery while the link is down");
        assertEquals(1, ticks.size());
    }

    @Test
    void testBracketEntryThenTarget() {
        venue.connect();
        venue.subscribe("NQ");
        BracketOrder accepted = venue.submitBracket(shortBracket());

        assertEquals("PAPER-1", accepted.entry().venueOrderId());
        assertEquals(3, venue.queryOpenOrders().size());

        venue.publishTick(tick("15094", 1));
        assertEquals(1, fills.size());
        assertEquals(accepted.entry().venueOrderId(), fills.get(0).venueOrderId());
        assertEquals(List.of(new VenuePosition("NQ", -2, new BigDecimal("15094"))), venue.queryPositions());

        venue.publishTick(tick("15000", 2));
        assertEquals(1, fills.size(), "Between stop and target nothing fills");

        venue.publishTick(tick("14899", 3));
        assertEquals(2, fills.size());
        assertEquals(accepted.takeProfit().reference(), fills.get(1).reference());
        assertEquals(0, SetupScenarios.SHORT_TARGET.compareTo(fills.get(1).price()));

        assertTrue(venue.queryOpenOrders().isEmpty(), "Stop cancelled once the target filled");
        VenueOrder stop = venue.queryRecentOrders().stream()
            .filter(o -> o.venueOrderId().equals(accepted.stopLoss().venueOrderId()))
            .findFirst().orElseThrow();
        assertEquals(OrderStatus.CANCELLED, stop.status());
        assertTrue(venue.queryPositions().isEmpty());
    }

    @Test
    void testLostAckStillPlacesBracket() {
        venue.connect();
        venue.loseNextAcks(1);

        assertThrows(VenueConnectionException.class, () -> venue.submitBracket(shortBracket()));

        assertEquals(1, venue.getBracketCount());
        assertEquals(3, venue.queryOpenOrders().size());
        assertTrue(venue.queryOpenOrders().get(0).reference().startsWith("SLOB-s1-"));
    }

    @Test
    void testSeededPositionReported() {
        venue.connect();
        venue.setPosition("ES", 3, new BigDecimal("4800"));

        List<VenuePosition> positions = venue.queryPositions();

        assertEquals(1, positions.size());
        assertEquals(3, positions.get(0).quantity());
    }
}
