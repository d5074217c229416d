package io.slobengine.infrastructure.venue.common;

import io.slobengine.application.monitoring.AlertService;
import io.slobengine.domain.connection.ConnectionPhase;
import io.slobengine.domain.event.ConnectionLostEvent;
import io.slobengine.domain.event.ConnectionRestoredEvent;
import io.slobengine.domain.event.SafeModeClearedEvent;
import io.slobengine.domain.event.SafeModeEnteredEvent;
import io.slobengine.domain.monitoring.AlertLevel;
import io.slobengine.infrastructure.venue.VenueClient;
import io.slobengine.infrastructure.venue.VenueConnectionException;
import io.slobengine.infrastructure.venue.paper.PaperVenueClient;
import io.slobengine.service.core.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests:
 * - Backoff delays between connect attempts
 * - Safe mode after the attempt budget and no further attempts
 * - Operator clear
 * - Heartbeat loss recovery and resubscription
 */
class ConnectionSupervisorTest {

    private EventBus bus;
    private AlertService alerts;
    private PaperVenueClient venue;
    private List<Duration> sleeps;
    private ConnectionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        alerts = new AlertService();
        venue = new PaperVenueClient();
        sleeps = new CopyOnWriteArrayList<>();
        supervisor = newSupervisor(venue, Duration.ofMinutes(10), Duration.ofMinutes(20));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown(Duration.ofSeconds(1));
        bus.shutdown(Duration.ofSeconds(1));
    }

    private ConnectionSupervisor newSupervisor(VenueClient client, Duration ping, Duration timeout) {
        return new ConnectionSupervisor(client, bus, alerts,
            ReconnectionPolicy.forVenue(), ReconnectionPolicy.forHeartbeatRecovery(),
            ping, timeout, sleeps::add);
    }

    @Test
    void testConnectSucceedsFirstAttempt() {
        assertTrue(supervisor.connect());

        assertEquals(ConnectionPhase.CONNECTED, supervisor.getState().phase());
        assertTrue(supervisor.isConnected());
        assertTrue(sleeps.isEmpty(), "No backoff on first-attempt success");
        assertEquals(1L, supervisor.getStats().get("connectAttempts"));
    }

    @Test
    void testBackoffBetweenFailedAttempts() {
        venue.failNextConnects(3);

        assertTrue(supervisor.connect());

        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
        assertEquals(4L, supervisor.getStats().get("connectAttempts"));
    }

    @Test
    void testSafeModeAfterMaxAttempts() {
        List<SafeModeEnteredEvent> entered = new CopyOnWriteArrayList<>();
        bus.subscribe(SafeModeEnteredEvent.class, entered::add);
        venue.failNextConnects(100);

        assertFalse(supervisor.connect());

        assertEquals(ConnectionPhase.SAFE_MODE, supervisor.getState().phase());
        assertEquals(5, supervisor.getState().consecutiveFailures());
        assertEquals(1, entered.size(), "Safe mode event delivered before connect returns");
        assertEquals(5, entered.get(0).consecutiveFailures());
        assertEquals(1L, alerts.getCount(AlertLevel.CRITICAL));
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8),
            Duration.ofSeconds(16)), sleeps);
    }

    @Test
    void testNoAutomaticAttemptsInSafeMode() {
        venue.failNextConnects(100);
        supervisor.connect();
        long attempts = supervisor.getStats().get("connectAttempts");

        assertFalse(supervisor.connect());
        assertThrows(VenueConnectionException.class, supervisor::ensureConnected);

        assertEquals(attempts, supervisor.getStats().get("connectAttempts"), "Safe mode blocks further attempts");
        assertTrue(supervisor.isSafeMode());
    }

    @Test
    void testClearSafeModeAllowsReconnect() throws InterruptedException {
        CountDownLatch cleared = new CountDownLatch(1);
        bus.subscribe(SafeModeClearedEvent.class, e -> cleared.countDown());
        venue.failNextConnects(5);
        supervisor.connect();
        assertTrue(supervisor.isSafeMode());

        assertTrue(supervisor.clearSafeMode("ops"));

        assertEquals(ConnectionPhase.DISCONNECTED, supervisor.getState().phase());
        assertEquals(0, supervisor.getState().consecutiveFailures());
        assertTrue(cleared.await(1, TimeUnit.SECONDS), "Cleared event published");
        assertTrue(supervisor.connect(), "Fresh budget after clear");
        assertFalse(supervisor.clearSafeMode("ops"), "Clear outside safe mode is ignored");
    }

    @Test
    void testHeartbeatRecoveryResubscribes() throws InterruptedException {
        CountDownLatch lost = new CountDownLatch(1);
        CountDownLatch restored = new CountDownLatch(1);
        List<ConnectionRestoredEvent> restoredEvents = new CopyOnWriteArrayList<>();
        bus.subscribe(ConnectionLostEvent.class, e -> lost.countDown());
        bus.subscribe(ConnectionRestoredEvent.class, e -> {
            restoredEvents.add(e);
            restored.countDown();
        });

        VenueClient client = mock(VenueClient.class);
        when(client.getVenueName()).thenReturn("MOCK");
        when(client.isConnected()).thenReturn(true);
        ConnectionSupervisor mocked = newSupervisor(client, Duration.ofMinutes(10), Duration.ofMinutes(20));
        try {
            assertTrue(mocked.connect());
            mocked.subscribe("NQ");

            mocked.recoverFromHeartbeatLoss();

            assertTrue(lost.await(1, TimeUnit.SECONDS));
            assertTrue(restored.await(1, TimeUnit.SECONDS));
            assertEquals(1, restoredEvents.get(0).resubscribedSymbols());
            verify(client, times(2)).subscribe("NQ");
            verify(client).disconnect();
            assertTrue(mocked.isConnected());
        } finally {
            mocked.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void testHeartbeatRecoveryUsesSmallerBudget() {
        assertTrue(supervisor.connect());
        venue.failNextConnects(100);

        supervisor.recoverFromHeartbeatLoss();

        assertTrue(supervisor.isSafeMode());
        assertEquals(3, supervisor.getState().consecutiveFailures());
    }

    @Test
    void testHeartbeatLossTriggersRecovery() throws InterruptedException {
        CountDownLatch restored = new CountDownLatch(1);
        bus.subscribe(ConnectionRestoredEvent.class, e -> restored.countDown());
        ConnectionSupervisor fast = newSupervisor(venue, Duration.ofMillis(100), Duration.ofMillis(300));
        try {
            assertTrue(fast.connect());
            venue.setPingFailing(true);

            assertTrue(restored.await(3, TimeUnit.SECONDS), "Reconnected after heartbeat loss");
            assertTrue(fast.isConnected());
            assertEquals(1L, fast.getStats().get("heartbeatLosses"));
        } finally {
            fast.shutdown(Duration.ofSeconds(1));
        }
    }

    @Test
    void testSubscriptionsTracked() {
        supervisor.subscribe("NQ");
        supervisor.subscribe("ES");
        supervisor.unsubscribe("ES");

        assertEquals(List.of("NQ"), supervisor.getSubscriptions());
        assertFalse(venue.isSubscribed("NQ"), "Not forwarded while disconnected");

        supervisor.connect();
        assertTrue(venue.isSubscribed("NQ"), "Tracked symbols subscribed on connect");
    }

    @Test
    void testDisconnectKeepsSafeMode() {
        venue.failNextConnects(100);
        supervisor.connect();

        supervisor.disconnect();

        assertTrue(supervisor.isSafeMode());
    }
}
