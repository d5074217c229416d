package io.slobengine.infrastructure.venue.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HeartbeatManager.
 *
 * Tests:
 * - Periodic ping sending
 * - Failing ping marks the link unhealthy
 * - Timeout detection while a ping is blocked
 * - Lifecycle management
 */
class HeartbeatManagerTest {

    private HeartbeatManager heartbeat;

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
    }

    @Test
    void testInitialState() {
        AtomicInteger pingCount = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("PAPER", Duration.ofSeconds(1), Duration.ofSeconds(2),
            pingCount::incrementAndGet, healthy -> {});

        assertEquals(0, pingCount.get(), "No pings sent before start");
        assertNull(heartbeat.getTimeSinceLastPong(), "No pongs received yet");
        assertFalse(heartbeat.isRunning());
    }

    @Test
    void testPeriodicPingSending() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);

        heartbeat = new HeartbeatManager("PAPER", Duration.ofMillis(100), Duration.ofSeconds(1),
            pingLatch::countDown, healthy -> {});
        heartbeat.start();

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS), "Should send 3 pings within 2 seconds");
        assertTrue(heartbeat.isHealthy(), "Successful pings count as pongs");
    }

    @Test
    void testFailingPingMarksUnhealthy() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        AtomicBoolean lastStatus = new AtomicBoolean(true);

        heartbeat = new HeartbeatManager("PAPER", Duration.ofMillis(50), Duration.ofSeconds(5),
            () -> { throw new IllegalStateException("no route"); },
            healthy -> {
                lastStatus.set(healthy);
                if (!healthy) {
                    unhealthy.countDown();
                }
            });
        heartbeat.start();

        assertTrue(unhealthy.await(2, TimeUnit.SECONDS), "Health callback should report loss");
        assertFalse(lastStatus.get());
        assertFalse(heartbeat.isHealthy());
    }

    @Test
    void testTimeoutFiresWhilePingIsBlocked() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        heartbeat = new HeartbeatManager("PAPER", Duration.ofMillis(50), Duration.ofMillis(200),
            () -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            },
            healthy -> {
                if (!healthy) {
                    unhealthy.countDown();
                }
            });
        heartbeat.start();

        assertTrue(unhealthy.await(2, TimeUnit.SECONDS), "Timeout should fire while the ping hangs");
        release.countDown();
    }

    @Test
    void testRecordPongRestoresHealth() {
        AtomicBoolean status = new AtomicBoolean(true);
        heartbeat = new HeartbeatManager("PAPER", Duration.ofSeconds(10), Duration.ofSeconds(20),
            () -> {}, status::set);
        heartbeat.start();

        heartbeat.recordPong();

        assertTrue(heartbeat.isHealthy());
        assertNotNull(heartbeat.getTimeSinceLastPong());
    }

    @Test
    void testStopIsIdempotent() {
        heartbeat = HeartbeatManager.withDefaults("PAPER", () -> {}, healthy -> {});
        heartbeat.start();
        assertTrue(heartbeat.isRunning());

        heartbeat.stop();
        heartbeat.stop();

        assertFalse(heartbeat.isRunning());
    }
}
