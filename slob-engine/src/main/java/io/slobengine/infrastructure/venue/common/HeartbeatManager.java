package io.slobengine.infrastructure.venue.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Heartbeat manager for the venue link.
 *
 * Sends a ping every pingInterval on its own scheduler thread. A ping that returns normally
 * counts as a pong. When no pong arrives within timeout, or a ping throws, the connection is
 * marked unhealthy and the health callback fires once per change.
 *
 * A manager is single-use: after {@link #stop()} a new instance is needed.
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String venue;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Consumer<Boolean> healthCallback;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pingTask;
    private volatile ScheduledFuture<?> timeoutTask;
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    public HeartbeatManager(String venue, Duration pingInterval, Duration timeout,
                            Runnable pingFunction, Consumer<Boolean> healthCallback) {
        this.venue = venue;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.healthCallback = healthCallback;
        // Two threads so the timeout check still fires while a ping is blocked
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, threadName());
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[{}] Heartbeat manager already running", venue);
            return;
        }

        log.info("[{}] Starting heartbeat (ping interval: {}ms, timeout: {}ms)",
            venue, pingInterval.toMillis(), timeout.toMillis());

        running = true;
        healthy = true;
        lastPongTime = Instant.now();

        pingTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sendPing();
            } catch (Exception e) {
                log.error("[{}] Failed to send ping", venue, e);
                markUnhealthy();
            }
        }, pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop pinging. Safe to call from the health callback.
     */
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }

            log.info("[{}] Stopping heartbeat", venue);
            running = false;

            if (pingTask != null) {
                pingTask.cancel(false);
                pingTask = null;
            }
            if (timeoutTask != null) {
                timeoutTask.cancel(false);
                timeoutTask = null;
            }
            scheduler.shutdown();
        }

        if (Thread.currentThread().getName().equals(threadName())) {
            return;
        }
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Record a pong. Resets the timeout and marks the link healthy.
     */
    public synchronized void recordPong() {
        lastPongTime = Instant.now();

        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }

        if (!healthy) {
            log.info("[{}] Heartbeat recovered, marking as healthy", venue);
            markHealthy();
        }
    }

    public boolean isHealthy() {
        return healthy && isWithinTimeout();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return Duration since last pong, or null before start
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return null;
        }
        return Duration.between(lastPong, Instant.now());
    }

    private void sendPing() {
        if (!running) {
            return;
        }

        log.debug("[{}] Sending ping", venue);
        scheduleTimeoutCheck();

        try {
            pingFunction.run();
        } catch (Exception e) {
            log.warn("[{}] Ping failed: {}", venue, e.getMessage());
            markUnhealthy();
            return;
        }

        recordPong();
    }

    private synchronized void scheduleTimeoutCheck() {
        if (timeoutTask != null || !running) {
            return;
        }

        timeoutTask = scheduler.schedule(() -> {
            if (isWithinTimeout()) {
                return;
            }
            log.warn("[{}] Heartbeat timeout - no pong for {}ms", venue, timeout.toMillis());
            markUnhealthy();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isWithinTimeout() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return false;
        }
        return Duration.between(lastPong, Instant.now()).compareTo(timeout) < 0;
    }

    private String threadName() {
        return "heartbeat-" + venue;
    }

    private void markHealthy() {
        if (healthy) {
            return;
        }
        healthy = true;
        notifyHealth(true);
    }

    private void markUnhealthy() {
        if (!healthy) {
            return;
        }
        healthy = false;
        notifyHealth(false);
    }

    private void notifyHealth(boolean isHealthy) {
        if (healthCallback == null) {
            return;
        }
        try {
            healthCallback.accept(isHealthy);
        } catch (Exception e) {
            log.error("[{}] Health callback threw exception", venue, e);
        }
    }

    /**
     * 30s ping, 60s timeout.
     */
    public static HeartbeatManager withDefaults(String venue, Runnable pingFunction,
                                                Consumer<Boolean> healthCallback) {
        return new HeartbeatManager(venue, Duration.ofSeconds(30), Duration.ofSeconds(60),
            pingFunction, healthCallback);
    }
}
