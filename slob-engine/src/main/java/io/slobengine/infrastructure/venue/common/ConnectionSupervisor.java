package io.slobengine.infrastructure.venue.common;

import io.slobengine.application.monitoring.AlertService;
import io.slobengine.domain.connection.ConnectionPhase;
import io.slobengine.domain.connection.ConnectionState;
import io.slobengine.domain.event.ConnectionLostEvent;
import io.slobengine.domain.event.ConnectionRestoredEvent;
import io.slobengine.domain.event.SafeModeClearedEvent;
import io.slobengine.domain.event.SafeModeEnteredEvent;
import io.slobengine.infrastructure.venue.VenueClient;
import io.slobengine.infrastructure.venue.VenueConnectionException;
import io.slobengine.service.core.EventBus;
import io.slobengine.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection Supervisor - owns the venue link.
 *
 * PHASES:
 *   DISCONNECTED -> CONNECTING -> CONNECTED
 *   CONNECTED -(heartbeat loss)-> CONNECTING (smaller budget) -> CONNECTED | SAFE_MODE
 *   CONNECTING -(budget exhausted)-> SAFE_MODE
 *   SAFE_MODE -(clearSafeMode by operator)-> DISCONNECTED
 *
 * SAFE MODE:
 * No automatic reconnects and no order submission. Entering it is announced with
 * publishAndWait so observers have seen it before the caller continues.
 *
 * This class is the only writer of {@link ConnectionState}; readers get the current snapshot.
 */
public final class ConnectionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private static final Duration EVENT_TIMEOUT = Duration.ofSeconds(5);

    private final VenueClient venue;
    private final String venueName;
    private final EventBus eventBus;
    private final AlertService alertService;
    private final ReconnectionPolicy connectPolicy;
    private final ReconnectionPolicy heartbeatPolicy;
    private final Duration pingInterval;
    private final Duration heartbeatTimeout;
    private final Sleeper sleeper;

    private final ExecutorService recoveryExecutor;
    private final Set<String> symbols = new LinkedHashSet<>();

    private volatile ConnectionState state;
    private volatile HeartbeatManager heartbeat;
    private volatile boolean stopped = false;
    private int lastAttempts;

    // Statistics
    private final AtomicLong connectAttempts = new AtomicLong();
    private final AtomicLong connectFailures = new AtomicLong();
    private final AtomicLong heartbeatLosses = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private final AtomicLong safeModeEntries = new AtomicLong();

    public ConnectionSupervisor(VenueClient venue, EventBus eventBus, AlertService alertService) {
        this(venue, eventBus, alertService, ReconnectionPolicy.forVenue(),
            ReconnectionPolicy.forHeartbeatRecovery(), Duration.ofSeconds(30), Duration.ofSeconds(60),
            Sleeper.SYSTEM);
    }

    public ConnectionSupervisor(VenueClient venue, EventBus eventBus, AlertService alertService,
                                ReconnectionPolicy connectPolicy, ReconnectionPolicy heartbeatPolicy,
                                Duration pingInterval, Duration heartbeatTimeout, Sleeper sleeper) {
        this.venue = venue;
        this.venueName = venue.getVenueName();
        this.eventBus = eventBus;
        this.alertService = alertService;
        this.connectPolicy = connectPolicy;
        this.heartbeatPolicy = heartbeatPolicy;
        this.pingInterval = pingInterval;
        this.heartbeatTimeout = heartbeatTimeout;
        this.sleeper = sleeper;
        this.state = ConnectionState.initial(Instant.now());
        this.recoveryExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "venue-recovery-" + venueName);
            t.setDaemon(true);
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECT
    // ═══════════════════════════════════════════════════════════════

    /**
     * Connect with the startup budget. Blocks through the backoff delays.
     *
     * @return true when connected, false when safe mode was entered or the wait was interrupted
     */
    public synchronized boolean connect() {
        if (state.isConnected() && venue.isConnected()) {
            return true;
        }
        if (!runConnectLoop(connectPolicy, "connect")) {
            return false;
        }
        resubscribeAll();
        return true;
    }

    /**
     * Make sure the link is usable before an order goes out.
     *
     * @throws VenueConnectionException when in safe mode or the reconnect budget ran out
     */
    public synchronized void ensureConnected() {
        if (state.isSafeMode()) {
            throw new VenueConnectionException(venueName, "Safe mode active, connection attempts suspended");
        }
        if (state.isConnected() && venue.isConnected()) {
            return;
        }
        log.warn("[{}] Link not healthy (phase {}), reconnecting before use", venueName, state.phase());
        if (!runConnectLoop(connectPolicy, "ensureConnected")) {
            throw new VenueConnectionException(venueName,
                "Unable to connect after " + state.consecutiveFailures() + " attempt(s), phase " + state.phase());
        }
        resubscribeAll();
    }

    private boolean runConnectLoop(ReconnectionPolicy policy, String trigger) {
        if (state.isSafeMode()) {
            log.warn("[{}] {} skipped: safe mode active", venueName, trigger);
            return false;
        }
        if (stopped) {
            return false;
        }

        policy.reset();
        lastAttempts = 0;
        setState(ConnectionPhase.CONNECTING, 0);
        String lastError = "unknown";

        while (policy.shouldRetry()) {
            lastAttempts++;
            connectAttempts.incrementAndGet();
            try {
                venue.connect();
                policy.recordSuccess();
                setState(ConnectionPhase.CONNECTED, 0);
                log.info("[{}] Connected ({} on attempt {})", venueName, trigger, lastAttempts);
                startHeartbeat();
                return true;
            } catch (RuntimeException e) {
                policy.recordFailure();
                connectFailures.incrementAndGet();
                lastError = e.getMessage();
                setState(ConnectionPhase.CONNECTING, policy.getAttemptCount());
                log.warn("[{}] Connect attempt {}/{} failed: {}",
                    venueName, policy.getAttemptCount(), policy.getMaxAttempts(), e.getMessage());
            }

            if (stopped) {
                setState(ConnectionPhase.DISCONNECTED, policy.getAttemptCount());
                return false;
            }
            if (policy.shouldRetry()) {
                Duration delay = policy.getNextDelay();
                log.info("[{}] Retrying in {}ms", venueName, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[{}] Reconnect interrupted", venueName);
                    setState(ConnectionPhase.DISCONNECTED, policy.getAttemptCount());
                    return false;
                }
            }
        }

        enterSafeMode(policy.getAttemptCount(), lastError);
        return false;
    }

    private void enterSafeMode(int failures, String reason) {
        stopHeartbeat();
        setState(ConnectionPhase.SAFE_MODE, failures);
        safeModeEntries.incrementAndGet();
        log.error("[{}] SAFE MODE after {} consecutive failures: {}", venueName, failures, reason);

        if (alertService != null) {
            alertService.sendCriticalAlert("SAFE_MODE",
                venueName + " unreachable after " + failures + " attempts: " + reason);
        }
        if (eventBus != null) {
            boolean delivered = eventBus.publishAndWait(
                new SafeModeEnteredEvent(venueName, failures, reason, Instant.now()), EVENT_TIMEOUT);
            if (!delivered) {
                log.warn("[{}] Safe mode event not fully delivered within {}ms", venueName, EVENT_TIMEOUT.toMillis());
            }
        }
    }

    /**
     * Operator action: leave safe mode. The next connect starts with a fresh budget.
     *
     * @return false when not in safe mode
     */
    public synchronized boolean clearSafeMode(String clearedBy) {
        if (!state.isSafeMode()) {
            log.info("[{}] clearSafeMode ignored: phase is {}", venueName, state.phase());
            return false;
        }
        connectPolicy.reset();
        heartbeatPolicy.reset();
        setState(ConnectionPhase.DISCONNECTED, 0);
        log.warn("[{}] Safe mode cleared by {}", venueName, clearedBy);

        if (alertService != null) {
            alertService.sendInfoAlert("SAFE_MODE_CLEARED", venueName + " safe mode cleared by " + clearedBy);
        }
        if (eventBus != null) {
            eventBus.publish(new SafeModeClearedEvent(venueName, clearedBy, Instant.now()));
        }
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // HEARTBEAT
    // ═══════════════════════════════════════════════════════════════

    private void startHeartbeat() {
        stopHeartbeat();
        HeartbeatManager hb = new HeartbeatManager(venueName, pingInterval, heartbeatTimeout,
            venue::ping, this::onHealthChange);
        heartbeat = hb;
        hb.start();
    }

    private void stopHeartbeat() {
        HeartbeatManager hb = heartbeat;
        heartbeat = null;
        if (hb != null) {
            hb.stop();
        }
    }

    private void onHealthChange(boolean healthy) {
        if (healthy) {
            log.info("[{}] Heartbeat healthy", venueName);
            return;
        }
        try {
            recoveryExecutor.execute(this::recoverFromHeartbeatLoss);
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Heartbeat lost during shutdown, not reconnecting", venueName);
        }
    }

    /**
     * Heartbeat loss: announce, reconnect with the smaller budget, resubscribe on success.
     */
    synchronized void recoverFromHeartbeatLoss() {
        if (stopped || !state.isConnected()) {
            return;
        }
        heartbeatLosses.incrementAndGet();
        stopHeartbeat();
        log.warn("[{}] Heartbeat lost, reconnecting", venueName);

        if (eventBus != null) {
            eventBus.publish(new ConnectionLostEvent(venueName, "Heartbeat timeout", Instant.now()));
        }
        try {
            venue.disconnect();
        } catch (RuntimeException e) {
            log.warn("[{}] Disconnect after heartbeat loss failed: {}", venueName, e.getMessage());
        }
        setState(ConnectionPhase.DISCONNECTED, 0);

        if (!runConnectLoop(heartbeatPolicy, "heartbeat recovery")) {
            return;
        }

        int resubscribed = resubscribeAll();
        reconnects.incrementAndGet();
        log.info("[{}] Connection restored after {} attempt(s), {} symbol(s) resubscribed",
            venueName, lastAttempts, resubscribed);
        if (eventBus != null) {
            eventBus.publish(new ConnectionRestoredEvent(venueName, lastAttempts, resubscribed, Instant.now()));
        }
    }

    private int resubscribeAll() {
        int count = 0;
        for (String symbol : getSubscriptions()) {
            try {
                venue.subscribe(symbol);
                count++;
            } catch (RuntimeException e) {
                log.error("[{}] Resubscribe failed for {}", venueName, symbol, e);
            }
        }
        return count;
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBSCRIPTIONS
    // ═══════════════════════════════════════════════════════════════

    public void subscribe(String symbol) {
        synchronized (symbols) {
            symbols.add(symbol);
        }
        if (state.isConnected()) {
            try {
                venue.subscribe(symbol);
                log.info("[{}] Subscribed {}", venueName, symbol);
            } catch (RuntimeException e) {
                log.warn("[{}] Subscribe {} failed, will retry on reconnect: {}", venueName, symbol, e.getMessage());
            }
        }
    }

    public void unsubscribe(String symbol) {
        synchronized (symbols) {
            symbols.remove(symbol);
        }
        if (state.isConnected()) {
            try {
                venue.unsubscribe(symbol);
            } catch (RuntimeException e) {
                log.warn("[{}] Unsubscribe {} failed: {}", venueName, symbol, e.getMessage());
            }
        }
    }

    public List<String> getSubscriptions() {
        synchronized (symbols) {
            return new ArrayList<>(symbols);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Stop the heartbeat and close the link. Safe mode is kept.
     */
    public synchronized void disconnect() {
        stopHeartbeat();
        try {
            venue.disconnect();
        } catch (RuntimeException e) {
            log.warn("[{}] Disconnect failed: {}", venueName, e.getMessage());
        }
        if (!state.isSafeMode()) {
            setState(ConnectionPhase.DISCONNECTED, state.consecutiveFailures());
        }
        log.info("[{}] Disconnected", venueName);
    }

    /**
     * Final stop: no further reconnects, bounded wait for the recovery thread.
     */
    public void shutdown(Duration timeout) {
        stopped = true;
        recoveryExecutor.shutdownNow();
        disconnect();
        try {
            if (!recoveryExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[{}] Recovery thread did not stop within {}ms", venueName, timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void setState(ConnectionPhase phase, int failures) {
        ConnectionPhase previous = state.phase();
        state = new ConnectionState(phase, failures, Instant.now());
        if (previous != phase) {
            log.debug("[{}] {} -> {}", venueName, previous, phase);
        }
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isSafeMode() {
        return state.isSafeMode();
    }

    public boolean isConnected() {
        return state.isConnected() && venue.isConnected();
    }

    public String getVenueName() {
        return venueName;
    }

    public Map<String, Long> getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("connectAttempts", connectAttempts.get());
        stats.put("connectFailures", connectFailures.get());
        stats.put("heartbeatLosses", heartbeatLosses.get());
        stats.put("reconnects", reconnects.get());
        stats.put("safeModeEntries", safeModeEntries.get());
        return stats;
    }
}
