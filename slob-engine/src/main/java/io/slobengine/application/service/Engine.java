package io.slobengine.application.service;

import io.slobengine.application.monitoring.AlertService;
import io.slobengine.application.port.output.StateStore;
import io.slobengine.application.port.output.StateStoreException;
import io.slobengine.domain.connection.ConnectionState;
import io.slobengine.domain.data.Candle;
import io.slobengine.domain.data.Tick;
import io.slobengine.domain.event.CandleCompletedEvent;
import io.slobengine.domain.event.ConnectionLostEvent;
import io.slobengine.domain.event.ConnectionRestoredEvent;
import io.slobengine.domain.event.OrderFilledEvent;
import io.slobengine.domain.event.OrderPlacedEvent;
import io.slobengine.domain.event.OrderRejectedEvent;
import io.slobengine.domain.event.ReconciliationAlertEvent;
import io.slobengine.domain.event.SafeModeClearedEvent;
import io.slobengine.domain.event.SafeModeEnteredEvent;
import io.slobengine.domain.monitoring.Alert;
import io.slobengine.domain.monitoring.AlertLevel;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.order.OrderResult;
import io.slobengine.domain.order.VenuePosition;
import io.slobengine.domain.setup.SetupCandidate;
import io.slobengine.domain.setup.SetupSnapshot;
import io.slobengine.domain.trade.SessionState;
import io.slobengine.domain.trade.Trade;
import io.slobengine.infrastructure.metrics.EngineMetrics;
import io.slobengine.infrastructure.metrics.EngineMetrics.ConnectionEvent;
import io.slobengine.infrastructure.metrics.EngineMetrics.SetupOutcome;
import io.slobengine.infrastructure.venue.VenueClient;
import io.slobengine.infrastructure.venue.common.ConnectionSupervisor;
import io.slobengine.service.candle.CandleAggregator;
import io.slobengine.service.candle.TickBuffer;
import io.slobengine.service.core.EventBus;
import io.slobengine.service.execution.OrderExecutor;
import io.slobengine.service.risk.PositionSize;
import io.slobengine.service.risk.RiskManager;
import io.slobengine.service.risk.RiskState;
import io.slobengine.service.setup.CandleUpdate;
import io.slobengine.service.setup.SetupTracker;
import io.slobengine.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Owns the trading pipeline for one instrument.
 *
 * PIPELINE:
 * venue tick callback → TickBuffer → engine thread → CandleAggregator → EventBus
 *   → SetupTracker → RiskManager → OrderExecutor
 *
 * THREADING:
 * - One engine thread drains ticks, so ticks reach the aggregator in arrival order.
 * - Candle events are handled on the bus dispatch thread, one at a time, so every candidate
 *   sees candles in strict order.
 * - Snapshots run on their own scheduled thread.
 *
 * LIFECYCLE:
 * start(): recover → connect → reconcile → subscribe → run.
 * shutdown(): every step has a time budget; a step that overruns is logged and skipped.
 */
public final class Engine {
    private static final Logger log = LoggerFactory.getLogger(Engine.class);

    private static final Duration POLL_INTERVAL = Duration.ofMillis(200);

    private final EngineConfig config;
    private final VenueClient venue;
    private final StateStore stateStore;
    private final EventBus eventBus;
    private final AlertService alertService;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final ConnectionSupervisor supervisor;
    private final TickBuffer tickBuffer;
    private final CandleAggregator aggregator;
    private final SetupTracker tracker;
    private final RiskManager riskManager;
    private final OrderExecutor executor;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private volatile boolean running;
    private volatile Instant startedAt;

    private ExecutorService engineThread;
    private ScheduledExecutorService snapshotScheduler;

    public Engine(EngineConfig config, VenueClient venue, StateStore stateStore, EventBus eventBus,
                  AlertService alertService, EngineMetrics metrics) {
        this(config, venue, stateStore, eventBus, alertService, metrics, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public Engine(EngineConfig config, VenueClient venue, StateStore stateStore, EventBus eventBus,
                  AlertService alertService, EngineMetrics metrics, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.venue = venue;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.alertService = alertService;
        this.metrics = metrics != null ? metrics : EngineMetrics.NOOP;
        this.clock = clock;

        this.supervisor = new ConnectionSupervisor(venue, eventBus, alertService,
            config.connectPolicy(), config.heartbeatPolicy(),
            config.pingInterval(), config.heartbeatTimeout(), sleeper);
        this.tickBuffer = new TickBuffer(config.tickBufferCapacity());
        this.aggregator = new CandleAggregator(eventBus, config.candleInterval(), config.maxGapFill());
        this.tracker = new SetupTracker(config.trackerConfig(), eventBus);
        this.riskManager = new RiskManager(config.riskConfig(), eventBus, alertService);
        this.executor = new OrderExecutor(venue, supervisor, riskManager, stateStore, eventBus,
            config.executorConfig(), sleeper, clock);
    }

    // ═══════════════════════════════════════════════════════════════
    // STARTUP
    // ═══════════════════════════════════════════════════════════════

    /**
     * Recover, connect, reconcile and start processing.
     * A venue that cannot be reached leaves the engine running in safe mode.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine already started");
        }
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("[ENGINE] Starting {} on {}", config.symbol(), venue.getVenueName());
        log.info("═══════════════════════════════════════════════════════════════");

        subscribeHandlers();
        recover();

        venue.setTickListener(this::onTick);
        venue.setFillListener(executor::onFill);

        boolean connected = supervisor.connect();
        metrics.updateConnectionPhase(supervisor.getState().phase());
        if (connected) {
            reconcile();
        } else {
            log.error("[ENGINE] Venue unavailable at startup, running in safe mode until cleared");
        }

        // Tracked even in safe mode so a later reconnect resubscribes it.
        supervisor.subscribe(config.symbol());

        running = true;
        startedAt = clock.instant();

        engineThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "engine-" + config.symbol());
            t.setDaemon(true);
            return t;
        });
        engineThread.submit(this::runLoop);

        snapshotScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "engine-snapshot");
            t.setDaemon(true);
            return t;
        });
        long period = config.snapshotInterval().toMillis();
        snapshotScheduler.scheduleAtFixedRate(this::snapshotSafely, period, period, TimeUnit.MILLISECONDS);

        log.info("[ENGINE] ✓ Running (connected={}, activeSetups={}, openTrades={})",
            connected, tracker.getActiveCandidates().size(), executor.getOpenTrades().size());
    }

    /**
     * Rehydrate tracker, executor and risk from the store. Unreadable rows were already skipped
     * by the store; a store that cannot be read at all aborts startup.
     */
    void recover() {
        try {
            List<SetupSnapshot> setups = stateStore.loadActiveSetups();
            List<SetupCandidate> candidates = new ArrayList<>();
            for (SetupSnapshot snapshot : setups) {
                candidates.add(SetupCandidate.fromSnapshot(snapshot));
            }
            int restored = tracker.restore(candidates);

            List<BracketOrder> brackets = stateStore.loadBrackets();
            List<Trade> trades = stateStore.loadOpenTrades();
            executor.restore(brackets, trades);

            LocalDate today = LocalDate.ofInstant(clock.instant(), config.trackerConfig().zone());
            stateStore.loadSessionState(today).ifPresent(session -> {
                riskManager.restore(session);
                tracker.restoreSession(session.tradingDate(), session.sessionHigh(), session.sessionLow());
            });

            log.info("[ENGINE] Recovery: setups={} brackets={} openTrades={}",
                restored, brackets.size(), trades.size());
        } catch (StateStoreException e) {
            log.error("[ENGINE] Recovery failed: {}", e.getMessage(), e);
            alertService.sendCriticalAlert("RECOVERY_FAILED", e.getMessage());
            throw e;
        }
    }

    /**
     * Compare venue positions with local open trades, by symbol.
     * A venue position with no local trade is reported and left alone.
     * A local trade with no venue position was closed out of band and is finalized locally.
     */
    public ReconciliationResult reconcile() {
        List<VenuePosition> positions;
        try {
            positions = venue.queryPositions();
        } catch (RuntimeException e) {
            log.error("[ENGINE] Reconciliation skipped, positions unavailable: {}", e.getMessage(), e);
            alertService.sendHighAlert("RECONCILIATION_SKIPPED", e.getMessage());
            return new ReconciliationResult(List.of(), List.of());
        }

        Map<String, VenuePosition> venueBySymbol = new HashMap<>();
        for (VenuePosition p : positions) {
            if (!p.isFlat()) {
                venueBySymbol.put(p.symbol(), p);
            }
        }
        Map<String, List<Trade>> localBySymbol = executor.getOpenTrades().stream()
            .collect(Collectors.groupingBy(Trade::symbol));

        List<String> unmatchedVenue = new ArrayList<>();
        for (VenuePosition p : venueBySymbol.values()) {
            if (!localBySymbol.containsKey(p.symbol())) {
                String message = String.format("Venue holds %d %s with no local trade", p.quantity(), p.symbol());
                log.error("[ENGINE] Reconciliation mismatch: {}", message);
                eventBus.publish(new ReconciliationAlertEvent(p.symbol(), p.quantity(), message, clock.instant()));
                alertService.sendAlert(Alert.of(AlertLevel.CRITICAL, "RECONCILIATION_MISMATCH", message)
                    .withDetail("symbol", p.symbol())
                    .withDetail("quantity", p.quantity())
                    .withDetail("averagePrice", p.averagePrice()));
                unmatchedVenue.add(p.symbol());
            }
        }

        List<String> finalized = new ArrayList<>();
        for (Map.Entry<String, List<Trade>> entry : localBySymbol.entrySet()) {
            if (venueBySymbol.containsKey(entry.getKey())) {
                continue;
            }
            for (Trade trade : entry.getValue()) {
                log.warn("[ENGINE] Trade {} has no venue position, finalizing as EXTERNAL", trade.tradeId());
                executor.finalizeExternally(trade);
                finalized.add(trade.tradeId());
            }
        }

        log.info("[ENGINE] Reconciliation: venuePositions={} localSymbols={} unmatchedVenue={} finalized={}",
            venueBySymbol.size(), localBySymbol.size(), unmatchedVenue.size(), finalized.size());
        return new ReconciliationResult(unmatchedVenue, finalized);
    }

    public record ReconciliationResult(List<String> unmatchedVenueSymbols, List<String> finalizedTradeIds) {
    }

    // ═══════════════════════════════════════════════════════════════
    // PIPELINE
    // ═══════════════════════════════════════════════════════════════

    private void onTick(Tick tick) {
        tickBuffer.offer(tick);
    }

    private void runLoop() {
        log.info("[ENGINE] Engine thread started");
        while (running && !Thread.currentThread().isInterrupted()) {
            Tick tick;
            try {
                tick = tickBuffer.poll(POLL_INTERVAL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (tick == null) {
                continue;
            }
            try {
                aggregator.onTick(tick);
                metrics.recordTick();
            } catch (RuntimeException e) {
                log.error("[ENGINE] Tick processing failed for {}: {}", tick.symbol(), e.getMessage(), e);
            }
        }
        log.info("[ENGINE] Engine thread stopped");
    }

    /**
     * Runs on the bus dispatch thread.
     */
    void onCandleCompleted(CandleCompletedEvent event) {
        Candle candle = event.candle();
        metrics.recordCandle(candle.isSynthetic());
        try {
            stateStore.saveCandle(candle);
        } catch (StateStoreException e) {
            log.error("[ENGINE] Candle {} {} not persisted: {}", candle.symbol(), candle.timestamp(), e.getMessage());
        }
        if (!config.symbol().equals(candle.symbol())) {
            return;
        }

        Set<String> before = new HashSet<>();
        for (SetupCandidate c : tracker.getActiveCandidates()) {
            before.add(c.getId());
        }
        LocalDate dateBefore = tracker.getCurrentDate();

        CandleUpdate update = tracker.onCandle(candle);
        if (update.rejected()) {
            return;
        }
        if (dateBefore != null && !dateBefore.equals(tracker.getCurrentDate())) {
            riskManager.startNewDay();
        }

        for (SetupCandidate c : update.updated()) {
            if (!before.contains(c.getId())) {
                metrics.recordSetup(SetupOutcome.DETECTED);
            }
            persistSetup(c);
        }
        for (int i = 0; i < update.invalidated().size(); i++) {
            metrics.recordSetup(SetupOutcome.INVALIDATED);
        }
        for (SetupCandidate c : update.completed()) {
            metrics.recordSetup(SetupOutcome.COMPLETED);
            placeOrder(c);
        }
    }

    private void placeOrder(SetupCandidate setup) {
        if (stopping.get()) {
            log.warn("[ENGINE] Setup {} completed during shutdown; stored, not traded", setup.shortId());
            metrics.recordOrder("skipped");
            return;
        }
        PositionSize size = riskManager.calculatePositionSize(
            setup.getEntryPrice(), setup.getStopPrice(), tracker.getAtr());
        if (!size.isTradable()) {
            log.warn("[ENGINE] Setup {} not traded: {}", setup.shortId(), size.getSummary());
            metrics.recordOrder("skipped");
            return;
        }
        OrderResult result = executor.submitBracket(setup, size.contracts());
        log.info("[ENGINE] Setup {} → {} ({})", setup.shortId(), result.outcome(), result.message());
    }

    private void persistSetup(SetupCandidate candidate) {
        persistSetup(candidate.toSnapshot());
    }

    private void persistSetup(SetupSnapshot snapshot) {
        try {
            stateStore.saveSetup(snapshot);
        } catch (StateStoreException e) {
            log.error("[ENGINE] Setup {} not persisted: {}", snapshot.id(), e.getMessage());
        }
    }

    private void subscribeHandlers() {
        eventBus.subscribe(CandleCompletedEvent.class, this::onCandleCompleted);

        eventBus.subscribe(OrderPlacedEvent.class, e -> metrics.recordOrder("placed"));
        eventBus.subscribe(OrderFilledEvent.class, e -> metrics.recordOrder("filled"));
        eventBus.subscribe(OrderRejectedEvent.class,
            e -> metrics.recordOrder(e.outcome().name().toLowerCase()));

        eventBus.subscribe(ConnectionLostEvent.class, e -> {
            metrics.recordConnectionEvent(ConnectionEvent.LOST);
            metrics.updateConnectionPhase(supervisor.getState().phase());
        });
        eventBus.subscribe(ConnectionRestoredEvent.class, e -> {
            metrics.recordConnectionEvent(ConnectionEvent.RESTORED);
            metrics.updateConnectionPhase(supervisor.getState().phase());
        });
        eventBus.subscribe(SafeModeEnteredEvent.class, e -> {
            metrics.recordConnectionEvent(ConnectionEvent.SAFE_MODE_ENTERED);
            metrics.updateConnectionPhase(supervisor.getState().phase());
        });
        eventBus.subscribe(SafeModeClearedEvent.class, e -> {
            metrics.recordConnectionEvent(ConnectionEvent.SAFE_MODE_CLEARED);
            metrics.updateConnectionPhase(supervisor.getState().phase());
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // SNAPSHOTS
    // ═══════════════════════════════════════════════════════════════

    private void snapshotSafely() {
        try {
            persistSnapshot();
            refreshMetrics();
        } catch (RuntimeException e) {
            log.error("[ENGINE] Snapshot failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Write every active setup and the session state.
     */
    void persistSnapshot() {
        for (SetupSnapshot snapshot : tracker.snapshotActive()) {
            persistSetup(snapshot);
        }
        try {
            stateStore.saveSessionState(currentSession());
        } catch (StateStoreException e) {
            log.error("[ENGINE] Session state not persisted: {}", e.getMessage());
        }
    }

    private SessionState currentSession() {
        RiskState risk = riskManager.getState();
        LocalDate date = tracker.getCurrentDate() != null
            ? tracker.getCurrentDate()
            : LocalDate.ofInstant(clock.instant(), config.trackerConfig().zone());
        return new SessionState(date, tracker.getSessionHigh(), tracker.getSessionLow(),
            risk.equity(), risk.peakEquity(), risk.tradesToday(), risk.pnlToday(),
            risk.tradingHalted(), clock.instant());
    }

    /**
     * Push gauges that are sampled rather than event driven.
     */
    public void refreshMetrics() {
        RiskState risk = riskManager.getState();
        metrics.updateRisk(risk.equity(), risk.drawdown());
        metrics.updateConnectionPhase(supervisor.getState().phase());
        metrics.updateHandlerErrors(eventBus.getHandlerErrors());
    }

    // ═══════════════════════════════════════════════════════════════
    // CONTROL
    // ═══════════════════════════════════════════════════════════════

    /**
     * Operator action. Reconnects immediately and reconciles when the venue is back.
     */
    public boolean clearSafeMode(String clearedBy) {
        if (!supervisor.clearSafeMode(clearedBy)) {
            return false;
        }
        if (stopping.get()) {
            return true;
        }
        if (supervisor.connect()) {
            reconcile();
        }
        metrics.updateConnectionPhase(supervisor.getState().phase());
        return true;
    }

    public boolean resumeTrading() {
        if (!riskManager.isTradingHalted()) {
            return false;
        }
        riskManager.resumeTrading();
        log.info("[ENGINE] Trading resumed by operator");
        return true;
    }

    public EngineStatus getStatus() {
        ConnectionState conn = supervisor.getState();
        RiskState risk = riskManager.getState();
        return new EngineStatus(
            config.symbol(),
            venue.getVenueName(),
            running,
            tracker.isAccepting(),
            conn.phase(),
            conn.isSafeMode(),
            risk.tradingHalted(),
            risk.equity(),
            risk.peakEquity(),
            risk.drawdown(),
            tracker.getActiveCandidates().size(),
            executor.getOpenTrades().size(),
            tickBuffer.size(),
            eventBus.getHandlerErrors(),
            startedAt,
            clock.instant());
    }

    // ═══════════════════════════════════════════════════════════════
    // SHUTDOWN
    // ═══════════════════════════════════════════════════════════════

    public ShutdownReport shutdown() {
        return shutdown(config.shutdownTimeout());
    }

    /**
     * Bounded graceful shutdown. Venue brackets are left working; their stops protect any
     * open position while the engine is down.
     */
    public ShutdownReport shutdown(Duration timeout) {
        if (!stopping.compareAndSet(false, true)) {
            log.warn("[ENGINE] Shutdown already in progress");
            return new ShutdownReport(List.of(), List.of(), List.of(), Duration.ZERO);
        }
        long startNanos = System.nanoTime();
        long deadline = startNanos + timeout.toNanos();
        log.info("[ENGINE] Shutting down (timeout {}s)", timeout.toSeconds());

        ShutdownSteps steps = new ShutdownSteps(deadline);
        try {
            steps.run("stop-accepting", () -> {
                tracker.stopAccepting();
                return true;
            });

            Duration taskBudget = timeout.dividedBy(4);
            steps.run("cancel-tasks", () -> stopBackgroundTasks(taskBudget));

            log.info("[ENGINE] Leaving {} open trade(s) protected by venue brackets",
                executor.getOpenTrades().size());

            steps.run("persist-final-state", () -> {
                List<Candle> forced = aggregator.forceCompleteAll();
                persistSnapshot();
                log.info("[ENGINE] Final state persisted ({} candle(s) force-completed)", forced.size());
                return true;
            });

            steps.run("disconnect", () -> {
                supervisor.shutdown(steps.remaining());
                return true;
            });

            steps.run("drain-event-bus", () -> eventBus.shutdown(steps.remaining()));

            steps.run("close-store", () -> {
                stateStore.shutdown();
                return true;
            });
        } finally {
            steps.close();
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        ShutdownReport report = new ShutdownReport(steps.completed, steps.overrun, steps.failed, elapsed);
        if (report.isClean()) {
            log.info("[ENGINE] ✓ Shutdown complete in {}ms", elapsed.toMillis());
        } else {
            log.warn("[ENGINE] Shutdown completed in {}ms with overrun={} failed={}",
                elapsed.toMillis(), report.overrunSteps(), report.failedSteps());
        }
        return report;
    }

    private boolean stopBackgroundTasks(Duration budget) throws InterruptedException {
        running = false;
        boolean stopped = true;
        if (snapshotScheduler != null) {
            snapshotScheduler.shutdownNow();
        }
        if (engineThread != null) {
            engineThread.shutdownNow();
            stopped = engineThread.awaitTermination(budget.toMillis(), TimeUnit.MILLISECONDS);
            if (!stopped) {
                log.warn("[ENGINE] Engine thread did not stop within {}ms", budget.toMillis());
            }
        }
        if (snapshotScheduler != null && !snapshotScheduler.awaitTermination(
                Math.max(1, budget.toMillis() / 2), TimeUnit.MILLISECONDS)) {
            log.warn("[ENGINE] Snapshot task did not stop in time");
            stopped = false;
        }
        return stopped;
    }

    /**
     * Runs each step on a helper thread so a step that ignores interrupts cannot hold
     * shutdown past its deadline.
     */
    private static final class ShutdownSteps {
        private final long deadline;
        private final AtomicInteger threadCount = new AtomicInteger();
        private final ExecutorService worker = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "engine-shutdown-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        private final List<String> completed = new ArrayList<>();
        private final List<String> overrun = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();
        private boolean interrupted;

        ShutdownSteps(long deadline) {
            this.deadline = deadline;
        }

        Duration remaining() {
            return Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
        }

        void run(String name, Callable<Boolean> step) {
            Duration budget = remaining();
            if (budget.isZero()) {
                log.warn("[ENGINE] Shutdown step '{}' skipped, no time left", name);
                overrun.add(name);
                return;
            }
            Future<Boolean> future = worker.submit(step);
            try {
                if (Boolean.TRUE.equals(future.get(budget.toNanos(), TimeUnit.NANOSECONDS))) {
                    completed.add(name);
                } else {
                    log.warn("[ENGINE] Shutdown step '{}' did not finish cleanly", name);
                    overrun.add(name);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("[ENGINE] Shutdown step '{}' overran {}ms, skipping", name, budget.toMillis());
                overrun.add(name);
            } catch (ExecutionException e) {
                log.error("[ENGINE] Shutdown step '{}' failed: {}", name, e.getCause().getMessage(), e.getCause());
                failed.add(name);
            } catch (InterruptedException e) {
                // Flag restored in close() so the remaining steps still get their budget.
                future.cancel(true);
                interrupted = true;
                log.warn("[ENGINE] Interrupted during shutdown step '{}'", name);
                overrun.add(name);
            }
        }

        void close() {
            worker.shutdownNow();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ACCESSORS
    // ═══════════════════════════════════════════════════════════════

    public boolean isRunning() {
        return running;
    }

    public SetupTracker getTracker() {
        return tracker;
    }

    public RiskManager getRiskManager() {
        return riskManager;
    }

    public OrderExecutor getExecutor() {
        return executor;
    }

    public ConnectionSupervisor getSupervisor() {
        return supervisor;
    }

    public CandleAggregator getAggregator() {
        return aggregator;
    }

    public TickBuffer getTickBuffer() {
        return tickBuffer;
    }

    public EngineConfig getConfig() {
        return config;
    }
}
