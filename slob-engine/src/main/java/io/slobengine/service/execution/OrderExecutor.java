package io.slobengine.service.execution;

import io.slobengine.application.port.output.StateStore;
import io.slobengine.application.port.output.StateStoreException;
import io.slobengine.domain.event.EngineEvent;
import io.slobengine.domain.event.OrderFilledEvent;
import io.slobengine.domain.event.OrderPlacedEvent;
import io.slobengine.domain.event.OrderRejectedEvent;
import io.slobengine.domain.order.BracketLeg;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.order.LegRole;
import io.slobengine.domain.order.OrderResult;
import io.slobengine.domain.order.OrderStatus;
import io.slobengine.domain.order.VenueFill;
import io.slobengine.domain.order.VenueOrder;
import io.slobengine.domain.setup.SetupCandidate;
import io.slobengine.domain.setup.SetupState;
import io.slobengine.domain.trade.ExitReason;
import io.slobengine.domain.trade.Trade;
import io.slobengine.infrastructure.venue.VenueClient;
import io.slobengine.infrastructure.venue.VenueConnectionException;
import io.slobengine.infrastructure.venue.common.ConnectionSupervisor;
import io.slobengine.service.core.EventBus;
import io.slobengine.service.risk.RiskManager;
import io.slobengine.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Order Executor - exactly-once bracket submission for completed setups.
 *
 * IDEMPOTENCY:
 * 1. Local registry: a setup id is reserved before anything is sent; a second call for the same
 *    setup is a DUPLICATE_ORDER no-op.
 * 2. Venue check: open and recent venue orders are scanned for the setup's idempotency key
 *    before the first attempt and again before every retry.
 * 3. References are built once; retries resend the identical bracket.
 *
 * A retry that finds its own earlier attempt at the venue (lost acknowledgement) adopts that
 * order instead of sending again.
 *
 * FILLS:
 * Entry fill opens a Trade. Stop or target fill closes it and feeds the realized pnl to the
 * RiskManager.
 */
public final class OrderExecutor {
    private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

    private final VenueClient venue;
    private final ConnectionSupervisor supervisor;
    private final RiskManager riskManager;
    private final StateStore stateStore;
    private final EventBus eventBus;
    private final OrderExecutorConfig config;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Map<String, BracketOrder> brackets = new ConcurrentHashMap<>();
    private final Map<String, Trade> openTrades = new ConcurrentHashMap<>();

    // Statistics
    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong filled = new AtomicLong();

    public OrderExecutor(VenueClient venue, ConnectionSupervisor supervisor, RiskManager riskManager,
                         StateStore stateStore, EventBus eventBus, OrderExecutorConfig config) {
        this(venue, supervisor, riskManager, stateStore, eventBus, config, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public OrderExecutor(VenueClient venue, ConnectionSupervisor supervisor, RiskManager riskManager,
                         StateStore stateStore, EventBus eventBus, OrderExecutorConfig config,
                         Sleeper sleeper, Clock clock) {
        this.venue = venue;
        this.supervisor = supervisor;
        this.riskManager = riskManager;
        this.stateStore = stateStore;
        this.eventBus = eventBus;
        this.config = config;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBMISSION
    // ═══════════════════════════════════════════════════════════════

    public OrderResult submitBracket(SetupCandidate setup, int contracts) {
        String setupId = setup.getId();

        String refusal = refusalReason(setup, contracts);
        if (refusal != null) {
            rejected.incrementAndGet();
            log.warn("[ORDER] Refused {}: {}", setup.shortId(), refusal);
            publish(new OrderRejectedEvent(setupId, OrderResult.Outcome.REJECTED, refusal, clock.instant()));
            return OrderResult.rejected(setupId, refusal);
        }

        BracketOrder bracket = BracketFactory.build(setup, contracts, clock.instant());
        if (brackets.putIfAbsent(setupId, bracket) != null) {
            return duplicate(setupId, "Setup already submitted by this engine");
        }

        if (!supervisor.isConnected()) {
            try {
                supervisor.ensureConnected();
            } catch (VenueConnectionException e) {
                brackets.remove(setupId, bracket);
                return fail(setupId, null, "Venue unavailable: " + e.getMessage());
            }
        }

        try {
            if (!findAtVenue(bracket.idempotencyKey()).isEmpty()) {
                brackets.remove(setupId, bracket);
                return duplicate(setupId, "Venue already holds orders for " + bracket.idempotencyKey());
            }
        } catch (VenueConnectionException e) {
            brackets.remove(setupId, bracket);
            return fail(setupId, null, "Duplicate check failed: " + e.getMessage());
        }

        persist(bracket);

        BracketOrder placed;
        try {
            placed = submitWithRetries(bracket);
        } catch (OrderPlacementException e) {
            BracketOrder dead = bracket.withStatus(OrderStatus.REJECTED);
            brackets.put(setupId, dead);
            persist(dead);
            return fail(setupId, dead, e.getMessage());
        }

        brackets.put(setupId, placed);
        persist(placed);
        submitted.incrementAndGet();
        log.info("[ORDER] PLACED {} {} x{} entry={} stop={} target={} ids=[{}, {}, {}]",
            placed.idempotencyKey(), placed.direction(), placed.quantity(),
            placed.entry().price(), placed.stopLoss().price(), placed.takeProfit().price(),
            placed.entry().venueOrderId(), placed.stopLoss().venueOrderId(), placed.takeProfit().venueOrderId());
        publish(new OrderPlacedEvent(placed, clock.instant()));
        return OrderResult.placed(placed);
    }

    private String refusalReason(SetupCandidate setup, int contracts) {
        if (setup.getState() != SetupState.SETUP_COMPLETE) {
            return "Setup not complete (state " + setup.getState() + ")";
        }
        if (setup.getEntryPrice() == null || setup.getStopPrice() == null || setup.getTargetPrice() == null) {
            return "Setup lacks entry, stop or target price";
        }
        if (contracts <= 0) {
            return "Quantity must be positive";
        }
        if (supervisor.isSafeMode()) {
            return "Safe mode active";
        }
        if (riskManager.isTradingHalted()) {
            return "Trading halted by drawdown policy";
        }
        return null;
    }

    private BracketOrder submitWithRetries(BracketOrder bracket) {
        String lastError = "no attempt made";
        for (int attempt = 1; attempt <= config.maxRetryAttempts(); attempt++) {
            if (attempt > 1) {
                Duration delay = config.retryDelay().multipliedBy(1L << (attempt - 2));
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new OrderPlacementException(bracket.setupId(), "Interrupted before retry", e);
                }

                // An earlier attempt may have landed even though we saw an error
                try {
                    List<VenueOrder> existing = findAtVenue(bracket.idempotencyKey());
                    if (!existing.isEmpty()) {
                        log.warn("[ORDER] {} found at venue before retry {}, adopting it",
                            bracket.idempotencyKey(), attempt);
                        return adopt(bracket, existing);
                    }
                } catch (VenueConnectionException e) {
                    lastError = e.getMessage();
                    log.warn("[ORDER] Duplicate check before retry {} failed: {}", attempt, e.getMessage());
                    continue;
                }
            }

            try {
                return venue.submitBracket(bracket).withStatus(OrderStatus.PLACED);
            } catch (VenueConnectionException e) {
                lastError = e.getMessage();
                log.warn("[ORDER] Attempt {}/{} for {} failed: {}",
                    attempt, config.maxRetryAttempts(), bracket.idempotencyKey(), e.getMessage());
            } catch (RuntimeException e) {
                throw new OrderPlacementException(bracket.setupId(), "Venue rejected bracket: " + e.getMessage(), e);
            }
        }
        throw new OrderPlacementException(bracket.setupId(),
            "Gave up after " + config.maxRetryAttempts() + " attempts: " + lastError);
    }

    private BracketOrder adopt(BracketOrder bracket, List<VenueOrder> existing) {
        String entryId = null;
        String stopId = null;
        String targetId = null;
        for (VenueOrder order : existing) {
            BracketLeg leg = bracket.findLeg(order.reference(), null);
            if (leg == null) {
                continue;
            }
            switch (leg.role()) {
                case ENTRY:
                    entryId = order.venueOrderId();
                    break;
                case STOP_LOSS:
                    stopId = order.venueOrderId();
                    break;
                default:
                    targetId = order.venueOrderId();
            }
        }
        return bracket.withVenueOrderIds(entryId, stopId, targetId).withStatus(OrderStatus.PLACED);
    }

    /**
     * Venue orders (open or recent) whose reference belongs to the idempotency key.
     */
    private List<VenueOrder> findAtVenue(String idempotencyKey) {
        String prefix = idempotencyKey + "-";
        Map<String, VenueOrder> matches = new LinkedHashMap<>();
        List<VenueOrder> candidates = new ArrayList<>(venue.queryOpenOrders());
        candidates.addAll(venue.queryRecentOrders());
        for (VenueOrder order : candidates) {
            if (order.reference() != null && order.reference().startsWith(prefix)) {
                matches.putIfAbsent(order.venueOrderId(), order);
            }
        }
        return new ArrayList<>(matches.values());
    }

    private OrderResult duplicate(String setupId, String message) {
        duplicates.incrementAndGet();
        log.warn("[ORDER] DUPLICATE_ORDER for setup {}: {}", setupId, message);
        publish(new OrderRejectedEvent(setupId, OrderResult.Outcome.DUPLICATE_ORDER, message, clock.instant()));
        return OrderResult.duplicate(setupId, message);
    }

    private OrderResult fail(String setupId, BracketOrder bracket, String message) {
        failed.incrementAndGet();
        log.error("[ORDER] FAILED for setup {}: {}", setupId, message);
        publish(new OrderRejectedEvent(setupId, OrderResult.Outcome.FAILED, message, clock.instant()));
        return OrderResult.failed(setupId, bracket, message);
    }

    // ═══════════════════════════════════════════════════════════════
    // FILLS
    // ═══════════════════════════════════════════════════════════════

    public synchronized void onFill(VenueFill fill) {
        BracketOrder bracket = null;
        BracketLeg leg = null;
        for (BracketOrder b : brackets.values()) {
            leg = b.findLeg(fill.reference(), fill.venueOrderId());
            if (leg != null) {
                bracket = b;
                break;
            }
        }
        if (bracket == null) {
            log.warn("[ORDER] Fill for unknown order {} ({}), ignoring", fill.venueOrderId(), fill.reference());
            return;
        }

        String setupId = bracket.setupId();
        filled.incrementAndGet();

        if (leg.role() == LegRole.ENTRY) {
            if (openTrades.containsKey(setupId)) {
                log.warn("[ORDER] Repeated entry fill for {}, ignoring", bracket.idempotencyKey());
                return;
            }
            Trade trade = Trade.open(setupId, bracket.symbol(), bracket.direction(), fill.price(),
                fill.quantity(), fill.timestamp());
            openTrades.put(setupId, trade);
            save(trade);
            updateBracket(bracket.withStatus(OrderStatus.PARTIAL));
            log.info("[ORDER] Entry filled {} {} x{} @ {}", bracket.idempotencyKey(),
                bracket.direction(), fill.quantity(), fill.price());
        } else {
            Trade open = openTrades.remove(setupId);
            if (open == null) {
                log.warn("[ORDER] Exit fill for {} without an open trade", bracket.idempotencyKey());
                updateBracket(bracket.withStatus(OrderStatus.FILLED));
                return;
            }
            ExitReason reason = leg.role() == LegRole.STOP_LOSS ? ExitReason.SL : ExitReason.TP;
            Trade closed = open.close(fill.price(), reason, fill.timestamp(), config.pointValue());
            save(closed);
            updateBracket(bracket.withStatus(OrderStatus.FILLED));
            log.info("[ORDER] Exit {} {} @ {} pnl={}", reason, bracket.idempotencyKey(), fill.price(), closed.pnl());
            riskManager.updateAfterTrade(closed.pnl());
        }

        publish(new OrderFilledEvent(setupId, leg.role(), fill, clock.instant()));
    }

    /**
     * Close a local trade whose venue position no longer exists.
     */
    public synchronized Trade finalizeExternally(Trade trade) {
        openTrades.remove(trade.setupId());
        Trade closed = trade.finalizeExternally(clock.instant());
        save(closed);
        BracketOrder bracket = brackets.get(trade.setupId());
        if (bracket != null) {
            updateBracket(bracket.withStatus(OrderStatus.CANCELLED));
        }
        log.warn("[ORDER] Trade {} finalized locally: no venue position", trade.tradeId());
        return closed;
    }

    // ═══════════════════════════════════════════════════════════════
    // RECOVERY / QUERIES
    // ═══════════════════════════════════════════════════════════════

    public synchronized void restore(Collection<BracketOrder> savedBrackets, Collection<Trade> savedTrades) {
        for (BracketOrder b : savedBrackets) {
            brackets.put(b.setupId(), b);
        }
        for (Trade t : savedTrades) {
            if (t.isOpen()) {
                openTrades.put(t.setupId(), t);
            }
        }
        log.info("[ORDER] Restored {} bracket(s), {} open trade(s)", brackets.size(), openTrades.size());
    }

    public BracketOrder getBracket(String setupId) {
        return brackets.get(setupId);
    }

    public List<Trade> getOpenTrades() {
        return new ArrayList<>(openTrades.values());
    }

    public Map<String, Long> getStats() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("submitted", submitted.get());
        stats.put("duplicates", duplicates.get());
        stats.put("rejected", rejected.get());
        stats.put("failed", failed.get());
        stats.put("filled", filled.get());
        stats.put("openTrades", (long) openTrades.size());
        return stats;
    }

    private void updateBracket(BracketOrder bracket) {
        brackets.put(bracket.setupId(), bracket);
        persist(bracket);
    }

    private void persist(BracketOrder bracket) {
        try {
            stateStore.saveBracket(bracket);
        } catch (StateStoreException e) {
            log.error("[ORDER] Could not persist bracket {}: {}", bracket.idempotencyKey(), e.getMessage());
        }
    }

    private void save(Trade trade) {
        try {
            stateStore.saveTrade(trade);
        } catch (StateStoreException e) {
            log.error("[ORDER] Could not persist trade {}: {}", trade.tradeId(), e.getMessage());
        }
    }

    private void publish(EngineEvent event) {
        if (eventBus != null) {
            eventBus.publish(event);
        }
    }
}
