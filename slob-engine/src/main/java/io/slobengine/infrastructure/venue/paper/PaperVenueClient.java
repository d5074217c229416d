package io.slobengine.infrastructure.venue.paper;

import io.slobengine.domain.data.Tick;
import io.slobengine.domain.order.BracketLeg;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.order.OrderStatus;
import io.slobengine.domain.order.VenueFill;
import io.slobengine.domain.order.VenueOrder;
import io.slobengine.domain.order.VenuePosition;
import io.slobengine.domain.setup.Direction;
import io.slobengine.infrastructure.venue.VenueClient;
import io.slobengine.infrastructure.venue.VenueConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process venue simulation for paper trading and tests.
 *
 * MATCHING:
 * - Entry legs are marketable: they fill on the next tick for the symbol at that tick's price.
 * - Once the entry is filled, the stop and target legs work as one-cancels-other and fill at
 *   their own price when a later tick reaches them.
 *
 * Failure injection (connect failures, dead pings, lost submit acks, dropped link) lets tests
 * drive the resilience paths without a network.
 */
public final class PaperVenueClient implements VenueClient {
    private static final Logger log = LoggerFactory.getLogger(PaperVenueClient.class);

    private final String venueName;
    private final AtomicLong orderSeq = new AtomicLong();
    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();

    // Guarded by this
    private final Map<String, VenueOrder> orders = new LinkedHashMap<>();
    private final List<SimBracket> brackets = new ArrayList<>();
    private final Map<String, VenuePosition> positions = new LinkedHashMap<>();
    private int failConnects;
    private int lostAcks;

    private volatile boolean connected;
    private volatile boolean pingFailing;
    private volatile Consumer<Tick> tickListener;
    private volatile Consumer<VenueFill> fillListener;

    public PaperVenueClient() {
        this("PAPER");
    }

    public PaperVenueClient(String venueName) {
        this.venueName = venueName;
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTION
    // ═══════════════════════════════════════════════════════════════

    @Override
    public String getVenueName() {
        return venueName;
    }

    @Override
    public synchronized void connect() {
        if (failConnects > 0) {
            failConnects--;
            throw new VenueConnectionException(venueName, "Simulated connect failure");
        }
        connected = true;
        pingFailing = false;
        log.info("[{}] Paper venue connected", venueName);
    }

    @Override
    public void disconnect() {
        connected = false;
        log.info("[{}] Paper venue disconnected", venueName);
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void ping() {
        if (!connected || pingFailing) {
            throw new VenueConnectionException(venueName, "No pong");
        }
    }

    @Override
    public void subscribe(String symbol) {
        requireConnected();
        subscriptions.add(symbol);
    }

    @Override
    public void unsubscribe(String symbol) {
        subscriptions.remove(symbol);
    }

    @Override
    public void setTickListener(Consumer<Tick> listener) {
        this.tickListener = listener;
    }

    @Override
    public void setFillListener(Consumer<VenueFill> listener) {
        this.fillListener = listener;
    }

    // ═══════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public synchronized BracketOrder submitBracket(BracketOrder bracket) {
        requireConnected();

        BracketOrder accepted = bracket
            .withVenueOrderIds(nextOrderId(), nextOrderId(), nextOrderId())
            .withStatus(OrderStatus.PLACED);
        for (BracketLeg leg : accepted.legs()) {
            orders.put(leg.venueOrderId(), new VenueOrder(leg.venueOrderId(), accepted.symbol(),
                leg.reference(), leg.action(), accepted.quantity(), leg.price(), OrderStatus.PLACED));
        }
        brackets.add(new SimBracket(accepted));
        log.info("[{}] Bracket accepted for {}: {} x{} entry={} stop={} target={}",
            venueName, accepted.idempotencyKey(), accepted.direction(), accepted.quantity(),
            accepted.entry().price(), accepted.stopLoss().price(), accepted.takeProfit().price());

        if (lostAcks > 0) {
            lostAcks--;
            throw new VenueConnectionException(venueName, "Simulated lost acknowledgement");
        }
        return accepted;
    }

    @Override
    public synchronized List<VenueOrder> queryOpenOrders() {
        requireConnected();
        List<VenueOrder> open = new ArrayList<>();
        for (VenueOrder order : orders.values()) {
            if (order.status().isLive()) {
                open.add(order);
            }
        }
        return open;
    }

    @Override
    public synchronized List<VenueOrder> queryRecentOrders() {
        requireConnected();
        return new ArrayList<>(orders.values());
    }

    @Override
    public synchronized List<VenuePosition> queryPositions() {
        requireConnected();
        List<VenuePosition> open = new ArrayList<>();
        for (VenuePosition position : positions.values()) {
            if (!position.isFlat()) {
                open.add(position);
            }
        }
        return open;
    }

    // ═══════════════════════════════════════════════════════════════
    // MARKET SIMULATION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Push a market tick: delivered to the tick listener when subscribed, then matched.
     *
     * @return false when dropped because the link is down or the symbol is not subscribed
     */
    public boolean publishTick(Tick tick) {
        if (!connected || !subscriptions.contains(tick.symbol())) {
            return false;
        }
        Consumer<Tick> listener = tickListener;
        if (listener != null) {
            listener.accept(tick);
        }

        List<VenueFill> fills;
        synchronized (this) {
            fills = match(tick);
        }
        Consumer<VenueFill> onFill = fillListener;
        if (onFill != null) {
            fills.forEach(onFill);
        }
        return true;
    }

    private List<VenueFill> match(Tick tick) {
        List<VenueFill> fills = new ArrayList<>();
        BigDecimal price = tick.price();
        for (SimBracket sim : brackets) {
            BracketOrder b = sim.bracket;
            if (sim.closed || !b.symbol().equals(tick.symbol())) {
                continue;
            }
            if (!sim.entryFilled) {
                sim.entryFilled = true;
                fills.add(fill(b, b.entry(), price, tick));
                continue;
            }

            boolean shortSide = b.direction() == Direction.SHORT;
            boolean stopHit = shortSide
                ? price.compareTo(b.stopLoss().price()) >= 0
                : price.compareTo(b.stopLoss().price()) <= 0;
            boolean targetHit = shortSide
                ? price.compareTo(b.takeProfit().price()) <= 0
                : price.compareTo(b.takeProfit().price()) >= 0;

            if (stopHit || targetHit) {
                BracketLeg exit = stopHit ? b.stopLoss() : b.takeProfit();
                BracketLeg other = stopHit ? b.takeProfit() : b.stopLoss();
                sim.closed = true;
                fills.add(fill(b, exit, exit.price(), tick));
                setStatus(other.venueOrderId(), OrderStatus.CANCELLED);
            }
        }
        return fills;
    }

    private VenueFill fill(BracketOrder b, BracketLeg leg, BigDecimal price, Tick tick) {
        setStatus(leg.venueOrderId(), OrderStatus.FILLED);
        int signed = "SELL".equals(leg.action()) ? -b.quantity() : b.quantity();
        adjustPosition(b.symbol(), signed, price);
        log.info("[{}] Fill {} {} x{} @ {}", venueName, leg.reference(), leg.action(), b.quantity(), price);
        return new VenueFill(leg.venueOrderId(), leg.reference(), b.symbol(), price, b.quantity(), tick.timestamp());
    }

    private void setStatus(String venueOrderId, OrderStatus status) {
        VenueOrder o = orders.get(venueOrderId);
        if (o != null) {
            orders.put(venueOrderId, new VenueOrder(o.venueOrderId(), o.symbol(), o.reference(),
                o.action(), o.quantity(), o.price(), status));
        }
    }

    private void adjustPosition(String symbol, int delta, BigDecimal price) {
        VenuePosition current = positions.get(symbol);
        int qty = current == null ? 0 : current.quantity();
        int newQty = qty + delta;
        BigDecimal avg;
        if (newQty == 0) {
            avg = BigDecimal.ZERO;
        } else if (qty == 0 || Integer.signum(qty) != Integer.signum(newQty)) {
            avg = price;
        } else if (Math.abs(newQty) > Math.abs(qty)) {
            avg = current.averagePrice().multiply(BigDecimal.valueOf(Math.abs(qty)))
                .add(price.multiply(BigDecimal.valueOf(Math.abs(delta))))
                .divide(BigDecimal.valueOf(Math.abs(newQty)), MathContext.DECIMAL64);
        } else {
            avg = current.averagePrice();
        }
        positions.put(symbol, new VenuePosition(symbol, newQty, avg));
    }

    // ═══════════════════════════════════════════════════════════════
    // TEST / OPERATOR HOOKS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Seed a position opened outside this engine.
     */
    public synchronized void setPosition(String symbol, int quantity, BigDecimal averagePrice) {
        positions.put(symbol, new VenuePosition(symbol, quantity, averagePrice));
    }

    public synchronized void failNextConnects(int count) {
        this.failConnects = count;
    }

    /**
     * The next submissions are accepted by the venue but the caller sees a connection error.
     */
    public synchronized void loseNextAcks(int count) {
        this.lostAcks = count;
    }

    public void setPingFailing(boolean failing) {
        this.pingFailing = failing;
    }

    /**
     * Simulate the link dropping without a disconnect call.
     */
    public void dropConnection() {
        connected = false;
        log.warn("[{}] Paper venue link dropped", venueName);
    }

    public synchronized int getBracketCount() {
        return brackets.size();
    }

    public synchronized List<BracketOrder> getBrackets() {
        List<BracketOrder> result = new ArrayList<>();
        for (SimBracket sim : brackets) {
            result.add(sim.bracket);
        }
        return result;
    }

    public boolean isSubscribed(String symbol) {
        return subscriptions.contains(symbol);
    }

    private void requireConnected() {
        if (!connected) {
            throw new VenueConnectionException(venueName, "Not connected");
        }
    }

    private String nextOrderId() {
        return venueName + "-" + orderSeq.incrementAndGet();
    }

    private static final class SimBracket {
        private final BracketOrder bracket;
        private boolean entryFilled;
        private boolean closed;

        private SimBracket(BracketOrder bracket) {
            this.bracket = bracket;
        }
    }
}
