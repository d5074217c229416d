package io.slobengine.service.risk;

import io.slobengine.application.monitoring.AlertService;
import io.slobengine.domain.event.TradingHaltedEvent;
import io.slobengine.domain.trade.SessionState;
import io.slobengine.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Risk Manager - position sizing and drawdown control.
 *
 * SIZING:
 *   baseRisk    = equity x maxRiskPerTrade   (x drawdownSizeMultiplier past reduceSizeAtDrawdown)
 *   distance    = max(|entry - stop|, atr)   (ATR only ever shrinks the size)
 *   contracts   = floor(baseRisk / (distance x pointValue)), floored at 1, capped at maxPositionSize
 *
 * DRAWDOWN:
 *   drawdown = (peak - equity) / peak. Crossing maxDrawdownStop halts trading until
 *   {@link #resumeTrading()} is called by an operator.
 *
 * Equity, peak and the halt flag are written only by this class.
 */
public final class RiskManager {
    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private final RiskConfig config;
    private final EventBus eventBus;
    private final AlertService alertService;

    private BigDecimal equity;
    private BigDecimal peakEquity;
    private boolean tradingHalted;
    private int tradesToday;
    private BigDecimal pnlToday = BigDecimal.ZERO;

    public RiskManager(RiskConfig config, EventBus eventBus, AlertService alertService) {
        this.config = config;
        this.eventBus = eventBus;
        this.alertService = alertService;
        this.equity = config.initialEquity();
        this.peakEquity = config.initialEquity();
        log.info("[RISK] Initialized: equity={}, risk/trade={}, max size={}, halt at drawdown {}",
            equity, config.maxRiskPerTrade(), config.maxPositionSize(), config.maxDrawdownStop());
    }

    // ═══════════════════════════════════════════════════════════════
    // SIZING
    // ═══════════════════════════════════════════════════════════════

    public synchronized PositionSize calculatePositionSize(BigDecimal entry, BigDecimal stop, BigDecimal atr) {
        return calculatePositionSize(entry, stop, atr, equity);
    }

    public synchronized PositionSize calculatePositionSize(BigDecimal entry, BigDecimal stop,
                                                           BigDecimal atr, BigDecimal accountEquity) {
        if (tradingHalted) {
            log.warn("[RISK] Sizing refused: trading halted (drawdown {})", drawdown());
            return PositionSize.refused(PositionSize.Method.HALTED, "Trading halted by drawdown policy");
        }
        if (entry == null || stop == null || accountEquity == null || accountEquity.signum() <= 0) {
            return PositionSize.refused(PositionSize.Method.INVALID, "Missing entry, stop or equity");
        }

        BigDecimal distance = entry.subtract(stop).abs();
        if (distance.signum() == 0) {
            log.warn("[RISK] Sizing refused: entry equals stop ({})", entry);
            return PositionSize.refused(PositionSize.Method.INVALID, "Zero stop distance");
        }

        PositionSize.Method method = PositionSize.Method.FIXED_RISK;
        BigDecimal baseRisk = accountEquity.multiply(config.maxRiskPerTrade());
        BigDecimal currentDrawdown = drawdown();
        if (currentDrawdown.compareTo(config.reduceSizeAtDrawdown()) >= 0) {
            baseRisk = baseRisk.multiply(config.drawdownSizeMultiplier());
            method = PositionSize.Method.DRAWDOWN_REDUCED;
        }

        if (atr != null && atr.compareTo(distance) > 0) {
            distance = atr;
            if (method == PositionSize.Method.FIXED_RISK) {
                method = PositionSize.Method.ATR_ADJUSTED;
            }
        }

        BigDecimal perUnitRisk = distance.multiply(config.pointValue());
        int contracts = baseRisk.divide(perUnitRisk, 0, RoundingMode.DOWN).intValue();
        String reason = String.format("baseRisk=%s perUnit=%s drawdown=%s",
            baseRisk.setScale(2, RoundingMode.HALF_UP), perUnitRisk, currentDrawdown.setScale(4, RoundingMode.HALF_UP));

        if (contracts < 1) {
            contracts = 1;
        }
        if (contracts > config.maxPositionSize()) {
            contracts = config.maxPositionSize();
        }

        BigDecimal riskAmount = perUnitRisk.multiply(BigDecimal.valueOf(contracts));
        PositionSize size = new PositionSize(contracts, riskAmount, method, reason);
        log.info("[RISK] Position size: {}", size.getSummary());
        return size;
    }

    // ═══════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════

    /**
     * Apply a realized pnl and re-evaluate the drawdown policy.
     */
    public void updateAfterTrade(BigDecimal pnl) {
        TradingHaltedEvent halted = null;
        synchronized (this) {
            if (pnl == null) {
                return;
            }
            equity = equity.add(pnl);
            tradesToday++;
            pnlToday = pnlToday.add(pnl);
            if (equity.compareTo(peakEquity) > 0) {
                peakEquity = equity;
            }
            BigDecimal currentDrawdown = drawdown();
            log.info("[RISK] Trade closed pnl={} equity={} peak={} drawdown={}",
                pnl, equity, peakEquity, currentDrawdown.setScale(4, RoundingMode.HALF_UP));

            if (!tradingHalted && currentDrawdown.compareTo(config.maxDrawdownStop()) >= 0) {
                tradingHalted = true;
                halted = new TradingHaltedEvent(currentDrawdown, equity, peakEquity, Instant.now());
            }
        }

        // Publish outside the lock: handlers may call getState()
        if (halted != null) {
            log.error("[RISK] Trading HALTED: drawdown {} >= {}", halted.drawdown(), config.maxDrawdownStop());
            if (alertService != null) {
                alertService.sendCriticalAlert("TRADING_HALTED",
                    "Drawdown " + halted.drawdown().setScale(4, RoundingMode.HALF_UP)
                        + " reached limit " + config.maxDrawdownStop() + "; equity " + halted.equity());
            }
            if (eventBus != null) {
                eventBus.publish(halted);
            }
        }
    }

    public synchronized void resumeTrading() {
        if (!tradingHalted) {
            return;
        }
        tradingHalted = false;
        // Drawdown is measured from here on so the policy does not re-trigger immediately
        peakEquity = equity;
        log.warn("[RISK] Trading resumed by operator at equity {}", equity);
        if (alertService != null) {
            alertService.sendInfoAlert("TRADING_RESUMED", "Trading resumed at equity " + equity);
        }
    }

    public synchronized boolean isTradingHalted() {
        return tradingHalted;
    }

    public synchronized RiskState getState() {
        return new RiskState(equity, peakEquity, drawdown(), tradingHalted, tradesToday, pnlToday);
    }

    public RiskConfig getConfig() {
        return config;
    }

    /**
     * Rehydrate from the persisted session. A null state keeps the configured initial equity.
     */
    public synchronized void restore(SessionState state) {
        if (state == null || state.equity() == null) {
            return;
        }
        equity = state.equity();
        peakEquity = state.peakEquity() != null ? state.peakEquity().max(equity) : equity;
        tradingHalted = state.tradingHalted();
        tradesToday = state.tradesToday();
        pnlToday = state.pnlToday() != null ? state.pnlToday() : BigDecimal.ZERO;
        log.info("[RISK] Restored: equity={} peak={} halted={}", equity, peakEquity, tradingHalted);
    }

    /**
     * Reset the daily counters at a new trading date.
     */
    public synchronized void startNewDay() {
        tradesToday = 0;
        pnlToday = BigDecimal.ZERO;
    }

    private BigDecimal drawdown() {
        if (peakEquity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return peakEquity.subtract(equity).divide(peakEquity, MC).max(BigDecimal.ZERO);
    }
}
