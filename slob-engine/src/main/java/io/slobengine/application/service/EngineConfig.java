package io.slobengine.application.service;

import io.slobengine.infrastructure.venue.common.ReconnectionPolicy;
import io.slobengine.service.candle.CandleAggregator;
import io.slobengine.service.candle.TickBuffer;
import io.slobengine.service.execution.OrderExecutorConfig;
import io.slobengine.service.risk.RiskConfig;
import io.slobengine.service.setup.SetupTrackerConfig;
import io.slobengine.util.Env;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Engine wiring parameters. Component configs are nested so each service keeps its own validation.
 */
public record EngineConfig(
    String symbol,
    String venue,                   // PAPER
    String storeType,               // MEMORY | POSTGRES
    int controlPort,
    SetupTrackerConfig trackerConfig,
    RiskConfig riskConfig,
    OrderExecutorConfig executorConfig,
    Duration candleInterval,
    int maxGapFill,
    int tickBufferCapacity,
    Duration reconnectBaseDelay,
    Duration reconnectMaxDelay,
    int reconnectMaxAttempts,
    int heartbeatMaxAttempts,
    Duration pingInterval,
    Duration heartbeatTimeout,
    Duration snapshotInterval,
    Duration shutdownTimeout
) {
    public EngineConfig {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (!symbol.equals(trackerConfig.symbol())) {
            throw new IllegalArgumentException("Tracker symbol " + trackerConfig.symbol()
                + " does not match engine symbol " + symbol);
        }
        if (reconnectMaxAttempts < 1 || heartbeatMaxAttempts < 1) {
            throw new IllegalArgumentException("Reconnect attempt budgets must be at least 1");
        }
        if (shutdownTimeout == null || shutdownTimeout.isZero() || shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("Shutdown timeout must be positive");
        }
        if (snapshotInterval == null || snapshotInterval.isZero() || snapshotInterval.isNegative()) {
            throw new IllegalArgumentException("Snapshot interval must be positive");
        }
    }

    public static EngineConfig defaults(String symbol) {
        return new EngineConfig(symbol, "PAPER", "MEMORY", 8080,
            SetupTrackerConfig.defaults(symbol), RiskConfig.defaults(), OrderExecutorConfig.defaults(),
            CandleAggregator.DEFAULT_BUCKET, CandleAggregator.DEFAULT_MAX_GAP_FILL_DISTANCE,
            TickBuffer.DEFAULT_CAPACITY,
            Duration.ofSeconds(1), Duration.ofSeconds(60), 5, 3,
            Duration.ofSeconds(30), Duration.ofSeconds(60),
            Duration.ofSeconds(30), Duration.ofSeconds(30));
    }

    /**
     * Read from environment variables, then system properties.
     */
    public static EngineConfig fromEnv() {
        String symbol = Env.get("SLOB_SYMBOL", "NQ");
        ZoneId zone = ZoneId.of(Env.get("SLOB_ZONE", "UTC"));

        SetupTrackerConfig tracker = SetupTrackerConfig.builder()
            .symbol(symbol)
            .zone(zone)
            .build();

        BigDecimal equity = Env.getDecimal("INITIAL_EQUITY", new BigDecimal("50000"));
        RiskConfig risk = RiskConfig.withEquity(equity)
            .withMaxPositionSize(Env.getInt("MAX_POSITION_SIZE", 5));

        OrderExecutorConfig executor = new OrderExecutorConfig(
            Env.getInt("ORDER_MAX_RETRIES", 3),
            Duration.ofMillis(Env.getLong("ORDER_RETRY_DELAY_MS", 1000)),
            Env.getDecimal("POINT_VALUE", new BigDecimal("20")));

        return new EngineConfig(
            symbol,
            Env.get("SLOB_VENUE", "PAPER").toUpperCase(),
            Env.get("SLOB_STORE", "MEMORY").toUpperCase(),
            Env.getInt("CONTROL_PORT", 8080),
            tracker,
            risk,
            executor,
            Duration.ofSeconds(Env.getLong("CANDLE_INTERVAL_SECONDS", 60)),
            Env.getInt("MAX_GAP_FILL", CandleAggregator.DEFAULT_MAX_GAP_FILL_DISTANCE),
            Env.getInt("TICK_BUFFER_CAPACITY", TickBuffer.DEFAULT_CAPACITY),
            Duration.ofMillis(Env.getLong("RECONNECT_BASE_DELAY_MS", 1000)),
            Duration.ofSeconds(Env.getLong("RECONNECT_MAX_DELAY_SECONDS", 60)),
            Env.getInt("RECONNECT_MAX_ATTEMPTS", 5),
            Env.getInt("HEARTBEAT_MAX_ATTEMPTS", 3),
            Duration.ofSeconds(Env.getLong("HEARTBEAT_INTERVAL_SECONDS", 30)),
            Duration.ofSeconds(Env.getLong("HEARTBEAT_TIMEOUT_SECONDS", 60)),
            Duration.ofSeconds(Env.getLong("SNAPSHOT_INTERVAL_SECONDS", 30)),
            Duration.ofSeconds(Env.getLong("SHUTDOWN_TIMEOUT_SECONDS", 30)));
    }

    public EngineConfig withShutdownTimeout(Duration timeout) {
        return new EngineConfig(symbol, venue, storeType, controlPort, trackerConfig, riskConfig,
            executorConfig, candleInterval, maxGapFill, tickBufferCapacity, reconnectBaseDelay,
            reconnectMaxDelay, reconnectMaxAttempts, heartbeatMaxAttempts, pingInterval,
            heartbeatTimeout, snapshotInterval, timeout);
    }

    public EngineConfig withTrackerConfig(SetupTrackerConfig tracker) {
        return new EngineConfig(symbol, venue, storeType, controlPort, tracker, riskConfig,
            executorConfig, candleInterval, maxGapFill, tickBufferCapacity, reconnectBaseDelay,
            reconnectMaxDelay, reconnectMaxAttempts, heartbeatMaxAttempts, pingInterval,
            heartbeatTimeout, snapshotInterval, shutdownTimeout);
    }

    public ReconnectionPolicy connectPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectBaseDelay)
            .maxDelay(reconnectMaxDelay)
            .multiplier(2.0)
            .maxAttempts(reconnectMaxAttempts)
            .build();
    }

    public ReconnectionPolicy heartbeatPolicy() {
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectBaseDelay)
            .maxDelay(reconnectMaxDelay)
            .multiplier(2.0)
            .maxAttempts(heartbeatMaxAttempts)
            .build();
    }
}
