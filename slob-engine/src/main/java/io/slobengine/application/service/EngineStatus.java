package io.slobengine.application.service;

import io.slobengine.domain.connection.ConnectionPhase;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time view served by the control surface.
 */
public record EngineStatus(
    String symbol,
    String venue,
    boolean running,
    boolean acceptingSetups,
    ConnectionPhase connectionPhase,
    boolean safeMode,
    boolean tradingHalted,
    BigDecimal equity,
    BigDecimal peakEquity,
    BigDecimal drawdown,
    int activeSetups,
    int openTrades,
    int tickBufferSize,
    long eventHandlerErrors,
    Instant startedAt,
    Instant timestamp
) {
}
