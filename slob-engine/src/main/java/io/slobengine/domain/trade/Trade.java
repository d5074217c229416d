package io.slobengine.domain.trade;

import io.slobengine.domain.setup.Direction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A filled position opened by a setup's bracket. Persisted on entry fill,
 * reconciled against venue positions.
 */
public record Trade(
    String tradeId,
    String setupId,
    String symbol,
    Direction direction,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    int size,
    TradeStatus status,
    ExitReason exitReason,
    BigDecimal pnl,
    Instant openedAt,
    Instant closedAt
) {
    public Trade {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("Trade id cannot be null or empty");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (direction == null) {
            throw new IllegalArgumentException("Direction cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
    }

    public static Trade open(String setupId, String symbol, Direction direction,
                             BigDecimal entryPrice, int size, Instant openedAt) {
        return new Trade("T-" + setupId, setupId, symbol, direction, entryPrice, null, size,
            TradeStatus.OPEN, null, null, openedAt, null);
    }

    public boolean isOpen() {
        return status == TradeStatus.OPEN;
    }

    /**
     * Close with a known exit price. pnl = signed points x size x pointValue.
     */
    public Trade close(BigDecimal exit, ExitReason reason, Instant at, BigDecimal pointValue) {
        BigDecimal points = direction == Direction.SHORT
            ? entryPrice.subtract(exit)
            : exit.subtract(entryPrice);
        BigDecimal realized = points.multiply(BigDecimal.valueOf(size)).multiply(pointValue);
        return new Trade(tradeId, setupId, symbol, direction, entryPrice, exit, size,
            TradeStatus.CLOSED, reason, realized, openedAt, at);
    }

    /**
     * Close without an exit price, used when the venue closed the position out of band.
     */
    public Trade finalizeExternally(Instant at) {
        return new Trade(tradeId, setupId, symbol, direction, entryPrice, null, size,
            TradeStatus.CLOSED, ExitReason.EXTERNAL, null, openedAt, at);
    }
}
