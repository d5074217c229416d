package io.slobengine.service.execution;

import io.slobengine.domain.order.BracketLeg;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.order.LegRole;
import io.slobengine.domain.order.OrderStatus;
import io.slobengine.domain.order.OrderType;
import io.slobengine.domain.setup.Direction;
import io.slobengine.domain.setup.SetupCandidate;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Builds brackets and their venue references.
 *
 * idempotencyKey = "SLOB-" + setupId
 * leg reference  = idempotencyKey + "-" + submittedAt epoch millis + "-" + role code
 */
public final class BracketFactory {

    public static final String KEY_PREFIX = "SLOB-";

    private BracketFactory() {
    }

    public static String idempotencyKey(String setupId) {
        return KEY_PREFIX + setupId;
    }

    public static String legReference(String idempotencyKey, Instant submittedAt, LegRole role) {
        return idempotencyKey + "-" + submittedAt.toEpochMilli() + "-" + role.code();
    }

    public static BracketOrder build(SetupCandidate setup, int quantity, Instant submittedAt) {
        String key = idempotencyKey(setup.getId());
        Direction direction = setup.getDirection();
        return new BracketOrder(
            setup.getId(),
            key,
            setup.getSymbol(),
            direction,
            quantity,
            submittedAt,
            leg(LegRole.ENTRY, OrderType.LIMIT, direction.entryAction(), setup.getEntryPrice(), key, submittedAt),
            leg(LegRole.STOP_LOSS, OrderType.STOP, direction.exitAction(), setup.getStopPrice(), key, submittedAt),
            leg(LegRole.TAKE_PROFIT, OrderType.LIMIT, direction.exitAction(), setup.getTargetPrice(), key, submittedAt),
            OrderStatus.PENDING
        );
    }

    private static BracketLeg leg(LegRole role, OrderType type, String action, BigDecimal price,
                                  String key, Instant submittedAt) {
        return new BracketLeg(role, type, action, price, legReference(key, submittedAt, role), null);
    }
}
