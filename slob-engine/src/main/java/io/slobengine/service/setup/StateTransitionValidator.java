package io.slobengine.service.setup;

import io.slobengine.domain.setup.InvalidationReason;
import io.slobengine.domain.setup.SetupCandidate;
import io.slobengine.domain.setup.SetupState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Guards every state change of a setup candidate.
 *
 * Edges:
 * WATCHING_LIQ1 -> WATCHING_CONSOL    (LIQ#1 recorded, session levels known)
 * WATCHING_CONSOL -> WATCHING_LIQ2    (consolidation frozen, no-wick found)
 * WATCHING_LIQ2 -> WAITING_ENTRY      (LIQ#2 candle frozen)
 * WAITING_ENTRY -> SETUP_COMPLETE     (entry, stop and target set)
 * any non-terminal -> INVALIDATED
 */
public final class StateTransitionValidator {

    private static final Map<SetupState, Set<SetupState>> ALLOWED = new EnumMap<>(SetupState.class);

    static {
        ALLOWED.put(SetupState.WATCHING_LIQ1, EnumSet.of(SetupState.WATCHING_CONSOL, SetupState.INVALIDATED));
        ALLOWED.put(SetupState.WATCHING_CONSOL, EnumSet.of(SetupState.WATCHING_LIQ2, SetupState.INVALIDATED));
        ALLOWED.put(SetupState.WATCHING_LIQ2, EnumSet.of(SetupState.WAITING_ENTRY, SetupState.INVALIDATED));
        ALLOWED.put(SetupState.WAITING_ENTRY, EnumSet.of(SetupState.SETUP_COMPLETE, SetupState.INVALIDATED));
        ALLOWED.put(SetupState.SETUP_COMPLETE, EnumSet.noneOf(SetupState.class));
        ALLOWED.put(SetupState.INVALIDATED, EnumSet.noneOf(SetupState.class));
    }

    private StateTransitionValidator() {}

    public static boolean isAllowed(SetupState from, SetupState to) {
        return ALLOWED.get(from).contains(to);
    }

    /**
     * Check the edge and its data guards, then apply the transition.
     *
     * @throws IllegalStateException if the edge is not allowed or required data is missing
     */
    public static void transition(SetupCandidate candidate, SetupState to, Instant candleTime,
                                  BigDecimal price, String reason) {
        SetupState from = candidate.getState();
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                "Illegal transition " + from + " -> " + to + " for setup " + candidate.getId());
        }
        String missing = missingData(candidate, to);
        if (missing != null) {
            throw new IllegalStateException(
                "Cannot enter " + to + " for setup " + candidate.getId() + ": " + missing);
        }
        candidate.applyTransition(to, candleTime, price, reason);
    }

    public static void invalidate(SetupCandidate candidate, InvalidationReason reason,
                                  Instant candleTime, BigDecimal price) {
        candidate.markInvalidated(reason);
        transition(candidate, SetupState.INVALIDATED, candleTime, price, reason.name());
    }

    private static String missingData(SetupCandidate c, SetupState to) {
        switch (to) {
            case WATCHING_CONSOL:
                if (c.getLiq1Time() == null) return "LIQ#1 not recorded";
                if (c.getSessionHigh() == null || c.getSessionLow() == null) return "session levels not set";
                return null;
            case WATCHING_LIQ2:
                if (!c.isConsolidationFrozen()) return "consolidation not frozen";
                if (!c.hasNoWick()) return "no-wick candle not found";
                if (c.getConsolHigh() == null || c.getConsolLow() == null) return "consolidation bounds not set";
                return null;
            case WAITING_ENTRY:
                return c.getLiq2Candle() == null ? "LIQ#2 candle not frozen" : null;
            case SETUP_COMPLETE:
                if (c.getEntryPrice() == null) return "entry not triggered";
                if (c.getStopPrice() == null || c.getTargetPrice() == null) return "stop/target not calculated";
                return null;
            default:
                return null;
        }
    }
}
