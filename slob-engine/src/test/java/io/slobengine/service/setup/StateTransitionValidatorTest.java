package io.slobengine.service.setup;

import io.slobengine.domain.setup.CandleSnapshot;
import io.slobengine.domain.setup.Direction;
import io.slobengine.domain.setup.InvalidationReason;
import io.slobengine.domain.setup.SetupCandidate;
import io.slobengine.domain.setup.SetupState;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests:
 * - Legal forward edges only, terminal states are final
 * - Data guards refuse a transition whose prerequisites are missing
 * - Invalidation from any non-terminal state records the reason
 */
class StateTransitionValidatorTest {

    private static final Instant T = Instant.parse("2024-01-02T15:30:00Z");

    private static SetupCandidate candidate() {
        return new SetupCandidate("setup-1", "NQ", Direction.SHORT,
            new BigDecimal("15120"), new BigDecimal("14900"), T);
    }

    @Test
    void testEdgeTable() {
        assertTrue(StateTransitionValidator.isAllowed(SetupState.WATCHING_LIQ1, SetupState.WATCHING_CONSOL));
        assertTrue(StateTransitionValidator.isAllowed(SetupState.WAITING_ENTRY, SetupState.SETUP_COMPLETE));
        assertTrue(StateTransitionValidator.isAllowed(SetupState.WATCHING_LIQ2, SetupState.INVALIDATED));

        assertFalse(StateTransitionValidator.isAllowed(SetupState.WATCHING_CONSOL, SetupState.WAITING_ENTRY),
            "Skipping LIQ#2 is not allowed");
        assertFalse(StateTransitionValidator.isAllowed(SetupState.WATCHING_LIQ2, SetupState.WATCHING_CONSOL),
            "No backward edges");
        for (SetupState to : SetupState.values()) {
            assertFalse(StateTransitionValidator.isAllowed(SetupState.SETUP_COMPLETE, to));
            assertFalse(StateTransitionValidator.isAllowed(SetupState.INVALIDATED, to));
        }
    }

    @Test
    void testConsolidationRequiresLiq1() {
        SetupCandidate c = candidate();

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StateTransitionValidator.transition(c, SetupState.WATCHING_CONSOL, T, BigDecimal.ONE, "test"));

        assertTrue(e.getMessage().contains("LIQ#1"));
        assertEquals(SetupState.WATCHING_LIQ1, c.getState(), "Refused transition leaves state untouched");
    }

    @Test
    void testLiq2RequiresFrozenWindowAndNoWick() {
        SetupCandidate c = candidate();
        c.recordLiq1(T, new BigDecimal("15135"));
        StateTransitionValidator.transition(c, SetupState.WATCHING_CONSOL, T, new BigDecimal("15135"), "liq1");

        assertThrows(IllegalStateException.class,
            () -> StateTransitionValidator.transition(c, SetupState.WATCHING_LIQ2, T, BigDecimal.ONE, "early"));

        CandleSnapshot window = new CandleSnapshot(T.plusSeconds(60), new BigDecimal("15102"),
            new BigDecimal("15115"), new BigDecimal("15100"), new BigDecimal("15114"));
        c.admitConsolidationCandle(window);
        c.recordNoWick(window);
        c.freezeConsolidation(T.plusSeconds(120));

        StateTransitionValidator.transition(c, SetupState.WATCHING_LIQ2, T.plusSeconds(120), c.getConsolHigh(), "frozen");
        assertEquals(SetupState.WATCHING_LIQ2, c.getState());
    }

    @Test
    void testIllegalEdgeThrows() {
        SetupCandidate c = candidate();

        assertThrows(IllegalStateException.class,
            () -> StateTransitionValidator.transition(c, SetupState.SETUP_COMPLETE, T, BigDecimal.ONE, "jump"));
    }

    @Test
    void testInvalidateRecordsReason() {
        SetupCandidate c = candidate();
        c.recordLiq1(T, new BigDecimal("15135"));
        StateTransitionValidator.transition(c, SetupState.WATCHING_CONSOL, T, new BigDecimal("15135"), "liq1");

        StateTransitionValidator.invalidate(c, InvalidationReason.CONSOL_TIMEOUT, T.plusSeconds(60), BigDecimal.TEN);

        assertEquals(SetupState.INVALIDATED, c.getState());
        assertEquals(InvalidationReason.CONSOL_TIMEOUT, c.getInvalidationReason());
        assertEquals(2, c.getTransitions().size());
        assertEquals(SetupState.WATCHING_CONSOL, c.getTransitions().get(1).from());
        assertFalse(c.isActive());

        assertThrows(IllegalStateException.class,
            () -> StateTransitionValidator.invalidate(c, InvalidationReason.MARKET_CLOSED, T.plusSeconds(120), BigDecimal.TEN),
            "Terminal setups cannot be invalidated again");
    }
}
