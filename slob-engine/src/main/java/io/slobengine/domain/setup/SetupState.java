package io.slobengine.domain.setup;

/**
 * Setup detection states.
 *
 * WATCHING_LIQ1 -> WATCHING_CONSOL -> WATCHING_LIQ2 -> WAITING_ENTRY -> SETUP_COMPLETE
 * Any non-terminal state may move to INVALIDATED.
 */
public enum SetupState {
    WATCHING_LIQ1,
    WATCHING_CONSOL,
    WATCHING_LIQ2,
    WAITING_ENTRY,
    SETUP_COMPLETE,
    INVALIDATED;

    public boolean isTerminal() {
        return this == SETUP_COMPLETE || this == INVALIDATED;
    }
}
