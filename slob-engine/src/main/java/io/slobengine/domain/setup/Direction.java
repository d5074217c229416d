package io.slobengine.domain.setup;

/**
 * Trade direction of a setup.
 * SHORT setups follow a sweep above the session high, LONG setups a sweep below the session low.
 */
public enum Direction {
    SHORT,
    LONG;

    public String entryAction() {
        return this == SHORT ? "SELL" : "BUY";
    }

    public String exitAction() {
        return this == SHORT ? "BUY" : "SELL";
    }
}
