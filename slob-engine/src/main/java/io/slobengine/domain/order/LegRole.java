package io.slobengine.domain.order;

/**
 * Role of a leg inside a bracket. The short code is part of the leg's venue reference.
 */
public enum LegRole {
    ENTRY("EN"),
    STOP_LOSS("SL"),
    TAKE_PROFIT("TP");

    private final String code;

    LegRole(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
