package io.slobengine.domain.trade;

/**
 * Why a trade was closed. EXTERNAL marks a trade finalized by reconciliation
 * because the venue no longer holds the position.
 */
public enum ExitReason {
    TP,
    SL,
    MANUAL,
    EOD,
    EXTERNAL
}
