package io.slobengine.domain.order;

/**
 * Outcome of a bracket submission.
 * DUPLICATE_ORDER is a signaled no-op, not a failure.
 */
public record OrderResult(
    Outcome outcome,
    String setupId,
    BracketOrder bracket,
    String message
) {
    public enum Outcome {
        PLACED,
        DUPLICATE_ORDER,
        REJECTED,
        FAILED
    }

    public static OrderResult placed(BracketOrder bracket) {
        return new OrderResult(Outcome.PLACED, bracket.setupId(), bracket, "Bracket placed");
    }

    public static OrderResult duplicate(String setupId, String message) {
        return new OrderResult(Outcome.DUPLICATE_ORDER, setupId, null, message);
    }

    public static OrderResult rejected(String setupId, String message) {
        return new OrderResult(Outcome.REJECTED, setupId, null, message);
    }

    public static OrderResult failed(String setupId, BracketOrder bracket, String message) {
        return new OrderResult(Outcome.FAILED, setupId, bracket, message);
    }

    public boolean isPlaced() {
        return outcome == Outcome.PLACED;
    }

    public boolean isDuplicate() {
        return outcome == Outcome.DUPLICATE_ORDER;
    }
}
