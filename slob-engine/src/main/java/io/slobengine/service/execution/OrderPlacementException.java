package io.slobengine.service.execution;

/**
 * Exception thrown when a bracket could not be placed after all attempts.
 */
public class OrderPlacementException extends RuntimeException {

    private final String setupId;

    public OrderPlacementException(String setupId, String message) {
        super(String.format("Order placement failed for setup %s: %s", setupId, message));
        this.setupId = setupId;
    }

    public OrderPlacementException(String setupId, String message, Throwable cause) {
        super(String.format("Order placement failed for setup %s: %s", setupId, message), cause);
        this.setupId = setupId;
    }

    public String getSetupId() {
        return setupId;
    }
}
