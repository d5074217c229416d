package io.slobengine.application.port.output;

/**
 * Persistence failure in a {@link StateStore}.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
