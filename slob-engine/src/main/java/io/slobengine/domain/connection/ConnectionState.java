package io.slobengine.domain.connection;

import java.time.Instant;

/**
 * Read-only view of the venue link. Only ConnectionSupervisor produces new instances.
 */
public record ConnectionState(
    ConnectionPhase phase,
    int consecutiveFailures,
    Instant since
) {
    public static ConnectionState initial(Instant now) {
        return new ConnectionState(ConnectionPhase.DISCONNECTED, 0, now);
    }

    public boolean isConnected() {
        return phase == ConnectionPhase.CONNECTED;
    }

    public boolean isSafeMode() {
        return phase == ConnectionPhase.SAFE_MODE;
    }
}
