package io.slobengine.domain.connection;

public enum ConnectionPhase {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    SAFE_MODE
}
