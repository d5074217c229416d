package io.slobengine.domain.monitoring;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator-facing alert raised by the engine (reconciliation mismatch, safe mode, drawdown halt).
 * Details keep insertion order.
 */
public record Alert(String type, AlertLevel level, String message, Instant raisedAt, Map<String, Object> details) {

    public Alert {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Alert type cannot be null or empty");
        }
        if (level == null) {
            throw new IllegalArgumentException("Alert level cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("Alert message cannot be null");
        }
        raisedAt = raisedAt != null ? raisedAt : Instant.now();
        details = details == null || details.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static Alert of(AlertLevel level, String type, String message) {
        return new Alert(type, level, message, Instant.now(), Map.of());
    }

    public Alert withDetail(String key, Object value) {
        Map<String, Object> extended = new LinkedHashMap<>(details);
        extended.put(key, value);
        return new Alert(type, level, message, raisedAt, extended);
    }

    @Override
    public String toString() {
        return level + " " + type + ": " + message;
    }
}
