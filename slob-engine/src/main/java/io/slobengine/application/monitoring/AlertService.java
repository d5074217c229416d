package io.slobengine.application.monitoring;

import io.slobengine.domain.monitoring.Alert;
import io.slobengine.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operator alert service.
 *
 * Routes alerts to SLF4J by severity and keeps the most recent ones for the control surface.
 * Safe mode, trading halt and reconciliation mismatches are raised here as CRITICAL.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private static final int RECENT_LIMIT = 200;

    private final Deque<Alert> recent = new ArrayDeque<>();
    private final Map<AlertLevel, Long> counts = new EnumMap<>(AlertLevel.class);

    /**
     * Send alert to configured channels.
     *
     * @param alert Alert to send
     */
    public void sendAlert(Alert alert) {
        switch (alert.level()) {
            case CRITICAL:
                log.error("[ALERT-CRITICAL] {} - {}", alert.type(), alert.message());
                break;
            case HIGH:
            case MEDIUM:
                log.warn("[ALERT-{}] {} - {}", alert.level(), alert.type(), alert.message());
                break;
            default:
                log.info("[ALERT-INFO] {} - {}", alert.type(), alert.message());
                break;
        }

        if (!alert.details().isEmpty()) {
            log.info("[ALERT-DETAILS] {} {}", alert.type(), alert.details());
        }

        synchronized (recent) {
            recent.addLast(alert);
            if (recent.size() > RECENT_LIMIT) {
                recent.removeFirst();
            }
            counts.merge(alert.level(), 1L, Long::sum);
        }
    }

    public void sendCriticalAlert(String alertType, String message) {
        sendAlert(Alert.of(AlertLevel.CRITICAL, alertType, message));
    }

    public void sendHighAlert(String alertType, String message) {
        sendAlert(Alert.of(AlertLevel.HIGH, alertType, message));
    }

    public void sendInfoAlert(String alertType, String message) {
        sendAlert(Alert.of(AlertLevel.INFO, alertType, message));
    }

    /**
     * Most recent alerts, oldest first.
     */
    public List<Alert> getRecentAlerts() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    public long getCount(AlertLevel level) {
        synchronized (recent) {
            return counts.getOrDefault(level, 0L);
        }
    }
}
