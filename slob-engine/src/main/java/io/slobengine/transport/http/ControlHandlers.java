package io.slobengine.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.slobengine.application.service.Engine;
import io.slobengine.application.service.EngineStatus;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator endpoints.
 *
 * - GET  /health            - liveness plus link phase
 * - GET  /status            - full engine status
 * - POST /safe-mode/clear   - leave safe mode and reconnect (?by=name)
 * - POST /trading/resume    - lift a drawdown halt
 */
public final class ControlHandlers {
    private static final Logger log = LoggerFactory.getLogger(ControlHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Engine engine;

    public ControlHandlers(Engine engine) {
        this.engine = engine;
    }

    /**
     * GET /health
     *
     * 200 while the engine runs and the link is usable, 503 otherwise.
     */
    public void health(HttpServerExchange exchange) {
        try {
            EngineStatus status = engine.getStatus();
            boolean healthy = status.running() && !status.safeMode();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", healthy ? "UP" : "DEGRADED");
            body.put("connection", status.connectionPhase());
            body.put("tradingHalted", status.tradingHalted());
            sendJson(exchange, healthy ? StatusCodes.OK : StatusCodes.SERVICE_UNAVAILABLE, body);
        } catch (Exception e) {
            log.error("Health check failed", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Health check failed: " + e.getMessage());
        }
    }

    /**
     * GET /status
     */
    public void status(HttpServerExchange exchange) {
        try {
            sendJson(exchange, StatusCodes.OK, engine.getStatus());
        } catch (Exception e) {
            log.error("Status failed", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to get status: " + e.getMessage());
        }
    }

    /**
     * POST /safe-mode/clear
     *
     * Blocks through the reconnect attempts, so it runs off the IO thread.
     * 409 when the engine is not in safe mode.
     */
    public void clearSafeMode(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::clearSafeMode);
            return;
        }
        String clearedBy = queryParam(exchange, "by", "operator");
        try {
            boolean cleared = engine.clearSafeMode(clearedBy);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("cleared", cleared);
            body.put("connection", engine.getStatus().connectionPhase());
            log.info("[CONTROL] Safe mode clear requested by {} → cleared={}", clearedBy, cleared);
            sendJson(exchange, cleared ? StatusCodes.OK : StatusCodes.CONFLICT, body);
        } catch (Exception e) {
            log.error("Clear safe mode failed", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to clear safe mode: " + e.getMessage());
        }
    }

    /**
     * POST /trading/resume
     *
     * 409 when trading is not halted.
     */
    public void resumeTrading(HttpServerExchange exchange) {
        try {
            boolean resumed = engine.resumeTrading();
            log.info("[CONTROL] Resume trading requested → resumed={}", resumed);
            sendJson(exchange, resumed ? StatusCodes.OK : StatusCodes.CONFLICT, Map.of("resumed", resumed));
        } catch (Exception e) {
            log.error("Resume trading failed", e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to resume trading: " + e.getMessage());
        }
    }

    private static String queryParam(HttpServerExchange exchange, String name, String defaultValue) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) {
            return defaultValue;
        }
        return values.peekFirst();
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
