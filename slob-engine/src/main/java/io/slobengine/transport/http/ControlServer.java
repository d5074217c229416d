package io.slobengine.transport.http;

import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Undertow listener for the operator surface and the Prometheus scrape endpoint.
 */
public final class ControlServer {
    private static final Logger log = LoggerFactory.getLogger(ControlServer.class);

    private final String host;
    private final int port;
    private final RoutingHandler routes;
    private Undertow server;

    public ControlServer(String host, int port, ControlHandlers handlers, HttpHandler metricsHandler) {
        this.host = host;
        this.port = port;
        this.routes = Handlers.routing()
            .get("/health", handlers::health)
            .get("/status", handlers::status)
            .post("/safe-mode/clear", handlers::clearSafeMode)
            .post("/trading/resume", handlers::resumeTrading)
            .get("/metrics", metricsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "SLOB engine control\n\n" +
                    "GET  /health, /status, /metrics\n" +
                    "POST /safe-mode/clear?by=<name>, /trading/resume\n");
            });
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ Control server started on http://{}:{}/", host, port);
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop();
        server = null;
        log.info("Control server stopped");
    }

    public int getPort() {
        return port;
    }
}
