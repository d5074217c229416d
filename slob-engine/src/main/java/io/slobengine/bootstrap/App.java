package io.slobengine.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.slobengine.application.monitoring.AlertService;
import io.slobengine.application.port.output.StateStore;
import io.slobengine.application.service.Engine;
import io.slobengine.application.service.EngineConfig;
import io.slobengine.application.service.ShutdownReport;
import io.slobengine.infrastructure.metrics.PrometheusEngineMetrics;
import io.slobengine.infrastructure.metrics.PrometheusMetricsHandler;
import io.slobengine.infrastructure.persistence.InMemoryStateStore;
import io.slobengine.infrastructure.persistence.PostgresStateStore;
import io.slobengine.infrastructure.persistence.SchemaMigration;
import io.slobengine.infrastructure.venue.paper.PaperVenueClient;
import io.slobengine.infrastructure.venue.paper.TickReplayer;
import io.slobengine.service.core.EventBus;
import io.slobengine.transport.http.ControlHandlers;
import io.slobengine.transport.http.ControlServer;
import io.slobengine.util.Env;
import io.slobengine.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Entry point. Hand wiring, no container.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== SLOB Engine Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EngineConfig config = EngineConfig.fromEnv();
        log.info("Config: symbol={} venue={} store={} controlPort={} shutdownTimeout={}s",
            config.symbol(), config.venue(), config.storeType(), config.controlPort(),
            config.shutdownTimeout().toSeconds());

        // ═══════════════════════════════════════════════════════════════
        // State store
        // ═══════════════════════════════════════════════════════════════
        StateStore stateStore = createStateStore(config);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Venue
        // ═══════════════════════════════════════════════════════════════
        if (!"PAPER".equals(config.venue())) {
            throw new IllegalArgumentException("Unsupported venue: " + config.venue() + " (supported: PAPER)");
        }
        PaperVenueClient venue = new PaperVenueClient();

        // ═══════════════════════════════════════════════════════════════
        // Engine
        // ═══════════════════════════════════════════════════════════════
        EventBus eventBus = new EventBus();
        AlertService alertService = new AlertService();
        Engine engine = new Engine(config, venue, stateStore, eventBus, alertService, metrics,
            Sleeper.SYSTEM, Clock.systemUTC());

        // ═══════════════════════════════════════════════════════════════
        // Control server
        // ═══════════════════════════════════════════════════════════════
        ControlServer controlServer = new ControlServer(
            Env.get("CONTROL_HOST", "0.0.0.0"),
            config.controlPort(),
            new ControlHandlers(engine),
            new PrometheusMetricsHandler(metrics.getRegistry(), engine::refreshMetrics));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            controlServer.stop();
            ShutdownReport report = engine.shutdown();
            log.info("Shutdown report: completed={} overrun={} failed={}",
                report.completedSteps(), report.overrunSteps(), report.failedSteps());
        }, "shutdown-hook"));

        engine.start();
        controlServer.start();

        // ═══════════════════════════════════════════════════════════════
        // Optional tick replay (paper mode)
        // ═══════════════════════════════════════════════════════════════
        String replayFile = Env.get("SLOB_REPLAY_FILE", null);
        if (replayFile != null) {
            startReplay(venue, Path.of(replayFile), Double.parseDouble(Env.get("SLOB_REPLAY_SPEED", "0")));
        }

        log.info("=== SLOB Engine running ({}) ===", config.symbol());
    }

    private static StateStore createStateStore(EngineConfig config) {
        switch (config.storeType()) {
            case "MEMORY":
                log.info("State store: in-memory (state is lost on restart)");
                return new InMemoryStateStore();
            case "POSTGRES":
                DataSource dataSource = createDataSource();
                if (Env.getBool("DB_MIGRATE", true)) {
                    new SchemaMigration(dataSource).migrate();
                }
                return new PostgresStateStore(dataSource);
            default:
                throw new IllegalArgumentException("Unsupported store: " + config.storeType()
                    + " (supported: MEMORY, POSTGRES)");
        }
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/slob");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("slob-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private static void startReplay(PaperVenueClient venue, Path file, double speed) {
        Thread replay = new Thread(() -> {
            try {
                new TickReplayer(venue, Sleeper.SYSTEM, speed).replay(file);
            } catch (IOException e) {
                log.error("[REPLAY] Failed to read {}: {}", file, e.getMessage(), e);
            }
        }, "tick-replay");
        replay.setDaemon(true);
        replay.start();
    }
}
