package io.slobengine.application.service;

import io.slobengine.service.setup.SetupTrackerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static final List<String> KEYS = List.of(
        "SLOB_SYMBOL", "SLOB_ZONE", "INITIAL_EQUITY", "MAX_POSITION_SIZE", "SHUTDOWN_TIMEOUT_SECONDS", "SLOB_STORE");

    @AfterEach
    void clearProperties() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults("NQ");

        assertEquals("PAPER", config.venue());
        assertEquals("MEMORY", config.storeType());
        assertEquals(Duration.ofMinutes(1), config.candleInterval());
        assertEquals(Duration.ofSeconds(30), config.shutdownTimeout());
        assertEquals(5, config.connectPolicy().getMaxAttempts());
        assertEquals(3, config.heartbeatPolicy().getMaxAttempts());
    }

    @Test
    void testFromSystemProperties() {
        System.setProperty("SLOB_SYMBOL", "ES");
        System.setProperty("SLOB_ZONE", "America/New_York");
        System.setProperty("INITIAL_EQUITY", "75000");
        System.setProperty("MAX_POSITION_SIZE", "3");
        System.setProperty("SHUTDOWN_TIMEOUT_SECONDS", "12");
        System.setProperty("SLOB_STORE", "postgres");

        EngineConfig config = EngineConfig.fromEnv();

        assertEquals("ES", config.symbol());
        assertEquals("ES", config.trackerConfig().symbol());
        assertEquals(ZoneId.of("America/New_York"), config.trackerConfig().zone());
        assertEquals(0, new BigDecimal("75000").compareTo(config.riskConfig().initialEquity()));
        assertEquals(3, config.riskConfig().maxPositionSize());
        assertEquals(Duration.ofSeconds(12), config.shutdownTimeout());
        assertEquals("POSTGRES", config.storeType(), "Store type is normalized to upper case");
    }

    @Test
    void testTrackerSymbolMustMatch() {
        EngineConfig config = EngineConfig.defaults("NQ");

        assertThrows(IllegalArgumentException.class,
            () -> config.withTrackerConfig(SetupTrackerConfig.defaults("ES")));
    }

    @Test
    void testShutdownTimeoutMustBePositive() {
        EngineConfig config = EngineConfig.defaults("NQ");

        assertThrows(IllegalArgumentException.class, () -> config.withShutdownTimeout(Duration.ZERO));
        assertEquals(Duration.ofSeconds(5), config.withShutdownTimeout(Duration.ofSeconds(5)).shutdownTimeout());
    }
}
