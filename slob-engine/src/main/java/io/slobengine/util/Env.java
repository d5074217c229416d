package io.slobengine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Configuration lookup: environment variable first, then system property, then the default.
 * Unparseable values fall back to the default with a warning.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String raw = System.getenv(key);
        if (isBlank(raw)) {
            raw = System.getProperty(key);
        }
        return isBlank(raw) ? defaultValue : raw.trim();
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::valueOf);
    }

    public static long getLong(String key, long defaultValue) {
        return parse(key, defaultValue, Long::valueOf);
    }

    public static BigDecimal getDecimal(String key, BigDecimal defaultValue) {
        return parse(key, defaultValue, BigDecimal::new);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String raw = get(key, null);
        if (raw == null) {
            return defaultValue;
        }
        return raw.equalsIgnoreCase("true") || raw.equals("1") || raw.equalsIgnoreCase("yes");
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String raw = get(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return parser.apply(raw);
        } catch (NumberFormatException e) {
            log.warn("[CONFIG] Ignoring {}={} ({}), using {}", key, raw, e.getMessage(), defaultValue);
            return defaultValue;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private Env() {}
}
