package io.slobengine.infrastructure.persistence;

import io.slobengine.application.port.output.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates the state store tables on startup. Every statement is idempotent (IF NOT EXISTS),
 * so running it against an existing database is a no-op.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    public static final String SCHEMA_RESOURCE = "db/schema.sql";

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return number of statements executed
     */
    public int migrate() {
        log.info("[MIGRATION] Applying {}", SCHEMA_RESOURCE);
        List<String> statements = splitStatements(loadSchema());

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            log.info("[MIGRATION] ✓ {} statement(s) applied", statements.size());
            return statements.size();
        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new StateStoreException("Schema migration failed", e);
        }
    }

    private static String loadSchema() {
        try (InputStream in = SchemaMigration.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new StateStoreException("Schema resource not found: " + SCHEMA_RESOURCE, null);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StateStoreException("Schema resource unreadable: " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Split on ';' after dropping '--' comment lines. The schema has no procedural bodies.
     */
    static List<String> splitStatements(String script) {
        StringBuilder cleaned = new StringBuilder();
        for (String line : script.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.startsWith("--")) {
                cleaned.append(line).append('\n');
            }
        }
        List<String> statements = new ArrayList<>();
        for (String part : cleaned.toString().split(";")) {
            String sql = part.trim();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        return statements;
    }
}
