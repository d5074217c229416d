package io.slobengine.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.zaxxer.hikari.HikariDataSource;
import io.slobengine.application.port.output.StateStore;
import io.slobengine.application.port.output.StateStoreException;
import io.slobengine.domain.data.Candle;
import io.slobengine.domain.order.BracketOrder;
import io.slobengine.domain.setup.Direction;
import io.slobengine.domain.setup.SetupSnapshot;
import io.slobengine.domain.trade.ExitReason;
import io.slobengine.domain.trade.SessionState;
import io.slobengine.domain.trade.Trade;
import io.slobengine.domain.trade.TradeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PostgreSQL implementation of StateStore.
 *
 * Setups and brackets are stored as JSONB documents next to a few indexed columns; trades,
 * candles and session state are plain columns. Writes for one setup id are serialized with a
 * keyed lock so a snapshot save never interleaves with the live-path save of the same setup.
 * Schema: {@code db/schema.sql}.
 */
public final class PostgresStateStore implements StateStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresStateStore.class);

    private final DataSource dataSource;
    private final ObjectMapper mapper;
    private final ConcurrentMap<String, Object> setupLocks = new ConcurrentHashMap<>();
    private final AtomicLong corruptedRows = new AtomicLong();

    public PostgresStateStore(DataSource dataSource) {
        this(dataSource, defaultMapper());
    }

    public PostgresStateStore(DataSource dataSource, ObjectMapper mapper) {
        this.dataSource = dataSource;
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // ═══════════════════════════════════════════════════════════════
    // SETUPS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void saveSetup(SetupSnapshot setup) {
        String sql = """
            INSERT INTO setups (id, symbol, direction, state, snapshot, updated_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (id)
            DO UPDATE SET
                state = EXCLUDED.state,
                snapshot = EXCLUDED.snapshot,
                updated_at = EXCLUDED.updated_at
            WHERE setups.updated_at <= EXCLUDED.updated_at
              AND (setups.state NOT IN ('SETUP_COMPLETE', 'INVALIDATED')
                   OR EXCLUDED.state IN ('SETUP_COMPLETE', 'INVALIDATED'))
            """;

        synchronized (setupLocks.computeIfAbsent(setup.id(), k -> new Object())) {
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement ps = conn.prepareStatement(sql)) {

                ps.setString(1, setup.id());
                ps.setString(2, setup.symbol());
                ps.setString(3, setup.direction().name());
                ps.setString(4, setup.state().name());
                ps.setString(5, mapper.writeValueAsString(setup));
                ps.setTimestamp(6, timestamp(setup.updatedAt() != null ? setup.updatedAt() : Instant.now()));
                if (ps.executeUpdate() == 0) {
                    log.debug("Setup {} not overwritten: stored row is newer or terminal", setup.id());
                }

            } catch (Exception e) {
                log.error("Failed to save setup {}: {}", setup.id(), e.getMessage(), e);
                throw new StateStoreException("Failed to save setup " + setup.id(), e);
            }
        }

        if (!setup.isActive()) {
            setupLocks.remove(setup.id());
        }
    }

    @Override
    public List<SetupSnapshot> loadActiveSetups() {
        String sql = """
            SELECT id, snapshot
            FROM setups
            WHERE state NOT IN ('SETUP_COMPLETE', 'INVALIDATED')
            ORDER BY updated_at ASC
            """;

        List<SetupSnapshot> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                String id = rs.getString("id");
                try {
                    result.add(mapper.readValue(rs.getString("snapshot"), SetupSnapshot.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    corruptedRows.incrementAndGet();
                    log.error("Skipping unreadable setup row {}: {}", id, e.getMessage());
                }
            }

        } catch (SQLException e) {
            log.error("Failed to load active setups: {}", e.getMessage(), e);
            throw new StateStoreException("Failed to load active setups", e);
        }

        return result;
    }

    // ═══════════════════════════════════════════════════════════════
    // TRADES
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void saveTrade(Trade trade) {
        String sql = """
            INSERT INTO trades (
                trade_id, setup_id, symbol, direction, entry_price, exit_price, size,
                status, exit_reason, pnl, opened_at, closed_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (trade_id)
            DO UPDATE SET
                exit_price = EXCLUDED.exit_price,
                status = EXCLUDED.status,
                exit_reason = EXCLUDED.exit_reason,
                pnl = EXCLUDED.pnl,
                closed_at = EXCLUDED.closed_at
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, trade.tradeId());
            ps.setString(2, trade.setupId());
            ps.setString(3, trade.symbol());
            ps.setString(4, trade.direction().name());
            ps.setBigDecimal(5, trade.entryPrice());
            ps.setBigDecimal(6, trade.exitPrice());
            ps.setInt(7, trade.size());
            ps.setString(8, trade.status().name());
            ps.setString(9, trade.exitReason() != null ? trade.exitReason().name() : null);
            ps.setBigDecimal(10, trade.pnl());
            ps.setTimestamp(11, timestamp(trade.openedAt()));
            ps.setTimestamp(12, timestamp(trade.closedAt()));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to save trade {}: {}", trade.tradeId(), e.getMessage(), e);
            throw new StateStoreException("Failed to save trade " + trade.tradeId(), e);
        }
    }

    @Override
    public List<Trade> loadOpenTrades() {
        String sql = """
            SELECT trade_id, setup_id, symbol, direction, entry_price, exit_price, size,
                   status, exit_reason, pnl, opened_at, closed_at
            FROM trades
            WHERE status = 'OPEN'
            ORDER BY opened_at ASC
            """;

        List<Trade> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                try {
                    result.add(mapTrade(rs));
                } catch (IllegalArgumentException e) {
                    corruptedRows.incrementAndGet();
                    log.error("Skipping unreadable trade row {}: {}", rs.getString("trade_id"), e.getMessage());
                }
            }

        } catch (SQLException e) {
            log.error("Failed to load open trades: {}", e.getMessage(), e);
            throw new StateStoreException("Failed to load open trades", e);
        }

        return result;
    }

    private Trade mapTrade(ResultSet rs) throws SQLException {
        String exitReason = rs.getString("exit_reason");
        return new Trade(
            rs.getString("trade_id"),
            rs.getString("setup_id"),
            rs.getString("symbol"),
            Direction.valueOf(rs.getString("direction")),
            rs.getBigDecimal("entry_price"),
            rs.getBigDecimal("exit_price"),
            rs.getInt("size"),
            TradeStatus.valueOf(rs.getString("status")),
            exitReason != null ? ExitReason.valueOf(exitReason) : null,
            rs.getBigDecimal("pnl"),
            instant(rs.getTimestamp("opened_at")),
            instant(rs.getTimestamp("closed_at"))
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // BRACKETS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void saveBracket(BracketOrder bracket) {
        String sql = """
            INSERT INTO brackets (setup_id, idempotency_key, symbol, status, payload, submitted_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (setup_id)
            DO UPDATE SET
                status = EXCLUDED.status,
                payload = EXCLUDED.payload
            """;

        synchronized (setupLocks.computeIfAbsent(bracket.setupId(), k -> new Object())) {
            try (Connection conn = dataSource.getConnection();
                 PreparedStatement ps = conn.prepareStatement(sql)) {

                ps.setString(1, bracket.setupId());
                ps.setString(2, bracket.idempotencyKey());
                ps.setString(3, bracket.symbol());
                ps.setString(4, bracket.status().name());
                ps.setString(5, mapper.writeValueAsString(bracket));
                ps.setTimestamp(6, timestamp(bracket.submittedAt()));
                ps.executeUpdate();

            } catch (Exception e) {
                log.error("Failed to save bracket {}: {}", bracket.idempotencyKey(), e.getMessage(), e);
                throw new StateStoreException("Failed to save bracket " + bracket.idempotencyKey(), e);
            }
        }
    }

    @Override
    public List<BracketOrder> loadBrackets() {
        String sql = """
            SELECT setup_id, payload
            FROM brackets
            ORDER BY submitted_at ASC
            """;

        List<BracketOrder> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                String setupId = rs.getString("setup_id");
                try {
                    result.add(mapper.readValue(rs.getString("payload"), BracketOrder.class));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    corruptedRows.incrementAndGet();
                    log.error("Skipping unreadable bracket row {}: {}", setupId, e.getMessage());
                }
            }

        } catch (SQLException e) {
            log.error("Failed to load brackets: {}", e.getMessage(), e);
            throw new StateStoreException("Failed to load brackets", e);
        }

        return result;
    }

    // ═══════════════════════════════════════════════════════════════
    // CANDLES
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void saveCandle(Candle candle) {
        String sql = """
            INSERT INTO candles (symbol, ts, open, high, low, close, volume, tick_count)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (symbol, ts)
            DO UPDATE SET
                open = EXCLUDED.open,
                high = EXCLUDED.high,
                low = EXCLUDED.low,
                close = EXCLUDED.close,
                volume = EXCLUDED.volume,
                tick_count = EXCLUDED.tick_count
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, candle.symbol());
            ps.setTimestamp(2, Timestamp.from(candle.timestamp()));
            ps.setBigDecimal(3, candle.open());
            ps.setBigDecimal(4, candle.high());
            ps.setBigDecimal(5, candle.low());
            ps.setBigDecimal(6, candle.close());
            ps.setLong(7, candle.volume());
            ps.setInt(8, candle.tickCount());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to save candle: {}", e.getMessage());
            throw new StateStoreException("Failed to save candle", e);
        }
    }

    @Override
    public List<Candle> loadCandles(String symbol, Instant from, Instant to) {
        String sql = """
            SELECT symbol, ts, open, high, low, close, volume, tick_count
            FROM candles
            WHERE symbol = ? AND ts >= ? AND ts <= ?
            ORDER BY ts ASC
            """;

        List<Candle> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setTimestamp(2, Timestamp.from(from));
            ps.setTimestamp(3, Timestamp.from(to));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapCandle(rs));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to load candles: {}", e.getMessage());
            throw new StateStoreException("Failed to load candles", e);
        }

        return result;
    }

    private Candle mapCandle(ResultSet rs) throws SQLException {
        return new Candle(
            rs.getString("symbol"),
            rs.getTimestamp("ts").toInstant(),
            rs.getBigDecimal("open"),
            rs.getBigDecimal("high"),
            rs.getBigDecimal("low"),
            rs.getBigDecimal("close"),
            rs.getLong("volume"),
            rs.getInt("tick_count")
        );
    }

    // ═══════════════════════════════════════════════════════════════
    // SESSION
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void saveSessionState(SessionState state) {
        String sql = """
            INSERT INTO session_state (
                trading_date, session_high, session_low, equity, peak_equity,
                trades_today, pnl_today, trading_halted, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (trading_date)
            DO UPDATE SET
                session_high = EXCLUDED.session_high,
                session_low = EXCLUDED.session_low,
                equity = EXCLUDED.equity,
                peak_equity = EXCLUDED.peak_equity,
                trades_today = EXCLUDED.trades_today,
                pnl_today = EXCLUDED.pnl_today,
                trading_halted = EXCLUDED.trading_halted,
                updated_at = EXCLUDED.updated_at
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDate(1, Date.valueOf(state.tradingDate()));
            ps.setBigDecimal(2, state.sessionHigh());
            ps.setBigDecimal(3, state.sessionLow());
            ps.setBigDecimal(4, state.equity());
            ps.setBigDecimal(5, state.peakEquity());
            ps.setInt(6, state.tradesToday());
            ps.setBigDecimal(7, state.pnlToday());
            ps.setBoolean(8, state.tradingHalted());
            ps.setTimestamp(9, timestamp(state.updatedAt()));
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to save session state {}: {}", state.tradingDate(), e.getMessage(), e);
            throw new StateStoreException("Failed to save session state", e);
        }
    }

    @Override
    public Optional<SessionState> loadSessionState(LocalDate tradingDate) {
        String sql = """
            SELECT trading_date, session_high, session_low, equity, peak_equity,
                   trades_today, pnl_today, trading_halted, updated_at
            FROM session_state
            WHERE trading_date = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDate(1, Date.valueOf(tradingDate));

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new SessionState(
                        rs.getDate("trading_date").toLocalDate(),
                        rs.getBigDecimal("session_high"),
                        rs.getBigDecimal("session_low"),
                        rs.getBigDecimal("equity"),
                        rs.getBigDecimal("peak_equity"),
                        rs.getInt("trades_today"),
                        rs.getBigDecimal("pnl_today"),
                        rs.getBoolean("trading_halted"),
                        instant(rs.getTimestamp("updated_at"))
                    ));
                }
            }

        } catch (SQLException e) {
            log.error("Failed to load session state {}: {}", tradingDate, e.getMessage(), e);
            throw new StateStoreException("Failed to load session state", e);
        }

        return Optional.empty();
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    public long getCorruptedRows() {
        return corruptedRows.get();
    }

    @Override
    public void shutdown() {
        if (dataSource instanceof HikariDataSource) {
            ((HikariDataSource) dataSource).close();
            log.info("Connection pool closed");
        }
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
