package de.bsommerfeld.channelstate.db;

import de.bsommerfeld.channelstate.core.domain.ConnectionAction;
import de.bsommerfeld.channelstate.core.domain.ConnectionSnapshot;
import de.bsommerfeld.channelstate.core.domain.HistoryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * SQLite-backed {@link ConnectionStateStore} for production use.
 *
 * <p>
 * All SQL lives in {@code sql/*.sql} files loaded via {@link SqlLoader}; the
 * tables must already exist (see {@link SchemaInitializer}).
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed on every exit
 * path. The store holds no state beyond its configuration and a lock.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #connect} and {@link #disconnect} run their read-modify-write in one
 * transaction spanning both tables. They also hold {@link #writeLock}, so two
 * callers in this JVM never interleave on the status row. Across processes
 * the {@code IMMEDIATE} transaction mode set by
 * {@link SqliteConnectionFactory} provides the same guarantee.
 *
 * <h3>Failure handling</h3>
 * A failed transition is rolled back, then recorded as an ERROR history row
 * in a second, independent transaction. That second write is best effort:
 * if it fails it is logged and dropped, and the caller still receives the
 * original failure as a {@link TransactionException}.
 *
 * <p>
 * Reads never fold storage failures into "not connected". Only a missing
 * status row yields an empty result; everything else is a
 * {@link TransactionException}.
 */
public class SqlConnectionStateStore implements ConnectionStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(SqlConnectionStateStore.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final SqliteConnectionFactory connectionFactory;
    private final TableNames tables;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public SqlConnectionStateStore(SqliteConnectionFactory connectionFactory, TableNames tables, Clock clock) {
        this.connectionFactory = connectionFactory;
        this.tables = tables.validate();
        this.clock = clock;
    }

    Connection getConnection() throws SQLException {
        return connectionFactory.open();
    }

    // =====================================================================
    // State Transitions
    // =====================================================================

    @Override
    public void connect(String channelId, String guildId) {
        ConnectionStateStore.requireChannelId(channelId);

        writeLock.lock();
        try {
            JdbcTransactions.inTransaction(this::getConnection, conn -> {
                // Read only once the write lock is held, so timestamps follow id order
                OffsetDateTime now = OffsetDateTime.now(clock);
                Optional<ConnectionSnapshot> existing = readStatus(conn);
                if (existing.isPresent()) {
                    ConnectionSnapshot old = existing.get();
                    appendHistory(conn, old.channelId(), old.guildId(),
                            ConnectionAction.DISCONNECT, now, SUPERSEDED_MESSAGE);
                    LOG.info("Superseding connection to channel {}", old.channelId());
                }
                upsertStatus(conn, channelId, guildId, now);
                appendHistory(conn, channelId, guildId, ConnectionAction.CONNECT, now, null);
                return null;
            });
            LOG.info("Connected to channel {} (guild {})", channelId, guildId);
        } catch (SQLException | RuntimeException e) {
            recordFailure(channelId, guildId, "Connection failed", e);
            LOG.error("connect({}) failed", channelId, e);
            throw asTransactionFailure("Failed to connect to channel " + channelId, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<ConnectionSnapshot> disconnect() {
        AtomicReference<ConnectionSnapshot> observed = new AtomicReference<>();

        writeLock.lock();
        try {
            Optional<ConnectionSnapshot> removed = JdbcTransactions.inTransaction(this::getConnection, conn -> {
                Optional<ConnectionSnapshot> current = readStatus(conn);
                if (current.isEmpty()) {
                    return current;
                }
                ConnectionSnapshot snapshot = current.get();
                observed.set(snapshot);
                deleteStatus(conn);
                appendHistory(conn, snapshot.channelId(), snapshot.guildId(),
                        ConnectionAction.DISCONNECT, OffsetDateTime.now(clock), null);
                return current;
            });

            if (removed.isPresent()) {
                LOG.info("Disconnected from channel {}", removed.get().channelId());
            } else {
                LOG.debug("Disconnect requested without an active connection.");
            }
            return removed;
        } catch (SQLException | RuntimeException e) {
            ConnectionSnapshot known = observed.get();
            recordFailure(known != null ? known.channelId() : UNKNOWN_CHANNEL,
                    known != null ? known.guildId() : null, "Disconnect failed", e);
            LOG.error("disconnect() failed", e);
            throw asTransactionFailure("Failed to disconnect", e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Appends an ERROR row in its own transaction. Never throws: a failure
     * here must not replace the error that triggered it.
     */
    private void recordFailure(String channelId, String guildId, String prefix, Exception cause) {
        String message = prefix + ": " + cause.getClass().getSimpleName() + ": " + cause.getMessage();
        try {
            JdbcTransactions.inTransaction(this::getConnection, conn -> {
                appendHistory(conn, channelId, guildId, ConnectionAction.ERROR, OffsetDateTime.now(clock), message);
                return null;
            });
        } catch (SQLException | RuntimeException logFailure) {
            LOG.error("Failed to record error for channel {} in history", channelId, logFailure);
        }
    }

    private static ConnectionStateException asTransactionFailure(String message, Exception e) {
        if (e instanceof ConnectionStateException) {
            return (ConnectionStateException) e;
        }
        return new TransactionException(message, e);
    }

    // =====================================================================
    // Queries
    // =====================================================================

    @Override
    public Optional<ConnectionSnapshot> getCurrent() {
        try {
            return JdbcTransactions.withConnection(this::getConnection, this::readStatus);
        } catch (SQLException | DateTimeException e) {
            throw new TransactionException("Failed to read current connection", e);
        }
    }

    @Override
    public List<HistoryEvent> recentHistory(int limit) {
        return queryHistory("select-recent-history", ps -> ps.setInt(1, sqlLimit(limit)));
    }

    @Override
    public List<HistoryEvent> historyForChannel(String channelId, int limit) {
        ConnectionStateStore.requireChannelId(channelId);
        return queryHistory("select-history-for-channel", ps -> {
            ps.setString(1, channelId);
            ps.setInt(2, sqlLimit(limit));
        });
    }

    @FunctionalInterface
    private interface ParameterBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<HistoryEvent> queryHistory(String sqlName, ParameterBinder binder) {
        String sql = SqlLoader.load(sqlName, tables);
        try {
            return JdbcTransactions.withConnection(this::getConnection, conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    binder.bind(ps);

                    List<HistoryEvent> events = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next())
                            events.add(mapHistoryEvent(rs));
                    }
                    return events;
                }
            });
        } catch (SQLException | DateTimeException | IllegalArgumentException e) {
            // IllegalArgumentException: unknown action value in a history row
            throw new TransactionException("Failed to read connection history", e);
        }
    }

    // SQLite treats a negative LIMIT as "no limit"
    private static int sqlLimit(int limit) {
        return limit > 0 ? limit : -1;
    }

    // =====================================================================
    // Statement Steps
    // =====================================================================

    Optional<ConnectionSnapshot> readStatus(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-status", tables));
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next())
                return Optional.empty();
            return Optional.of(new ConnectionSnapshot(
                    rs.getString("channel_id"),
                    rs.getString("guild_id"),
                    parseTimestamp(rs.getString("connected_at")),
                    parseTimestamp(rs.getString("last_updated"))));
        }
    }

    void upsertStatus(Connection conn, String channelId, String guildId, OffsetDateTime now)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-status", tables))) {
            ps.setString(1, channelId);
            ps.setString(2, guildId);
            ps.setString(3, TIMESTAMP.format(now));
            ps.setString(4, TIMESTAMP.format(now));
            ps.executeUpdate();
        }
    }

    void deleteStatus(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("delete-status", tables))) {
            ps.executeUpdate();
        }
    }

    void appendHistory(Connection conn, String channelId, String guildId, ConnectionAction action,
            OffsetDateTime timestamp, String errorMessage) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-history", tables))) {
            ps.setString(1, channelId);
            ps.setString(2, guildId);
            ps.setString(3, action.name());
            ps.setString(4, TIMESTAMP.format(timestamp));
            ps.setString(5, errorMessage);
            ps.executeUpdate();
        }
        LOG.debug("[DB] History {} for channel {}", action, channelId);
    }

    private HistoryEvent mapHistoryEvent(ResultSet rs) throws SQLException {
        return new HistoryEvent(
                rs.getLong("id"),
                rs.getString("channel_id"),
                rs.getString("guild_id"),
                ConnectionAction.valueOf(rs.getString("action")),
                parseTimestamp(rs.getString("timestamp")),
                rs.getString("error_message"));
    }

    private static OffsetDateTime parseTimestamp(String value) {
        return OffsetDateTime.parse(value, TIMESTAMP);
    }
}
