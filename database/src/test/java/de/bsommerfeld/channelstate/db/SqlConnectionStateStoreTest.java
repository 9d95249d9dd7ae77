package de.bsommerfeld.channelstate.db;

import de.bsommerfeld.channelstate.core.domain.ConnectionAction;
import de.bsommerfeld.channelstate.core.domain.ConnectionSnapshot;
import de.bsommerfeld.channelstate.core.domain.HistoryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.spy;

/**
 * Integration tests for SqlConnectionStateStore against a real temporary
 * SQLite database. Storage failures are injected by overriding the
 * package-private statement steps.
 */
class SqlConnectionStateStoreTest {

    @TempDir
    Path tempDir;

    private SqliteConnectionFactory connectionFactory;
    private SqlConnectionStateStore store;

    @BeforeEach
    void setUp() {
        connectionFactory = new SqliteConnectionFactory(tempDir.resolve("state.db"), Duration.ofSeconds(5));
        new SchemaInitializer(connectionFactory, TableNames.defaults()).ensureSchema();
        store = new SqlConnectionStateStore(connectionFactory, TableNames.defaults(), Clock.systemUTC());
    }

    // -- Connect --

    @Test
    void connect_shouldRoundTripThroughGetCurrent() {
        store.connect("c1", "g1");

        ConnectionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals("c1", current.channelId());
        assertEquals("g1", current.guildId());
        assertEquals(current.connectedAt(), current.lastUpdated());
        assertTrue(store.isConnected());
    }

    @Test
    void connect_shouldAcceptMissingGuild() {
        store.connect("c1", null);

        ConnectionSnapshot current = store.getCurrent().orElseThrow();
        assertNull(current.guildId());
        assertNull(store.recentHistory(0).get(0).guildId());
    }

    @Test
    void connect_shouldAppendExactlyOneConnectRowWhenDisconnected() {
        store.connect("c1", "g1");

        List<HistoryEvent> history = store.recentHistory(0);
        assertEquals(1, history.size());
        assertEquals(ConnectionAction.CONNECT, history.get(0).action());
        assertEquals("c1", history.get(0).channelId());
        assertNull(history.get(0).errorMessage());
    }

    @Test
    void connect_shouldSupersedeExistingConnection() {
        store.connect("chan-A", "guild-1");
        assertEquals("chan-A", store.getCurrent().orElseThrow().channelId());

        store.connect("chan-B", "guild-1");

        List<HistoryEvent> history = store.recentHistory(0);
        assertEquals(3, history.size());
        assertEvent(history.get(0), ConnectionAction.CONNECT, "chan-A");
        assertEvent(history.get(1), ConnectionAction.DISCONNECT, "chan-A");
        assertEvent(history.get(2), ConnectionAction.CONNECT, "chan-B");
        assertEquals(ConnectionStateStore.SUPERSEDED_MESSAGE, history.get(1).errorMessage());
        assertEquals("guild-1", history.get(1).guildId());

        ConnectionSnapshot current = store.getCurrent().orElseThrow();
        assertEquals("chan-B", current.channelId());
        assertEquals("guild-1", current.guildId());
        assertEquals(1, countStatusRows());
    }

    @Test
    void connect_shouldRefreshConnectedAtWhenReconnectingSameChannel() {
        store.connect("c1", "g1");
        OffsetDateTime first = store.getCurrent().orElseThrow().connectedAt();

        store.connect("c1", "g1");

        ConnectionSnapshot current = store.getCurrent().orElseThrow();
        assertFalse(current.connectedAt().isBefore(first));
        assertEquals(3, store.recentHistory(0).size());
    }

    @Test
    void connect_shouldRejectBlankChannelWithoutTouchingHistory() {
        assertThrows(ValidationException.class, () -> store.connect("", "g1"));
        assertThrows(ValidationException.class, () -> store.connect("   ", "g1"));
        assertThrows(ValidationException.class, () -> store.connect(null, "g1"));

        assertTrue(store.recentHistory(0).isEmpty());
        assertFalse(store.isConnected());
    }

    // -- Disconnect --

    @Test
    void disconnect_shouldBeNoOpWhenNotConnected() {
        assertFalse(store.isConnected());

        Optional<ConnectionSnapshot> removed = store.disconnect();

        assertTrue(removed.isEmpty());
        assertTrue(store.recentHistory(0).isEmpty());
    }

    @Test
    void disconnect_shouldReturnRemovedSnapshotAndLogOnce() {
        store.connect("c1", "g1");
        ConnectionSnapshot before = store.getCurrent().orElseThrow();

        Optional<ConnectionSnapshot> removed = store.disconnect();

        assertEquals(Optional.of(before), removed);
        assertFalse(store.isConnected());
        assertEquals(0, countStatusRows());

        List<HistoryEvent> history = store.recentHistory(0);
        assertEquals(2, history.size());
        assertEvent(history.get(1), ConnectionAction.DISCONNECT, "c1");
        assertNull(history.get(1).errorMessage());
    }

    @Test
    void disconnect_twiceShouldOnlyLogOnce() {
        store.connect("c1", "g1");
        store.disconnect();
        int afterFirst = store.recentHistory(0).size();

        assertTrue(store.disconnect().isEmpty());
        assertEquals(afterFirst, store.recentHistory(0).size());
    }

    // -- History --

    @Test
    void history_idsShouldStrictlyIncreaseInCallOrder() {
        store.connect("a", "g");
        store.connect("b", "g");
        store.disconnect();
        store.disconnect();
        store.connect("c", null);

        List<HistoryEvent> history = store.recentHistory(0);
        assertEquals(5, history.size());
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i).id() > history.get(i - 1).id());
            assertFalse(history.get(i).timestamp().isBefore(history.get(i - 1).timestamp()));
        }
    }

    @Test
    void recentHistory_shouldReturnNewestEventsOldestFirst() {
        store.connect("a", null);
        store.connect("b", null);
        store.connect("c", null);

        List<HistoryEvent> lastTwo = store.recentHistory(2);
        assertEquals(2, lastTwo.size());
        assertEvent(lastTwo.get(0), ConnectionAction.DISCONNECT, "b");
        assertEvent(lastTwo.get(1), ConnectionAction.CONNECT, "c");
    }

    @Test
    void historyForChannel_shouldFilterByChannel() {
        store.connect("a", null);
        store.connect("b", null);
        store.disconnect();

        List<HistoryEvent> forA = store.historyForChannel("a", 0);
        assertEquals(2, forA.size());
        assertTrue(forA.stream().allMatch(e -> e.channelId().equals("a")));

        assertEquals(1, store.historyForChannel("b", 1).size());
        assertEquals(ConnectionAction.DISCONNECT, store.historyForChannel("b", 1).get(0).action());
        assertTrue(store.historyForChannel("unknown", 0).isEmpty());
    }

    @Test
    void historyForChannel_shouldRejectBlankChannel() {
        store.connect("5", null);

        assertThrows(ValidationException.class, () -> store.historyForChannel(null, 5));
        assertThrows(ValidationException.class, () -> store.historyForChannel(" ", 5));
    }

    @Test
    void recentHistory_shouldReportUnknownActionAsTransactionFailure() throws SQLException {
        try (Connection conn = connectionFactory.open();
                Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("CREATE TABLE legacy_history (id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "channel_id TEXT NOT NULL, guild_id TEXT, action TEXT NOT NULL, "
                    + "timestamp TEXT NOT NULL, error_message TEXT)");
            stmt.executeUpdate("INSERT INTO legacy_history (channel_id, action, timestamp) "
                    + "VALUES ('c1', 'RECONNECT', '2025-06-01T10:15:30Z')");
        }
        SqlConnectionStateStore legacy = new SqlConnectionStateStore(connectionFactory,
                new TableNames(TableNames.defaults().statusTable(), "legacy_history"), Clock.systemUTC());

        TransactionException ex = assertThrows(TransactionException.class, () -> legacy.recentHistory(0));
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    // -- Failure Handling --

    @Test
    void connect_shouldRollBackAndRecordErrorWhenUpsertFails() {
        store.connect("chan-A", "guild-1");
        SqlConnectionStateStore failing = storeFailingOnUpsert();

        TransactionException ex = assertThrows(TransactionException.class,
                () -> failing.connect("chan-B", "guild-2"));
        assertInstanceOf(SQLException.class, ex.getCause());

        // The superseding DISCONNECT was rolled back together with the upsert
        assertEquals("chan-A", store.getCurrent().orElseThrow().channelId());
        List<HistoryEvent> history = store.recentHistory(0);
        assertEquals(2, history.size());
        assertEvent(history.get(0), ConnectionAction.CONNECT, "chan-A");

        HistoryEvent error = history.get(1);
        assertEvent(error, ConnectionAction.ERROR, "chan-B");
        assertEquals("guild-2", error.guildId());
        assertEquals("Connection failed: SQLException: disk I/O error", error.errorMessage());
    }

    @Test
    void connect_shouldNotRaiseWhenErrorRecordingAlsoFails() {
        SqlConnectionStateStore failing = new SqlConnectionStateStore(
                connectionFactory, TableNames.defaults(), Clock.systemUTC()) {
            @Override
            void upsertStatus(Connection conn, String channelId, String guildId, OffsetDateTime now)
                    throws SQLException {
                throw new SQLException("disk I/O error");
            }

            @Override
            void appendHistory(Connection conn, String channelId, String guildId, ConnectionAction action,
                    OffsetDateTime timestamp, String errorMessage) throws SQLException {
                if (action == ConnectionAction.ERROR)
                    throw new SQLException("history unavailable");
                super.appendHistory(conn, channelId, guildId, action, timestamp, errorMessage);
            }
        };

        TransactionException ex = assertThrows(TransactionException.class, () -> failing.connect("c1", "g1"));
        assertEquals("disk I/O error", ex.getCause().getMessage());
        assertFalse(store.isConnected());
        assertTrue(store.recentHistory(0).isEmpty());
    }

    @Test
    void disconnect_shouldRecordErrorWithKnownChannel() {
        store.connect("c1", "g1");
        SqlConnectionStateStore failing = new SqlConnectionStateStore(
                connectionFactory, TableNames.defaults(), Clock.systemUTC()) {
            @Override
            void deleteStatus(Connection conn) throws SQLException {
                throw new SQLException("database is locked");
            }
        };

        assertThrows(TransactionException.class, failing::disconnect);

        assertEquals("c1", store.getCurrent().orElseThrow().channelId());
        HistoryEvent last = lastEvent();
        assertEvent(last, ConnectionAction.ERROR, "c1");
        assertEquals("g1", last.guildId());
        assertEquals("Disconnect failed: SQLException: database is locked", last.errorMessage());
    }

    @Test
    void disconnect_shouldRecordErrorWithPlaceholderWhenNothingWasRead() {
        SqlConnectionStateStore failing = new SqlConnectionStateStore(
                connectionFactory, TableNames.defaults(), Clock.systemUTC()) {
            @Override
            Optional<ConnectionSnapshot> readStatus(Connection conn) throws SQLException {
                throw new SQLException("no such table");
            }
        };

        assertThrows(TransactionException.class, failing::disconnect);

        HistoryEvent last = lastEvent();
        assertEvent(last, ConnectionAction.ERROR, ConnectionStateStore.UNKNOWN_CHANNEL);
        assertNull(last.guildId());
    }

    @Test
    void connect_shouldKeepOriginalErrorWhenRollbackAndCloseFail() {
        SqlConnectionStateStore failing = new SqlConnectionStateStore(
                connectionFactory, TableNames.defaults(), Clock.systemUTC()) {
            @Override
            Connection getConnection() throws SQLException {
                return unreliable(super.getConnection());
            }

            @Override
            void upsertStatus(Connection conn, String channelId, String guildId, OffsetDateTime now)
                    throws SQLException {
                throw new SQLException("disk I/O error");
            }
        };

        TransactionException ex = assertThrows(TransactionException.class, () -> failing.connect("c1", null));
        assertEquals("disk I/O error", ex.getCause().getMessage());
    }

    @Test
    void getCurrent_shouldSwallowCloseFailure() {
        store.connect("c1", "g1");
        SqlConnectionStateStore flaky = new SqlConnectionStateStore(
                connectionFactory, TableNames.defaults(), Clock.systemUTC()) {
            @Override
            Connection getConnection() throws SQLException {
                return unreliable(super.getConnection());
            }
        };

        assertEquals("c1", flaky.getCurrent().orElseThrow().channelId());
    }

    @Test
    void getCurrent_shouldPropagateStorageFailures() {
        SqlConnectionStateStore failing = new SqlConnectionStateStore(
                connectionFactory, TableNames.defaults(), Clock.systemUTC()) {
            @Override
            Connection getConnection() throws SQLException {
                throw new SQLException("unable to open database file");
            }
        };

        assertThrows(TransactionException.class, failing::getCurrent);
        assertThrows(TransactionException.class, failing::isConnected);
        assertThrows(TransactionException.class, () -> failing.recentHistory(10));
    }

    @Test
    void constructor_shouldRejectInvalidTableNames() {
        assertThrows(ValidationException.class, () -> new SqlConnectionStateStore(
                connectionFactory, new TableNames("status; DROP TABLE x", "history"), Clock.systemUTC()));
    }

    // -- Concurrency --

    @Test
    void concurrentConnects_shouldLeaveOneActiveConnectionAndFullHistory() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                String channel = "chan-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    store.connect(channel, "guild");
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures)
                f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, countStatusRows());

        List<HistoryEvent> history = store.recentHistory(0);
        assertEquals(callers * 2 - 1, history.size());

        // Every CONNECT after the first is preceded by the DISCONNECT of the
        // connection it replaced
        String active = null;
        for (HistoryEvent event : history) {
            if (event.action() == ConnectionAction.DISCONNECT) {
                assertEquals(active, event.channelId());
                assertEquals(ConnectionStateStore.SUPERSEDED_MESSAGE, event.errorMessage());
                active = null;
            } else {
                assertEquals(ConnectionAction.CONNECT, event.action());
                assertNull(active, "two connections active at once");
                active = event.channelId();
            }
        }
        assertEquals(active, store.getCurrent().orElseThrow().channelId());
    }

    @Test
    void connect_shouldStampRowsInIdOrderWhenClockReadingIsDelayed() throws Exception {
        StallingClock clock = new StallingClock("slow-caller");
        SqlConnectionStateStore timed = new SqlConnectionStateStore(connectionFactory, TableNames.defaults(), clock);
        ExecutorService slowCaller = Executors.newSingleThreadExecutor(r -> new Thread(r, "slow-caller"));
        try {
            CompletableFuture<Void> slow = CompletableFuture.runAsync(() -> timed.connect("chan-A", null), slowCaller);
            assertTrue(clock.readingTaken.await(10, TimeUnit.SECONDS));

            timed.connect("chan-B", null);
            slow.get(30, TimeUnit.SECONDS);
        } finally {
            slowCaller.shutdownNow();
        }

        List<HistoryEvent> history = store.recentHistory(0);
        assertEquals(3, history.size());
        assertEvent(history.get(0), ConnectionAction.CONNECT, "chan-A");
        assertEvent(history.get(1), ConnectionAction.DISCONNECT, "chan-A");
        assertEvent(history.get(2), ConnectionAction.CONNECT, "chan-B");
        for (int i = 1; i < history.size(); i++) {
            assertFalse(history.get(i).timestamp().isBefore(history.get(i - 1).timestamp()),
                    "row " + history.get(i).id() + " is stamped before row " + history.get(i - 1).id());
        }
    }

    // -- Helpers --

    private SqlConnectionStateStore storeFailingOnUpsert() {
        return new SqlConnectionStateStore(connectionFactory, TableNames.defaults(), Clock.systemUTC()) {
            @Override
            void upsertStatus(Connection conn, String channelId, String guildId, OffsetDateTime now)
                    throws SQLException {
                throw new SQLException("disk I/O error");
            }
        };
    }

    private HistoryEvent lastEvent() {
        List<HistoryEvent> last = store.recentHistory(1);
        assertEquals(1, last.size());
        return last.get(0);
    }

    private int countStatusRows() {
        try (Connection conn = connectionFactory.open();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM connection_status")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void assertEvent(HistoryEvent event, ConnectionAction action, String channelId) {
        assertEquals(action, event.action());
        assertEquals(channelId, event.channelId());
    }

    /**
     * Spies on a real connection so that rollback and close throw after doing
     * their work. Used to check that neither failure masks the primary result.
     */
    private static Connection unreliable(Connection delegate) throws SQLException {
        Connection conn = spy(delegate);
        doAnswer(invocation -> {
            invocation.callRealMethod();
            throw new SQLException("rollback failed");
        }).when(conn).rollback();
        doAnswer(invocation -> {
            invocation.callRealMethod();
            throw new SQLException("close failed");
        }).when(conn).close();
        return conn;
    }

    /**
     * Hands out one second later on every reading. On the named thread it
     * stalls after taking the reading, like a caller descheduled between
     * reading the time and writing it.
     */
    private static final class StallingClock extends Clock {

        private final Instant base = Instant.parse("2025-06-01T10:00:00Z");
        private final AtomicLong readings = new AtomicLong();
        private final String stallingThread;
        final CountDownLatch readingTaken = new CountDownLatch(1);

        StallingClock(String stallingThread) {
            this.stallingThread = stallingThread;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            Instant reading = base.plusSeconds(readings.incrementAndGet());
            if (Thread.currentThread().getName().equals(stallingThread)) {
                readingTaken.countDown();
                try {
                    Thread.sleep(500);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return reading;
        }
    }
}
