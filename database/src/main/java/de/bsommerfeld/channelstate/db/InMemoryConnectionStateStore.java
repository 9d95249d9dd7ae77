package de.bsommerfeld.channelstate.db;

import de.bsommerfeld.channelstate.core.domain.ConnectionAction;
import de.bsommerfeld.channelstate.core.domain.ConnectionSnapshot;
import de.bsommerfeld.channelstate.core.domain.HistoryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory {@link ConnectionStateStore} for TEST mode: no SQLite, no schema,
 * nothing survives a restart. Bound by {@link ConnectionStateModule} when the
 * application runs with {@code channelstate.mode=TEST}.
 *
 * <p>
 * Transitions and history follow exactly the same rules as
 * {@link SqlConnectionStateStore}. All methods synchronize on the instance,
 * which plays the role of the database transaction.
 */
public class InMemoryConnectionStateStore implements ConnectionStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryConnectionStateStore.class);

    private final Clock clock;
    private final List<HistoryEvent> history = new ArrayList<>();
    private ConnectionSnapshot current;
    private long nextId = 1;

    public InMemoryConnectionStateStore(Clock clock) {
        this.clock = clock;
        LOG.warn("##############################################################");
        LOG.warn("#  TEST MODE ENABLED: Connection state persistence is DISABLED #");
        LOG.warn("##############################################################");
    }

    @Override
    public synchronized void connect(String channelId, String guildId) {
        ConnectionStateStore.requireChannelId(channelId);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (current != null) {
            append(current.channelId(), current.guildId(), ConnectionAction.DISCONNECT, now, SUPERSEDED_MESSAGE);
        }
        current = new ConnectionSnapshot(channelId, guildId, now, now);
        append(channelId, guildId, ConnectionAction.CONNECT, now, null);
    }

    @Override
    public synchronized Optional<ConnectionSnapshot> disconnect() {
        if (current == null) {
            return Optional.empty();
        }
        ConnectionSnapshot removed = current;
        current = null;
        append(removed.channelId(), removed.guildId(), ConnectionAction.DISCONNECT, OffsetDateTime.now(clock), null);
        return Optional.of(removed);
    }

    @Override
    public synchronized Optional<ConnectionSnapshot> getCurrent() {
        return Optional.ofNullable(current);
    }

    @Override
    public synchronized List<HistoryEvent> recentHistory(int limit) {
        return tail(history, limit);
    }

    @Override
    public synchronized List<HistoryEvent> historyForChannel(String channelId, int limit) {
        ConnectionStateStore.requireChannelId(channelId);
        List<HistoryEvent> matching = history.stream()
                .filter(e -> e.channelId().equals(channelId))
                .collect(Collectors.toList());
        return tail(matching, limit);
    }

    private void append(String channelId, String guildId, ConnectionAction action,
            OffsetDateTime at, String message) {
        history.add(new HistoryEvent(nextId++, channelId, guildId, action, at, message));
    }

    private static List<HistoryEvent> tail(List<HistoryEvent> events, int limit) {
        if (limit > 0 && events.size() > limit) {
            return new ArrayList<>(events.subList(events.size() - limit, events.size()));
        }
        return new ArrayList<>(events);
    }
}
