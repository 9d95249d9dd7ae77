package de.bsommerfeld.channelstate.db;

import de.bsommerfeld.channelstate.core.domain.ConnectionSnapshot;
import de.bsommerfeld.channelstate.core.domain.HistoryEvent;

import java.util.List;
import java.util.Optional;

/**
 * Tracks the single active channel connection and its audit history.
 *
 * <p>
 * At most one connection is active at any time. Every state transition
 * appends to the history, which is never rewritten. Implementations must be
 * thread-safe: callers may invoke any method concurrently.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link SqlConnectionStateStore}: production persistence via SQLite</li>
 * <li>{@link InMemoryConnectionStateStore}: TEST mode, no disk I/O</li>
 * </ul>
 * Switching between them is done in {@link ConnectionStateModule}.
 */
public interface ConnectionStateStore {

    /** Error message recorded on the DISCONNECT row of a superseded connection. */
    String SUPERSEDED_MESSAGE = "superseded by new connection";

    /** Channel recorded on ERROR rows when no channel was known. */
    String UNKNOWN_CHANNEL = "UNKNOWN";

    /**
     * Makes {@code channelId} the active connection. An existing connection is
     * first logged as DISCONNECT with {@link #SUPERSEDED_MESSAGE}, then
     * replaced, then CONNECT is logged; all of it atomically.
     *
     * @param guildId optional grouping ID, may be {@code null}
     * @throws ValidationException  if {@code channelId} is null or blank
     * @throws TransactionException if the change could not be committed
     */
    void connect(String channelId, String guildId);

    /**
     * Ends the active connection, if any.
     *
     * @return the connection as it was right before removal, or empty if
     *         nothing was connected (in which case no history is written)
     * @throws TransactionException if the change could not be committed
     */
    Optional<ConnectionSnapshot> disconnect();

    /**
     * @return the active connection, or empty if disconnected
     * @throws TransactionException if the status could not be read
     */
    Optional<ConnectionSnapshot> getCurrent();

    default boolean isConnected() {
        return getCurrent().isPresent();
    }

    /**
     * Returns the newest {@code limit} history events, oldest first.
     * A {@code limit} of zero or less returns the complete history.
     */
    List<HistoryEvent> recentHistory(int limit);

    /**
     * Same as {@link #recentHistory(int)}, restricted to one channel.
     *
     * @throws ValidationException if {@code channelId} is null or blank
     */
    List<HistoryEvent> historyForChannel(String channelId, int limit);

    static String requireChannelId(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            throw new ValidationException("channelId must not be empty");
        }
        return channelId;
    }
}
