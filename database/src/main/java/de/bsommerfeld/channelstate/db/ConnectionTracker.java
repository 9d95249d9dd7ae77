package de.bsommerfeld.channelstate.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.channelstate.core.domain.ConnectionSnapshot;
import de.bsommerfeld.channelstate.core.domain.HistoryEvent;
import de.bsommerfeld.channelstate.core.event.ConnectionEventBus;
import de.bsommerfeld.channelstate.core.event.ConnectionEvents.ChannelConnectedEvent;
import de.bsommerfeld.channelstate.core.event.ConnectionEvents.ChannelDisconnectedEvent;
import de.bsommerfeld.channelstate.core.event.ConnectionEvents.ConnectionFailedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Asynchronous entry point for the command layer.
 *
 * <p>
 * Callers that handle many interactions at once must not block on SQLite
 * I/O, so every operation is dispatched to a dedicated single-thread
 * executor and answered with a {@link CompletableFuture}. After a transition
 * commits, the matching event from
 * {@link de.bsommerfeld.channelstate.core.event.ConnectionEvents} is posted on
 * the {@link ConnectionEventBus}; a failure posts
 * {@link ConnectionFailedEvent} and completes the future exceptionally with
 * the store's original exception.
 *
 * <h3>Cancellation</h3>
 * Cancelling a returned future only detaches the caller. The store call keeps
 * running on the executor until its transaction has committed or rolled back.
 */
@Singleton
public class ConnectionTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionTracker.class);

    private final ConnectionStateStore store;
    private final ConnectionEventBus eventBus;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "connection-state");
        t.setDaemon(true);
        return t;
    });

    @Inject
    public ConnectionTracker(ConnectionStateStore store, ConnectionEventBus eventBus) {
        this.store = store;
        this.eventBus = eventBus;
    }

    public CompletableFuture<Void> connect(String channelId, String guildId) {
        return CompletableFuture.runAsync(() -> {
            try {
                store.connect(channelId, guildId);
            } catch (ConnectionStateException e) {
                eventBus.post(new ConnectionFailedEvent("connect", channelId, e.getMessage()));
                throw e;
            }
            eventBus.post(new ChannelConnectedEvent(channelId, guildId));
        }, executor);
    }

    /**
     * @return future completing with the removed connection, or empty if
     *         nothing was connected
     */
    public CompletableFuture<Optional<ConnectionSnapshot>> disconnect() {
        return CompletableFuture.supplyAsync(() -> {
            Optional<ConnectionSnapshot> removed;
            try {
                removed = store.disconnect();
            } catch (ConnectionStateException e) {
                eventBus.post(new ConnectionFailedEvent("disconnect", null, e.getMessage()));
                throw e;
            }
            removed.ifPresent(snapshot -> eventBus.post(new ChannelDisconnectedEvent(snapshot)));
            return removed;
        }, executor);
    }

    public CompletableFuture<Optional<ConnectionSnapshot>> current() {
        return CompletableFuture.supplyAsync(store::getCurrent, executor);
    }

    public CompletableFuture<Boolean> isConnected() {
        return CompletableFuture.supplyAsync(store::isConnected, executor);
    }

    public CompletableFuture<List<HistoryEvent>> recentHistory(int limit) {
        return CompletableFuture.supplyAsync(() -> store.recentHistory(limit), executor);
    }

    /**
     * Lets queued operations finish (up to 30s), then stops the executor.
     * Call during application shutdown so no accepted transition is lost.
     */
    public void shutdown() {
        LOG.info("Shutting down ConnectionTracker...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                LOG.warn("ConnectionTracker forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
