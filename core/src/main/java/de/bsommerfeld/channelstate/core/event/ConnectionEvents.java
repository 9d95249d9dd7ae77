package de.bsommerfeld.channelstate.core.event;

import de.bsommerfeld.channelstate.core.domain.ConnectionSnapshot;

/**
 * Events published after connection state transitions. They are posted only
 * once the corresponding transaction has committed (or failed), so listeners
 * never observe a state that was rolled back.
 */
public class ConnectionEvents {

    private ConnectionEvents() {
    }

    /** A connection to {@code channelId} is now the active one. */
    public record ChannelConnectedEvent(String channelId, String guildId) {
    }

    /** The given connection was removed by an explicit disconnect. */
    public record ChannelDisconnectedEvent(ConnectionSnapshot snapshot) {
    }

    /**
     * A connect or disconnect failed and was rolled back. {@code channelId} is
     * {@code null} when no channel was known at the time of the failure.
     */
    public record ConnectionFailedEvent(String operation, String channelId, String message) {
    }
}
