package de.bsommerfeld.channelstate.core.domain;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Immutable view of the active connection as stored in the status table.
 *
 * <p>
 * {@code guildId} is optional and may be {@code null}. {@code connectedAt} is
 * fixed when the connection is established; {@code lastUpdated} is refreshed
 * on every write to the status row. Right after a connect both are equal.
 */
public record ConnectionSnapshot(
        String channelId,
        String guildId,
        OffsetDateTime connectedAt,
        OffsetDateTime lastUpdated) {

    public ConnectionSnapshot {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(connectedAt, "connectedAt");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public boolean hasGuild() {
        return guildId != null;
    }
}
