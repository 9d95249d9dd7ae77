package de.bsommerfeld.channelstate.core.domain;

import java.time.OffsetDateTime;

/**
 * One row of the append-only connection history.
 *
 * <p>
 * The {@code id} is assigned by the store and grows strictly with every
 * appended row. {@code errorMessage} is only set for {@link ConnectionAction#ERROR}
 * rows and for superseded connections, where it records why the
 * {@link ConnectionAction#DISCONNECT} happened.
 */
public record HistoryEvent(
        long id,
        String channelId,
        String guildId,
        ConnectionAction action,
        OffsetDateTime timestamp,
        String errorMessage) {

    public boolean isError() {
        return action == ConnectionAction.ERROR;
    }
}
