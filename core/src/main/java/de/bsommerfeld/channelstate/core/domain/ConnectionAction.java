package de.bsommerfeld.channelstate.core.domain;

/**
 * Kind of event recorded in the connection history. The names are persisted
 * verbatim in the {@code action} column, which carries a matching
 * {@code CHECK} constraint.
 */
public enum ConnectionAction {

    CONNECT,
    DISCONNECT,
    ERROR
}
