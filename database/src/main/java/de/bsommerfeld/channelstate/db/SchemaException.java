package de.bsommerfeld.channelstate.db;

/**
 * Thrown when the status or history table cannot be created. Fatal to startup.
 */
public class SchemaException extends ConnectionStateException {

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
