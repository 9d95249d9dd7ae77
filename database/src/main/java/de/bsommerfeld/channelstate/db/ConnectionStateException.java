package de.bsommerfeld.channelstate.db;

/**
 * Root of all failures raised by the connection state layer.
 */
public class ConnectionStateException extends RuntimeException {

    public ConnectionStateException(String message) {
        super(message);
    }

    public ConnectionStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
