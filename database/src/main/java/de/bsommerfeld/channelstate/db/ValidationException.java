package de.bsommerfeld.channelstate.db;

/**
 * Thrown for input that can never succeed, such as a blank channel ID or a
 * table name that is not a plain identifier. Retrying is pointless.
 */
public class ValidationException extends ConnectionStateException {

    public ValidationException(String message) {
        super(message);
    }
}
