package de.bsommerfeld.channelstate.db;

/**
 * Thrown when reading or changing connection state fails at the storage
 * level. By the time this is raised the transaction has been rolled back.
 */
public class TransactionException extends ConnectionStateException {

    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
