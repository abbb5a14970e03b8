package io.agentkeep.db;

/**
 * Raised when the underlying SQLite store rejects a statement or cannot be reached.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
