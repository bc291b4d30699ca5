package org.nodebook.store;

/**
 * Thrown when a graph cannot be read from or written to its backing storage.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
