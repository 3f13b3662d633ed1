package com.ganesh.doctable;

/**
 * Thrown when a document file cannot be opened or read, or a connection is used after it was closed.
 * Never retried internally.
 */
public class StoreConnectionException extends StoreException {

    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
