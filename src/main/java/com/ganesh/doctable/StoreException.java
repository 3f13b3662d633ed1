package com.ganesh.doctable;

/**
 * Base class of every error raised by the table store. All subclasses are unchecked; I/O failures
 * from the underlying document files are wrapped rather than declared.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
