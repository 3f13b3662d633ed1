package com.ganesh.doctable;

/**
 * Thrown when a supplied key is not a usable identifier (null or empty).
 */
public class KeyTypeException extends StoreException {

    public KeyTypeException(String message) {
        super(message);
    }
}
