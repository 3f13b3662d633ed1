package com.ganesh.doctable;

/**
 * Thrown when a value is missing, its data is not a mapping, or its data cannot be represented as a
 * JSON object.
 */
public class ValueTypeException extends StoreException {

    public ValueTypeException(String message) {
        super(message);
    }

    public ValueTypeException(String message, Throwable cause) {
        super(message, cause);
    }
}
