package com.ganesh.doctable;

/**
 * Thrown by the typed accessors of {@link TableStore} when the table exists but has the other shape.
 */
public class TableTypeException extends StoreException {

    public TableTypeException(String message) {
        super(message);
    }
}
