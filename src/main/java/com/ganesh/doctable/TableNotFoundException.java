package com.ganesh.doctable;

/**
 * Thrown when a table name is not registered, or when a table's backing file is gone.
 */
public class TableNotFoundException extends StoreException {

    public TableNotFoundException(String message) {
        super(message);
    }
}
