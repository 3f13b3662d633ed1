package com.ganesh.doctable;

/**
 * Thrown when creating a table whose name is already registered or is reserved for metadata.
 */
public class TableExistsException extends StoreException {

    public TableExistsException(String message) {
        super(message);
    }
}
