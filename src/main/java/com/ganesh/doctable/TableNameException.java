package com.ganesh.doctable;

/**
 * Thrown when a table name does not match {@code ^[A-Za-z][A-Za-z0-9_]*$}.
 */
public class TableNameException extends StoreException {

    public TableNameException(String message) {
        super(message);
    }
}
