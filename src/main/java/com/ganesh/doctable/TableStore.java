package com.ganesh.doctable;

import java.util.Map;

/**
 * Defines the public API of a table registry: the single source of truth for which tables exist, of
 * what type, stored where. Implementations own a directory holding one file per table plus a reserved
 * metadata file, and are the only component that creates or deletes table files.
 */
public interface TableStore {

    /**
     * Starts the store. This method must be called before any other operations.
     * It creates the data directory if needed and opens the metadata file.
     * @throws StoreConnectionException if the metadata file cannot be opened.
     */
    void start();

    /**
     * Stops the store and closes every open connection, including those still referenced by tables.
     */
    void stop();

    /**
     * Creates an empty KV table.
     *
     * @param name The table name.
     * @throws TableNameException if the name does not match {@code ^[A-Za-z][A-Za-z0-9_]*$}.
     * @throws TableExistsException if the name is reserved or already registered.
     */
    void createKvTable(String name);

    /**
     * Creates an empty KKV table.
     *
     * @param name The table name.
     * @throws TableNameException if the name does not match {@code ^[A-Za-z][A-Za-z0-9_]*$}.
     * @throws TableExistsException if the name is reserved or already registered.
     */
    void createKkvTable(String name);

    /**
     * Returns a new table object of the registered type, sharing the file's connection with every
     * other table object over the same file.
     *
     * @param name The table name.
     * @return A {@link KvTable} or {@link KkvTable}.
     * @throws TableNotFoundException if the table is not registered or its file is missing.
     */
    Table getTable(String name);

    /**
     * @throws TableNotFoundException if the table is not registered or its file is missing.
     * @throws TableTypeException if the table is a KKV table.
     */
    KvTable getKvTable(String name);

    /**
     * @throws TableNotFoundException if the table is not registered or its file is missing.
     * @throws TableTypeException if the table is a KV table.
     */
    KkvTable getKkvTable(String name);

    /**
     * @return Every registered table name with its type; empty for an empty store.
     */
    Map<String, TableType> listTables();

    /**
     * @throws TableNotFoundException if the table is not registered.
     */
    TableInfo getTableInfo(String name);

    /**
     * Deletes the table's file and its registration. Table objects still open on it fail afterwards.
     *
     * @throws TableNotFoundException if the table is not registered.
     */
    void dropTable(String name);

    /**
     * @return The metrics collector shared by this store and every table it hands out.
     */
    StoreMetrics getMetrics();
}
