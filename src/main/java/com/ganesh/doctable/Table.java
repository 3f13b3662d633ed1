package com.ganesh.doctable;

/**
 * Operations shared by both table shapes. Obtain instances from {@link TableStore#getTable(String)}.
 *
 * <p>The backing document engine has no atomic multi-write support, so {@link #supportsTransactions()}
 * is {@code false} for every table in this store. The transaction verbs remain callable for code
 * written against a transactional contract, but they do nothing: each write is persisted as soon as
 * it is issued and nothing is ever rolled back.
 */
public interface Table extends AutoCloseable {

    /**
     * @return The table name.
     */
    String getName();

    /**
     * @return The table shape.
     */
    TableType getType();

    /**
     * @return Whether {@link #beginTransaction()}, {@link #commit()} and {@link #rollback()} give any
     * atomicity guarantee.
     */
    boolean supportsTransactions();

    /** Inert unless {@link #supportsTransactions()}; never throws. */
    void beginTransaction();

    /** Inert unless {@link #supportsTransactions()}; never throws. */
    void commit();

    /** Inert unless {@link #supportsTransactions()}; never throws. Writes already issued stay written. */
    void rollback();

    /**
     * Releases this table's reference to its shared connection. Other tables on the same file are
     * unaffected. Operations on a closed table fail with {@link StoreConnectionException}.
     */
    @Override
    void close();
}
