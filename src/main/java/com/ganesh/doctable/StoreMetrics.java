package com.ganesh.doctable;

import java.util.concurrent.atomic.LongAdder;

/**
 * A thread-safe class for tracking operation counts across a store and all tables opened from it.
 * Uses LongAdder for high-performance counting under concurrent access.
 */
public class StoreMetrics {
    public final LongAdder sets = new LongAdder();
    public final LongAdder gets = new LongAdder();
    public final LongAdder deletes = new LongAdder();
    public final LongAdder cacheHits = new LongAdder();
    public final LongAdder cacheMisses = new LongAdder();
    public final LongAdder tablesCreated = new LongAdder();
    public final LongAdder tablesDropped = new LongAdder();
    public final LongAdder engineWrites = new LongAdder(); // full-file rewrites
    public final LongAdder transactionCallsIgnored = new LongAdder();

    /**
     * Calculates the share of KV reads served from a read cache.
     * @return The hit rate in percent, or 0 if no cached reads have been attempted.
     */
    public double getCacheHitRate() {
        long hits = cacheHits.sum();
        long lookups = hits + cacheMisses.sum();
        if (lookups == 0) return 0.0;
        return (hits * 100.0) / lookups;
    }

    /**
     * Generates a human-readable summary of all collected metrics.
     * @return A string containing the metrics summary.
     */
    public String getSummary() {
        return String.format(
            "--- Store Metrics ---\n" +
            "Operations -> Sets: %,d | Gets: %,d | Deletes: %,d\n" +
            "Cache      -> Hits: %,d | Misses: %,d (%.2f%% hit rate)\n" +
            "Tables     -> Created: %,d | Dropped: %,d\n" +
            "Internals  -> Engine Writes: %,d | Ignored Transaction Calls: %,d\n" +
            "---------------------",
            sets.sum(), gets.sum(), deletes.sum(),
            cacheHits.sum(), cacheMisses.sum(), getCacheHitRate(),
            tablesCreated.sum(), tablesDropped.sum(),
            engineWrites.sum(), transactionCallsIgnored.sum()
        );
    }
}
