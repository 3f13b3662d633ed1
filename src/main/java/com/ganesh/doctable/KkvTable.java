package com.ganesh.doctable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A two-level document table addressed by a primary key and a secondary key. Uncached.
 */
public interface KkvTable extends Table {

    /**
     * Inserts or replaces the value stored under {@code (pkey, skey)}.
     *
     * @throws KeyTypeException if either key is null or empty.
     * @throws ValueTypeException if the value is null or its data is not a JSON object.
     */
    void set(String pkey, String skey, StoreValue value);

    Optional<StoreValue> get(String pkey, String skey);

    /**
     * @return {@code true} if a value was removed.
     */
    boolean delete(String pkey, String skey);

    /**
     * Removes every secondary key stored under {@code pkey}.
     *
     * @return How many values were removed.
     */
    int deleteAll(String pkey);

    /**
     * @return The distinct primary keys.
     */
    Set<String> listPkeys();

    /**
     * @return The secondary keys stored under {@code pkey}, empty if none.
     */
    List<String> listSkeys(String pkey);

    /**
     * @return {@code {pkey: {skey: value}}} for every stored value.
     */
    Map<String, Map<String, StoreValue>> listAll();
}
