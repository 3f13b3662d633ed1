package com.ganesh.doctable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single-key document table.
 *
 * <p>Reads go through a per-instance cache: a value written or read through this instance is served
 * from memory until the configured TTL elapses. Writes made through another instance over the same
 * file are not seen by this instance until its cached entry expires.
 */
public interface KvTable extends Table {

    /**
     * Inserts or replaces the value stored under {@code key}.
     *
     * @param key A non-empty key.
     * @param value The value; only its data is used, timestamps are assigned on write.
     * @throws KeyTypeException if the key is null or empty.
     * @throws ValueTypeException if the value is null or its data is not a JSON object.
     */
    void set(String key, StoreValue value);

    /**
     * @param key The key to look up.
     * @return The stored value, or empty if the key is absent.
     */
    Optional<StoreValue> get(String key);

    /**
     * @param key The key to delete.
     * @return {@code true} if a value was removed, {@code false} if the key did not exist.
     */
    boolean delete(String key);

    /**
     * @return Every key in the backing store.
     */
    List<String> listKeys();

    /**
     * @return Every key with its value, read from the backing store.
     */
    Map<String, StoreValue> listAll();

    /**
     * @return The number of stored keys.
     */
    int size();
}
