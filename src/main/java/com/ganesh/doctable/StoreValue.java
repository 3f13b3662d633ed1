package com.ganesh.doctable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The document stored under a key.
 *
 * <p>{@code createdAt} is set by the first write of a key and kept by later writes; {@code updatedAt}
 * is refreshed by every write. Both are epoch milliseconds assigned by the table, so the timestamps of
 * a value handed to {@code set} are ignored. {@code data} is an unmodifiable mapping of field names to
 * JSON-representable values.
 */
public final class StoreValue {
    private final long createdAt;
    private final long updatedAt;
    private final Map<String, Object> data;

    @JsonCreator
    public StoreValue(@JsonProperty("created_at") long createdAt,
                      @JsonProperty("updated_at") long updatedAt,
                      @JsonProperty("data") Map<String, Object> data) {
        if (data == null) {
            throw new ValueTypeException("Value data must be a mapping, got null");
        }
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Wraps arbitrary data in an unstamped value, rejecting anything that is not a mapping with
     * string field names.
     *
     * @param data The candidate data.
     * @return A new value with zero timestamps.
     * @throws ValueTypeException if {@code data} is not a {@link Map} or has a non-string field name.
     */
    public static StoreValue of(Object data) {
        if (!(data instanceof Map)) {
            throw new ValueTypeException("Value data must be a mapping, got "
                    + (data == null ? "null" : data.getClass().getSimpleName()));
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new ValueTypeException("Value field names must be strings, got " + entry.getKey());
            }
            fields.put((String) entry.getKey(), entry.getValue());
        }
        return new StoreValue(0L, 0L, fields);
    }

    @JsonProperty("created_at")
    public long getCreatedAt() { return createdAt; }

    @JsonProperty("updated_at")
    public long getUpdatedAt() { return updatedAt; }

    @JsonProperty("data")
    public Map<String, Object> getData() { return data; }

    /**
     * @param field A field name.
     * @return The field's value, or {@code null} when absent.
     */
    public Object get(String field) {
        return data.get(field);
    }

    /**
     * @return A copy of this value carrying the given timestamps.
     */
    public StoreValue withTimestamps(long createdAt, long updatedAt) {
        return new StoreValue(createdAt, updatedAt, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoreValue)) return false;
        StoreValue other = (StoreValue) o;
        return createdAt == other.createdAt && updatedAt == other.updatedAt && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(createdAt, updatedAt, data);
    }

    @Override
    public String toString() {
        return "StoreValue{createdAt=" + createdAt + ", updatedAt=" + updatedAt + ", data=" + data + "}";
    }
}
