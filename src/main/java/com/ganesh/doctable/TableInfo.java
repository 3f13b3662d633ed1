package com.ganesh.doctable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Registry metadata for one table, stored in the reserved {@code _table_info} collection.
 * Timestamps are epoch milliseconds.
 */
public final class TableInfo {
    private final String name;
    private final TableType type;
    private final long createdAt;
    private final long updatedAt;

    @JsonCreator
    public TableInfo(@JsonProperty("name") String name,
                     @JsonProperty("type") TableType type,
                     @JsonProperty("created_at") long createdAt,
                     @JsonProperty("updated_at") long updatedAt) {
        this.name = name;
        this.type = type;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @JsonProperty("name")
    public String getName() { return name; }

    @JsonProperty("type")
    public TableType getType() { return type; }

    @JsonProperty("created_at")
    public long getCreatedAt() { return createdAt; }

    @JsonProperty("updated_at")
    public long getUpdatedAt() { return updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableInfo)) return false;
        TableInfo other = (TableInfo) o;
        return createdAt == other.createdAt && updatedAt == other.updatedAt
                && name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "TableInfo{name=" + name + ", type=" + type + ", createdAt=" + createdAt + ", updatedAt=" + updatedAt + "}";
    }
}
