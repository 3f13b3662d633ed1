package com.ganesh.doctable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The shape of a table, fixed when the table is created.
 */
public enum TableType {
    /** Single-level key to document. */
    KV("kv"),
    /** Two-level primary key to secondary key to document. */
    KKV("kkv");

    private final String code;

    TableType(String code) {
        this.code = code;
    }

    /**
     * @return The code persisted in the metadata file, {@code "kv"} or {@code "kkv"}.
     */
    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static TableType fromCode(String code) {
        for (TableType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown table type: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
