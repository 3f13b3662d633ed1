package com.ganesh.doctable.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ganesh.doctable.KeyTypeException;
import com.ganesh.doctable.StoreValue;
import com.ganesh.doctable.ValueTypeException;
import com.ganesh.doctable.engine.Documents;

import java.io.IOException;

/**
 * Boundary checks shared by both table shapes. Every check runs before any mutation is attempted.
 */
final class Validation {

    private Validation() {
    }

    /**
     * @param key The candidate key.
     * @param label How to name the key in the error message.
     * @return The key, unchanged.
     * @throws KeyTypeException if the key is null or empty.
     */
    static String requireKey(String key, String label) {
        if (key == null) {
            throw new KeyTypeException(label + " must be a string, got null");
        }
        if (key.isEmpty()) {
            throw new KeyTypeException(label + " must not be empty");
        }
        return key;
    }

    /**
     * Converts a value's data to the JSON object that will be stored. The data is written out as JSON
     * text and parsed back, so the node held in memory carries exactly the number types a reload of
     * the file produces.
     *
     * @throws ValueTypeException if the value is null or its data cannot be written as a JSON object.
     */
    static ObjectNode toDataNode(StoreValue value) {
        if (value == null) {
            throw new ValueTypeException("Value must not be null");
        }
        JsonNode node;
        try {
            byte[] json = Documents.objectMapper.writeValueAsBytes(value.getData());
            node = Documents.objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ValueTypeException("Value data cannot be represented as JSON: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ValueTypeException("Value data must be a mapping");
        }
        return (ObjectNode) node;
    }
}
