package com.ganesh.doctable.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.function.Predicate;

/**
 * Shared JSON plumbing for the document engine: the {@link ObjectMapper} every component uses, and
 * the field-equality predicates the tables build their lookups from.
 */
public final class Documents {

    /**
     * Thread-safe once configured; never reconfigure after class initialization. Decimals are read as
     * exact {@link java.math.BigDecimal}s, so a number reloaded from disk keeps every digit and its scale.
     */
    public static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

    private Documents() {
    }

    public static ObjectNode newDocument() {
        return objectMapper.createObjectNode();
    }

    /**
     * Builds a predicate matching documents whose text field {@code field} equals {@code value}
     * exactly. Documents without the field, or with a non-text field, never match.
     *
     * @param field The field name.
     * @param value The expected value.
     * @return The predicate.
     */
    public static Predicate<JsonNode> fieldEquals(String field, String value) {
        return document -> {
            JsonNode node = document.get(field);
            return node != null && node.isTextual() && node.textValue().equals(value);
        };
    }

    /**
     * Conjunction of two field-equality predicates, used for composite keys.
     */
    public static Predicate<JsonNode> fieldsEqual(String field1, String value1, String field2, String value2) {
        return fieldEquals(field1, value1).and(fieldEquals(field2, value2));
    }
}
