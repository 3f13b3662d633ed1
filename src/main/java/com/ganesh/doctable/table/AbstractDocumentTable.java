package com.ganesh.doctable.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ganesh.doctable.Config;
import com.ganesh.doctable.StoreConnectionException;
import com.ganesh.doctable.StoreException;
import com.ganesh.doctable.StoreMetrics;
import com.ganesh.doctable.StoreValue;
import com.ganesh.doctable.Table;
import com.ganesh.doctable.engine.DocumentCollection;
import com.ganesh.doctable.engine.Documents;
import com.ganesh.doctable.engine.EngineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Shared plumbing for tables stored in one collection of a pooled document file: the engine handle,
 * document stamping, value decoding and the inert transaction verbs.
 *
 * <p>Each stored document keeps its value under {@code "value"} as
 * {@code {"created_at": ms, "updated_at": ms, "data": {...}}}, next to the shape-specific key fields.
 */
public abstract class AbstractDocumentTable implements Table {
    private static final Logger logger = LoggerFactory.getLogger(AbstractDocumentTable.class);

    protected static final String VALUE_FIELD = "value";
    private static final String CREATED_AT_FIELD = "created_at";
    private static final String UPDATED_AT_FIELD = "updated_at";
    private static final String DATA_FIELD = "data";

    private final String name;
    private final EngineHandle handle;
    protected final Config config;
    protected final StoreMetrics metrics;

    protected AbstractDocumentTable(String name, EngineHandle handle, Config config, StoreMetrics metrics) {
        this.name = name;
        this.handle = handle;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * @return The collection holding this table's documents, resolved through the handle on every call
     * so a closed table fails fast.
     */
    protected DocumentCollection collection() {
        return handle.collection(name);
    }

    /**
     * Fails if this table was closed, or its file was dropped or closed underneath it.
     */
    protected void checkOpen() {
        if (handle.isReleased()) {
            throw new StoreConnectionException("Table '" + name + "' is closed");
        }
        handle.ensureUsable();
    }

    protected long now() {
        return config.getClock().millis();
    }

    /**
     * Builds the document to store for a write. {@code created_at} is carried over from the document
     * being replaced, if any.
     *
     * @param keyFields The shape-specific key fields.
     * @param existing The document currently stored under the same key.
     * @param data The validated value data.
     * @param now The write time.
     * @return A new document.
     */
    protected ObjectNode stampDocument(ObjectNode keyFields, Optional<ObjectNode> existing, ObjectNode data, long now) {
        long createdAt = existing
                .map(document -> document.path(VALUE_FIELD).path(CREATED_AT_FIELD).asLong(now))
                .orElse(now);
        ObjectNode document = keyFields.deepCopy();
        ObjectNode value = document.putObject(VALUE_FIELD);
        value.put(CREATED_AT_FIELD, createdAt);
        value.put(UPDATED_AT_FIELD, now);
        value.set(DATA_FIELD, data);
        return document;
    }

    protected StoreValue readValue(JsonNode document) {
        JsonNode value = document.get(VALUE_FIELD);
        if (value == null || !value.isObject()) {
            throw new StoreException("Malformed document in table '" + name + "': missing value");
        }
        try {
            return Documents.objectMapper.convertValue(value, StoreValue.class);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Malformed document in table '" + name + "'", e);
        }
    }

    @Override
    public boolean supportsTransactions() {
        return false;
    }

    @Override
    public void beginTransaction() {
        ignoredTransactionCall("beginTransaction");
    }

    @Override
    public void commit() {
        ignoredTransactionCall("commit");
    }

    @Override
    public void rollback() {
        ignoredTransactionCall("rollback");
    }

    private void ignoredTransactionCall(String verb) {
        metrics.transactionCallsIgnored.increment();
        logger.warn("Table '{}' does not support transactions; {} has no effect", name, verb);
    }

    @Override
    public void close() {
        handle.close();
    }
}
