package com.ganesh.doctable.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ganesh.doctable.Config;
import com.ganesh.doctable.KeyTypeException;
import com.ganesh.doctable.KkvTable;
import com.ganesh.doctable.StoreMetrics;
import com.ganesh.doctable.StoreValue;
import com.ganesh.doctable.TableType;
import com.ganesh.doctable.ValueTypeException;
import com.ganesh.doctable.engine.Documents;
import com.ganesh.doctable.engine.EngineHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * {@link KkvTable} storing one document per composite key, shaped
 * {@code {"key1": pkey, "key2": skey, "value": {...}}}.
 */
public class DefaultKkvTable extends AbstractDocumentTable implements KkvTable {
    private static final Logger logger = LoggerFactory.getLogger(DefaultKkvTable.class);

    static final String PRIMARY_KEY_FIELD = "key1";
    static final String SECONDARY_KEY_FIELD = "key2";

    public DefaultKkvTable(String name, EngineHandle handle, Config config, StoreMetrics metrics) {
        super(name, handle, config, metrics);
    }

    @Override
    public TableType getType() {
        return TableType.KKV;
    }

    @Override
    public void set(String pkey, String skey, StoreValue value) {
        ObjectNode data;
        try {
            Validation.requireKey(pkey, "Primary key");
            Validation.requireKey(skey, "Secondary key");
            data = Validation.toDataNode(value);
        } catch (KeyTypeException | ValueTypeException e) {
            logger.error("Failed to set KKV pair in table '{}': {}", getName(), e.getMessage());
            throw e;
        }
        logger.debug("Setting KKV pair: table={}, pkey={}, skey={}", getName(), pkey, skey);
        ObjectNode keyFields = Documents.newDocument()
                .put(PRIMARY_KEY_FIELD, pkey)
                .put(SECONDARY_KEY_FIELD, skey);
        long now = now();
        collection().update(byKeys(pkey, skey), existing -> stampDocument(keyFields, existing, data, now));
        metrics.sets.increment();
    }

    @Override
    public Optional<StoreValue> get(String pkey, String skey) {
        Validation.requireKey(pkey, "Primary key");
        Validation.requireKey(skey, "Secondary key");
        metrics.gets.increment();
        logger.debug("Getting value for table={}, pkey={}, skey={}", getName(), pkey, skey);
        return collection().get(byKeys(pkey, skey)).map(this::readValue);
    }

    @Override
    public boolean delete(String pkey, String skey) {
        Validation.requireKey(pkey, "Primary key");
        Validation.requireKey(skey, "Secondary key");
        logger.debug("Deleting table={}, pkey={}, skey={}", getName(), pkey, skey);
        metrics.deletes.increment();
        return collection().remove(byKeys(pkey, skey)) > 0;
    }

    @Override
    public int deleteAll(String pkey) {
        Validation.requireKey(pkey, "Primary key");
        logger.debug("Deleting every skey of table={}, pkey={}", getName(), pkey);
        int removed = collection().remove(Documents.fieldEquals(PRIMARY_KEY_FIELD, pkey));
        metrics.deletes.add(removed);
        return removed;
    }

    @Override
    public Set<String> listPkeys() {
        Set<String> pkeys = new LinkedHashSet<>();
        for (JsonNode document : collection().all()) {
            pkeys.add(document.path(PRIMARY_KEY_FIELD).asText());
        }
        return pkeys;
    }

    @Override
    public List<String> listSkeys(String pkey) {
        Validation.requireKey(pkey, "Primary key");
        List<String> skeys = new ArrayList<>();
        for (JsonNode document : collection().search(Documents.fieldEquals(PRIMARY_KEY_FIELD, pkey))) {
            skeys.add(document.path(SECONDARY_KEY_FIELD).asText());
        }
        return skeys;
    }

    @Override
    public Map<String, Map<String, StoreValue>> listAll() {
        Map<String, Map<String, StoreValue>> result = new LinkedHashMap<>();
        for (JsonNode document : collection().all()) {
            String pkey = document.path(PRIMARY_KEY_FIELD).asText();
            String skey = document.path(SECONDARY_KEY_FIELD).asText();
            result.computeIfAbsent(pkey, k -> new LinkedHashMap<>()).put(skey, readValue(document));
        }
        return result;
    }

    private static Predicate<JsonNode> byKeys(String pkey, String skey) {
        return Documents.fieldsEqual(PRIMARY_KEY_FIELD, pkey, SECONDARY_KEY_FIELD, skey);
    }
}
