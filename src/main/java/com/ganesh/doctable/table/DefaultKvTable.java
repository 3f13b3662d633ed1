package com.ganesh.doctable.table;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ganesh.doctable.Config;
import com.ganesh.doctable.KeyTypeException;
import com.ganesh.doctable.KvTable;
import com.ganesh.doctable.StoreException;
import com.ganesh.doctable.StoreMetrics;
import com.ganesh.doctable.StoreValue;
import com.ganesh.doctable.TableType;
import com.ganesh.doctable.ValueTypeException;
import com.ganesh.doctable.engine.Documents;
import com.ganesh.doctable.engine.EngineHandle;
import com.google.common.cache.Cache;
import com.google.common.base.Throwables;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader.InvalidCacheLoadException;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * {@link KvTable} storing one document per key, shaped {@code {"key": ..., "value": {...}}}.
 *
 * <p>The read cache is a Guava {@link Cache} with expire-after-write semantics: an entry written at
 * {@code t} is served only while {@code now - t < ttl}, and both {@link #set} and a cache-missing
 * {@link #get} (re)write the entry. Absent keys are never cached. The cache belongs to this instance.
 */
public class DefaultKvTable extends AbstractDocumentTable implements KvTable {
    private static final Logger logger = LoggerFactory.getLogger(DefaultKvTable.class);

    static final String KEY_FIELD = "key";

    private final Cache<String, StoreValue> cache;

    public DefaultKvTable(String name, EngineHandle handle, Config config, StoreMetrics metrics) {
        super(name, handle, config, metrics);
        this.cache = CacheBuilder.newBuilder()
                .expireAfterWrite(config.getCacheTtl())
                .maximumSize(config.getCacheMaximumSize())
                .ticker(config.getTicker())
                .build();
    }

    @Override
    public TableType getType() {
        return TableType.KV;
    }

    @Override
    public void set(String key, StoreValue value) {
        ObjectNode data;
        try {
            Validation.requireKey(key, "Key");
            data = Validation.toDataNode(value);
        } catch (KeyTypeException | ValueTypeException e) {
            logger.error("Failed to set KV pair in table '{}': {}", getName(), e.getMessage());
            throw e;
        }
        logger.debug("Setting KV pair: table={}, key={}", getName(), key);
        ObjectNode keyFields = Documents.newDocument().put(KEY_FIELD, key);
        long now = now();
        ObjectNode stored = collection().update(byKey(key), existing -> stampDocument(keyFields, existing, data, now));
        cache.put(key, readValue(stored));
        metrics.sets.increment();
    }

    @Override
    public Optional<StoreValue> get(String key) {
        Validation.requireKey(key, "Key");
        checkOpen();
        metrics.gets.increment();
        StoreValue cached = cache.getIfPresent(key);
        if (cached != null) {
            metrics.cacheHits.increment();
            return Optional.of(cached);
        }
        metrics.cacheMisses.increment();

        logger.debug("Getting value for table={}, key={}", getName(), key);
        return load(key);
    }

    /**
     * Reads {@code key} through the cache so that a {@link #set} racing the read wins: Guava drops a
     * loaded value whose entry was replaced while loading.
     */
    private Optional<StoreValue> load(String key) {
        try {
            return Optional.of(cache.get(key, () -> collection().get(byKey(key)).map(this::readValue).orElse(null)));
        } catch (InvalidCacheLoadException e) {
            // absent keys are not cached
            return Optional.empty();
        } catch (UncheckedExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw e;
        } catch (ExecutionException e) {
            throw new StoreException("Failed to read key '" + key + "' from table '" + getName() + "'", e.getCause());
        }
    }

    @Override
    public boolean delete(String key) {
        Validation.requireKey(key, "Key");
        logger.debug("Deleting table={}, key={}", getName(), key);
        cache.invalidate(key);
        metrics.deletes.increment();
        return collection().remove(byKey(key)) > 0;
    }

    @Override
    public List<String> listKeys() {
        List<String> keys = new ArrayList<>();
        for (JsonNode document : collection().all()) {
            keys.add(document.path(KEY_FIELD).asText());
        }
        return keys;
    }

    @Override
    public Map<String, StoreValue> listAll() {
        Map<String, StoreValue> result = new LinkedHashMap<>();
        for (JsonNode document : collection().all()) {
            result.put(document.path(KEY_FIELD).asText(), readValue(document));
        }
        return result;
    }

    @Override
    public int size() {
        return collection().count();
    }

    private static Predicate<JsonNode> byKey(String key) {
        return Documents.fieldEquals(KEY_FIELD, key);
    }
}
