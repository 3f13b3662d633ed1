package com.ganesh.doctable.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ganesh.doctable.StoreConnectionException;
import com.ganesh.doctable.StoreException;
import com.ganesh.doctable.StoreMetrics;
import com.ganesh.doctable.TableNotFoundException;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A {@link DocumentEngine} keeping one JSON document file fully in memory and rewriting it on every
 * mutation.
 *
 * <p>The file is read once when the engine is opened. Each write builds a new document list for the
 * affected collection, persists the whole file through {@link JsonFileWriter}, and only then swaps the
 * new list in, so a failed write leaves both the file and the in-memory state unchanged.
 *
 * <p>Thread safety is managed using a {@link ReentrantReadWriteLock}: lookups and scans run
 * concurrently, mutations take exclusive access. This lock is the per-file mutex every table sharing
 * the file goes through.
 */
public class JsonFileEngine implements DocumentEngine {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileEngine.class);

    private enum State { OPEN, CLOSED, DROPPED }

    private final Path path;
    private final JsonFileWriter writer;
    private final StoreMetrics metrics;
    /** Guards {@link #collections}. */
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<ObjectNode>> collections = new LinkedHashMap<>();
    private volatile State state = State.OPEN;

    private JsonFileEngine(Path path, JsonFileWriter writer, StoreMetrics metrics) {
        this.path = path;
        this.writer = writer;
        this.metrics = metrics;
    }

    /**
     * Opens an existing document file and loads every collection into memory.
     *
     * @param path The document file.
     * @param writer The writer used to persist mutations.
     * @param metrics The metrics collector to update on writes.
     * @return The open engine.
     * @throws StoreConnectionException if the file is missing, unreadable or not a JSON document file.
     */
    public static JsonFileEngine open(Path path, JsonFileWriter writer, StoreMetrics metrics) {
        JsonFileEngine engine = new JsonFileEngine(path, writer, metrics);
        engine.load();
        return engine;
    }

    private void load() {
        if (!Files.isRegularFile(path)) {
            throw new StoreConnectionException("Document file does not exist: " + path);
        }
        JsonNode root;
        try {
            if (Files.size(path) == 0) {
                return;
            }
            root = Documents.objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new StoreConnectionException("Failed to read document file " + path, e);
        }
        if (root == null || root.isMissingNode()) {
            return;
        }
        if (!root.isObject()) {
            throw new StoreConnectionException("Malformed document file (expected a JSON object): " + path);
        }
        int total = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) {
                throw new StoreConnectionException("Malformed collection '" + field.getKey() + "' in " + path);
            }
            List<ObjectNode> documents = new ArrayList<>();
            for (JsonNode document : field.getValue()) {
                if (document.isObject()) {
                    documents.add((ObjectNode) document);
                } else {
                    logger.warn("Skipping non-object document in collection '{}' of {}", field.getKey(), path);
                }
            }
            collections.put(field.getKey(), documents);
            total += documents.size();
        }
        logger.debug("Loaded {} document(s) in {} collection(s) from {}", total, collections.size(), path);
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public DocumentCollection collection(String name) {
        Preconditions.checkNotNull(name, "collection name");
        return new CollectionView(name);
    }

    @Override
    public boolean isOpen() {
        return state == State.OPEN;
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (state == State.OPEN) {
                state = State.CLOSED;
                collections.clear();
                logger.info("Closed document engine for {}", path);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks the engine as belonging to a file that has been deleted. Later calls through any collection
     * view fail with {@link TableNotFoundException} instead of resurrecting the file.
     */
    void markDropped() {
        lock.writeLock().lock();
        try {
            state = State.DROPPED;
            collections.clear();
            logger.info("Document engine for {} invalidated by drop", path);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws TableNotFoundException if the backing file was dropped.
     * @throws StoreConnectionException if the engine was closed.
     */
    void ensureOpen() {
        if (state == State.DROPPED) {
            throw new TableNotFoundException("Backing file was dropped: " + path);
        }
        if (state == State.CLOSED) {
            throw new StoreConnectionException("Document engine is closed: " + path);
        }
    }

    /** Must be called with the write lock held. */
    private void persist(String name, List<ObjectNode> documents) {
        Map<String, List<ObjectNode>> snapshot = new LinkedHashMap<>(collections);
        snapshot.put(name, documents);
        try {
            writer.write(path, snapshot);
        } catch (IOException e) {
            throw new StoreException("Failed to persist document file " + path, e);
        }
        metrics.engineWrites.increment();
        collections.put(name, documents);
    }

    private class CollectionView implements DocumentCollection {
        private final String name;

        CollectionView(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }

        private List<ObjectNode> documents() {
            return collections.getOrDefault(name, List.of());
        }

        @Override
        public void upsert(ObjectNode document, Predicate<JsonNode> predicate) {
            Preconditions.checkNotNull(document, "document");
            lock.writeLock().lock();
            try {
                ensureOpen();
                List<ObjectNode> updated = new ArrayList<>(documents());
                boolean matched = false;
                for (int i = 0; i < updated.size(); i++) {
                    if (predicate.test(updated.get(i))) {
                        ObjectNode merged = updated.get(i).deepCopy();
                        merged.setAll(document.deepCopy());
                        updated.set(i, merged);
                        matched = true;
                    }
                }
                if (!matched) {
                    updated.add(document.deepCopy());
                }
                persist(name, updated);
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public ObjectNode update(Predicate<JsonNode> predicate, Function<Optional<ObjectNode>, ObjectNode> updater) {
            lock.writeLock().lock();
            try {
                ensureOpen();
                List<ObjectNode> updated = new ArrayList<>(documents());
                int index = -1;
                for (int i = 0; i < updated.size(); i++) {
                    if (predicate.test(updated.get(i))) {
                        index = i;
                        break;
                    }
                }
                Optional<ObjectNode> current = index < 0 ? Optional.empty() : Optional.of(updated.get(index).deepCopy());
                ObjectNode replacement = Preconditions.checkNotNull(updater.apply(current), "updater returned null");
                if (index < 0) {
                    updated.add(replacement.deepCopy());
                } else {
                    updated.set(index, replacement.deepCopy());
                }
                persist(name, updated);
                return replacement.deepCopy();
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public Optional<ObjectNode> get(Predicate<JsonNode> predicate) {
            lock.readLock().lock();
            try {
                ensureOpen();
                for (ObjectNode document : documents()) {
                    if (predicate.test(document)) {
                        return Optional.of(document.deepCopy());
                    }
                }
                return Optional.empty();
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public int remove(Predicate<JsonNode> predicate) {
            lock.writeLock().lock();
            try {
                ensureOpen();
                List<ObjectNode> remaining = new ArrayList<>();
                for (ObjectNode document : documents()) {
                    if (!predicate.test(document)) {
                        remaining.add(document);
                    }
                }
                int removed = documents().size() - remaining.size();
                if (removed > 0) {
                    persist(name, remaining);
                }
                return removed;
            } finally {
                lock.writeLock().unlock();
            }
        }

        @Override
        public List<ObjectNode> all() {
            return search(document -> true);
        }

        @Override
        public List<ObjectNode> search(Predicate<JsonNode> predicate) {
            lock.readLock().lock();
            try {
                ensureOpen();
                List<ObjectNode> result = new ArrayList<>();
                for (ObjectNode document : documents()) {
                    if (predicate.test(document)) {
                        result.add(document.deepCopy());
                    }
                }
                return result;
            } finally {
                lock.readLock().unlock();
            }
        }

        @Override
        public int count() {
            lock.readLock().lock();
            try {
                ensureOpen();
                return documents().size();
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
