package com.ganesh.doctable.engine;

import com.ganesh.doctable.StoreMetrics;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns every open {@link DocumentEngine}, at most one per backing file.
 *
 * <p>Callers obtain an {@link EngineHandle} with {@link #acquire(Path)}; the first acquire of a path
 * opens its engine and later acquires share it. Each handle holds one reference, and the engine is
 * closed when its last handle is released. Paths are normalized to absolute form, so different
 * spellings of one file share one engine.
 */
public class EnginePool implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EnginePool.class);

    private final JsonFileWriter writer;
    private final StoreMetrics metrics;
    private final Map<Path, PooledEngine> engines = new HashMap<>();
    private boolean closed;

    /**
     * @param writer The writer every engine persists through.
     * @param metrics The metrics collector shared by every engine.
     */
    public EnginePool(JsonFileWriter writer, StoreMetrics metrics) {
        this.writer = writer;
        this.metrics = metrics;
    }

    /**
     * Returns a handle on the engine for {@code path}, opening it if no handle is live.
     *
     * @param path The document file, which must exist.
     * @return A new handle holding one reference.
     * @throws com.ganesh.doctable.StoreConnectionException if the file cannot be opened.
     */
    public synchronized EngineHandle acquire(Path path) {
        Preconditions.checkState(!closed, "Engine pool is closed");
        Path key = normalize(path);
        PooledEngine pooled = engines.get(key);
        if (pooled == null) {
            logger.info("Opening document engine for {}", key);
            pooled = new PooledEngine(key, JsonFileEngine.open(key, writer, metrics));
            engines.put(key, pooled);
        }
        pooled.references++;
        return new EngineHandle(this, pooled);
    }

    synchronized void release(PooledEngine pooled) {
        pooled.references--;
        if (pooled.references <= 0 && engines.get(pooled.path) == pooled) {
            engines.remove(pooled.path);
            pooled.engine.close();
        }
    }

    /**
     * Detaches the engine for {@code path} from the pool because its file is being deleted. Handles
     * still referring to it fail from now on; the next {@link #acquire(Path)} opens a fresh engine.
     *
     * @param path The document file.
     */
    public synchronized void invalidate(Path path) {
        PooledEngine pooled = engines.remove(normalize(path));
        if (pooled != null) {
            if (pooled.references > 0) {
                logger.warn("Invalidating {} with {} live handle(s)", pooled.path, pooled.references);
            }
            pooled.engine.markDropped();
        }
    }

    /**
     * @param path The document file.
     * @return The number of live handles on that file's engine, 0 if none is open.
     */
    public synchronized int referenceCount(Path path) {
        PooledEngine pooled = engines.get(normalize(path));
        return pooled == null ? 0 : pooled.references;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int openEngineCount() {
        return engines.size();
    }

    /**
     * Closes every engine regardless of outstanding handles.
     */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        List<PooledEngine> open = new ArrayList<>(engines.values());
        engines.clear();
        for (PooledEngine pooled : open) {
            pooled.engine.close();
        }
        logger.info("Engine pool closed ({} engine(s))", open.size());
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    static final class PooledEngine {
        final Path path;
        final JsonFileEngine engine;
        int references; // guarded by the pool monitor

        PooledEngine(Path path, JsonFileEngine engine) {
            this.path = path;
            this.engine = engine;
        }
    }
}
