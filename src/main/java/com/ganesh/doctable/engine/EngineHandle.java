package com.ganesh.doctable.engine;

import com.ganesh.doctable.StoreConnectionException;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A non-owning reference to a pooled {@link DocumentEngine}. Closing the handle releases the reference;
 * closing it twice is a no-op.
 */
public final class EngineHandle implements AutoCloseable {
    private final EnginePool pool;
    private final EnginePool.PooledEngine pooled;
    private final AtomicBoolean released = new AtomicBoolean(false);

    EngineHandle(EnginePool pool, EnginePool.PooledEngine pooled) {
        this.pool = pool;
        this.pooled = pooled;
    }

    public Path getPath() {
        return pooled.path;
    }

    /**
     * @param name The collection name.
     * @return The named collection of the shared engine.
     * @throws StoreConnectionException if this handle was already released.
     */
    public DocumentCollection collection(String name) {
        if (released.get()) {
            throw new StoreConnectionException("Engine handle already released: " + pooled.path);
        }
        return pooled.engine.collection(name);
    }

    /**
     * Fails unless this handle is live and its engine still serves its file.
     *
     * @throws StoreConnectionException if the handle was released or the engine closed.
     * @throws com.ganesh.doctable.TableNotFoundException if the file was dropped.
     */
    public void ensureUsable() {
        if (released.get()) {
            throw new StoreConnectionException("Engine handle already released: " + pooled.path);
        }
        pooled.engine.ensureOpen();
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(pooled);
        }
    }
}
