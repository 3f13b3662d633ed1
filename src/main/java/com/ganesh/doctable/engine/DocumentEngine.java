package com.ganesh.doctable.engine;

import java.nio.file.Path;

/**
 * One open document file. A file holds any number of named {@link DocumentCollection}s; collections
 * are created lazily on first write.
 */
public interface DocumentEngine extends AutoCloseable {

    /**
     * @return The backing file.
     */
    Path getPath();

    /**
     * @param name The collection name.
     * @return A view of the named collection, valid until the engine is closed or dropped.
     */
    DocumentCollection collection(String name);

    /**
     * @return {@code true} until {@link #close()} or a drop of the backing file.
     */
    boolean isOpen();

    /**
     * Releases the in-memory state. Later calls through any collection view fail.
     */
    @Override
    void close();
}
