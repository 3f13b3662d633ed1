package com.ganesh.doctable.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A named collection of JSON documents inside one backing file.
 *
 * <p>Documents handed in are copied and documents handed out are copies, so callers can never
 * mutate stored state directly. Every write is persisted before the call returns.
 */
public interface DocumentCollection {

    /**
     * @return The collection name within its file.
     */
    String getName();

    /**
     * Inserts {@code document} if no document matches {@code predicate}; otherwise replaces the fields
     * of every matching document with the fields of {@code document}.
     *
     * @param document The document to write.
     * @param predicate Selects the document(s) to replace.
     */
    void upsert(ObjectNode document, Predicate<JsonNode> predicate);

    /**
     * Read-modify-write of the first document matching {@code predicate}, performed under the file's
     * write lock. The updater receives the current document (or empty) and returns the document to
     * store in its place, which is inserted if nothing matched.
     *
     * @param predicate Selects the document to update.
     * @param updater Computes the replacement document.
     * @return A copy of the stored document.
     */
    ObjectNode update(Predicate<JsonNode> predicate, Function<Optional<ObjectNode>, ObjectNode> updater);

    /**
     * @param predicate The lookup predicate.
     * @return The first matching document, or empty.
     */
    Optional<ObjectNode> get(Predicate<JsonNode> predicate);

    /**
     * @param predicate Selects the documents to delete.
     * @return How many documents were removed.
     */
    int remove(Predicate<JsonNode> predicate);

    /**
     * @return Every document in the collection, in no particular order.
     */
    List<ObjectNode> all();

    /**
     * @param predicate The filter.
     * @return Every matching document.
     */
    List<ObjectNode> search(Predicate<JsonNode> predicate);

    /**
     * @return The number of documents in the collection.
     */
    int count();
}
