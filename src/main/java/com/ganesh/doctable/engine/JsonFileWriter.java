package com.ganesh.doctable.engine;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;

/**
 * Writes the complete contents of a document file to disk.
 *
 * <p>This class implements a crash-safe writing strategy by first writing all data to a temporary
 * {@code .tmp} file next to the target. Only upon successful completion is the temporary file
 * atomically renamed over the target. A crash therefore leaves either the previous or the new
 * contents, never a partially written file.
 *
 * <p>The file format is a single JSON object mapping each collection name to an array of documents:
 * <pre>{"orders": [{"key": "o1", "value": {...}}, ...]}</pre>
 */
public class JsonFileWriter {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileWriter.class);
    private static final String TEMP_SUFFIX = ".tmp";

    private final ObjectWriter writer;

    /**
     * @param prettyPrint Whether to indent the JSON output.
     */
    public JsonFileWriter(boolean prettyPrint) {
        this.writer = prettyPrint
                ? Documents.objectMapper.writerWithDefaultPrettyPrinter()
                : Documents.objectMapper.writer();
    }

    /**
     * Writes an empty document file, replacing any existing file at {@code path}.
     *
     * @param path The file to create.
     * @throws IOException if any file I/O error occurs.
     */
    public void writeEmpty(Path path) throws IOException {
        write(path, Map.of());
    }

    /**
     * Writes every collection to {@code path}, replacing its previous contents.
     *
     * @param path The target file.
     * @param collections Collection name to documents.
     * @throws IOException if any file I/O error occurs during the write process.
     */
    public void write(Path path, Map<String, List<ObjectNode>> collections) throws IOException {
        ObjectNode root = Documents.newDocument();
        for (Map.Entry<String, List<ObjectNode>> entry : collections.entrySet()) {
            ArrayNode documents = root.putArray(entry.getKey());
            documents.addAll(entry.getValue());
        }

        Path tempFile = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        logger.debug("Writing document file to temporary file: {}", tempFile);
        try (OutputStream out = Files.newOutputStream(tempFile)) {
            writer.writeValue(out, root);
        }

        try {
            Files.move(tempFile, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.warn("Atomic move not supported for {}, falling back to plain replace", path);
            Files.move(tempFile, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
