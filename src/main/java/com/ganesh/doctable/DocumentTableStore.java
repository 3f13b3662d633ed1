package com.ganesh.doctable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ganesh.doctable.engine.DocumentCollection;
import com.ganesh.doctable.engine.Documents;
import com.ganesh.doctable.engine.EngineHandle;
import com.ganesh.doctable.engine.EnginePool;
import com.ganesh.doctable.engine.JsonFileWriter;
import com.ganesh.doctable.table.DefaultKkvTable;
import com.ganesh.doctable.table.DefaultKvTable;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * A {@link TableStore} keeping each table in its own JSON document file inside one data directory.
 *
 * <p>This class orchestrates the components of the store:
 * <ul>
 * <li><b>Metadata file:</b> a reserved document file whose {@code _table_info} collection holds one
 * {@link TableInfo} per table. It is the only state the registry itself reads and writes.</li>
 * <li><b>Table files:</b> {@code <name><extension>} per table, created and deleted only here.</li>
 * <li><b>Engine pool:</b> one shared connection per file, handed to tables as reference-counted
 * handles.</li>
 * </ul>
 *
 * <p>Registry mutations (create, drop) hold the write side of a {@link ReentrantReadWriteLock};
 * lookups hold the read side. A {@link #getTable(String)} racing a {@link #dropTable(String)} therefore
 * sees the table either fully present or fully gone.
 *
 * @see TableStore
 * @see EnginePool
 */
public class DocumentTableStore implements TableStore {
    private static final Logger logger = LoggerFactory.getLogger(DocumentTableStore.class);

    /** Collection name of the registry metadata; never usable as a table name. */
    public static final String TABLE_INFO_TABLE = "_table_info";
    static final Pattern TABLE_NAME_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");
    private static final String NAME_FIELD = "name";

    private final Config config;
    private final StoreMetrics metrics;
    private final JsonFileWriter fileWriter;
    /** Replaced by {@link #start()} after a {@link #stop()} closed it. */
    private volatile EnginePool enginePool;
    /** Serializes registry mutations against each other and against lookups. */
    private final ReentrantReadWriteLock registryLock = new ReentrantReadWriteLock();
    private final Path dataDirectory;
    private volatile EngineHandle metadata;

    /**
     * Constructs a new DocumentTableStore with the specified configuration.
     *
     * @param config The configuration object containing the data directory and cache settings.
     */
    public DocumentTableStore(Config config) {
        this.config = config;
        this.metrics = new StoreMetrics();
        this.fileWriter = new JsonFileWriter(config.isPrettyPrint());
        this.enginePool = new EnginePool(fileWriter, metrics);
        this.dataDirectory = Paths.get(config.getDataDirectory());
    }

    /**
     * Starts the store: creates the data directory if it doesn't exist, creates the metadata file on
     * first use, and opens it. A stopped store may be started again; it reopens its files through a
     * fresh engine pool.
     *
     * @throws StoreConnectionException if initialization fails due to an I/O error.
     */
    @Override
    public void start() {
        logger.info("Document table store starting in {}", dataDirectory.toAbsolutePath());
        registryLock.writeLock().lock();
        try {
            Preconditions.checkState(metadata == null, "Store already started");
            if (enginePool.isClosed()) {
                enginePool = new EnginePool(fileWriter, metrics);
            }
            Files.createDirectories(dataDirectory);
            Path metadataPath = metadataPath();
            if (!Files.exists(metadataPath)) {
                fileWriter.writeEmpty(metadataPath);
            }
            this.metadata = enginePool.acquire(metadataPath);
        } catch (IOException e) {
            throw new StoreConnectionException("Failed to initialize store in " + dataDirectory, e);
        } finally {
            registryLock.writeLock().unlock();
        }
        logger.info("Document table store started with {} table(s).", tableInfo().count());
    }

    /**
     * Stops the store, closing the metadata file and every pooled connection.
     */
    @Override
    public void stop() {
        registryLock.writeLock().lock();
        try {
            if (metadata != null) {
                metadata.close();
                metadata = null;
            }
            enginePool.close();
        } finally {
            registryLock.writeLock().unlock();
        }
        logger.info("Document table store stopped.");
    }

    @Override
    public StoreMetrics getMetrics() {
        return this.metrics;
    }

    @Override
    public void createKvTable(String name) {
        createTable(name, TableType.KV);
    }

    @Override
    public void createKkvTable(String name) {
        createTable(name, TableType.KKV);
    }

    /**
     * Creates the table file first and records the metadata second; if recording fails the new file is
     * removed again, so no file is left without registration.
     */
    private void createTable(String name, TableType type) {
        registryLock.writeLock().lock();
        try {
            try {
                validateTableName(name);
                if (findTableInfo(name).isPresent()) {
                    throw new TableExistsException("Table '" + name + "' already exists");
                }
            } catch (TableNameException | TableExistsException e) {
                logger.error("Failed to create {} table {}: {}", type, name, e.getMessage());
                throw e;
            }

            logger.info("Creating {} table: {}", type, name);
            Path path = tablePath(name);
            enginePool.invalidate(path);
            try {
                if (Files.exists(path)) {
                    logger.warn("Resetting orphan file {} with no table registration", path);
                }
                fileWriter.writeEmpty(path);
            } catch (IOException e) {
                throw new StoreException("Failed to create file for table '" + name + "'", e);
            }

            try {
                addTableInfo(name, type);
            } catch (RuntimeException e) {
                logger.error("Failed to register table {}, removing its file", name, e);
                deleteQuietly(path);
                throw e;
            }
            metrics.tablesCreated.increment();
            logger.info("Created {} table: {}", type, name);
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    @Override
    public Table getTable(String name) {
        registryLock.readLock().lock();
        try {
            ensureTableExists(name);
            TableType type = getTableType(name);
            Path path = tablePath(name);
            EngineHandle handle = enginePool.acquire(path);
            if (type == TableType.KKV) {
                return new DefaultKkvTable(name, handle, config, metrics);
            }
            return new DefaultKvTable(name, handle, config, metrics);
        } finally {
            registryLock.readLock().unlock();
        }
    }

    @Override
    public KvTable getKvTable(String name) {
        Table table = getTable(name);
        if (!(table instanceof KvTable)) {
            table.close();
            throw new TableTypeException("Table '" + name + "' is a " + table.getType() + " table, not kv");
        }
        return (KvTable) table;
    }

    @Override
    public KkvTable getKkvTable(String name) {
        Table table = getTable(name);
        if (!(table instanceof KkvTable)) {
            table.close();
            throw new TableTypeException("Table '" + name + "' is a " + table.getType() + " table, not kkv");
        }
        return (KkvTable) table;
    }

    @Override
    public Map<String, TableType> listTables() {
        registryLock.readLock().lock();
        try {
            Map<String, TableType> result = new LinkedHashMap<>();
            for (ObjectNode document : tableInfo().all()) {
                TableInfo info = toTableInfo(document);
                result.put(info.getName(), info.getType());
            }
            return result;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    @Override
    public TableInfo getTableInfo(String name) {
        registryLock.readLock().lock();
        try {
            return findTableInfo(name)
                    .orElseThrow(() -> new TableNotFoundException("Table '" + name + "' does not exist"));
        } finally {
            registryLock.readLock().unlock();
        }
    }

    /**
     * Drops a table: detaches its pooled connection, deletes its file (tolerating a file that is
     * already gone) and removes its registration, all under the registry write lock.
     */
    @Override
    public void dropTable(String name) {
        registryLock.writeLock().lock();
        try {
            try {
                if (findTableInfo(name).isEmpty()) {
                    throw new TableNotFoundException("Table '" + name + "' does not exist");
                }
            } catch (TableNotFoundException e) {
                logger.error("Failed to drop table {}: {}", name, e.getMessage());
                throw e;
            }
            logger.info("Dropping table: {}", name);
            Path path = tablePath(name);
            enginePool.invalidate(path);
            try {
                if (!Files.deleteIfExists(path)) {
                    logger.warn("File for table {} was already missing: {}", name, path);
                }
            } catch (IOException e) {
                throw new StoreException("Failed to delete file for table '" + name + "'", e);
            }
            removeTableInfo(name);
            metrics.tablesDropped.increment();
        } finally {
            registryLock.writeLock().unlock();
        }
    }

    private void addTableInfo(String name, TableType type) {
        long now = config.getClock().millis();
        TableInfo info = new TableInfo(name, type, now, now);
        ObjectNode document = Documents.objectMapper.valueToTree(info);
        tableInfo().upsert(document, Documents.fieldEquals(NAME_FIELD, name));
    }

    private void removeTableInfo(String name) {
        tableInfo().remove(Documents.fieldEquals(NAME_FIELD, name));
    }

    private TableType getTableType(String name) {
        return findTableInfo(name)
                .map(TableInfo::getType)
                .orElseThrow(() -> new TableNotFoundException("Table '" + name + "' does not exist"));
    }

    private Optional<TableInfo> findTableInfo(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return tableInfo().get(Documents.fieldEquals(NAME_FIELD, name)).map(this::toTableInfo);
    }

    private TableInfo toTableInfo(JsonNode document) {
        try {
            return Documents.objectMapper.convertValue(document, TableInfo.class);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Malformed table metadata: " + document, e);
        }
    }

    private void ensureTableExists(String name) {
        if (findTableInfo(name).isEmpty()) {
            throw new TableNotFoundException("Table '" + name + "' does not exist");
        }
        Path path = tablePath(name);
        if (!Files.exists(path)) {
            throw new TableNotFoundException("Table '" + name + "' database file does not exist: " + path);
        }
    }

    /**
     * @throws TableExistsException for the reserved metadata name.
     * @throws TableNameException if the name is null or does not match the table name syntax.
     */
    private void validateTableName(String name) {
        if (TABLE_INFO_TABLE.equals(name)) {
            throw new TableExistsException("Table name '" + name + "' is reserved for table metadata");
        }
        if (name == null) {
            throw new TableNameException("Table name must be a string, got null");
        }
        if (!TABLE_NAME_PATTERN.matcher(name).matches()) {
            throw new TableNameException("Table name must start with a letter and contain only letters, "
                    + "numbers and underscores: '" + name + "'");
        }
    }

    private DocumentCollection tableInfo() {
        EngineHandle handle = metadata;
        Preconditions.checkState(handle != null, "Store is not started");
        return handle.collection(TABLE_INFO_TABLE);
    }

    @VisibleForTesting
    Path tablePath(String name) {
        return dataDirectory.resolve(name + config.getFileExtension());
    }

    @VisibleForTesting
    Path metadataPath() {
        return dataDirectory.resolve(config.getMetadataFileName());
    }

    @VisibleForTesting
    EnginePool getEnginePool() {
        return enginePool;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete {}", path, e);
        }
    }
}
