package com.ganesh.doctable;

import com.ganesh.doctable.engine.Documents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTableStoreTest {

    private DocumentTableStore store;
    private Config config;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        this.config = new Config.Builder()
                .withDataDirectory(tempDir.resolve("test_data").toString())
                .build();
        store = new DocumentTableStore(config);
        store.start();
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.stop();
        }
    }

    @Test
    void testStartCreatesDirectoryAndMetadataFile() {
        assertTrue(Files.isDirectory(Path.of(config.getDataDirectory())));
        assertTrue(Files.exists(store.metadataPath()));
        assertEquals(".table_info", store.metadataPath().getFileName().toString());
    }

    @Test
    void testEmptyStoreListsNoTables() {
        assertTrue(store.listTables().isEmpty());
    }

    @Test
    void testCreateKvTableIsListed() {
        store.createKvTable("orders");
        assertEquals(Map.of("orders", TableType.KV), store.listTables());
        assertEquals("kv", store.listTables().get("orders").code());
        assertTrue(Files.exists(store.tablePath("orders")));
        assertEquals("orders.json", store.tablePath("orders").getFileName().toString());
    }

    @Test
    void testCreateBothTypes() {
        store.createKvTable("users");
        store.createKkvTable("events");
        Map<String, TableType> tables = store.listTables();
        assertEquals(2, tables.size());
        assertEquals(TableType.KV, tables.get("users"));
        assertEquals(TableType.KKV, tables.get("events"));
    }

    @Test
    void testCreateTwiceFails() {
        store.createKvTable("orders");
        assertThrows(TableExistsException.class, () -> store.createKvTable("orders"));
        assertThrows(TableExistsException.class, () -> store.createKkvTable("orders"));
        assertEquals(TableType.KV, store.listTables().get("orders"));
    }

    @Test
    void testInvalidTableNamesRejected() {
        assertThrows(TableNameException.class, () -> store.createKvTable("1bad"));
        assertThrows(TableNameException.class, () -> store.createKvTable("bad name"));
        assertThrows(TableNameException.class, () -> store.createKvTable(""));
        assertThrows(TableNameException.class, () -> store.createKvTable("_private"));
        assertThrows(TableNameException.class, () -> store.createKkvTable("dash-name"));
        assertThrows(TableNameException.class, () -> store.createKvTable(null));
        assertTrue(store.listTables().isEmpty());
    }

    @Test
    void testValidTableNamesAccepted() {
        store.createKvTable("a");
        store.createKvTable("Orders_2024");
        store.createKkvTable("x_1_y");
        assertEquals(3, store.listTables().size());
    }

    @Test
    void testReservedMetadataNameRejected() {
        assertThrows(TableExistsException.class, () -> store.createKvTable(DocumentTableStore.TABLE_INFO_TABLE));
        assertThrows(TableExistsException.class, () -> store.createKkvTable("_table_info"));
        assertTrue(store.listTables().isEmpty());
    }

    @Test
    void testGetTableDispatchesOnType() {
        store.createKvTable("users");
        store.createKkvTable("events");

        Table users = store.getTable("users");
        Table events = store.getTable("events");
        assertInstanceOf(KvTable.class, users);
        assertInstanceOf(KkvTable.class, events);
        assertEquals(TableType.KV, users.getType());
        assertEquals(TableType.KKV, events.getType());
        assertEquals("users", users.getName());
    }

    @Test
    void testTypedAccessorsRejectWrongType() {
        store.createKvTable("users");
        store.createKkvTable("events");

        assertNotNull(store.getKvTable("users"));
        assertNotNull(store.getKkvTable("events"));
        assertThrows(TableTypeException.class, () -> store.getKkvTable("users"));
        assertThrows(TableTypeException.class, () -> store.getKvTable("events"));
    }

    @Test
    void testGetUnknownTableFails() {
        assertThrows(TableNotFoundException.class, () -> store.getTable("missing"));
        assertThrows(TableNotFoundException.class, () -> store.getTableInfo("missing"));
    }

    @Test
    void testGetTableWithMissingFileFails() throws IOException {
        store.createKvTable("orders");
        Files.delete(store.tablePath("orders"));
        assertThrows(TableNotFoundException.class, () -> store.getTable("orders"));
    }

    @Test
    void testDropTable() {
        store.createKvTable("orders");
        store.dropTable("orders");

        assertThrows(TableNotFoundException.class, () -> store.getTable("orders"));
        assertFalse(store.listTables().containsKey("orders"));
        assertFalse(Files.exists(store.tablePath("orders")));
    }

    @Test
    void testDropUnknownTableFails() {
        assertThrows(TableNotFoundException.class, () -> store.dropTable("missing"));
    }

    @Test
    void testDropToleratesMissingFile() throws IOException {
        store.createKvTable("orders");
        Files.delete(store.tablePath("orders"));
        store.dropTable("orders");
        assertTrue(store.listTables().isEmpty());
    }

    @Test
    void testDropThenRecreateStartsEmpty() {
        store.createKvTable("orders");
        KvTable orders = store.getKvTable("orders");
        orders.set("o1", StoreValue.of(Map.of("total", 10)));
        orders.close();

        store.dropTable("orders");
        store.createKkvTable("orders");

        KkvTable recreated = store.getKkvTable("orders");
        assertTrue(recreated.listAll().isEmpty());
        assertEquals(TableType.KKV, store.listTables().get("orders"));
    }

    @Test
    void testOpenTableFailsAfterDrop() {
        store.createKvTable("orders");
        KvTable orders = store.getKvTable("orders");
        orders.set("o1", StoreValue.of(Map.of("total", 10)));

        store.dropTable("orders");

        assertThrows(TableNotFoundException.class, () -> orders.get("o1"));
        assertThrows(TableNotFoundException.class, orders::listKeys);
        assertThrows(TableNotFoundException.class, () -> orders.set("o2", StoreValue.of(Map.of())));
        assertFalse(Files.exists(store.tablePath("orders")));
    }

    @Test
    void testTableInfoRecordsTypeAndTimestamps() {
        long before = System.currentTimeMillis();
        store.createKkvTable("events");
        TableInfo info = store.getTableInfo("events");

        assertEquals("events", info.getName());
        assertEquals(TableType.KKV, info.getType());
        assertTrue(info.getCreatedAt() >= before);
        assertEquals(info.getCreatedAt(), info.getUpdatedAt());
    }

    @Test
    void testMetadataFileFormat() throws IOException {
        store.createKvTable("orders");
        var root = Documents.objectMapper.readTree(store.metadataPath().toFile());
        var infos = root.get(DocumentTableStore.TABLE_INFO_TABLE);
        assertEquals(1, infos.size());
        assertEquals("orders", infos.get(0).get("name").asText());
        assertEquals("kv", infos.get(0).get("type").asText());
        assertTrue(infos.get(0).has("created_at"));
        assertTrue(infos.get(0).has("updated_at"));
    }

    @Test
    void testOrphanFileIsResetOnCreate() throws IOException {
        Files.writeString(store.tablePath("orders"), "{\"orders\":[{\"key\":\"stale\",\"value\":{\"created_at\":1,\"updated_at\":1,\"data\":{}}}]}");

        store.createKvTable("orders");

        assertTrue(store.getKvTable("orders").listKeys().isEmpty());
    }

    @Test
    void testRecoveryAfterRestart() {
        store.createKvTable("users");
        store.createKkvTable("events");
        store.getKvTable("users").set("u1", StoreValue.of(Map.of("name", "Ganesh")));
        store.getKkvTable("events").set("u1", "login", StoreValue.of(Map.of("count", 3)));
        store.stop();

        DocumentTableStore newStore = new DocumentTableStore(config);
        newStore.start();
        try {
            assertEquals(Map.of("users", TableType.KV, "events", TableType.KKV), newStore.listTables());
            assertEquals("Ganesh", newStore.getKvTable("users").get("u1").orElseThrow().get("name"));
            assertEquals(3, newStore.getKkvTable("events").get("u1", "login").orElseThrow().get("count"));
        } finally {
            newStore.stop();
        }
        this.store = null;
    }

    @Test
    void testNumbersReadBackIdenticallyAfterRestart() {
        store.createKvTable("prices");
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", 5L);
        data.put("ratio", 1.5f);
        data.put("amount", new BigDecimal("0.10000000000000000000001"));
        store.getKvTable("prices").set("p1", StoreValue.of(data));

        Map<String, Object> beforeRestart = store.getKvTable("prices").get("p1").orElseThrow().getData();
        store.stop();

        DocumentTableStore newStore = new DocumentTableStore(config);
        newStore.start();
        try {
            Map<String, Object> afterRestart = newStore.getKvTable("prices").get("p1").orElseThrow().getData();
            assertEquals(beforeRestart, afterRestart);
            assertEquals(5L, ((Number) afterRestart.get("count")).longValue());
            assertEquals(0, new BigDecimal("1.5").compareTo((BigDecimal) afterRestart.get("ratio")));
            assertEquals(new BigDecimal("0.10000000000000000000001"), afterRestart.get("amount"));
        } finally {
            newStore.stop();
        }
        this.store = null;
    }

    @Test
    void testStoreCanBeStartedAgainAfterStop() {
        store.createKvTable("users");
        store.getKvTable("users").set("u1", StoreValue.of(Map.of("name", "Ganesh")));
        store.stop();

        store.start();

        assertEquals(Map.of("users", TableType.KV), store.listTables());
        assertEquals("Ganesh", store.getKvTable("users").get("u1").orElseThrow().get("name"));
        store.createKkvTable("events");
        assertEquals(TableType.KKV, store.getTableInfo("events").getType());
    }

    @Test
    void testMetadataFileNameMustNotCollideWithTableFiles() {
        assertThrows(IllegalArgumentException.class, () -> new Config.Builder()
                .withMetadataFileName("orders.json")
                .build());
        assertThrows(IllegalArgumentException.class, () -> new Config.Builder()
                .withFileExtension(".db")
                .withMetadataFileName("Registry_1.db")
                .build());
        assertEquals("_registry.json", new Config.Builder()
                .withMetadataFileName("_registry.json")
                .build()
                .getMetadataFileName());
        assertEquals("tables.meta", new Config.Builder()
                .withMetadataFileName("tables.meta")
                .build()
                .getMetadataFileName());
    }

    @Test
    void testTablesShareOneConnectionPerFile() {
        store.createKvTable("orders");
        Path path = store.tablePath("orders");

        KvTable first = store.getKvTable("orders");
        KvTable second = store.getKvTable("orders");
        assertNotSame(first, second);
        assertEquals(2, store.getEnginePool().referenceCount(path), "two handles on one engine");

        first.set("o1", StoreValue.of(Map.of("total", 5)));
        assertEquals(5, second.get("o1").orElseThrow().get("total"));

        first.close();
        assertEquals(1, store.getEnginePool().referenceCount(path));
        second.close();
        assertEquals(0, store.getEnginePool().referenceCount(path));
    }

    @Test
    void testMetricsCountTableLifecycle() {
        store.createKvTable("a");
        store.createKkvTable("b");
        store.dropTable("a");
        assertEquals(2, store.getMetrics().tablesCreated.sum());
        assertEquals(1, store.getMetrics().tablesDropped.sum());
        assertTrue(store.getMetrics().getSummary().contains("Created: 2"));
    }

    @Test
    void testOperationsBeforeStartFail() {
        DocumentTableStore notStarted = new DocumentTableStore(new Config.Builder()
                .withDataDirectory(tempDir.resolve("other").toString())
                .build());
        assertThrows(IllegalStateException.class, notStarted::listTables);
        assertThrows(IllegalStateException.class, () -> notStarted.createKvTable("orders"));
    }

    @Test
    void testCorruptMetadataFileFailsToStart() throws IOException {
        Path otherDir = tempDir.resolve("corrupt");
        Files.createDirectories(otherDir);
        Files.writeString(otherDir.resolve(".table_info"), "not json at all {");
        DocumentTableStore corrupt = new DocumentTableStore(new Config.Builder()
                .withDataDirectory(otherDir.toString())
                .build());
        assertThrows(StoreConnectionException.class, corrupt::start);
    }
}
