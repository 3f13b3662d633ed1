package com.ganesh.doctable;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A stress test to verify registry and table integrity when many threads share one store and one
 * backing file.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS) // Allows non-static @BeforeAll and @AfterAll
class DocumentTableStoreStressTest {

    private DocumentTableStore store;

    @TempDir
    static Path tempDir;

    // --- Test Parameters ---
    private static final int NUM_THREADS = 8;
    private static final int OPERATIONS_PER_THREAD = 300;
    private static final int KEYS_PER_THREAD = 50; // Each thread owns keys "t<n>-key-0" to "t<n>-key-49"

    @BeforeAll
    void setUp() {
        store = new DocumentTableStore(new Config.Builder()
                .withDataDirectory(tempDir.resolve("stress_test_data").toString())
                .build());
        store.start();
        store.createKvTable("shared");
    }

    @AfterAll
    void tearDown() {
        if (store != null) {
            System.out.println(store.getMetrics().getSummary());
            store.stop();
        }
    }

    @Test
    void runConcurrentKvStressTest() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(NUM_THREADS);
        // Keys are partitioned per thread, so each thread's view is the ground truth for its keys.
        final ConcurrentMap<String, Integer> groundTruth = new ConcurrentHashMap<>();

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int t = 0; t < NUM_THREADS; t++) {
            final int thread = t;
            tasks.add(() -> {
                Random random = new Random(thread);
                try (KvTable table = store.getKvTable("shared")) {
                    for (int i = 0; i < OPERATIONS_PER_THREAD; i++) {
                        String key = "t" + thread + "-key-" + random.nextInt(KEYS_PER_THREAD);
                        double operation = random.nextDouble();

                        // Workload: 40% reads, 50% writes, 10% deletes
                        if (operation < 0.4) {
                            Integer expected = groundTruth.get(key);
                            Integer actual = table.get(key).map(v -> (Integer) v.get("n")).orElse(null);
                            assertEquals(expected, actual, "Read mismatch for key: " + key);
                        } else if (operation < 0.9) {
                            table.set(key, StoreValue.of(Map.of("n", i)));
                            groundTruth.put(key, i);
                        } else {
                            table.delete(key);
                            groundTruth.remove(key);
                        }
                    }
                }
                return null;
            });
        }

        for (Future<Void> future : executor.invokeAll(tasks)) {
            future.get(); // surfaces assertion failures from worker threads
        }
        executor.shutdown();
        executor.awaitTermination(1, TimeUnit.MINUTES);

        try (KvTable verifier = store.getKvTable("shared")) {
            Map<String, StoreValue> all = verifier.listAll();
            assertEquals(groundTruth.size(), all.size());
            for (Map.Entry<String, Integer> entry : groundTruth.entrySet()) {
                assertEquals(entry.getValue(), all.get(entry.getKey()).get("n"), "Data mismatch for key: " + entry.getKey());
            }
        }
    }

    @Test
    void runConcurrentRegistryStressTest() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(NUM_THREADS);
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int t = 0; t < NUM_THREADS; t++) {
            final int thread = t;
            tasks.add(() -> {
                for (int i = 0; i < 5; i++) {
                    String name = "table_" + thread + "_" + i;
                    if (i % 2 == 0) {
                        store.createKvTable(name);
                    } else {
                        store.createKkvTable(name);
                    }
                }
                store.dropTable("table_" + thread + "_0");
                return null;
            });
        }

        for (Future<Void> future : executor.invokeAll(tasks)) {
            future.get();
        }
        executor.shutdown();
        executor.awaitTermination(1, TimeUnit.MINUTES);

        Map<String, TableType> tables = store.listTables();
        for (int t = 0; t < NUM_THREADS; t++) {
            assertTrue(!tables.containsKey("table_" + t + "_0"));
            for (int i = 1; i < 5; i++) {
                assertEquals(i % 2 == 0 ? TableType.KV : TableType.KKV, tables.get("table_" + t + "_" + i));
            }
        }
    }
}
