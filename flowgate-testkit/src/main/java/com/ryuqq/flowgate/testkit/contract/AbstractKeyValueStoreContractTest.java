package com.ryuqq.flowgate.testkit.contract;

import com.ryuqq.flowgate.core.spi.GenerationMismatchException;
import com.ryuqq.flowgate.core.spi.KeyValueStore;
import com.ryuqq.flowgate.core.spi.VersionedValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link KeyValueStore} implementations.
 *
 * <p>Adapters extend this class and provide a fresh store per test through {@link #createStore()}.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Read-your-writes and overwrite semantics</li>
 *   <li>Prefix listing in ascending key order</li>
 *   <li>Generation tracking and conditional writes</li>
 *   <li>Argument validation</li>
 *   <li>Concurrent writers to distinct keys</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractKeyValueStoreContractTest {

    protected KeyValueStore store;

    /**
     * Creates the store under test.
     *
     * @return empty store
     */
    protected abstract KeyValueStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Test
    void get_MissingKey_ReturnsEmpty() {
        assertTrue(store.get("links/missing").isEmpty());
    }

    @Test
    void put_ThenGet_ReturnsWrittenValue() {
        // When
        store.put("links/a", "{\"externalId\":\"Q1\"}");

        // Then
        assertEquals("{\"externalId\":\"Q1\"}", store.get("links/a").orElseThrow());
    }

    @Test
    void put_ExistingKey_OverwritesValue() {
        // Given
        store.put("queue/task-1", "v1");

        // When
        store.put("queue/task-1", "v2");

        // Then
        assertEquals("v2", store.get("queue/task-1").orElseThrow());
        assertEquals(List.of("queue/task-1"), store.list("queue/"));
    }

    @Test
    void list_ReturnsOnlyMatchingPrefixInAscendingOrder() {
        // Given
        store.put("queue/task-c", "3");
        store.put("links/x", "x");
        store.put("queue/task-a", "1");
        store.put("queue/task-b", "2");

        // When
        List<String> keys = store.list("queue/");

        // Then
        assertEquals(List.of("queue/task-a", "queue/task-b", "queue/task-c"), keys);
    }

    @Test
    void list_EmptyPrefix_ReturnsAllKeys() {
        // Given
        store.put("b", "2");
        store.put("a", "1");

        // When & Then
        assertEquals(List.of("a", "b"), store.list(""));
    }

    @Test
    void list_NoMatch_ReturnsEmptyList() {
        // Given
        store.put("links/a", "1");

        // When & Then
        assertTrue(store.list("queue/").isEmpty());
    }

    // ===================================================================
    // GENERATIONS
    // ===================================================================

    @Test
    void getVersioned_GenerationIncrementsOnEveryWrite() {
        // Given
        assertTrue(store.getVersioned("queue/task-1").isEmpty());

        // When
        store.put("queue/task-1", "v1");
        VersionedValue first = store.getVersioned("queue/task-1").orElseThrow();
        store.put("queue/task-1", "v2");
        VersionedValue second = store.getVersioned("queue/task-1").orElseThrow();

        // Then
        assertEquals(new VersionedValue("v1", 1), first);
        assertEquals(new VersionedValue("v2", 2), second);
    }

    @Test
    void putIfGeneration_MatchingGeneration_WritesAndReturnsNextGeneration() {
        // Given
        store.put("queue/task-1", "v1");
        long generation = store.getVersioned("queue/task-1").orElseThrow().generation();

        // When
        long written = store.putIfGeneration("queue/task-1", "v2", generation);

        // Then
        assertEquals(generation + 1, written);
        assertEquals(new VersionedValue("v2", written), store.getVersioned("queue/task-1").orElseThrow());
    }

    @Test
    void putIfGeneration_StaleGeneration_ThrowsAndKeepsValue() {
        // Given
        store.put("queue/task-1", "v1");
        long stale = store.getVersioned("queue/task-1").orElseThrow().generation();
        store.put("queue/task-1", "v2");

        // When
        GenerationMismatchException exception = assertThrows(GenerationMismatchException.class,
            () -> store.putIfGeneration("queue/task-1", "v3", stale));

        // Then
        assertEquals("queue/task-1", exception.getKey());
        assertEquals(stale, exception.getExpectedGeneration());
        assertEquals(stale + 1, exception.getCurrentGeneration());
        assertEquals("v2", store.get("queue/task-1").orElseThrow());
    }

    @Test
    void putIfGeneration_ZeroGeneration_OnlyCreatesMissingKey() {
        // When
        assertEquals(1, store.putIfGeneration("queue/task-1", "v1", 0));

        // Then
        assertThrows(GenerationMismatchException.class, () -> store.putIfGeneration("queue/task-1", "v2", 0));
        assertEquals("v1", store.get("queue/task-1").orElseThrow());
    }

    @Test
    void putIfGeneration_ConcurrentWritersWithSameGeneration_ExactlyOneWins() throws InterruptedException {
        // Given
        store.put("queue/task-1", "pending");
        long generation = store.getVersioned("queue/task-1").orElseThrow().generation();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger wins = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();

        // When
        for (int t = 0; t < threads; t++) {
            String value = "writer-" + t;
            executor.submit(() -> {
                try {
                    start.await();
                    store.putIfGeneration("queue/task-1", value, generation);
                    wins.incrementAndGet();
                } catch (GenerationMismatchException e) {
                    conflicts.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        // Then
        assertTrue(done.await(10, TimeUnit.SECONDS), "writers should finish");
        executor.shutdownNow();
        assertEquals(1, wins.get());
        assertEquals(threads - 1, conflicts.get());
        assertEquals(generation + 1, store.getVersioned("queue/task-1").orElseThrow().generation());
    }

    @Test
    void nullArguments_AreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.get(null));
        assertThrows(IllegalArgumentException.class, () -> store.put(null, "v"));
        assertThrows(IllegalArgumentException.class, () -> store.put("k", null));
        assertThrows(IllegalArgumentException.class, () -> store.list(null));
        assertThrows(IllegalArgumentException.class, () -> store.getVersioned(null));
        assertThrows(IllegalArgumentException.class, () -> store.putIfGeneration("k", null, 0));
        assertThrows(IllegalArgumentException.class, () -> store.putIfGeneration("k", "v", -1));
    }

    @Test
    void concurrentPuts_ToDistinctKeys_AreAllVisible() throws InterruptedException {
        // Given
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        // When
        for (int t = 0; t < threads; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.put(String.format("queue/%02d-%03d", thread, i), "v");
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();

        // Then
        assertTrue(done.await(10, TimeUnit.SECONDS), "writers should finish");
        executor.shutdownNow();

        List<String> keys = store.list("queue/");
        assertEquals(threads * perThread, keys.size());
        List<String> sorted = new ArrayList<>(keys);
        sorted.sort(null);
        assertEquals(sorted, keys, "keys must be listed in ascending order");
    }
}
