package com.ryuqq.flowgate.adapter.inmemory.store;

import com.ryuqq.flowgate.core.spi.GenerationMismatchException;
import com.ryuqq.flowgate.core.spi.KeyValueStore;
import com.ryuqq.flowgate.core.spi.VersionedValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link KeyValueStore} SPI for testing and reference purposes.
 *
 * <p>Backed by a {@link ConcurrentSkipListMap}, so prefix listing is a sorted range scan
 * and every operation is thread-safe without external locking.</p>
 *
 * <p>Each entry carries its generation. Conditional writes compare and replace the entry inside
 * {@link ConcurrentSkipListMap#compute}, so exactly one of several writers holding the same
 * generation succeeds.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get / put / putIfGeneration:</strong> O(log N)</li>
 *   <li><strong>list:</strong> O(log N + M) for M matching keys</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * KeyValueStore store = new InMemoryKeyValueStore();
 * ReconciliationEngine engine = new StoreBackedReconciliationEngine(store, searchClient);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentSkipListMap<String, VersionedValue> entries = new ConcurrentSkipListMap<>();

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<String> get(String key) {
        return getVersioned(key).map(VersionedValue::value);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void put(String key, String value) {
        requireKey(key);
        requireValue(value);
        entries.compute(key, (k, current) -> new VersionedValue(value, generationOf(current) + 1));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<VersionedValue> getVersioned(String key) {
        requireKey(key);
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public long putIfGeneration(String key, String value, long expectedGeneration) {
        requireKey(key);
        requireValue(value);
        if (expectedGeneration < 0) {
            throw new IllegalArgumentException(
                "expectedGeneration must be non-negative (current: " + expectedGeneration + ")");
        }
        VersionedValue written = entries.compute(key, (k, current) -> {
            long currentGeneration = generationOf(current);
            if (currentGeneration != expectedGeneration) {
                throw new GenerationMismatchException(k, expectedGeneration, currentGeneration);
            }
            return new VersionedValue(value, currentGeneration + 1);
        });
        return written.generation();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Keys are visited in natural order starting at {@code prefix}; the scan stops at the
     * first key that no longer starts with it.</p>
     */
    @Override
    public List<String> list(String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, VersionedValue> entry : entries.tailMap(prefix, true).entrySet()) {
            if (!entry.getKey().startsWith(prefix)) {
                break;
            }
            keys.add(entry.getKey());
        }
        return keys;
    }

    /**
     * Removes all entries.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        entries.clear();
    }

    /**
     * Returns the number of stored entries.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    private static long generationOf(VersionedValue current) {
        return current == null ? 0 : current.generation();
    }

    private static void requireValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
    }
}
