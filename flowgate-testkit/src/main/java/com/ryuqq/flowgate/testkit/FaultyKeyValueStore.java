package com.ryuqq.flowgate.testkit;

import com.ryuqq.flowgate.core.spi.KeyValueStore;
import com.ryuqq.flowgate.core.spi.StorageException;
import com.ryuqq.flowgate.core.spi.VersionedValue;

import java.util.List;
import java.util.Optional;

/**
 * {@link KeyValueStore} decorator that injects storage failures on demand.
 *
 * <p>Used to verify that callers wrap persistence failures with context instead of
 * swallowing them. Raw values can also be written directly through {@link #putRaw(String, String)}
 * to simulate corrupt records.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FaultyKeyValueStore implements KeyValueStore {

    private final KeyValueStore delegate;
    private volatile boolean failReads;
    private volatile boolean failWrites;
    private volatile boolean failLists;

    /**
     * Wraps the given store.
     *
     * @param delegate store that handles non-failing calls
     */
    public FaultyKeyValueStore(KeyValueStore delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public FaultyKeyValueStore failReads(boolean fail) {
        this.failReads = fail;
        return this;
    }

    public FaultyKeyValueStore failWrites(boolean fail) {
        this.failWrites = fail;
        return this;
    }

    public FaultyKeyValueStore failLists(boolean fail) {
        this.failLists = fail;
        return this;
    }

    /**
     * Writes a value bypassing failure injection.
     *
     * @param key storage key
     * @param value raw value (may be invalid JSON)
     */
    public void putRaw(String key, String value) {
        delegate.put(key, value);
    }

    @Override
    public Optional<String> get(String key) {
        if (failReads) {
            throw new StorageException(key, "Injected read failure");
        }
        return delegate.get(key);
    }

    @Override
    public void put(String key, String value) {
        if (failWrites) {
            throw new StorageException(key, "Injected write failure");
        }
        delegate.put(key, value);
    }

    @Override
    public Optional<VersionedValue> getVersioned(String key) {
        if (failReads) {
            throw new StorageException(key, "Injected read failure");
        }
        return delegate.getVersioned(key);
    }

    @Override
    public long putIfGeneration(String key, String value, long expectedGeneration) {
        if (failWrites) {
            throw new StorageException(key, "Injected write failure");
        }
        return delegate.putIfGeneration(key, value, expectedGeneration);
    }

    @Override
    public List<String> list(String prefix) {
        if (failLists) {
            throw new StorageException(prefix, "Injected list failure");
        }
        return delegate.list(prefix);
    }
}
