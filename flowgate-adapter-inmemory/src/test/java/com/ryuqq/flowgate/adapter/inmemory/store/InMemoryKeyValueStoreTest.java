package com.ryuqq.flowgate.adapter.inmemory.store;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryKeyValueStore 고유 동작 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryKeyValueStoreTest {

    @Test
    void clear_RemovesAllEntries() {
        // Given
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.put("links/a", "1");
        store.put("queue/b", "2");

        // When
        store.clear();

        // Then
        assertEquals(0, store.size());
        assertTrue(store.list("").isEmpty());
    }

    @Test
    void list_PrefixSharingCharacters_DoesNotLeakNeighbours() {
        // Given
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        store.put("link", "0");
        store.put("links/a", "1");
        store.put("linksx", "2");
        store.put("queue/a", "3");

        // When & Then
        assertEquals(List.of("links/a"), store.list("links/"));
        assertEquals(List.of("links/a", "linksx"), store.list("links"));
    }

    @Test
    void put_EmptyKey_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryKeyValueStore().put("", "v"));
    }
}
