package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.artifact.CacheEntry;
import com.ryuqq.pipeline.core.spi.CacheStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CacheStore}.
 *
 * <p>Entries live for the lifetime of the store and are shared by every pipeline run that
 * uses it. The last writer of a key wins.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryCacheStore implements CacheStore {

    private final ConcurrentHashMap<String, CacheEntry> store = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> get(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(store.get(key));
    }

    @Override
    public void put(CacheEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        store.put(entry.key(), entry);
    }

    /**
     * Returns the number of cache keys (for testing).
     */
    public int size() {
        return store.size();
    }

    /**
     * Clears all cache entries (for testing).
     */
    public void clear() {
        store.clear();
    }
}
