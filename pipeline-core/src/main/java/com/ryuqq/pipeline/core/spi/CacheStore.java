package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.artifact.CacheEntry;

import java.util.Optional;

/**
 * Cache storage SPI.
 *
 * <p>Cache entries are shared across pipeline runs and keyed by the expanded cache key.
 * The last writer of a key wins.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CacheStore {

    /**
     * @param key the expanded cache key
     * @return the entry, or empty on a cache miss
     */
    Optional<CacheEntry> get(String key);

    /**
     * @param entry the entry to store (replaces any entry with the same key)
     * @throws IllegalArgumentException if entry is null
     */
    void put(CacheEntry entry);
}
