/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.cache;

import java.util.Optional;

/**
 * In-memory store of encoded sentiment results keyed by normalized input.
 *
 * <p>The cache is purely an optimization. Callers must tolerate a miss at any
 * time: entries expire after a fixed TTL and may be evicted earlier under
 * memory pressure.
 *
 * <p>Design principles:
 * <ul>
 *   <li>Values are opaque byte payloads, so memory use is measured in bytes</li>
 *   <li>Reads never block on I/O and never return an expired entry</li>
 *   <li>Writes are best-effort: a dropped write is reported, never thrown</li>
 *   <li>Safe for concurrent {@code get}/{@code set}; a racing set and get on the
 *       same key may observe either value</li>
 * </ul>
 */
public interface ResultCache {

    /**
     * Returns a copy of the payload stored under {@code key}, or empty when the key
     * is absent or its entry has expired.
     */
    Optional<byte[]> get(String key);

    /**
     * Stores {@code payload} under {@code key}, replacing any previous entry.
     *
     * @return {@code true} if the entry was stored, {@code false} if the write was dropped
     */
    boolean set(String key, byte[] payload);

    /**
     * Removes the entry for {@code key}, if any.
     */
    void invalidate(String key);

    /**
     * Removes all entries.
     */
    void clear();

    /**
     * Runs pending maintenance such as expiry and eviction.
     */
    default void cleanUp() {
    }

    /**
     * Get cache statistics for monitoring.
     */
    CacheMetrics getMetrics();

    /**
     * Cache metrics for monitoring and tuning.
     */
    record CacheMetrics(
            long totalRequests,
            long hits,
            long misses,
            long evictions,
            long droppedWrites,
            long currentSize,
            long weightedSizeBytes,
            long maxSizeBytes,
            double hitRate
    ) {
        public String format() {
            return String.format(
                    "Cache Metrics: requests=%d, hits=%d (%.1f%%), misses=%d, evictions=%d, dropped=%d, size=%d, bytes=%d/%d",
                    totalRequests, hits, hitRate * 100, misses, evictions, droppedWrites,
                    currentSize, weightedSizeBytes, maxSizeBytes
            );
        }
    }
}
