/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Memory-bounded TTL cache of encoded results, backed by Caffeine.
 *
 * <p>Two independent forces remove entries:
 * <ul>
 *   <li><b>TTL:</b> every entry expires a fixed time after it was written. The TTL
 *       is set at construction and applies to all entries alike.</li>
 *   <li><b>Memory ceiling:</b> entries are weighed by their approximate footprint
 *       in bytes; once the total weight exceeds the ceiling Caffeine evicts using
 *       Window TinyLFU, an LRU approximation with frequency admission.</li>
 * </ul>
 *
 * <p>Payloads are copied on write and on read, so no caller ever holds a
 * reference into stored bytes.
 *
 * <h2>Thread Safety</h2>
 * <p>Reads are lock-free. Concurrent writes to one key are atomic per entry;
 * the last write wins.
 *
 * <pre>{@code
 * ResultCache cache = CaffeineResultCache.builder()
 *     .maxSizeMb(64)
 *     .expireAfterWrite(Duration.ofMinutes(10))
 *     .recordStats(true)
 *     .build();
 * }</pre>
 */
public class CaffeineResultCache implements ResultCache {
    private static final Logger logger = Logger.getLogger(CaffeineResultCache.class.getName());

    static final long BYTES_PER_MB = 1024L * 1024L;

    /**
     * Approximate bookkeeping cost of one entry: node, key object, array header.
     */
    static final int ENTRY_OVERHEAD_BYTES = 96;

    private final Cache<String, byte[]> cache;
    private final long maxWeightBytes;
    private final Duration ttl;
    private final boolean statsEnabled;
    private final LongAdder droppedWrites = new LongAdder();

    private CaffeineResultCache(Builder builder) {
        this.maxWeightBytes = builder.maxSizeMb * BYTES_PER_MB;
        this.ttl = builder.ttl;
        this.statsEnabled = builder.recordStats;

        Caffeine<String, byte[]> cacheBuilder = Caffeine.newBuilder()
                .maximumWeight(maxWeightBytes)
                .weigher(CaffeineResultCache::weigh);

        cacheBuilder.expireAfterWrite(ttl);

        if (builder.ticker != null) {
            cacheBuilder.ticker(builder.ticker);
        }
        if (builder.executor != null) {
            cacheBuilder.executor(builder.executor);
        }
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }
        if (builder.logEvictions) {
            cacheBuilder.removalListener((String key, byte[] value, RemovalCause cause) -> {
                if (cause.wasEvicted() && logger.isLoggable(Level.FINE)) {
                    logger.fine("Cache entry removed: key=" + key + ", cause=" + cause);
                }
            });
        }

        this.cache = cacheBuilder.build();

        logger.info(String.format(
                "CaffeineResultCache initialized: maxSize=%dMB, ttl=%dms, stats=%b",
                builder.maxSizeMb, ttl.toMillis(), builder.recordStats));
    }

    /**
     * Approximate heap footprint of an entry in bytes.
     */
    static int weigh(String key, byte[] payload) {
        long weight = (long) key.length() * Character.BYTES + payload.length + ENTRY_OVERHEAD_BYTES;
        return (int) Math.min(Integer.MAX_VALUE, weight);
    }

    @Override
    public Optional<byte[]> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        byte[] payload = cache.getIfPresent(key);
        if (payload == null) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Cache miss: key=" + key);
            }
            return Optional.empty();
        }
        return Optional.of(payload.clone());
    }

    @Override
    public boolean set(String key, byte[] payload) {
        if (key == null || payload == null) {
            logger.warning("Dropping cache write with null key or payload");
            droppedWrites.increment();
            return false;
        }

        if (weigh(key, payload) > maxWeightBytes) {
            // Caffeine would admit and immediately evict it
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Dropping oversized cache entry: key=%s, bytes=%d, max=%d",
                        key, payload.length, maxWeightBytes));
            }
            droppedWrites.increment();
            return false;
        }

        try {
            cache.put(key, payload.clone());
            return true;
        } catch (RuntimeException e) {
            droppedWrites.increment();
            logger.log(Level.WARNING, "Cache write failed for key=" + key, e);
            return false;
        }
    }

    @Override
    public void invalidate(String key) {
        if (key != null) {
            cache.invalidate(key);
        }
    }

    @Override
    public void clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        cache.cleanUp();
        logger.info("Cache cleared: " + size + " entries removed");
    }

    @Override
    public void cleanUp() {
        cache.cleanUp();
    }

    @Override
    public CacheMetrics getMetrics() {
        CacheStats stats = statsEnabled ? cache.stats() : CacheStats.empty();
        long weightedSize = cache.policy().eviction()
                .map(eviction -> eviction.weightedSize().orElse(0L))
                .orElse(0L);

        return new CacheMetrics(
                stats.requestCount(),
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                droppedWrites.sum(),
                cache.estimatedSize(),
                weightedSize,
                maxWeightBytes,
                stats.hitRate()
        );
    }

    public Duration getTtl() {
        return ttl;
    }

    public long getMaxWeightBytes() {
        return maxWeightBytes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long maxSizeMb = 64;
        private Duration ttl = Duration.ofMinutes(10);
        private boolean recordStats = false;
        private boolean logEvictions = false;
        private Ticker ticker;
        private Executor executor;

        public Builder maxSizeMb(long maxSizeMb) {
            this.maxSizeMb = maxSizeMb;
            return this;
        }

        public Builder expireAfterWrite(Duration ttl) {
            this.ttl = Objects.requireNonNull(ttl, "ttl cannot be null");
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public Builder logEvictions(boolean logEvictions) {
            this.logEvictions = logEvictions;
            return this;
        }

        /**
         * Time source for expiry. Tests pass a manual ticker.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = ticker;
            return this;
        }

        /**
         * Executor for maintenance work. Defaults to the common pool.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public CaffeineResultCache build() {
            if (maxSizeMb <= 0) {
                throw new IllegalArgumentException("maxSizeMb must be positive: " + maxSizeMb);
            }
            if (ttl.isZero() || ttl.isNegative()) {
                throw new IllegalArgumentException("ttl must be positive: " + ttl);
            }
            return new CaffeineResultCache(this);
        }
    }
}
