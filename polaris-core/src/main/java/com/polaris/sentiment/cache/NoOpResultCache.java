/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.cache;

import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Logger;

/**
 * Cache that stores nothing. Every lookup misses and every write is dropped.
 *
 * <p>Selected when caching is disabled. The pipeline produces the same output
 * with this cache as with a live one; each request simply pays for a remote call.
 */
public class NoOpResultCache implements ResultCache {

    private static final Logger logger = Logger.getLogger(NoOpResultCache.class.getName());

    private final LongAdder requests = new LongAdder();
    private final LongAdder droppedWrites = new LongAdder();

    public NoOpResultCache() {
        logger.info("NoOpResultCache initialized - caching disabled");
    }

    @Override
    public Optional<byte[]> get(String key) {
        requests.increment();
        return Optional.empty();
    }

    @Override
    public boolean set(String key, byte[] payload) {
        droppedWrites.increment();
        return false;
    }

    @Override
    public void invalidate(String key) {
        // nothing stored
    }

    @Override
    public void clear() {
        // nothing stored
    }

    @Override
    public CacheMetrics getMetrics() {
        long total = requests.sum();
        return new CacheMetrics(total, 0L, total, 0L, droppedWrites.sum(), 0L, 0L, 0L, 0.0);
    }

    @Override
    public String toString() {
        return "NoOpResultCache{requests=" + requests.sum() + ", dropped=" + droppedWrites.sum() + "}";
    }
}
