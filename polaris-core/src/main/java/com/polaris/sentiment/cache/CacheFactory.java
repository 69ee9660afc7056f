/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.cache;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the result cache described by a {@link CacheConfig}.
 *
 * <ul>
 *   <li>enabled: {@link CaffeineResultCache} bounded by size and TTL</li>
 *   <li>disabled: {@link NoOpResultCache}</li>
 * </ul>
 */
public final class CacheFactory {

    private static final Logger logger = Logger.getLogger(CacheFactory.class.getName());

    private CacheFactory() {
        throw new AssertionError("CacheFactory should not be instantiated");
    }

    public static ResultCache create(CacheConfig config) {
        logger.info("Creating cache: " + config);

        if (!config.isEnabled()) {
            return new NoOpResultCache();
        }

        return CaffeineResultCache.builder()
                .maxSizeMb(config.getMaxSizeMb())
                .expireAfterWrite(config.getEntryTtl())
                .recordStats(config.isRecordStats())
                .logEvictions(Logger.getLogger(CaffeineResultCache.class.getName()).isLoggable(Level.FINE))
                .build();
    }
}
