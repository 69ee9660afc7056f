/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.cache;

import java.util.Locale;

/**
 * Derives the cache key for a piece of input text.
 *
 * <p>Policy: strip leading and trailing whitespace, then lowercase. Nothing
 * else is folded, so {@code "Hi there"} and {@code "hi   there"} stay distinct
 * keys while {@code " Hello "} and {@code "hello"} share one.
 */
public final class CacheKeyNormalizer {

    private CacheKeyNormalizer() {
        throw new AssertionError("No instances");
    }

    /**
     * Normalizes {@code text} into a cache key. Null normalizes to the empty key.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.strip().toLowerCase(Locale.ROOT);
    }
}
