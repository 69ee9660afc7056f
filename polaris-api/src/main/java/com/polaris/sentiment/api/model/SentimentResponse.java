/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.model;

import java.util.List;
import java.util.Map;

/**
 * Externally visible result of a sentiment request.
 *
 * <p>Each element is a single-entry map of sentence text to score. The same text
 * may appear more than once; entries are kept positionally.
 */
public record SentimentResponse(List<Map<String, Float>> entries) {

    public SentimentResponse {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static SentimentResponse empty() {
        return new SentimentResponse(List.of());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
