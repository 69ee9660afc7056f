/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.model;

import java.util.List;

/**
 * Raw result of a sentiment analysis call, as returned by a provider.
 *
 * <p>The order of {@link #sentences()} is whatever the provider produced and
 * carries no meaning; callers re-establish order when shaping the result.
 * A null sentence list is normalized to an empty list.
 */
public record SentimentResult(List<Sentence> sentences) {

    public SentimentResult {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
    }

    public static SentimentResult empty() {
        return new SentimentResult(List.of());
    }

    public boolean isEmpty() {
        return sentences.isEmpty();
    }
}
