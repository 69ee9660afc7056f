/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.model;

/**
 * A span of the analyzed text together with its polarity score.
 *
 * <p>Scores reported by the provider fall in {@code [-1.0, 1.0]}; negative values
 * are negative sentiment. The range is not enforced here.
 */
public record Sentence(String text, float score) {
}
