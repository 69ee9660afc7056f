/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.runtime;

import com.polaris.sentiment.api.model.Sentence;
import com.polaris.sentiment.api.model.SentimentResponse;
import com.polaris.sentiment.api.model.SortOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns provider sentences into the response shape: stable sort by score,
 * truncate, project each sentence to a single {@code text -> score} entry.
 *
 * <p>Sentences with equal scores keep their input order in both directions.
 * A negative limit keeps every sentence. Stateless and thread-safe.
 */
public class ResultShaper {

    public SentimentResponse shape(List<Sentence> sentences, SortOrder order, int limit) {
        Objects.requireNonNull(order, "order cannot be null");
        if (sentences == null || sentences.isEmpty()) {
            return SentimentResponse.empty();
        }

        // List.sort is a stable merge sort
        List<Sentence> sorted = new ArrayList<>(sentences);
        sorted.sort(order.comparator());

        int size = limit < 0 ? sorted.size() : Math.min(limit, sorted.size());
        List<Map<String, Float>> entries = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Sentence sentence = sorted.get(i);
            entries.add(Collections.singletonMap(sentence.text(), sentence.score()));
        }
        return new SentimentResponse(entries);
    }
}
