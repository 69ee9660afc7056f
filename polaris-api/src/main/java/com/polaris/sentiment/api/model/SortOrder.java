/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.model;

import java.util.Comparator;
import java.util.Locale;

/**
 * Ordering applied to sentences by score.
 */
public enum SortOrder {
    /**
     * Increasing score, most negative first.
     */
    ASCENDING,

    /**
     * Decreasing score, most positive first.
     */
    DESCENDING;

    private static final Comparator<Sentence> BY_SCORE =
            (a, b) -> Float.compare(a.score(), b.score());

    /**
     * Score comparator in this order. Equal scores compare as equal in both
     * directions, so a stable sort keeps their input order.
     */
    public Comparator<Sentence> comparator() {
        return this == ASCENDING ? BY_SCORE : BY_SCORE.reversed();
    }

    /**
     * Parses the {@code order} query parameter. Only {@code desc} (any case)
     * selects {@link #DESCENDING}; anything else, including null, is ascending.
     */
    public static SortOrder fromParameter(String value) {
        if (value != null && "desc".equals(value.toLowerCase(Locale.ROOT))) {
            return DESCENDING;
        }
        return ASCENDING;
    }
}
