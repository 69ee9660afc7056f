/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.service.server;

/**
 * Body of {@code POST /api}. Unknown fields are ignored and a missing
 * {@code content} reads as an empty string.
 */
public record AnalyzeRequest(String content) {

    public String contentOrEmpty() {
        return content == null ? "" : content;
    }
}
