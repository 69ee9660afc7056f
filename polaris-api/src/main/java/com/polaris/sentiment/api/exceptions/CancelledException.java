/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.exceptions;

/**
 * The caller's request context was cancelled or passed its deadline.
 * Never retried.
 */
public class CancelledException extends SentimentException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
