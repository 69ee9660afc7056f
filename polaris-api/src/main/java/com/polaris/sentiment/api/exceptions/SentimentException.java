/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.exceptions;

/**
 * Base type for failures raised while serving a sentiment request.
 *
 * <p>Unchecked so that callers handle failures where they can act on them
 * rather than at every layer in between.
 */
public class SentimentException extends RuntimeException {

    public SentimentException(String message) {
        super(message);
    }

    public SentimentException(String message, Throwable cause) {
        super(message, cause);
    }
}
