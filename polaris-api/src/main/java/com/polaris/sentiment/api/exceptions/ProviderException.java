/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api.exceptions;

/**
 * The remote sentiment provider failed: transport error, non-success status,
 * unreadable payload or timeout.
 */
public class ProviderException extends SentimentException {

    private final int statusCode;

    public ProviderException(String message) {
        this(message, -1, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or {@code -1} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
