/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api;

import com.polaris.sentiment.api.model.SentimentResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Remote sentiment-analysis capability.
 *
 * <p>Given text, returns the list of sentences with their polarity scores, or
 * fails. Implementations share one long-lived client across requests; every
 * call is independent and may be in flight concurrently with others.
 *
 * <p>Cancelling the returned future must abort the underlying remote call where
 * the transport allows it, so an abandoned request does not hold a connection.
 */
public interface SentimentProvider extends AutoCloseable {

    /**
     * Analyzes {@code text}.
     *
     * @param text    text exactly as submitted by the caller
     * @param timeout upper bound for the remote call
     * @return future completing with the result, or exceptionally with a
     *         {@link com.polaris.sentiment.api.exceptions.ProviderException}
     */
    CompletableFuture<SentimentResult> analyze(String text, Duration timeout);

    /**
     * Releases the underlying connection. Default does nothing.
     */
    @Override
    default void close() {
    }
}
