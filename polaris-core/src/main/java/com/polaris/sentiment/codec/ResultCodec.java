/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.codec;

import com.polaris.sentiment.api.model.SentimentResult;

/**
 * Converts results to and from the opaque bytes kept in the cache.
 *
 * <p>Implementations are stateless and thread-safe.
 */
public interface ResultCodec {

    /**
     * @throws EncodeException if the result cannot be represented
     */
    byte[] encode(SentimentResult result);

    /**
     * @throws DecodeException if {@code payload} is not a valid encoding
     */
    SentimentResult decode(byte[] payload);
}
