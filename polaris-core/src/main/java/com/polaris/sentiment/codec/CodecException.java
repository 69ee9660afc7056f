/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.codec;

import com.polaris.sentiment.api.exceptions.SentimentException;

/**
 * Failure converting a result to or from its stored form.
 */
public class CodecException extends SentimentException {

    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
