/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polaris.sentiment.api.model.Sentence;
import com.polaris.sentiment.api.model.SentimentResult;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of results, using Jackson.
 *
 * <p>The stored document carries a format version so that entries written by an
 * incompatible build decode as a miss rather than as wrong data:
 * <pre>{@code
 * {"v":1,"sentences":[{"text":"Great food.","score":0.8}]}
 * }</pre>
 */
public class JsonResultCodec implements ResultCodec {

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public JsonResultCodec() {
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public byte[] encode(SentimentResult result) {
        if (result == null) {
            throw new EncodeException("Cannot encode a null result");
        }

        List<StoredSentence> sentences = new ArrayList<>(result.sentences().size());
        for (Sentence sentence : result.sentences()) {
            if (sentence == null) {
                throw new EncodeException("Result contains a null sentence");
            }
            sentences.add(new StoredSentence(sentence.text(), sentence.score()));
        }

        try {
            return objectMapper.writeValueAsBytes(new StoredResult(FORMAT_VERSION, sentences));
        } catch (JsonProcessingException e) {
            throw new EncodeException("Failed to encode result", e);
        }
    }

    @Override
    public SentimentResult decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new DecodeException("Empty payload");
        }

        StoredResult stored;
        try {
            stored = objectMapper.readValue(payload, StoredResult.class);
        } catch (IOException e) {
            throw new DecodeException("Malformed payload", e);
        }

        if (stored == null) {
            throw new DecodeException("Payload decodes to null");
        }
        if (stored.v() != FORMAT_VERSION) {
            throw new DecodeException("Unsupported format version: " + stored.v());
        }
        if (stored.sentences() == null) {
            return SentimentResult.empty();
        }

        List<Sentence> sentences = new ArrayList<>(stored.sentences().size());
        for (StoredSentence s : stored.sentences()) {
            if (s == null || s.text() == null) {
                throw new DecodeException("Payload contains an incomplete sentence");
            }
            sentences.add(new Sentence(s.text(), s.score()));
        }
        return new SentimentResult(sentences);
    }

    record StoredResult(int v, List<StoredSentence> sentences) {
    }

    record StoredSentence(String text, float score) {
    }
}
