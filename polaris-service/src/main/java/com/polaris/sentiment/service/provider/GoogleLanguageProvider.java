/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.service.provider;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutureCallback;
import com.google.api.core.ApiFutures;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.grpc.GrpcCallContext;
import com.google.api.gax.rpc.ApiCallContext;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.FixedHeaderProvider;
import com.google.cloud.language.v1.AnalyzeSentimentRequest;
import com.google.cloud.language.v1.AnalyzeSentimentResponse;
import com.google.cloud.language.v1.Document;
import com.google.cloud.language.v1.EncodingType;
import com.google.cloud.language.v1.LanguageServiceClient;
import com.google.cloud.language.v1.LanguageServiceSettings;
import com.google.common.util.concurrent.MoreExecutors;
import com.polaris.sentiment.api.SentimentProvider;
import com.polaris.sentiment.api.exceptions.ProviderException;
import com.polaris.sentiment.api.model.Sentence;
import com.polaris.sentiment.api.model.SentimentResult;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link SentimentProvider} backed by the Google Cloud Natural Language API.
 *
 * <p>Each call is one {@code analyzeSentiment} RPC carrying the caller's timeout as
 * its deadline. Cancelling the returned future cancels the RPC.
 *
 * <p>Credentials come from Application Default Credentials unless an API key is
 * configured, in which case the key is sent in the {@code x-goog-api-key} header.
 *
 * <p>Thread-safe: one {@link LanguageServiceClient} is shared by all calls.
 */
public class GoogleLanguageProvider implements SentimentProvider {

    private static final Logger logger = Logger.getLogger(GoogleLanguageProvider.class.getName());

    static final String API_KEY_HEADER = "x-goog-api-key";

    private final LanguageServiceClient client;

    public GoogleLanguageProvider(LanguageServiceClient client) {
        this.client = Objects.requireNonNull(client, "LanguageServiceClient cannot be null");
    }

    /**
     * Connects to {@code endpoint} ({@code host:port}).
     *
     * @param apiKey API key, or null to use Application Default Credentials
     * @throws IOException if credentials cannot be resolved or the channel cannot be built
     */
    public static GoogleLanguageProvider create(String endpoint, String apiKey) throws IOException {
        LanguageServiceSettings.Builder settings = LanguageServiceSettings.newBuilder()
                .setEndpoint(endpoint);
        if (apiKey != null && !apiKey.isBlank()) {
            settings.setCredentialsProvider(NoCredentialsProvider.create())
                    .setHeaderProvider(FixedHeaderProvider.create(API_KEY_HEADER, apiKey));
            logger.info("Natural Language client using API key authentication: endpoint=" + endpoint);
        } else {
            logger.info("Natural Language client using Application Default Credentials: endpoint=" + endpoint);
        }
        return new GoogleLanguageProvider(LanguageServiceClient.create(settings.build()));
    }

    @Override
    public CompletableFuture<SentimentResult> analyze(String text, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        AnalyzeSentimentRequest request = AnalyzeSentimentRequest.newBuilder()
                .setDocument(Document.newBuilder()
                        .setType(Document.Type.PLAIN_TEXT)
                        .setContent(text == null ? "" : text))
                .setEncodingType(EncodingType.UTF8)
                .build();
        ApiCallContext callContext = GrpcCallContext.createDefault()
                .withTimeout(org.threeten.bp.Duration.ofNanos(timeout.toNanos()));

        ApiFuture<AnalyzeSentimentResponse> call;
        try {
            call = client.analyzeSentimentCallable().futureCall(request, callContext);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(toProviderException(e));
        }

        CompletableFuture<SentimentResult> result = new CompletableFuture<>();
        ApiFutures.addCallback(call, new ApiFutureCallback<>() {
            @Override
            public void onSuccess(AnalyzeSentimentResponse response) {
                result.complete(toResult(response));
            }

            @Override
            public void onFailure(Throwable t) {
                result.completeExceptionally(toProviderException(t));
            }
        }, MoreExecutors.directExecutor());

        result.whenComplete((r, e) -> {
            if (e instanceof CancellationException) {
                call.cancel(true);
            }
        });
        return result;
    }

    static SentimentResult toResult(AnalyzeSentimentResponse response) {
        List<Sentence> sentences = new ArrayList<>(response.getSentencesCount());
        for (com.google.cloud.language.v1.Sentence sentence : response.getSentencesList()) {
            sentences.add(new Sentence(sentence.getText().getContent(), sentence.getSentiment().getScore()));
        }
        logger.fine(() -> "Natural Language API returned " + sentences.size() + " sentences");
        return new SentimentResult(sentences);
    }

    static ProviderException toProviderException(Throwable t) {
        if (t instanceof ProviderException) {
            return (ProviderException) t;
        }
        if (t instanceof ApiException) {
            ApiException api = (ApiException) t;
            return new ProviderException("Natural Language API call failed with " + api.getStatusCode().getCode()
                    + ": " + api.getMessage(), api.getStatusCode().getCode().getHttpStatusCode(), api);
        }
        return new ProviderException("Natural Language API call failed: " + t.getMessage(), t);
    }

    @Override
    public void close() {
        client.close();
        try {
            if (!client.awaitTermination(5, TimeUnit.SECONDS)) {
                client.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.shutdownNow();
        }
        logger.log(Level.FINE, "Natural Language client closed");
    }
}
