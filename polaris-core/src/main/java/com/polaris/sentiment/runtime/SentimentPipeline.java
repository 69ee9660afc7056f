/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.runtime;

import com.polaris.sentiment.api.ISentimentPipeline;
import com.polaris.sentiment.api.SentimentProvider;
import com.polaris.sentiment.api.context.RequestContext;
import com.polaris.sentiment.api.exceptions.CancelledException;
import com.polaris.sentiment.api.exceptions.ProviderException;
import com.polaris.sentiment.api.exceptions.SentimentException;
import com.polaris.sentiment.api.model.SentimentResponse;
import com.polaris.sentiment.api.model.SentimentResult;
import com.polaris.sentiment.api.model.SortOrder;
import com.polaris.sentiment.cache.CacheKeyNormalizer;
import com.polaris.sentiment.cache.ResultCache;
import com.polaris.sentiment.codec.DecodeException;
import com.polaris.sentiment.codec.ResultCodec;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves sentiment requests through the result cache.
 *
 * <h2>Request Flow</h2>
 * <ol>
 *   <li>Fail with {@link CancelledException} if the context is already done</li>
 *   <li>Normalize the input into a cache key and look it up; a payload that fails
 *       to decode counts as a miss</li>
 *   <li>On a miss, call the provider with the original input, bounded by the
 *       request timeout and the context deadline</li>
 *   <li>Encode and store the fresh result, best-effort</li>
 *   <li>Fail with {@link CancelledException} if the context finished meanwhile</li>
 *   <li>Shape the result</li>
 * </ol>
 *
 * <p>Only {@link CancelledException} and {@link ProviderException} escape. Cache
 * and codec faults degrade to the slow path and are logged.
 *
 * <h2>Thread Safety</h2>
 * <p>Holds no mutable state of its own. Thread safety rests on the cache and
 * provider, both of which support concurrent use.
 */
public class SentimentPipeline implements ISentimentPipeline {

    private static final Logger logger = Logger.getLogger(SentimentPipeline.class.getName());

    private final SentimentProvider provider;
    private final ResultCache cache;
    private final ResultCodec codec;
    private final ResultShaper shaper;
    private final Duration requestTimeout;
    private final Tracer tracer;

    /**
     * @param provider       remote sentiment capability
     * @param cache          shared result cache
     * @param codec          encoding of cached results
     * @param shaper         response shaping
     * @param requestTimeout upper bound for each remote call
     * @param tracer         OpenTelemetry tracer
     */
    public SentimentPipeline(SentimentProvider provider, ResultCache cache, ResultCodec codec,
                             ResultShaper shaper, Duration requestTimeout, Tracer tracer) {
        this.provider = Objects.requireNonNull(provider, "SentimentProvider cannot be null");
        this.cache = Objects.requireNonNull(cache, "ResultCache cannot be null");
        this.codec = Objects.requireNonNull(codec, "ResultCodec cannot be null");
        this.shaper = Objects.requireNonNull(shaper, "ResultShaper cannot be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        if (requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
        }
    }

    @Override
    public SentimentResponse handle(RequestContext ctx, String rawText, SortOrder order, int limit) {
        Objects.requireNonNull(ctx, "RequestContext cannot be null");
        Objects.requireNonNull(order, "SortOrder cannot be null");
        String input = rawText == null ? "" : rawText;

        Span span = tracer.spanBuilder("sentiment.handle").startSpan();
        try (Scope scope = span.makeCurrent()) {
            ensureActive(ctx, input, "before processing");

            String key = CacheKeyNormalizer.normalize(input);
            Optional<SentimentResult> cached = lookup(key);
            span.setAttribute("cache.hit", cached.isPresent());

            SentimentResult result;
            if (cached.isPresent()) {
                result = cached.get();
            } else {
                result = fetch(ctx, input);
                if (result != null) {
                    store(key, result);
                }
            }

            ensureActive(ctx, input, "after analysis");

            if (result == null) {
                return SentimentResponse.empty();
            }
            span.setAttribute("sentence.count", result.sentences().size());
            return shaper.shape(result.sentences(), order, limit);

        } catch (SentimentException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            throw e;
        } finally {
            span.end();
        }
    }

    private void ensureActive(RequestContext ctx, String input, String stage) {
        if (ctx.isDone()) {
            logger.warning("Context cancelled " + stage + ": input=" + input);
            ctx.ensureActive();
        }
    }

    private Optional<SentimentResult> lookup(String key) {
        Optional<byte[]> payload;
        try {
            payload = cache.get(key);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Cache lookup failed, treating as miss: key=" + key, e);
            return Optional.empty();
        }
        if (payload.isEmpty()) {
            return Optional.empty();
        }

        try {
            SentimentResult result = codec.decode(payload.get());
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Cache hit: key=" + key);
            }
            return Optional.of(result);
        } catch (DecodeException e) {
            logger.log(Level.WARNING, "Discarding undecodable cache entry: key=" + key, e);
            return Optional.empty();
        }
    }

    private SentimentResult fetch(RequestContext ctx, String input) {
        Duration timeout = ctx.boundTimeout(requestTimeout);
        boolean cutByDeadline = timeout.compareTo(requestTimeout) < 0;
        CompletableFuture<SentimentResult> future = startCall(input, timeout);

        try (RequestContext.Registration registration = ctx.onCancel(() -> future.cancel(true))) {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            if (cutByDeadline || ctx.isDone()) {
                logger.warning("Context deadline reached during remote call: input=" + input);
                throw new CancelledException("Request deadline exceeded during remote call", e);
            }
            logger.severe("Remote API call timed out after " + timeout.toMillis() + "ms: input=" + input);
            throw new ProviderException("Remote call timed out after " + timeout.toMillis() + "ms", e);

        } catch (CancellationException e) {
            logger.warning("Remote call cancelled: input=" + input);
            throw new CancelledException("Remote call cancelled", e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.SEVERE, "Remote API call failure: input=" + input, cause);
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            throw new ProviderException("Remote call failed", cause);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new CancelledException("Interrupted while waiting for remote call", e);
        }
    }

    private CompletableFuture<SentimentResult> startCall(String input, Duration timeout) {
        try {
            return Objects.requireNonNull(provider.analyze(input, timeout), "Provider returned no future");
        } catch (ProviderException e) {
            logger.log(Level.SEVERE, "Remote API call failure: input=" + input, e);
            throw e;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Remote API call failure: input=" + input, e);
            throw new ProviderException("Remote call failed", e);
        }
    }

    /**
     * Best-effort write. The response never depends on it.
     */
    private void store(String key, SentimentResult result) {
        try {
            byte[] payload = codec.encode(result);
            if (!cache.set(key, payload) && logger.isLoggable(Level.FINE)) {
                logger.fine("Cache write dropped: key=" + key);
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Skipping cache write: key=" + key, e);
        }
    }
}
