/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.api;

import com.polaris.sentiment.api.context.RequestContext;
import com.polaris.sentiment.api.model.SentimentResponse;
import com.polaris.sentiment.api.model.SortOrder;

/**
 * Contract for serving a sentiment request end to end.
 *
 * <p>Implementations are thread-safe; one instance serves all concurrent requests.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ISentimentPipeline pipeline = // obtain from application wiring
 *
 * RequestContext ctx = RequestContext.withTimeout(Duration.ofSeconds(10));
 * SentimentResponse response = pipeline.handle(ctx, "Great service. Awful food.",
 *         SortOrder.DESCENDING, 1);
 * }</pre>
 */
public interface ISentimentPipeline {

    /**
     * Analyzes {@code rawText}, serving from cache when possible, and shapes the
     * result.
     *
     * @param ctx     caller's cancellation context
     * @param rawText text as submitted by the caller
     * @param order   score ordering of the response
     * @param limit   maximum number of entries; negative means no limit
     * @return shaped response, empty when the provider found no sentences
     * @throws com.polaris.sentiment.api.exceptions.CancelledException if the context
     *         is done before work starts or before the result is returned
     * @throws com.polaris.sentiment.api.exceptions.ProviderException if the remote
     *         call fails
     */
    SentimentResponse handle(RequestContext ctx, String rawText, SortOrder order, int limit);
}
