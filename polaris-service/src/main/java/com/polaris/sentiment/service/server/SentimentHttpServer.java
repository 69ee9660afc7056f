/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.service.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.polaris.sentiment.api.ISentimentPipeline;
import com.polaris.sentiment.api.context.RequestContext;
import com.polaris.sentiment.api.exceptions.CancelledException;
import com.polaris.sentiment.api.exceptions.SentimentException;
import com.polaris.sentiment.api.model.SentimentResponse;
import com.polaris.sentiment.api.model.SortOrder;
import com.polaris.sentiment.cache.ResultCache;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight HTTP front end for the sentiment pipeline.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>POST /api?order={asc|desc}&amp;limit={n} - Analyze {@code {"content": "..."}}</li>
 *   <li>/status - Liveness, 200 for any method</li>
 *   <li>GET /metrics - Cache metrics</li>
 * </ul>
 *
 * <p>Every {@code /api} request runs under its own {@link RequestContext} bounded by
 * the HTTP timeout; the context is cancelled once the response is written.
 * Failures surface as an opaque {@code 500}.
 *
 * <h2>Thread Safety</h2>
 * <p>Requests are served by a fixed pool of {@code 2 x cores} threads. The handlers
 * keep no per-request state outside the exchange.
 */
public class SentimentHttpServer {

    private static final Logger logger = Logger.getLogger(SentimentHttpServer.class.getName());

    static final String API_PATH = "/api";
    static final String STATUS_PATH = "/status";
    static final String METRICS_PATH = "/metrics";

    private static final String INTERNAL_ERROR = "{\"error\":\"Internal Server Error\"}";

    private final HttpServer server;
    private final ExecutorService executor;
    private final ISentimentPipeline pipeline;
    private final ResultCache cache;
    private final Duration httpTimeout;
    private final Tracer tracer;
    private final ObjectMapper objectMapper;

    /**
     * Creates a new server bound to {@code port}; {@code 0} picks a free port.
     *
     * @param port        the port to listen on
     * @param pipeline    request pipeline
     * @param cache       cache reported by {@code /metrics}
     * @param httpTimeout deadline of each {@code /api} request
     * @param tracer      OpenTelemetry tracer
     * @throws IOException if the server socket cannot be bound
     */
    public SentimentHttpServer(int port, ISentimentPipeline pipeline, ResultCache cache,
                               Duration httpTimeout, Tracer tracer) throws IOException {
        this.pipeline = Objects.requireNonNull(pipeline, "ISentimentPipeline cannot be null");
        this.cache = Objects.requireNonNull(cache, "ResultCache cannot be null");
        this.httpTimeout = Objects.requireNonNull(httpTimeout, "httpTimeout cannot be null");
        this.tracer = Objects.requireNonNull(tracer, "Tracer cannot be null");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.server = HttpServer.create(new InetSocketAddress(port), 0);

        this.server.createContext(API_PATH, new AnalyzeHandler());
        this.server.createContext(STATUS_PATH, new StatusHandler());
        this.server.createContext(METRICS_PATH, new MetricsHandler());
        this.server.createContext("/", exchange -> {
            drain(exchange);
            sendResponse(exchange, 404, "{\"error\":\"Not Found\"}");
        });

        int coreCount = Runtime.getRuntime().availableProcessors();
        this.executor = Executors.newFixedThreadPool(coreCount * 2, new ThreadFactoryBuilder()
                .setNameFormat("sentiment-http-%d")
                .build());
        this.server.setExecutor(executor);
    }

    public void start() {
        server.start();
        logger.info("Sentiment server started on port " + getPort());
        logger.info("Endpoints: /api (POST), /status, /metrics (GET)");
    }

    /**
     * Stops accepting connections and waits up to {@code grace} for in-flight
     * requests to finish.
     */
    public void stop(Duration grace) {
        logger.info("Stopping server...");
        server.stop((int) Math.max(0, grace.toSeconds()));
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        logger.info("Server stopped");
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Hot path: decode the body, run the pipeline, encode the entries.
     */
    class AnalyzeHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!API_PATH.equals(exchange.getRequestURI().getPath())) {
                drain(exchange);
                sendResponse(exchange, 404, "{\"error\":\"Not Found\"}");
                return;
            }
            if (!"POST".equals(exchange.getRequestMethod())) {
                drain(exchange);
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }

            Span span = tracer.spanBuilder("http-analyze").startSpan();
            try (Scope scope = span.makeCurrent()) {
                AnalyzeRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, AnalyzeRequest.class);
                } catch (JsonProcessingException e) {
                    logger.warning("Rejecting malformed request body: " + e.getOriginalMessage());
                    span.setStatus(StatusCode.ERROR, "bad request");
                    sendResponse(exchange, 400, "{\"error\":\"Bad Request\"}");
                    return;
                }
                String content = request == null ? "" : request.contentOrEmpty();

                Map<String, String> query = parseQuery(exchange.getRequestURI().getRawQuery());
                SortOrder order = SortOrder.fromParameter(query.get("order"));
                int limit = parseLimit(query.get("limit"));
                span.setAttribute("order", order.name());
                span.setAttribute("limit", limit);

                RequestContext ctx = RequestContext.withTimeout(httpTimeout);
                SentimentResponse response;
                try {
                    response = pipeline.handle(ctx, content, order, limit);
                } finally {
                    ctx.cancel();
                }

                String body;
                try {
                    body = objectMapper.writeValueAsString(response.entries());
                } catch (JsonProcessingException e) {
                    span.recordException(e);
                    span.setStatus(StatusCode.ERROR);
                    logger.log(Level.SEVERE, "Failed to encode response", e);
                    sendResponse(exchange, 500, INTERNAL_ERROR);
                    return;
                }
                sendResponse(exchange, 200, body);

            } catch (CancelledException e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                logger.warning("Request cancelled: " + e.getMessage());
                sendResponse(exchange, 500, INTERNAL_ERROR);
            } catch (SentimentException e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                logger.log(Level.SEVERE, "Error processing request", e);
                sendResponse(exchange, 500, INTERNAL_ERROR);
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                logger.log(Level.SEVERE, "Unexpected error processing request", e);
                sendResponse(exchange, 500, INTERNAL_ERROR);
            } finally {
                span.end();
            }
        }
    }

    /**
     * Liveness only; says nothing about the remote provider.
     */
    class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            drain(exchange);
            sendResponse(exchange, 200, "{\"status\":\"UP\"}");
        }
    }

    class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            drain(exchange);
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "{\"error\":\"Method Not Allowed\"}");
                return;
            }

            try {
                sendResponse(exchange, 200, objectMapper.writeValueAsString(cache.getMetrics()));
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Error getting metrics", e);
                sendResponse(exchange, 500, INTERNAL_ERROR);
            }
        }
    }

    /**
     * Parses a raw query string; the first occurrence of a name wins.
     */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            params.putIfAbsent(name, value);
        }
        return params;
    }

    /**
     * Absent means no limit. An unparsable value is logged and also means no limit.
     */
    static int parseLimit(String value) {
        if (value == null || value.isEmpty()) {
            return -1;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warning("Invalid limit parameter, ignoring: " + value);
            return -1;
        }
    }

    private static void drain(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            is.readAllBytes();
        }
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        byte[] responseBytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(statusCode, responseBytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(responseBytes);
        }
    }
}
