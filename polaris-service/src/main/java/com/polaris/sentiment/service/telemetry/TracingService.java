/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.service.telemetry;

import com.polaris.sentiment.config.ConfigSource;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for the service.
 *
 * <p>Configuration (environment variable or system property of the same name):
 * <ul>
 *   <li>{@code OTEL_DISABLED}: disable tracing entirely (default: false)</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code logging} or {@code otlp} (default: logging)</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: OTLP endpoint (default: http://localhost:4317)</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: 0.0-1.0 (default: 1.0)</li>
 *   <li>{@code OTEL_SERVICE_NAME}: service identifier (default: polaris-sentiment)</li>
 * </ul>
 *
 * <p>Spans are exported in batches off the request path. Call {@link #shutdown()}
 * on exit to drain the buffer.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.polaris.sentiment";
    private static final String DEFAULT_SERVICE_NAME = "polaris-sentiment";
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(Tracer tracer, SdkTracerProvider tracerProvider) {
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
    }

    /**
     * Tracing disabled: spans are created but never recorded.
     */
    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME), null);
    }

    public static TracingService create(ConfigSource source) {
        if (source.getBoolean("OTEL_DISABLED", "OTEL_DISABLED").orElse(false)) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return noop();
        }

        try {
            String serviceName = source.get("OTEL_SERVICE_NAME", "OTEL_SERVICE_NAME").orElse(DEFAULT_SERVICE_NAME);
            Sampler sampler = configureSampler(source);

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(Resource.getDefault().merge(
                            Resource.create(Attributes.of(SERVICE_NAME, serviceName))))
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(configureExporter(source))
                            .setMaxQueueSize(2048)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s, sampler=%s",
                    serviceName, sampler.getDescription()));

            return new TracingService(sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider);

        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Sampler configureSampler(ConfigSource source) {
        double ratio = 1.0;
        String configured = source.get("OTEL_TRACE_SAMPLING_RATIO", "OTEL_TRACE_SAMPLING_RATIO").orElse(null);
        if (configured != null) {
            try {
                ratio = Math.max(0.0, Math.min(1.0, Double.parseDouble(configured)));
            } catch (NumberFormatException e) {
                logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using default: " + configured);
            }
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter configureExporter(ConfigSource source) {
        String type = source.get("OTEL_EXPORTER_TYPE", "OTEL_EXPORTER_TYPE")
                .orElse("logging")
                .toLowerCase(Locale.ROOT);

        switch (type) {
            case "otlp":
                String endpoint = source.get("OTEL_EXPORTER_OTLP_ENDPOINT", "OTEL_EXPORTER_OTLP_ENDPOINT")
                        .orElse("http://localhost:4317");
                logger.info("Using OTLP exporter: " + endpoint);
                return OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            case "logging":
                return LoggingSpanExporter.create();
            default:
                logger.warning("Unknown exporter type: " + type + ", using logging");
                return LoggingSpanExporter.create();
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    /**
     * Flushes buffered spans and stops the exporter.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }
}
