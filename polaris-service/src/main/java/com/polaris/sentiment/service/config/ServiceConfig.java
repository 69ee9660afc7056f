/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.service.config;

import com.polaris.sentiment.cache.CacheConfig;
import com.polaris.sentiment.config.ConfigSource;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-level settings of the sentiment service.
 *
 * <p>Every setting can be overridden by an environment variable or, failing
 * that, a system property:
 * <pre>
 * SERVER_PORT=8080                                     (server.port)
 * SERVER_HTTP_TIMEOUT=10s                              (server.http.timeout)
 * SERVER_SHUTDOWN_GRACE=60s                            (server.shutdown.grace)
 * SENTIMENT_REQUEST_TIMEOUT=1s                         (sentiment.request.timeout)
 * LOG_LEVEL=INFO                                       (log.level)
 * PROVIDER_ENDPOINT=language.googleapis.com:443       (provider.endpoint)
 * PROVIDER_API_KEY=...                                 (provider.api.key, default: ADC)
 * </pre>
 * plus the cache settings read by {@link CacheConfig#from(ConfigSource)}.
 */
public final class ServiceConfig {

    private static final Logger logger = Logger.getLogger(ServiceConfig.class.getName());

    public static final int DEFAULT_PORT = 8080;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(1);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofMinutes(1);
    public static final String DEFAULT_PROVIDER_ENDPOINT = "language.googleapis.com:443";

    private final int port;
    private final Duration requestTimeout;
    private final Duration httpTimeout;
    private final Duration shutdownGrace;
    private final Level logLevel;
    private final String providerEndpoint;
    private final String providerApiKey;
    private final CacheConfig cacheConfig;

    private ServiceConfig(Builder builder) {
        this.port = builder.port;
        this.requestTimeout = builder.requestTimeout;
        this.httpTimeout = builder.httpTimeout;
        this.shutdownGrace = builder.shutdownGrace;
        this.logLevel = builder.logLevel;
        this.providerEndpoint = builder.providerEndpoint;
        this.providerApiKey = builder.providerApiKey;
        this.cacheConfig = builder.cacheConfig;
        validate();
    }

    public static ServiceConfig from(ConfigSource source) {
        Builder builder = builder().cacheConfig(CacheConfig.from(source));
        source.getInt("SERVER_PORT", "server.port").ifPresent(builder::port);
        source.getDuration("SERVER_HTTP_TIMEOUT", "server.http.timeout").ifPresent(builder::httpTimeout);
        source.getDuration("SERVER_SHUTDOWN_GRACE", "server.shutdown.grace").ifPresent(builder::shutdownGrace);
        source.getDuration("SENTIMENT_REQUEST_TIMEOUT", "sentiment.request.timeout").ifPresent(builder::requestTimeout);
        source.get("LOG_LEVEL", "log.level").ifPresent(val -> builder.logLevel(parseLogLevel(val)));
        source.get("PROVIDER_ENDPOINT", "provider.endpoint").ifPresent(val -> {
            if (isHostAndPort(val)) {
                builder.providerEndpoint(val);
            } else {
                logger.warning("Invalid PROVIDER_ENDPOINT (expected host:port): " + val
                        + ", using default: " + DEFAULT_PROVIDER_ENDPOINT);
            }
        });
        source.get("PROVIDER_API_KEY", "provider.api.key").ifPresent(builder::providerApiKey);
        return builder.build();
    }

    private static boolean isHostAndPort(String value) {
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            return false;
        }
        try {
            int port = Integer.parseInt(value.substring(colon + 1));
            return port > 0 && port <= 65535;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Maps a log level name to a {@link Level}. Accepts DEBUG, INFO, WARN and ERROR
     * as well as the {@code java.util.logging} names; anything else is INFO.
     */
    public static Level parseLogLevel(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "DEBUG":
                return Level.FINE;
            case "WARN":
                return Level.WARNING;
            case "ERROR":
                return Level.SEVERE;
            default:
                try {
                    return Level.parse(normalized);
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid LOG_LEVEL: " + name + ", using INFO");
                    return Level.INFO;
                }
        }
    }

    private void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        requirePositive("requestTimeout", requestTimeout);
        requirePositive("httpTimeout", httpTimeout);
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be negative: " + shutdownGrace);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    public int getPort() {
        return port;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public String getProviderEndpoint() {
        return providerEndpoint;
    }

    public Optional<String> getProviderApiKey() {
        return Optional.ofNullable(providerApiKey);
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    @Override
    public String toString() {
        return "ServiceConfig{port=" + port +
                ", requestTimeout=" + requestTimeout +
                ", httpTimeout=" + httpTimeout +
                ", shutdownGrace=" + shutdownGrace +
                ", logLevel=" + logLevel +
                ", providerEndpoint=" + providerEndpoint +
                ", providerApiKey=" + (providerApiKey == null ? "<none>" : "***REDACTED***") +
                ", cache=" + cacheConfig + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int port = DEFAULT_PORT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration httpTimeout = DEFAULT_HTTP_TIMEOUT;
        private Duration shutdownGrace = DEFAULT_SHUTDOWN_GRACE;
        private Level logLevel = Level.INFO;
        private String providerEndpoint = DEFAULT_PROVIDER_ENDPOINT;
        private String providerApiKey;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        private Builder() {
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = Objects.requireNonNull(httpTimeout, "httpTimeout cannot be null");
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace cannot be null");
            return this;
        }

        public Builder logLevel(Level logLevel) {
            this.logLevel = Objects.requireNonNull(logLevel, "logLevel cannot be null");
            return this;
        }

        public Builder providerEndpoint(String providerEndpoint) {
            this.providerEndpoint = Objects.requireNonNull(providerEndpoint, "providerEndpoint cannot be null");
            return this;
        }

        public Builder providerApiKey(String providerApiKey) {
            this.providerApiKey = providerApiKey;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig cannot be null");
            return this;
        }

        public ServiceConfig build() {
            return new ServiceConfig(this);
        }
    }
}
