/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Lookup of configuration values from environment variables, falling back to
 * system properties.
 *
 * <p>Every setting has an environment key ({@code CACHE_MAX_SIZE_MB}) and a
 * property key ({@code cache.max.size.mb}); the environment wins. Values that
 * fail to parse are logged and treated as absent, so the caller keeps its default.
 */
public final class ConfigSource {

    private static final Logger logger = Logger.getLogger(ConfigSource.class.getName());

    private final Function<String, String> env;
    private final Function<String, String> properties;

    private ConfigSource(Function<String, String> env, Function<String, String> properties) {
        this.env = Objects.requireNonNull(env, "env cannot be null");
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
    }

    /**
     * Process environment and JVM system properties.
     */
    public static ConfigSource system() {
        return new ConfigSource(System::getenv, System::getProperty);
    }

    /**
     * Fixed values, for tests and embedding.
     */
    public static ConfigSource of(Map<String, String> env, Map<String, String> properties) {
        Map<String, String> envCopy = Map.copyOf(env);
        Map<String, String> propertiesCopy = Map.copyOf(properties);
        return new ConfigSource(envCopy::get, propertiesCopy::get);
    }

    public Optional<String> get(String envKey, String propertyKey) {
        String value = env.apply(envKey);
        if (value == null || value.trim().isEmpty()) {
            value = properties.apply(propertyKey);
        }
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        logger.fine("Loaded setting: " + envKey + "=" + maskSensitive(envKey, value.trim()));
        return Optional.of(value.trim());
    }

    public Optional<Integer> getInt(String envKey, String propertyKey) {
        return get(envKey, propertyKey).map(val -> {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException e) {
                logger.warning("Invalid int value for " + envKey + ": " + val);
                return null;
            }
        });
    }

    public Optional<Boolean> getBoolean(String envKey, String propertyKey) {
        return get(envKey, propertyKey).map(val -> {
            switch (val.toLowerCase(Locale.ROOT)) {
                case "true":
                case "1":
                case "yes":
                    return Boolean.TRUE;
                case "false":
                case "0":
                case "no":
                    return Boolean.FALSE;
                default:
                    logger.warning("Invalid boolean value for " + envKey + ": " + val);
                    return null;
            }
        });
    }

    public Optional<Duration> getDuration(String envKey, String propertyKey) {
        return get(envKey, propertyKey).map(val -> {
            try {
                return Durations.parse(val);
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid duration value for " + envKey + ": " + val);
                return null;
            }
        });
    }

    private static String maskSensitive(String key, String value) {
        if (key.contains("KEY") || key.contains("SECRET") || key.contains("PASSWORD")) {
            return "***REDACTED***";
        }
        return value;
    }
}
