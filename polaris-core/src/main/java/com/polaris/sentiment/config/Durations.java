/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses duration settings.
 *
 * <p>Two notations are accepted:
 * <ul>
 *   <li>unit-suffixed sequences such as {@code 500ms}, {@code 1s}, {@code 10m},
 *       {@code 1h30m}, {@code 1.5s} (units {@code ns us µs ms s m h}); a bare
 *       {@code 0} is zero</li>
 *   <li>ISO-8601, such as {@code PT10M}</li>
 * </ul>
 */
public final class Durations {

    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
    private static final Pattern FULL = Pattern.compile("(?:\\d+(?:\\.\\d+)?(?:ns|us|µs|ms|s|m|h))+");

    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L
    );

    private Durations() {
        throw new AssertionError("No instances");
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not a valid duration
     */
    public static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Duration must not be empty");
        }
        String text = value.trim();

        if (text.toUpperCase(Locale.ROOT).startsWith("P")) {
            try {
                return Duration.parse(text.toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid ISO-8601 duration: " + value, e);
            }
        }

        if ("0".equals(text)) {
            return Duration.ZERO;
        }
        if (!FULL.matcher(text).matches()) {
            throw new IllegalArgumentException("Invalid duration: " + value);
        }

        BigDecimal nanos = BigDecimal.ZERO;
        Matcher matcher = COMPONENT.matcher(text);
        while (matcher.find()) {
            BigDecimal amount = new BigDecimal(matcher.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2)))));
        }
        try {
            return Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration out of range: " + value, e);
        }
    }
}
